package com.e2eq.hooks.registration;

import com.e2eq.hooks.config.HookEngineConfig;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived pending grants keyed by lower-cased email. Each entry can be consumed
 * once and expires after the configured TTL.
 */
@ApplicationScoped
public class PendingGrantStore {

    private final Map<String, PendingGrant> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Inject
    public PendingGrantStore(HookEngineConfig config) {
        this(config.registration().pendingGrantTtl(), Clock.systemUTC());
    }

    public PendingGrantStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Remember a pending grant, replacing any earlier one for the same email.
     * Expired entries of abandoned sign-ups are dropped on the way.
     */
    public PendingGrant put(String email, String contextSlug, String inviteId) {
        purgeExpired();
        PendingGrant grant = new PendingGrant(key(email), contextSlug, inviteId, clock.instant().plus(ttl));
        entries.put(grant.email(), grant);
        return grant;
    }

    /**
     * Remove and return the grant for {@code email} unless it has expired.
     */
    public Optional<PendingGrant> consume(String email) {
        if (email == null) {
            return Optional.empty();
        }
        PendingGrant grant = entries.remove(key(email));
        if (grant == null || grant.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(grant);
    }

    /**
     * @return number of expired entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(g -> g.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            Log.debugf("Purged %d expired pending grants", purged);
        }
        return Math.max(0, purged);
    }

    public int size() {
        return entries.size();
    }

    private static String key(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
