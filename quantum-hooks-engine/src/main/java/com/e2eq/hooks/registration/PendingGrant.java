package com.e2eq.hooks.registration;

import java.time.Instant;

/**
 * A sign-up through a registration context that has not produced a user yet.
 */
public record PendingGrant(String email, String contextSlug, String inviteId, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
