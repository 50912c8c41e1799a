package com.e2eq.hooks.registry;

import com.e2eq.hooks.exceptions.UnknownHookException;
import com.e2eq.hooks.model.hooks.HookInputs;
import com.e2eq.hooks.model.pipeline.HookGroup;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.e2eq.hooks.model.pipeline.HookGroup.API_KEY;
import static com.e2eq.hooks.model.pipeline.HookGroup.AUTHENTICATION;
import static com.e2eq.hooks.model.pipeline.HookGroup.OAUTH_CLIENT;

/**
 * The fixed catalogue of lifecycle hooks. Read-only after class initialization.
 */
@ApplicationScoped
public class HookRegistry {

    private static final Map<String, HookDefinition> DEFINITIONS;

    static {
        Map<String, HookDefinition> m = new LinkedHashMap<>();
        // authentication
        put(m, HookDefinition.blocking("before_signup", AUTHENTICATION, HookInputs.BeforeSignup.class,
                "Runs before user creation. Return allowed:false to abort signup."));
        put(m, HookDefinition.async("after_signup", AUTHENTICATION, HookInputs.AfterSignup.class,
                "Runs after successful signup. For welcome emails, CRM sync."));
        put(m, HookDefinition.blocking("before_signin", AUTHENTICATION, HookInputs.BeforeSignin.class,
                "Runs before authentication. Check bans, lockouts, maintenance."));
        put(m, HookDefinition.async("after_signin", AUTHENTICATION, HookInputs.AfterSignin.class,
                "Runs after successful login. Audit trail, update last_seen."));
        put(m, HookDefinition.blocking("before_signout", AUTHENTICATION, HookInputs.BeforeSignout.class,
                "Runs before session termination."));
        put(m, HookDefinition.enrichment("token_build", AUTHENTICATION, HookInputs.TokenBuild.class,
                "Runs during token generation. Return data to inject custom claims."));
        // api keys
        put(m, HookDefinition.blocking("apikey_before_create", API_KEY, HookInputs.ApiKeyBeforeCreate.class,
                "Runs before API key creation. Enforce max keys, naming rules."));
        put(m, HookDefinition.async("apikey_after_create", API_KEY, HookInputs.ApiKeyAfterCreate.class,
                "Runs after API key creation. Notify security team."));
        put(m, HookDefinition.blocking("apikey_before_exchange", API_KEY, HookInputs.ApiKeyBeforeExchange.class,
                "Runs when an API key is used. Extra validation, origin checks."));
        put(m, HookDefinition.async("apikey_after_exchange", API_KEY, HookInputs.ApiKeyAfterExchange.class,
                "Runs after a successful API key exchange. Usage logging."));
        put(m, HookDefinition.blocking("apikey_before_revoke", API_KEY, HookInputs.ApiKeyBeforeRevoke.class,
                "Runs before API key revocation. Prevent accidental deletion."));
        // oauth clients
        put(m, HookDefinition.blocking("client_before_register", OAUTH_CLIENT, HookInputs.ClientBeforeRegister.class,
                "Runs before OAuth client registration. Validate metadata."));
        put(m, HookDefinition.async("client_after_register", OAUTH_CLIENT, HookInputs.ClientAfterRegister.class,
                "Runs after OAuth client creation. Internal notification."));
        put(m, HookDefinition.blocking("client_before_authorize", OAUTH_CLIENT, HookInputs.ClientBeforeAuthorize.class,
                "Runs during OAuth authorization. Validate scopes, user access."));
        put(m, HookDefinition.async("client_after_authorize", OAUTH_CLIENT, HookInputs.ClientAfterAuthorize.class,
                "Runs after OAuth consent. Audit consent grants."));
        put(m, HookDefinition.async("client_access_change", OAUTH_CLIENT, HookInputs.ClientAccessChange.class,
                "Runs when client access is granted or revoked for a user."));
        DEFINITIONS = Collections.unmodifiableMap(m);
    }

    private static void put(Map<String, HookDefinition> m, HookDefinition def) {
        m.put(def.name(), def);
    }

    public Optional<HookDefinition> getHookDefinition(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DEFINITIONS.get(name));
    }

    /**
     * @throws UnknownHookException when no hook has that name
     */
    public HookDefinition require(String name) {
        return getHookDefinition(name).orElseThrow(() -> new UnknownHookException(name));
    }

    public boolean isKnown(String name) {
        return name != null && DEFINITIONS.containsKey(name);
    }

    public Collection<HookDefinition> definitions() {
        return DEFINITIONS.values();
    }

    public List<HookDefinition> byGroup(HookGroup group) {
        return DEFINITIONS.values().stream()
                .filter(d -> d.group() == group)
                .collect(Collectors.toList());
    }
}
