package com.e2eq.hooks.registry;

import com.e2eq.hooks.exceptions.UnknownHookException;
import com.e2eq.hooks.model.pipeline.ExecutionMode;
import com.e2eq.hooks.model.pipeline.HookGroup;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HookRegistryTest {

    private final HookRegistry registry = new HookRegistry();

    @Test
    void catalogue_has_sixteen_hooks_with_expected_modes() {
        assertEquals(16, registry.definitions().size());
        Map<String, ExecutionMode> expected = Map.ofEntries(
                Map.entry("before_signup", ExecutionMode.BLOCKING),
                Map.entry("after_signup", ExecutionMode.ASYNC),
                Map.entry("before_signin", ExecutionMode.BLOCKING),
                Map.entry("after_signin", ExecutionMode.ASYNC),
                Map.entry("before_signout", ExecutionMode.BLOCKING),
                Map.entry("token_build", ExecutionMode.ENRICHMENT),
                Map.entry("apikey_before_create", ExecutionMode.BLOCKING),
                Map.entry("apikey_after_create", ExecutionMode.ASYNC),
                Map.entry("apikey_before_exchange", ExecutionMode.BLOCKING),
                Map.entry("apikey_after_exchange", ExecutionMode.ASYNC),
                Map.entry("apikey_before_revoke", ExecutionMode.BLOCKING),
                Map.entry("client_before_register", ExecutionMode.BLOCKING),
                Map.entry("client_after_register", ExecutionMode.ASYNC),
                Map.entry("client_before_authorize", ExecutionMode.BLOCKING),
                Map.entry("client_after_authorize", ExecutionMode.ASYNC),
                Map.entry("client_access_change", ExecutionMode.ASYNC));
        expected.forEach((name, mode) ->
                assertEquals(mode, registry.require(name).executionMode(), name));
    }

    @Test
    void groups_partition_the_catalogue() {
        assertEquals(6, registry.byGroup(HookGroup.AUTHENTICATION).size());
        assertEquals(5, registry.byGroup(HookGroup.API_KEY).size());
        assertEquals(5, registry.byGroup(HookGroup.OAUTH_CLIENT).size());
    }

    @Test
    void unknown_hook_is_not_found() {
        assertTrue(registry.getHookDefinition("before_launch").isEmpty());
        assertTrue(registry.getHookDefinition(null).isEmpty());
        assertFalse(registry.isKnown("before_launch"));
        UnknownHookException e = assertThrows(UnknownHookException.class, () -> registry.require("before_launch"));
        assertTrue(e.getMessage().contains("before_launch"));
    }
}
