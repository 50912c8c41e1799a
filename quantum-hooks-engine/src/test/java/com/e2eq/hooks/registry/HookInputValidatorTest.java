package com.e2eq.hooks.registry;

import com.e2eq.hooks.exceptions.HookInputValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HookInputValidatorTest {

    private final HookRegistry registry = new HookRegistry();
    private final HookInputValidator validator = new HookInputValidator(new ObjectMapper().findAndRegisterModules());

    @Test
    void valid_signup_is_normalized() {
        Map<String, Object> context = validator.validate(registry.require("before_signup"), Map.of(
                "email", "ada@example.com",
                "request", Map.of("ip", "10.0.0.1"),
                "somethingElse", 42));

        assertEquals("ada@example.com", context.get("email"));
        assertFalse(context.containsKey("somethingElse"));
        assertFalse(context.containsKey("name"));
        assertEquals(Map.of("ip", "10.0.0.1"), context.get("request"));
    }

    @Test
    void invalid_email_is_rejected_with_violation() {
        HookInputValidationException e = assertThrows(HookInputValidationException.class,
                () -> validator.validate(registry.require("before_signup"),
                        Map.of("email", "not-an-email", "request", Map.of())));
        assertEquals("before_signup", e.getHookName());
        assertFalse(e.getViolationMessages().isEmpty());
        assertTrue(e.getMessage().startsWith("Invalid input for hook before_signup"));
    }

    @Test
    void missing_required_nested_object_is_rejected() {
        assertThrows(HookInputValidationException.class,
                () -> validator.validate(registry.require("before_signup"), Map.of("email", "ada@example.com")));
    }

    @Test
    void wrong_type_and_null_payload_are_rejected() {
        assertThrows(HookInputValidationException.class,
                () -> validator.validate(registry.require("before_signup"),
                        Map.of("email", Map.of("nested", true), "request", Map.of())));
        assertThrows(HookInputValidationException.class,
                () -> validator.validate(registry.require("after_signup"), null));
    }

    @Test
    void client_type_is_constrained() {
        Map<String, Object> input = Map.of("name", "cli", "redirectUrls", List.of("https://x"), "type", "weird");
        assertThrows(HookInputValidationException.class,
                () -> validator.validate(registry.require("client_before_register"), input));
    }
}
