package com.e2eq.hooks.secrets;

import com.e2eq.hooks.exceptions.SecretException;
import com.e2eq.hooks.model.pipeline.PipelineSecret;
import com.e2eq.hooks.support.InMemorySecretRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SecretServiceTest {

    InMemorySecretRepo repo;
    SecretService service;

    static String randomKey() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    @BeforeEach
    void init() {
        repo = new InMemorySecretRepo();
        service = new SecretService(repo, new SecretCipher(randomKey()));
    }

    @Test
    void values_are_stored_encrypted_and_resolve_by_name() {
        PipelineSecret secret = service.create("STRIPE_KEY", "sk_live_123", "payments");
        assertNotEquals("sk_live_123", secret.getEncryptedValue());
        assertFalse(secret.getEncryptedValue().contains("sk_live_123"));
        assertEquals("sk_live_123", service.resolve("STRIPE_KEY"));
    }

    @Test
    void same_value_encrypts_differently_each_time() {
        SecretCipher cipher = new SecretCipher(randomKey());
        assertNotEquals(cipher.encrypt("abc"), cipher.encrypt("abc"));
    }

    @Test
    void invalid_names_are_rejected() {
        assertThrows(SecretException.class, () -> service.create("stripe_key", "v", null));
        assertThrows(SecretException.class, () -> service.create("1KEY", "v", null));
        assertThrows(SecretException.class, () -> service.create("API-KEY", "v", null));
        assertThrows(SecretException.class, () -> service.create(null, "v", null));
    }

    @Test
    void empty_value_is_rejected() {
        assertThrows(SecretException.class, () -> service.create("API_KEY", "", null));
    }

    @Test
    void duplicate_names_are_rejected() {
        service.create("API_KEY", "one", null);
        assertThrows(SecretException.class, () -> service.create("API_KEY", "two", null));
        assertEquals("one", service.resolve("API_KEY"));
    }

    @Test
    void replace_value_keeps_name() {
        service.create("API_KEY", "one", null);
        service.replaceValue("API_KEY", "two");
        assertEquals("two", service.resolve("API_KEY"));
        assertEquals(List.of("API_KEY"), service.listNames());
    }

    @Test
    void replace_missing_secret_fails() {
        assertThrows(SecretException.class, () -> service.replaceValue("NOPE", "x"));
    }

    @Test
    void deleted_secret_no_longer_resolves() {
        service.create("API_KEY", "one", null);
        assertTrue(service.delete("API_KEY"));
        assertFalse(service.delete("API_KEY"));
        assertThrows(SecretException.class, () -> service.resolve("API_KEY"));
    }

    @Test
    void value_encrypted_under_another_key_cannot_be_read() {
        PipelineSecret secret = service.create("API_KEY", "one", null);
        SecretCipher other = new SecretCipher(randomKey());
        assertThrows(SecretException.class, () -> other.decrypt(secret.getEncryptedValue()));
    }

    @Test
    void missing_key_disables_secrets() {
        SecretCipher unconfigured = new SecretCipher((String) null);
        assertFalse(unconfigured.isConfigured());
        assertThrows(SecretException.class, () -> unconfigured.encrypt("x"));
    }

    @Test
    void short_key_is_rejected() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);
        assertThrows(IllegalStateException.class, () -> new SecretCipher(shortKey));
    }
}
