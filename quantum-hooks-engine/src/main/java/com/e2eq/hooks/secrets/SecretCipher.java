package com.e2eq.hooks.secrets;

import com.e2eq.hooks.config.HookEngineConfig;
import com.e2eq.hooks.exceptions.SecretException;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for stored secret values.
 * <p>
 * Stored format: Base64 of IV (12 bytes) + ciphertext + auth tag (16 bytes).
 * The key is configured as {@code quantum.hooks.secrets.encryption-key}, a Base64
 * encoded 32 byte value ({@code openssl rand -base64 32}).
 */
@ApplicationScoped
public class SecretCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey secretKey;

    @Inject
    public SecretCipher(HookEngineConfig config) {
        this(config.secrets().encryptionKey().filter(k -> !k.isBlank()).orElse(null));
    }

    public SecretCipher(String base64Key) {
        if (base64Key == null) {
            Log.warn("No quantum.hooks.secrets.encryption-key configured; pipeline secrets are unavailable. "
                    + "Generate one with: openssl rand -base64 32");
            this.secretKey = null;
        } else {
            this.secretKey = parseKey(base64Key);
        }
    }

    private static SecretKey parseKey(String base64Key) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("quantum.hooks.secrets.encryption-key must be valid Base64", e);
        }
        if (keyBytes.length != 32) {
            throw new IllegalStateException("quantum.hooks.secrets.encryption-key must be 256 bits (32 bytes). Got: "
                    + keyBytes.length + " bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    public boolean isConfigured() {
        return secretKey != null;
    }

    public String encrypt(String plaintext) {
        requireKey();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + encrypted.length);
            buffer.put(iv);
            buffer.put(encrypted);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new SecretException("Failed to encrypt secret", e);
        }
    }

    public String decrypt(String stored) {
        requireKey();
        try {
            byte[] cipherBytes = Base64.getDecoder().decode(stored);
            if (cipherBytes.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
                throw new SecretException("Invalid ciphertext: too short");
            }
            ByteBuffer buffer = ByteBuffer.wrap(cipherBytes);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SecretException("Invalid ciphertext encoding", e);
        } catch (GeneralSecurityException e) {
            throw new SecretException("Failed to decrypt secret", e);
        }
    }

    private void requireKey() {
        if (secretKey == null) {
            throw new SecretException("Encryption key not configured");
        }
    }
}
