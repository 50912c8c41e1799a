package com.e2eq.hooks.secrets;

import com.e2eq.hooks.exceptions.SecretException;
import com.e2eq.hooks.model.pipeline.PipelineSecret;
import com.e2eq.hooks.repo.SecretRepo;
import com.e2eq.hooks.script.SecretResolver;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Administration and lookup of pipeline secrets. Values can be replaced but never
 * read back by administrators; scripts read them by name.
 */
@ApplicationScoped
public class SecretService implements SecretResolver {

    private static final Pattern NAME = Pattern.compile(PipelineSecret.NAME_PATTERN);

    private final SecretRepo repo;
    private final SecretCipher cipher;
    private final Clock clock;

    @Inject
    public SecretService(SecretRepo repo, SecretCipher cipher) {
        this(repo, cipher, Clock.systemUTC());
    }

    public SecretService(SecretRepo repo, SecretCipher cipher, Clock clock) {
        this.repo = repo;
        this.cipher = cipher;
        this.clock = clock;
    }

    public PipelineSecret create(String name, String value, String description) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new SecretException("Invalid secret name '" + name + "': use upper case letters, digits and underscores, starting with a letter");
        }
        if (value == null || value.isEmpty()) {
            throw new SecretException("Secret value is required");
        }
        if (repo.findByName(name).isPresent()) {
            throw new SecretException("Secret " + name + " already exists");
        }
        Instant now = clock.instant();
        PipelineSecret secret = PipelineSecret.builder()
                .name(name)
                .encryptedValue(cipher.encrypt(value))
                .description(description)
                .updatedAt(now)
                .build();
        secret.ensureIdentity(now);
        Log.infof("Created pipeline secret %s", name);
        return repo.save(secret);
    }

    /**
     * Replace the value of an existing secret. The name is immutable.
     */
    public PipelineSecret replaceValue(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new SecretException("Secret value is required");
        }
        PipelineSecret secret = repo.findByName(name)
                .orElseThrow(() -> new SecretException("Secret not found: " + name));
        secret.setEncryptedValue(cipher.encrypt(value));
        secret.setUpdatedAt(clock.instant());
        Log.infof("Replaced value of pipeline secret %s", name);
        return repo.save(secret);
    }

    public boolean delete(String name) {
        boolean deleted = repo.deleteByName(name);
        if (deleted) {
            Log.infof("Deleted pipeline secret %s", name);
        }
        return deleted;
    }

    /**
     * Secret names for display. Values are never listed.
     */
    public List<String> listNames() {
        return repo.findAll().stream().map(PipelineSecret::getName).collect(Collectors.toList());
    }

    @Override
    public String resolve(String name) {
        PipelineSecret secret = repo.findByName(name)
                .orElseThrow(() -> new SecretException("Secret not found: " + name));
        return cipher.decrypt(secret.getEncryptedValue());
    }
}
