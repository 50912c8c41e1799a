package com.e2eq.hooks.script;

/**
 * Resolves a secret value by name for {@code helpers.secret}.
 */
@FunctionalInterface
public interface SecretResolver {

    /**
     * @throws com.e2eq.hooks.exceptions.SecretException when no secret has that name
     */
    String resolve(String name);
}
