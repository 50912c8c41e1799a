package com.e2eq.hooks.authz;

/**
 * Who changed a policy and why, recorded on each policy version.
 */
public record ChangeAuthor(String type, String id, String reason) {

    public static final ChangeAuthor SYSTEM = new ChangeAuthor("system", "system", null);

    public static ChangeAuthor user(String userId, String reason) {
        return new ChangeAuthor("user", userId, reason);
    }
}
