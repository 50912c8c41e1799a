package com.e2eq.hooks.script;

/**
 * Permission lookup exposed to hook scripts as {@code helpers.checkPermission}.
 */
@FunctionalInterface
public interface PermissionChecker {

    boolean check(String subjectType, String subjectId, String entityType, String entityId, String permission);
}
