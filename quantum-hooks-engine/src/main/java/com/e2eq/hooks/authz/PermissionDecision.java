package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.AuditResult;
import com.e2eq.hooks.model.authz.PolicySource;

/**
 * @param policySource the policy script that decided, or null when the relation check alone decided
 * @param error internal failure that forced a denial; never shown to end users
 */
public record PermissionDecision(boolean allowed, AuditResult result, PolicySource policySource, String error) {

    static PermissionDecision allowed(PolicySource source) {
        return new PermissionDecision(true, AuditResult.ALLOWED, source, null);
    }

    static PermissionDecision denied(PolicySource source) {
        return new PermissionDecision(false, AuditResult.DENIED, source, null);
    }

    static PermissionDecision failed(PolicySource source, String error) {
        return new PermissionDecision(false, AuditResult.ERROR, source, error);
    }
}
