package com.e2eq.hooks.authz;

import java.util.Map;

/**
 * One permission question plus the attributes handed to policy scripts and the
 * caller details written to the audit log.
 */
public record PermissionRequest(String subjectType,
                                String subjectId,
                                String entityType,
                                String entityId,
                                String permission,
                                Map<String, Object> attributes,
                                String requestIp,
                                String requestUserAgent) {

    public PermissionRequest {
        attributes = attributes == null ? Map.of() : attributes;
    }

    public static PermissionRequest of(String subjectType, String subjectId, String entityType, String entityId,
                                       String permission) {
        return new PermissionRequest(subjectType, subjectId, entityType, entityId, permission, Map.of(), null, null);
    }

    public PermissionRequest withAttributes(Map<String, Object> attrs) {
        return new PermissionRequest(subjectType, subjectId, entityType, entityId, permission, attrs,
                requestIp, requestUserAgent);
    }
}
