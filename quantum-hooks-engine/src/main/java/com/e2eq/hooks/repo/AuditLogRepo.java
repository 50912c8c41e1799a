package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.authz.AuditLogEntry;

import java.util.List;

public interface AuditLogRepo {

    /**
     * @throws com.e2eq.hooks.exceptions.AuditWriteException when the entry could not be stored
     */
    void append(AuditLogEntry entry);

    List<AuditLogEntry> findByEntity(String entityType, String entityId, int limit);
}
