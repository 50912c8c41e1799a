package com.e2eq.hooks.authz;

import com.e2eq.hooks.model.authz.AuditLogEntry;
import com.e2eq.hooks.repo.AuditLogRepo;
import com.e2eq.hooks.util.ExceptionLoggingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Best-effort writer of permission audit entries. Failures are logged and dropped.
 */
@ApplicationScoped
public class AuditLogger {

    private final AuditLogRepo repo;

    @Inject
    public AuditLogger(AuditLogRepo repo) {
        this.repo = repo;
    }

    public void record(AuditLogEntry entry) {
        try {
            repo.append(entry);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logBestEffortFailure(e, "Failed to write audit entry for %s:%s %s",
                    entry.getEntityType(), entry.getEntityId(), entry.getPermission());
        }
    }

    public List<AuditLogEntry> recent(String entityType, String entityId, int limit) {
        return repo.findByEntity(entityType, entityId, limit);
    }
}
