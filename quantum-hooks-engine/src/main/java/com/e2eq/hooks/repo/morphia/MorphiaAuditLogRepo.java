package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.exceptions.AuditWriteException;
import com.e2eq.hooks.model.authz.AuditLogEntry;
import com.e2eq.hooks.repo.AuditLogRepo;
import com.mongodb.MongoException;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

@ApplicationScoped
public class MorphiaAuditLogRepo implements AuditLogRepo {

    @Inject
    HookDatastore datastore;

    @Override
    public void append(AuditLogEntry entry) {
        try {
            datastore.get().insert(entry);
        } catch (MongoException e) {
            throw new AuditWriteException("Failed to write audit entry for " + entry.getEntityType()
                    + ":" + entry.getEntityId(), e);
        }
    }

    @Override
    public List<AuditLogEntry> findByEntity(String entityType, String entityId, int limit) {
        return datastore.get().find(AuditLogEntry.class)
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId))
                .iterator(new FindOptions().sort(Sort.descending("createdAt")).limit(limit))
                .toList();
    }
}
