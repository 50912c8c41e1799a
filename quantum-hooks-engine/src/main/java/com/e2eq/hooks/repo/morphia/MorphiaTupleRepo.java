package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.authz.AccessTuple;
import com.e2eq.hooks.repo.TupleRepo;
import com.mongodb.MongoException;
import dev.morphia.DeleteOptions;
import dev.morphia.UpdateOptions;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Query;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import dev.morphia.query.updates.UpdateOperators;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class MorphiaTupleRepo implements TupleRepo {

    @Inject
    HookDatastore datastore;

    private Query<AccessTuple> query() {
        return datastore.get().find(AccessTuple.class);
    }

    private Query<AccessTuple> exact(String entityType, String entityId, String relation,
                                     String subjectType, String subjectId) {
        return query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId))
                .filter(Filters.eq("relation", relation))
                .filter(Filters.eq("subjectType", subjectType))
                .filter(Filters.eq("subjectId", subjectId));
    }

    private static List<AccessTuple> list(Query<AccessTuple> q) {
        return q.iterator(new FindOptions().sort(Sort.ascending("createdAt"))).toList();
    }

    @Override
    public AccessTuple create(AccessTuple tuple) {
        tuple.ensureIdentity(Instant.now());
        return datastore.get().save(tuple);
    }

    @Override
    public CreateResult createIfNotExists(AccessTuple tuple) {
        Optional<AccessTuple> existing = findExact(tuple.getEntityType(), tuple.getEntityId(), tuple.getRelation(),
                tuple.getSubjectType(), tuple.getSubjectId());
        if (existing.isPresent()) {
            return new CreateResult(existing.get(), false);
        }
        try {
            return new CreateResult(create(tuple), true);
        } catch (MongoException e) {
            if (!HookDatastore.isDuplicateKey(e)) {
                throw e;
            }
            // lost the race with a concurrent insert of the same tuple
            Log.debugf("Tuple already exists after concurrent insert: %s", tuple);
            AccessTuple winner = findExact(tuple.getEntityType(), tuple.getEntityId(), tuple.getRelation(),
                    tuple.getSubjectType(), tuple.getSubjectId())
                    .orElseThrow(() -> e);
            return new CreateResult(winner, false);
        }
    }

    @Override
    public AccessTuple save(AccessTuple tuple) {
        return datastore.get().save(tuple);
    }

    @Override
    public Optional<AccessTuple> findById(String id) {
        return Optional.ofNullable(query().filter(Filters.eq("_id", id)).first());
    }

    @Override
    public Optional<AccessTuple> findExact(String entityType, String entityId, String relation,
                                           String subjectType, String subjectId) {
        return Optional.ofNullable(exact(entityType, entityId, relation, subjectType, subjectId).first());
    }

    @Override
    public List<AccessTuple> findBySubject(String subjectType, String subjectId) {
        return list(query()
                .filter(Filters.eq("subjectType", subjectType))
                .filter(Filters.eq("subjectId", subjectId)));
    }

    @Override
    public List<AccessTuple> findByEntity(String entityType, String entityId) {
        return list(query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId)));
    }

    @Override
    public List<AccessTuple> findByEntityAndRelation(String entityType, String entityId, String relation) {
        return list(query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId))
                .filter(Filters.eq("relation", relation)));
    }

    @Override
    public List<AccessTuple> findByEntityType(String entityType) {
        return list(query().filter(Filters.eq("entityType", entityType)));
    }

    @Override
    public List<AccessTuple> findByEntityTypeId(String entityTypeId) {
        return list(query().filter(Filters.eq("entityTypeId", entityTypeId)));
    }

    @Override
    public List<AccessTuple> findGrants(String entityType, Collection<String> entityIds, Collection<String> relations,
                                        String subjectType, String subjectId) {
        return list(query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.in("entityId", entityIds))
                .filter(Filters.in("relation", relations))
                .filter(Filters.eq("subjectType", subjectType))
                .filter(Filters.eq("subjectId", subjectId)));
    }

    @Override
    public List<AccessTuple> findBySubjectAndRelation(String entityType, String relation,
                                                      String subjectType, String subjectId) {
        return list(query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("relation", relation))
                .filter(Filters.eq("subjectType", subjectType))
                .filter(Filters.eq("subjectId", subjectId)));
    }

    @Override
    public boolean delete(String entityType, String entityId, String relation, String subjectType, String subjectId) {
        return exact(entityType, entityId, relation, subjectType, subjectId)
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }

    @Override
    public boolean deleteById(String id) {
        return query().filter(Filters.eq("_id", id))
                .delete(new DeleteOptions())
                .getDeletedCount() > 0;
    }

    @Override
    public long deleteByEntity(String entityType, String entityId) {
        return query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId))
                .delete(new DeleteOptions().multi(true))
                .getDeletedCount();
    }

    @Override
    public long deleteBySubjectAndEntityType(String subjectType, String subjectId, String entityType) {
        return query()
                .filter(Filters.eq("subjectType", subjectType))
                .filter(Filters.eq("subjectId", subjectId))
                .filter(Filters.eq("entityType", entityType))
                .delete(new DeleteOptions().multi(true))
                .getDeletedCount();
    }

    @Override
    public long countByRelation(String entityType, String relation) {
        return query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("relation", relation))
                .count();
    }

    @Override
    public long countByEntityAndRelation(String entityType, String entityId, String relation) {
        return query()
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("entityId", entityId))
                .filter(Filters.eq("relation", relation))
                .count();
    }

    @Override
    public long countByEntityType(String entityType) {
        return query().filter(Filters.eq("entityType", entityType)).count();
    }

    @Override
    public long updateEntityTypeName(String entityTypeId, String newEntityType) {
        return query()
                .filter(Filters.eq("entityTypeId", entityTypeId))
                .update(UpdateOperators.set("entityType", newEntityType))
                .execute(new UpdateOptions().multi(true))
                .getModifiedCount();
    }
}
