package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.authz.AccessTuple;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage contract for relationship tuples. Implementations enforce uniqueness on
 * (entityType, entityId, relation, subjectType, subjectId).
 */
public interface TupleRepo {

    record CreateResult(AccessTuple tuple, boolean created) {
    }

    /**
     * Insert a tuple; fails when an identical tuple exists.
     */
    AccessTuple create(AccessTuple tuple);

    /**
     * Insert a tuple unless an identical one exists; returns the stored tuple either way.
     */
    CreateResult createIfNotExists(AccessTuple tuple);

    /**
     * Update a stored tuple in place (its condition, for example).
     */
    AccessTuple save(AccessTuple tuple);

    Optional<AccessTuple> findById(String id);

    Optional<AccessTuple> findExact(String entityType, String entityId, String relation,
                                    String subjectType, String subjectId);

    List<AccessTuple> findBySubject(String subjectType, String subjectId);

    List<AccessTuple> findByEntity(String entityType, String entityId);

    List<AccessTuple> findByEntityAndRelation(String entityType, String entityId, String relation);

    List<AccessTuple> findByEntityType(String entityType);

    List<AccessTuple> findByEntityTypeId(String entityTypeId);

    /**
     * Tuples on {@code entityType} held by the subject whose entityId is one of
     * {@code entityIds} and whose relation is one of {@code relations}.
     */
    List<AccessTuple> findGrants(String entityType, Collection<String> entityIds, Collection<String> relations,
                                 String subjectType, String subjectId);

    /**
     * Tuples of {@code entityType} where the subject holds {@code relation}, on any entity.
     * Used for group membership lookups.
     */
    List<AccessTuple> findBySubjectAndRelation(String entityType, String relation,
                                               String subjectType, String subjectId);

    boolean delete(String entityType, String entityId, String relation, String subjectType, String subjectId);

    boolean deleteById(String id);

    long deleteByEntity(String entityType, String entityId);

    long deleteBySubjectAndEntityType(String subjectType, String subjectId, String entityType);

    long countByRelation(String entityType, String relation);

    long countByEntityAndRelation(String entityType, String entityId, String relation);

    long countByEntityType(String entityType);

    /**
     * Rewrite the denormalized entityType name of every tuple belonging to the model.
     *
     * @return number of tuples updated
     */
    long updateEntityTypeName(String entityTypeId, String newEntityType);
}
