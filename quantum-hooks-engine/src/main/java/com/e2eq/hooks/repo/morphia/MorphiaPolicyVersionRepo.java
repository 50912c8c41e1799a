package com.e2eq.hooks.repo.morphia;

import com.e2eq.hooks.model.authz.PolicyLevel;
import com.e2eq.hooks.model.authz.PolicyVersion;
import com.e2eq.hooks.repo.PolicyVersionRepo;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Query;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

@ApplicationScoped
public class MorphiaPolicyVersionRepo implements PolicyVersionRepo {

    @Inject
    HookDatastore datastore;

    private Query<PolicyVersion> history(String entityType, String permissionName, PolicyLevel level, String tupleId) {
        return datastore.get().find(PolicyVersion.class)
                .filter(Filters.eq("entityType", entityType))
                .filter(Filters.eq("permissionName", permissionName))
                .filter(Filters.eq("policyLevel", level))
                .filter(Filters.eq("tupleId", tupleId));
    }

    @Override
    public int latestVersion(String entityType, String permissionName, PolicyLevel level, String tupleId) {
        PolicyVersion latest = history(entityType, permissionName, level, tupleId)
                .first(new FindOptions().sort(Sort.descending("version")));
        return latest == null ? 0 : latest.getVersion();
    }

    @Override
    public List<PolicyVersion> findHistory(String entityType, String permissionName, PolicyLevel level, String tupleId) {
        return history(entityType, permissionName, level, tupleId)
                .iterator(new FindOptions().sort(Sort.descending("version")))
                .toList();
    }

    @Override
    public PolicyVersion append(PolicyVersion version) {
        return datastore.get().save(version);
    }
}
