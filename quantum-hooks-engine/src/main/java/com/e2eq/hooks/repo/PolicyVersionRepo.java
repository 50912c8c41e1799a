package com.e2eq.hooks.repo;

import com.e2eq.hooks.model.authz.PolicyLevel;
import com.e2eq.hooks.model.authz.PolicyVersion;

import java.util.List;

public interface PolicyVersionRepo {

    /**
     * Highest version recorded for the policy, or 0 when it has no history.
     */
    int latestVersion(String entityType, String permissionName, PolicyLevel level, String tupleId);

    /**
     * History newest first.
     */
    List<PolicyVersion> findHistory(String entityType, String permissionName, PolicyLevel level, String tupleId);

    PolicyVersion append(PolicyVersion version);
}
