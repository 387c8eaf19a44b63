package com.techStack.accessSys.service.cache;

import com.techStack.accessSys.models.decision.AccessDecision;

import java.util.Set;

/**
 * Stored cache value: the decision plus what it was derived from, so role and
 * tenant scoped invalidation can find it.
 */
public record CachedDecision(AccessDecision decision, Set<String> roleIds, String tenantId) {

    public CachedDecision {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }
}
