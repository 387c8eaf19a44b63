package com.techStack.accessSys.models.decision;

import lombok.Value;

import java.util.Objects;

/**
 * Row-level filter for list queries. An unrestricted filter means the principal
 * holds the cross-branch capability and no branch predicate applies.
 */
@Value
public class ScopeFilter {

    boolean restricted;
    String tenantId;
    String branchId;

    public static ScopeFilter unrestricted() {
        return new ScopeFilter(false, null, null);
    }

    public static ScopeFilter branch(String tenantId, String branchId) {
        return new ScopeFilter(true, tenantId, branchId);
    }

    public boolean matches(String rowTenantId, String rowBranchId) {
        if (!restricted) {
            return true;
        }
        return Objects.equals(tenantId, rowTenantId) && Objects.equals(branchId, rowBranchId);
    }
}
