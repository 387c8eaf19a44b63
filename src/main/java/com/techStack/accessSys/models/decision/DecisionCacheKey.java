package com.techStack.accessSys.models.decision;

/**
 * Cache identity of a decision. The context fingerprint covers the request
 * context and the resource attributes, which conditions may read.
 */
public record DecisionCacheKey(String principalId,
                               String tenantId,
                               String resourceType,
                               String resourceRef,
                               String action,
                               String contextFingerprint) {

    public String asString() {
        return String.join("|", principalId, tenantId, resourceType,
                resourceRef == null ? "" : resourceRef, action, contextFingerprint);
    }
}
