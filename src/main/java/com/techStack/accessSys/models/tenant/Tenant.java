package com.techStack.accessSys.models.tenant;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Node of the tenant tree (community, organization or branch).
 * A null ceiling means the layer configures no restriction of its own and inherits its parent's.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Tenant {

    String id;
    String name;
    String parentTenantId;
    CapabilityCeiling ceiling;

    @Builder.Default
    boolean active = true;

    public boolean hasCeiling() {
        return ceiling != null;
    }
}
