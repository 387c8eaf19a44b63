package com.techStack.accessSys.models.authorization;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Role node of the role hierarchy together with its direct permission grants.
 * Priority is carried for display ordering only and never affects a decision.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Role {

    String id;
    String tenantId;
    String name;
    String parentRoleId;

    @Builder.Default
    boolean assignable = true;

    @Builder.Default
    int priority = 0;

    @Builder.Default
    boolean active = true;

    @Singular
    List<Assignment> permissionGrants;
}
