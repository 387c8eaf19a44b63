package com.techStack.accessSys.models.graph;

import lombok.Builder;
import lombok.Value;

import java.util.SortedSet;

/**
 * Output of role aggregation for one principal; shared across the checks of a batch.
 */
@Value
@Builder
public class ResolvedRoles {

    String principalId;
    SortedSet<String> directRoleIds;
    SortedSet<String> groupRoleIds;
    SortedSet<String> activeRoleIds;
    RoleGraph roleGraph;
}
