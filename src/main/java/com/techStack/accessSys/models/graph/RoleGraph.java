package com.techStack.accessSys.models.graph;

import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.Role;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Roles reachable from a seed set by parent links, with every permission those roles grant.
 */
@Value
@Builder
public class RoleGraph {

    @Singular
    Map<String, Role> roles;

    @Singular
    Map<String, PermissionRecord> permissions;

    public static RoleGraph empty() {
        return RoleGraph.builder().build();
    }

    public String parentOf(String roleId) {
        Role role = roles.get(roleId);
        return role == null ? null : role.getParentRoleId();
    }
}
