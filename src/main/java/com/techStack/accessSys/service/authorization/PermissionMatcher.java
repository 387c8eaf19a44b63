package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.ResolvedRoles;
import com.techStack.accessSys.models.principal.ResourceRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Selects the permissions of the active roles that address the requested resource.
 */
@Slf4j
@Component
public class PermissionMatcher {

    private static final String WILDCARD = "*";

    /**
     * Active permissions reachable through unexpired role→permission edges whose
     * resource type and id or path match, ordered by permission id.
     */
    public List<PermissionRecord> candidates(ResolvedRoles resolved, ResourceRef resource, Instant now) {
        Map<String, PermissionRecord> matched = new TreeMap<>();
        Map<String, Role> roles = resolved.getRoleGraph().getRoles();
        Map<String, PermissionRecord> permissions = resolved.getRoleGraph().getPermissions();

        for (String roleId : resolved.getActiveRoleIds()) {
            Role role = roles.get(roleId);
            if (role == null) {
                continue;
            }
            for (Assignment grant : role.getPermissionGrants()) {
                if (!grant.isEffectiveAt(now)) {
                    continue;
                }
                PermissionRecord permission = permissions.get(grant.getTargetId());
                if (permission != null && permission.isActive() && matches(permission, resource)) {
                    matched.putIfAbsent(permission.getId(), permission);
                }
            }
        }
        log.debug("Matched {} candidate permissions for {}:{}", matched.size(), resource.getType(), resource.matchTarget());
        return new ArrayList<>(matched.values());
    }

    public static boolean matches(PermissionRecord permission, ResourceRef resource) {
        if (!Objects.equals(permission.getResourceType(), resource.getType())) {
            return false;
        }
        if (permission.getResourceId() != null) {
            return permission.getResourceId().equals(resource.getId());
        }
        return pathMatches(permission.getResourcePath(), resource.matchTarget());
    }

    /**
     * A pattern ending in {@code *} matches any value starting with the text
     * before it; any other pattern must equal the value.
     */
    public static boolean pathMatches(String pattern, String value) {
        if (pattern == null || value == null) {
            return false;
        }
        if (pattern.endsWith(WILDCARD)) {
            return value.startsWith(pattern.substring(0, pattern.length() - WILDCARD.length()));
        }
        return pattern.equals(value);
    }
}
