package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.dto.response.EffectivePermissionsReport;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.ResolvedRoles;
import com.techStack.accessSys.models.principal.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything a principal can reach, for audit and debugging. Conditions are not
 * evaluated here; a conditional permission is listed as reachable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EffectivePermissionService {

    private final RoleAggregator roleAggregator;
    private final Clock clock;

    public Mono<EffectivePermissionsReport> report(Principal principal) {
        return roleAggregator.activeRoles(principal)
                .map(resolved -> build(principal, resolved))
                .doOnNext(report -> log.info("📋 Effective permissions for {}: {} roles, {} scopes",
                        principal.getId(), report.getResolvedRoleIds().size(), report.getScopes().size()));
    }

    private EffectivePermissionsReport build(Principal principal, ResolvedRoles resolved) {
        Instant now = clock.instant();
        SortedMap<String, List<String>> byRole = new TreeMap<>();
        SortedSet<String> scopes = new TreeSet<>();

        for (String roleId : resolved.getActiveRoleIds()) {
            Role role = resolved.getRoleGraph().getRoles().get(roleId);
            if (role == null) {
                continue;
            }
            SortedSet<String> permissionIds = new TreeSet<>();
            for (Assignment grant : role.getPermissionGrants()) {
                PermissionRecord permission = resolved.getRoleGraph().getPermissions().get(grant.getTargetId());
                if (!grant.isEffectiveAt(now) || permission == null || !permission.isActive()) {
                    continue;
                }
                permissionIds.add(permission.getId());
                for (String action : permission.getActions()) {
                    scopes.add(permission.getResourceType() + ":" + action);
                    if (permission.getResourceId() != null) {
                        scopes.add(permission.getResourceType() + ":" + action + ":" + permission.getResourceId());
                    }
                }
            }
            byRole.put(roleId, new ArrayList<>(permissionIds));
        }

        return EffectivePermissionsReport.builder()
                .principalId(principal.getId())
                .tenantId(principal.getTenantId())
                .directRoleIds(resolved.getDirectRoleIds())
                .groupRoleIds(resolved.getGroupRoleIds())
                .resolvedRoleIds(resolved.getActiveRoleIds())
                .permissionIdsByRole(byRole)
                .scopes(scopes)
                .build();
    }
}
