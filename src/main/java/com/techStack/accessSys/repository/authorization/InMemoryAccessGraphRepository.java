package com.techStack.accessSys.repository.authorization;

import com.techStack.accessSys.exception.resource.ResourceNotFoundException;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.Group;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.GroupGraph;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.graph.RoleGraph;
import com.techStack.accessSys.models.tenant.Tenant;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-local store used for development and as test fixtures.
 * Permissions are compiled when they are put.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryAccessGraphRepository implements AccessGraphRepository {

    private final PermissionCompiler compiler;

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, Role> roles = new ConcurrentHashMap<>();
    private final Map<String, Group> groups = new ConcurrentHashMap<>();
    private final Map<String, PrincipalAssignments> principals = new ConcurrentHashMap<>();
    private final Map<String, PermissionRecord> permissions = new ConcurrentHashMap<>();

    private final Map<HierarchyKind, Object> hierarchyLocks = new EnumMap<>(Map.of(
            HierarchyKind.TENANT, new Object(),
            HierarchyKind.ROLE, new Object(),
            HierarchyKind.GROUP, new Object()));

    /* =========================
       Fixture writes
       ========================= */

    public InMemoryAccessGraphRepository putTenant(Tenant tenant) {
        tenants.put(tenant.getId(), tenant);
        return this;
    }

    public InMemoryAccessGraphRepository putRole(Role role) {
        roles.put(role.getId(), role);
        return this;
    }

    public InMemoryAccessGraphRepository putGroup(Group group) {
        groups.put(group.getId(), group);
        return this;
    }

    public InMemoryAccessGraphRepository putPrincipal(PrincipalAssignments assignments) {
        principals.put(assignments.getPrincipalId(), assignments);
        return this;
    }

    /**
     * @throws com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException
     *         if the definition does not name exactly one of resource id / path
     */
    public InMemoryAccessGraphRepository putPermission(PermissionDefinition definition) {
        permissions.put(definition.getId(), compiler.compile(definition));
        return this;
    }

    public void clear() {
        tenants.clear();
        roles.clear();
        groups.clear();
        principals.clear();
        permissions.clear();
    }

    /* =========================
       Reads
       ========================= */

    @Override
    public Mono<PrincipalAssignments> getDirectRolesAndGroups(String principalId) {
        return Mono.fromSupplier(() -> principals.getOrDefault(principalId, PrincipalAssignments.none(principalId)));
    }

    @Override
    public Mono<RoleGraph> getRoleAncestryAndPermissions(Collection<String> roleIds) {
        return Mono.fromSupplier(() -> {
            Map<String, Role> closure = closure(roleIds, roles::get, Role::getParentRoleId);
            RoleGraph.RoleGraphBuilder graph = RoleGraph.builder().roles(closure);
            closure.values().stream()
                    .flatMap(role -> role.getPermissionGrants().stream())
                    .map(Assignment::getTargetId)
                    .distinct()
                    .map(permissions::get)
                    .filter(Objects::nonNull)
                    .forEach(p -> graph.permission(p.getId(), p));
            return graph.build();
        });
    }

    @Override
    public Mono<GroupGraph> getGroupAncestryAndRoles(Collection<String> groupIds) {
        return Mono.fromSupplier(() -> GroupGraph.builder()
                .groups(closure(groupIds, groups::get, Group::getParentGroupId))
                .build());
    }

    @Override
    public Mono<Tenant> getTenantCeiling(String tenantId) {
        return Mono.justOrEmpty(tenants.get(tenantId));
    }

    @Override
    public Mono<Map<String, Tenant>> getTenantAncestry(String tenantId) {
        return Mono.fromSupplier(() -> closure(Set.of(tenantId), tenants::get, Tenant::getParentTenantId));
    }

    /* =========================
       Guarded write
       ========================= */

    @Override
    public Mono<Void> updateParent(HierarchyKind kind, String nodeId, String newParentId, ParentChangeCheck check) {
        return Mono.fromRunnable(() -> {
            synchronized (hierarchyLocks.get(kind)) {
                switch (kind) {
                    case TENANT -> reparent(tenants, "tenant", nodeId, newParentId, Tenant::getParentTenantId, check,
                            t -> t.toBuilder().parentTenantId(newParentId).build());
                    case ROLE -> reparent(roles, "role", nodeId, newParentId, Role::getParentRoleId, check,
                            r -> r.toBuilder().parentRoleId(newParentId).build());
                    case GROUP -> reparent(groups, "group", nodeId, newParentId, Group::getParentGroupId, check,
                            g -> g.toBuilder().parentGroupId(newParentId).build());
                }
            }
        });
    }

    private static <T> void reparent(Map<String, T> store, String label, String nodeId, String newParentId,
                                     Function<T, String> parentOf, ParentChangeCheck check,
                                     Function<T, T> withNewParent) {
        T node = store.get(nodeId);
        if (node == null) {
            throw new ResourceNotFoundException(label, nodeId);
        }
        if (newParentId != null && !store.containsKey(newParentId)) {
            throw new ResourceNotFoundException(label, newParentId);
        }
        check.verify(id -> {
            T current = store.get(id);
            return current == null ? null : parentOf.apply(current);
        });
        store.put(nodeId, withNewParent.apply(node));
        log.info("🔀 {} {} reparented to {}", label, nodeId, newParentId);
    }

    private static <T> Map<String, T> closure(Collection<String> seeds, Function<String, T> lookup,
                                              Function<T, String> parentOf) {
        Map<String, T> result = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seeds.stream().filter(Objects::nonNull).forEach(queue::add);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            T node = lookup.apply(id);
            if (node == null) {
                continue;
            }
            result.put(id, node);
            String parent = parentOf.apply(node);
            if (parent != null) {
                queue.add(parent);
            }
        }
        return result;
    }
}
