package com.techStack.accessSys.repository.authorization;

import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.graph.GroupGraph;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.graph.RoleGraph;
import com.techStack.accessSys.models.tenant.Tenant;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Read contract of the persistence collaborator, batched by id list, plus the
 * one write the engine guards (parent pointer changes).
 *
 * <p>Closures stop at ids already fetched, so a cyclic hierarchy terminates here;
 * detecting the cycle is left to the caller's walk.
 */
public interface AccessGraphRepository {

    /** Direct role and group edges, expired or inactive ones included. Empty assignments when unknown. */
    Mono<PrincipalAssignments> getDirectRolesAndGroups(String principalId);

    /** The given roles, every role reachable by parent links, and every permission any of them grants. */
    Mono<RoleGraph> getRoleAncestryAndPermissions(Collection<String> roleIds);

    /** The given groups and every group reachable by parent links. */
    Mono<GroupGraph> getGroupAncestryAndRoles(Collection<String> groupIds);

    /** Empty when the tenant does not exist. */
    Mono<Tenant> getTenantCeiling(String tenantId);

    /** The tenant and its reachable ancestors keyed by id; empty map when the tenant does not exist. */
    Mono<Map<String, Tenant>> getTenantAncestry(String tenantId);

    /**
     * Runs {@code check} and, if it passes, sets the parent of {@code nodeId} to
     * {@code newParentId} atomically with respect to other parent changes of the same kind.
     *
     * @throws com.techStack.accessSys.exception.resource.ResourceNotFoundException
     *         when the node or the new parent does not exist
     */
    Mono<Void> updateParent(HierarchyKind kind, String nodeId, String newParentId, ParentChangeCheck check);
}
