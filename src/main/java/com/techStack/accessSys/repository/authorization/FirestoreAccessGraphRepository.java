package com.techStack.accessSys.repository.authorization;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException;
import com.techStack.accessSys.exception.resource.ResourceNotFoundException;
import com.techStack.accessSys.exception.service.CustomException;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.Group;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.GroupGraph;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.graph.RoleGraph;
import com.techStack.accessSys.models.tenant.Tenant;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import com.techStack.accessSys.util.firebase.AccessGraphDocumentMapper;
import com.techStack.accessSys.util.firebase.FirestoreUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Access graph on Google Cloud Firestore.
 *
 * <p>Closures are fetched one hierarchy level per {@code getAll} round trip, so the
 * number of reads grows with depth, not with fan-out. Parent changes run inside a
 * Firestore transaction, which retries on contention.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access.store", havingValue = "firestore")
public class FirestoreAccessGraphRepository implements AccessGraphRepository {

    private final Firestore firestore;
    private final PermissionCompiler compiler;

    /* =========================
       Reads
       ========================= */

    @Override
    public Mono<PrincipalAssignments> getDirectRolesAndGroups(String principalId) {
        DocumentReference ref = firestore.collection(AccessGraphDocumentMapper.PRINCIPALS).document(principalId);
        return FirestoreUtils.apiFutureToMono(ref.get())
                .map(doc -> doc.exists()
                        ? AccessGraphDocumentMapper.toPrincipalAssignments(doc)
                        : PrincipalAssignments.none(principalId))
                .doOnError(e -> log.error("❌ Failed to load assignments of {}: {}", principalId, e.getMessage()));
    }

    @Override
    public Mono<RoleGraph> getRoleAncestryAndPermissions(Collection<String> roleIds) {
        return closure(AccessGraphDocumentMapper.ROLES, roleIds, AccessGraphDocumentMapper::toRole, Role::getParentRoleId)
                .flatMap(roles -> {
                    Set<String> permissionIds = roles.values().stream()
                            .flatMap(role -> role.getPermissionGrants().stream())
                            .map(Assignment::getTargetId)
                            .filter(Objects::nonNull)
                            .collect(Collectors.toCollection(LinkedHashSet::new));
                    return loadPermissions(permissionIds)
                            .map(permissions -> RoleGraph.builder()
                                    .roles(roles)
                                    .permissions(permissions)
                                    .build());
                });
    }

    @Override
    public Mono<GroupGraph> getGroupAncestryAndRoles(Collection<String> groupIds) {
        return closure(AccessGraphDocumentMapper.GROUPS, groupIds, AccessGraphDocumentMapper::toGroup, Group::getParentGroupId)
                .map(groups -> GroupGraph.builder().groups(groups).build());
    }

    @Override
    public Mono<Tenant> getTenantCeiling(String tenantId) {
        DocumentReference ref = firestore.collection(AccessGraphDocumentMapper.TENANTS).document(tenantId);
        return FirestoreUtils.apiFutureToMono(ref.get())
                .filter(DocumentSnapshot::exists)
                .map(AccessGraphDocumentMapper::toTenant);
    }

    @Override
    public Mono<Map<String, Tenant>> getTenantAncestry(String tenantId) {
        return closure(AccessGraphDocumentMapper.TENANTS, List.of(tenantId),
                AccessGraphDocumentMapper::toTenant, Tenant::getParentTenantId);
    }

    private Mono<Map<String, PermissionRecord>> loadPermissions(Set<String> permissionIds) {
        if (permissionIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        CollectionReference collection = firestore.collection(AccessGraphDocumentMapper.PERMISSIONS);
        DocumentReference[] refs = permissionIds.stream().map(collection::document).toArray(DocumentReference[]::new);

        return FirestoreUtils.apiFutureToMono(firestore.getAll(refs))
                .map(docs -> {
                    Map<String, PermissionRecord> permissions = new LinkedHashMap<>();
                    for (DocumentSnapshot doc : docs) {
                        if (!doc.exists()) {
                            continue;
                        }
                        try {
                            permissions.put(doc.getId(),
                                    compiler.compile(AccessGraphDocumentMapper.toPermissionDefinition(doc)));
                        } catch (AmbiguousResourceSpecificationException e) {
                            log.error("❌ Skipping stored permission {}: {}", doc.getId(), e.getMessage());
                        }
                    }
                    return permissions;
                });
    }

    /**
     * Breadth-first fetch of the given nodes and their ancestors. Ids already
     * fetched are not requested again, which also ends the walk on a cycle.
     */
    private <T> Mono<Map<String, T>> closure(String collection, Collection<String> seeds,
                                             Function<DocumentSnapshot, T> mapper, Function<T, String> parentOf) {
        return Mono.defer(() -> {
            Set<String> frontier = seeds.stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return fetchLevel(collection, frontier, new LinkedHashMap<>(), new HashSet<>(), mapper, parentOf);
        });
    }

    private <T> Mono<Map<String, T>> fetchLevel(String collection, Set<String> frontier, Map<String, T> acc,
                                                Set<String> requested, Function<DocumentSnapshot, T> mapper,
                                                Function<T, String> parentOf) {
        frontier.removeIf(requested::contains);
        if (frontier.isEmpty()) {
            return Mono.just(acc);
        }
        requested.addAll(frontier);

        CollectionReference ref = firestore.collection(collection);
        DocumentReference[] refs = frontier.stream().map(ref::document).toArray(DocumentReference[]::new);

        return FirestoreUtils.apiFutureToMono(firestore.getAll(refs))
                .flatMap(docs -> {
                    Set<String> next = new LinkedHashSet<>();
                    for (DocumentSnapshot doc : docs) {
                        if (!doc.exists()) {
                            continue;
                        }
                        T node = mapper.apply(doc);
                        acc.put(doc.getId(), node);
                        String parent = parentOf.apply(node);
                        if (parent != null) {
                            next.add(parent);
                        }
                    }
                    return fetchLevel(collection, next, acc, requested, mapper, parentOf);
                });
    }

    /* =========================
       Guarded write
       ========================= */

    @Override
    public Mono<Void> updateParent(HierarchyKind kind, String nodeId, String newParentId, ParentChangeCheck check) {
        String collectionName = collectionOf(kind);
        String parentField = parentFieldOf(kind);
        CollectionReference collection = firestore.collection(collectionName);

        return FirestoreUtils.apiFutureToMono(firestore.runTransaction(tx -> {
                    DocumentSnapshot node = read(tx, collection.document(nodeId));
                    if (!node.exists()) {
                        throw new ResourceNotFoundException(kind.name().toLowerCase(), nodeId);
                    }
                    if (newParentId != null && !read(tx, collection.document(newParentId)).exists()) {
                        throw new ResourceNotFoundException(kind.name().toLowerCase(), newParentId);
                    }
                    check.verify(id -> {
                        DocumentSnapshot doc = read(tx, collection.document(id));
                        return doc.exists() ? doc.getString(parentField) : null;
                    });
                    tx.update(collection.document(nodeId), parentField, newParentId);
                    return null;
                }))
                .onErrorMap(FirestoreUtils::unwrapDomainException)
                .doOnSuccess(v -> log.info("🔀 {} {} reparented to {} in Firestore", kind, nodeId, newParentId))
                .then();
    }

    private static DocumentSnapshot read(Transaction tx, DocumentReference ref) {
        try {
            return tx.get(ref).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CustomException(HttpStatus.SERVICE_UNAVAILABLE, "Interrupted while reading " + ref.getPath(),
                    e, null, ErrorCode.DATABASE_ERROR.getCode());
        } catch (ExecutionException e) {
            throw new CustomException(HttpStatus.SERVICE_UNAVAILABLE, "Failed to read " + ref.getPath(),
                    e.getCause(), null, ErrorCode.DATABASE_ERROR.getCode());
        }
    }

    private static String collectionOf(HierarchyKind kind) {
        return switch (kind) {
            case TENANT -> AccessGraphDocumentMapper.TENANTS;
            case ROLE -> AccessGraphDocumentMapper.ROLES;
            case GROUP -> AccessGraphDocumentMapper.GROUPS;
        };
    }

    private static String parentFieldOf(HierarchyKind kind) {
        return switch (kind) {
            case TENANT -> AccessGraphDocumentMapper.TENANT_PARENT;
            case ROLE -> AccessGraphDocumentMapper.ROLE_PARENT;
            case GROUP -> AccessGraphDocumentMapper.GROUP_PARENT;
        };
    }
}
