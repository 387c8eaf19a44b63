package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.Group;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.GroupGraph;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.graph.ResolvedRoles;
import com.techStack.accessSys.models.graph.RoleGraph;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.repository.authorization.AccessGraphRepository;
import com.techStack.accessSys.service.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes the roles that apply to a principal: direct roles, roles of the
 * principal's groups, and every ancestor of those roles.
 *
 * <p>Expired or inactive edges and inactive records are skipped. An ancestor walk
 * stops at the first inactive or missing role. A cycle in a role's ancestry drops
 * that role's ancestor contribution (the role itself is kept) and never fails the call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleAggregator {

    private final AccessGraphRepository repository;
    private final EngineProperties properties;
    private final EngineMetrics metrics;
    private final Clock clock;

    public Mono<ResolvedRoles> activeRoles(Principal principal) {
        return repository.getDirectRolesAndGroups(principal.getId())
                .defaultIfEmpty(PrincipalAssignments.none(principal.getId()))
                .flatMap(assignments -> {
                    Instant now = clock.instant();
                    SortedSet<String> directRoleIds = effectiveTargets(assignments.getRoles(), now);
                    SortedSet<String> groupIds = effectiveTargets(assignments.getGroups(), now);

                    return groupRoles(groupIds, now)
                            .flatMap(groupRoleIds -> {
                                SortedSet<String> seeds = new TreeSet<>(directRoleIds);
                                seeds.addAll(groupRoleIds);
                                return expandAncestry(principal.getId(), seeds)
                                        .map(expanded -> ResolvedRoles.builder()
                                                .principalId(principal.getId())
                                                .directRoleIds(Collections.unmodifiableSortedSet(directRoleIds))
                                                .groupRoleIds(Collections.unmodifiableSortedSet(groupRoleIds))
                                                .activeRoleIds(expanded.activeRoleIds())
                                                .roleGraph(expanded.graph())
                                                .build());
                            });
                })
                .doOnNext(resolved -> log.debug("Principal {} resolved to roles {}",
                        principal.getId(), resolved.getActiveRoleIds()));
    }

    /* =========================
       Groups
       ========================= */

    private Mono<SortedSet<String>> groupRoles(SortedSet<String> groupIds, Instant now) {
        if (groupIds.isEmpty()) {
            return Mono.just(new TreeSet<>());
        }
        return repository.getGroupAncestryAndRoles(groupIds)
                .defaultIfEmpty(GroupGraph.empty())
                .map(graph -> {
                    SortedSet<String> roleIds = new TreeSet<>();
                    for (String groupId : groupIds) {
                        Group group = graph.getGroups().get(groupId);
                        if (group == null || !group.isActive()) {
                            continue;
                        }
                        roleIds.addAll(effectiveTargets(group.getRoleGrants(), now));
                        if (properties.isInheritGroupRoles()) {
                            roleIds.addAll(ancestorGroupRoles(graph, groupId, now));
                        }
                    }
                    return roleIds;
                });
    }

    private SortedSet<String> ancestorGroupRoles(GroupGraph graph, String groupId, Instant now) {
        SortedSet<String> roleIds = new TreeSet<>();
        try {
            for (String ancestorId : HierarchyWalker.GROUPS.ancestors(groupId, graph::parentOf)) {
                Group ancestor = graph.getGroups().get(ancestorId);
                if (ancestor == null || !ancestor.isActive()) {
                    break;
                }
                roleIds.addAll(effectiveTargets(ancestor.getRoleGrants(), now));
            }
        } catch (CycleDetectedException e) {
            log.warn("⚠️ Ignoring ancestor groups of {}: {}", groupId, e.getMessage());
            metrics.recordCycle(e.getKind());
            return new TreeSet<>();
        }
        return roleIds;
    }

    /* =========================
       Role ancestry
       ========================= */

    private Mono<ExpandedRoles> expandAncestry(String principalId, SortedSet<String> seeds) {
        if (seeds.isEmpty()) {
            return Mono.just(new ExpandedRoles(Collections.emptySortedSet(), RoleGraph.empty()));
        }
        return repository.getRoleAncestryAndPermissions(seeds)
                .defaultIfEmpty(RoleGraph.empty())
                .map(graph -> {
                    SortedSet<String> active = new TreeSet<>();
                    for (String seedId : seeds) {
                        Role seed = graph.getRoles().get(seedId);
                        if (seed == null || !seed.isActive()) {
                            continue;
                        }
                        active.add(seedId);
                        active.addAll(ancestorsOf(principalId, seedId, graph));
                    }
                    return new ExpandedRoles(Collections.unmodifiableSortedSet(active), graph);
                });
    }

    private List<String> ancestorsOf(String principalId, String roleId, RoleGraph graph) {
        List<String> ancestors = new ArrayList<>();
        try {
            for (String ancestorId : HierarchyWalker.ROLES.ancestors(roleId, graph::parentOf)) {
                Role ancestor = graph.getRoles().get(ancestorId);
                if (ancestor == null || !ancestor.isActive()) {
                    break;
                }
                ancestors.add(ancestorId);
            }
        } catch (CycleDetectedException e) {
            log.warn("⚠️ Dropping inherited roles of {} for principal {}: {}", roleId, principalId, e.getMessage());
            metrics.recordCycle(e.getKind());
            return List.of();
        }
        return ancestors;
    }

    private static SortedSet<String> effectiveTargets(Collection<Assignment> edges, Instant now) {
        SortedSet<String> targets = new TreeSet<>();
        if (edges != null) {
            edges.stream()
                    .filter(edge -> edge.isEffectiveAt(now))
                    .map(Assignment::getTargetId)
                    .forEach(targets::add);
        }
        return targets;
    }

    private record ExpandedRoles(SortedSet<String> activeRoleIds, RoleGraph graph) {
    }
}
