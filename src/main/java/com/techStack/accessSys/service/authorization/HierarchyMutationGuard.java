package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.repository.authorization.AccessGraphRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Write-path guard for parent pointer changes. The ancestor walk and the write
 * happen in one atomic store operation, so two concurrent changes cannot close
 * a loop that neither would alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HierarchyMutationGuard {

    private final AccessGraphRepository repository;
    private final DecisionInvalidationService invalidationService;

    /**
     * @param newParentId null detaches the node
     * @throws CycleDetectedException when {@code newParentId} is the node itself or a descendant of it
     */
    public Mono<Void> reparent(HierarchyKind kind, String nodeId, String newParentId) {
        HierarchyWalker<String> walker = walkerFor(kind);

        return repository.updateParent(kind, nodeId, newParentId, parentOf -> {
                    if (newParentId != null && walker.isSelfOrAncestor(nodeId, newParentId, parentOf)) {
                        throw new CycleDetectedException(kind, nodeId, nodeId);
                    }
                })
                .doOnError(CycleDetectedException.class, e ->
                        log.warn("🚫 Refused to reparent {} {} under {}: {}", kind, nodeId, newParentId, e.getMessage()))
                .then(Mono.defer(() -> invalidationService.invalidate(InvalidationScope.all())))
                .doOnSuccess(v -> log.info("✅ {} {} now has parent {}", kind, nodeId, newParentId));
    }

    private static HierarchyWalker<String> walkerFor(HierarchyKind kind) {
        return switch (kind) {
            case TENANT -> HierarchyWalker.TENANTS;
            case ROLE -> HierarchyWalker.ROLES;
            case GROUP -> HierarchyWalker.GROUPS;
        };
    }
}
