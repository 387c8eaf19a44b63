package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.service.cache.DecisionCache;
import com.techStack.accessSys.service.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Invalidation hook called by the write path after every committed change to
 * permissions, roles, groups, assignments or hierarchy shape.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionInvalidationService {

    private final DecisionCache decisionCache;
    private final EngineMetrics metrics;

    public Mono<Void> invalidate(InvalidationScope scope) {
        return decisionCache.invalidate(scope)
                .doOnSuccess(v -> {
                    metrics.recordInvalidation(scope);
                    log.info("🧹 Decision cache invalidated: scope={} id={}", scope.type().value(), scope.id());
                })
                .doOnError(e -> log.error("❌ Decision cache invalidation failed for {}: {}", scope, e.getMessage()));
    }
}
