package com.techStack.accessSys.service.cache;

import com.techStack.accessSys.models.decision.DecisionCacheKey;
import com.techStack.accessSys.models.decision.InvalidationScope;
import reactor.core.publisher.Mono;

/**
 * Read-through memo of access decisions with TTL and scoped invalidation.
 *
 * <p>Implementations only store decisions whose reason is cacheable, and must not
 * store a value whose computation started before an invalidation that completed
 * while it was running.
 */
public interface DecisionCache {

    /**
     * Returns the cached decision for {@code key}, or subscribes to {@code compute},
     * stores its result and returns it. Errors from {@code compute} propagate and
     * nothing is stored.
     */
    Mono<CacheLookup> getOrCompute(DecisionCacheKey key, Mono<CachedDecision> compute);

    Mono<Void> invalidate(InvalidationScope scope);
}
