package com.techStack.accessSys.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.techStack.accessSys.models.decision.DecisionCacheKey;
import com.techStack.accessSys.models.decision.InvalidationScope;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process decision cache. Caffeine gives per-key atomic replacement and
 * lock-free reads; scoped invalidation scans the entry set.
 */
@Slf4j
public class CaffeineDecisionCache implements DecisionCache {

    private final Cache<DecisionCacheKey, CachedDecision> cache;
    private final AtomicLong generation = new AtomicLong();

    public CaffeineDecisionCache(Duration ttl, long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    @Override
    public Mono<CacheLookup> getOrCompute(DecisionCacheKey key, Mono<CachedDecision> compute) {
        return Mono.defer(() -> {
            CachedDecision cached = cache.getIfPresent(key);
            if (cached != null) {
                return Mono.just(CacheLookup.hit(cached.decision()));
            }
            long startedAt = generation.get();
            return compute.map(computed -> {
                store(key, computed, startedAt);
                return CacheLookup.computed(computed.decision());
            });
        });
    }

    private void store(DecisionCacheKey key, CachedDecision value, long startedAt) {
        if (!value.decision().isCacheable() || generation.get() != startedAt) {
            return;
        }
        cache.put(key, value);
        // an invalidation may have run between the check and the put
        if (generation.get() != startedAt) {
            cache.invalidate(key);
        }
    }

    @Override
    public Mono<Void> invalidate(InvalidationScope scope) {
        return Mono.fromRunnable(() -> {
            generation.incrementAndGet();
            switch (scope.type()) {
                case PRINCIPAL -> cache.asMap().keySet().removeIf(k -> scope.id().equals(k.principalId()));
                case TENANT -> cache.asMap().keySet().removeIf(k -> scope.id().equals(k.tenantId()));
                case ROLE -> cache.asMap().values().removeIf(v -> v.roleIds().contains(scope.id()));
                case ALL -> cache.invalidateAll();
            }
            log.debug("Local decision cache invalidated for {} ({} entries left)", scope, cache.estimatedSize());
        });
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
