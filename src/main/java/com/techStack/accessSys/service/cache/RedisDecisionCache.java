package com.techStack.accessSys.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.accessSys.exception.data.CacheException;
import com.techStack.accessSys.models.decision.DecisionCacheKey;
import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.service.observability.EngineMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared decision cache on Redis.
 *
 * <pre>
 *   {prefix}entry:{principal}|...   JSON CachedDecision, TTL
 *   {prefix}role:{roleId}           set of entry keys derived from the role
 *   {prefix}tenant:{tenantId}       set of entry keys of the tenant
 *   {prefix}generation              bumped by every invalidation
 * </pre>
 *
 * Reads and writes that fail are logged and the decision is computed without
 * caching. Invalidation failures propagate.
 */
@Slf4j
public class RedisDecisionCache implements DecisionCache {

    private static final int SCAN_BATCH = 500;

    private final ReactiveRedisTemplate<String, String> redis;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;
    private final Duration ttl;
    private final String prefix;
    private final CircuitBreaker circuitBreaker;

    public RedisDecisionCache(ReactiveRedisTemplate<String, String> redis,
                              ObjectMapper objectMapper,
                              EngineMetrics metrics,
                              Duration ttl,
                              String prefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.ttl = ttl;
        this.prefix = prefix;
        this.circuitBreaker = CircuitBreaker.ofDefaults("decisionCache");
    }

    /* =========================
       Read-through
       ========================= */

    @Override
    public Mono<CacheLookup> getOrCompute(DecisionCacheKey key, Mono<CachedDecision> compute) {
        String entryKey = entryKey(key);

        Mono<ReadState> state = Mono.zip(generation(), read(entryKey))
                .map(tuple -> new ReadState(true, tuple.getT1(), tuple.getT2()))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorResume(e -> {
                    log.warn("⚠️ Redis decision cache unavailable, computing directly: {}", e.getMessage());
                    metrics.recordCacheFailure("get");
                    return Mono.just(new ReadState(false, 0L, Optional.empty()));
                });

        return state.flatMap(s -> {
            if (s.cached().isPresent()) {
                return Mono.just(CacheLookup.hit(s.cached().get().decision()));
            }
            if (!s.available()) {
                return compute.map(computed -> CacheLookup.computed(computed.decision()));
            }
            return compute.flatMap(computed -> store(entryKey, computed, s.generation())
                    .thenReturn(CacheLookup.computed(computed.decision())));
        });
    }

    private Mono<Optional<CachedDecision>> read(String entryKey) {
        return redis.opsForValue().get(entryKey)
                .map(json -> deserialize(entryKey, json))
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<Long> generation() {
        return redis.opsForValue().get(generationKey())
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }

    private Mono<Void> store(String entryKey, CachedDecision value, long startedAt) {
        if (!value.decision().isCacheable()) {
            return Mono.empty();
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Could not serialise decision for {}: {}", entryKey, e.getMessage());
            return Mono.empty();
        }

        Mono<Void> write = redis.opsForValue().set(entryKey, json, ttl)
                .thenMany(Flux.fromIterable(value.roleIds()).concatMap(roleId -> index(roleIndex(roleId), entryKey)))
                .then(value.tenantId() == null ? Mono.<Void>empty() : index(tenantIndex(value.tenantId()), entryKey))
                // an invalidation may have run while writing
                .then(generation())
                .flatMap(current -> current == startedAt ? Mono.<Void>empty() : redis.delete(entryKey).then());

        return generation()
                .filter(current -> current == startedAt)
                .flatMap(current -> write)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorResume(e -> {
                    log.warn("⚠️ Failed to store decision {} in Redis: {}", entryKey, e.getMessage());
                    metrics.recordCacheFailure("set");
                    return Mono.empty();
                });
    }

    private Mono<Void> index(String indexKey, String entryKey) {
        return redis.opsForSet().add(indexKey, entryKey)
                .then(redis.expire(indexKey, ttl))
                .then();
    }

    /* =========================
       Invalidation
       ========================= */

    @Override
    public Mono<Void> invalidate(InvalidationScope scope) {
        return Mono.defer(() -> redis.opsForValue().increment(generationKey()))
                .then(Mono.defer(() -> removal(scope)))
                .doOnSuccess(v -> log.debug("Redis decision cache invalidated for {}", scope))
                .onErrorMap(e -> !(e instanceof CacheException),
                        e -> new CacheException("Failed to invalidate decision cache for " + scope, e));
    }

    private Mono<Void> removal(InvalidationScope scope) {
        return switch (scope.type()) {
            case PRINCIPAL -> deleteByPattern(prefix + "entry:" + escapeGlob(scope.id()) + "|*");
            case ROLE -> deleteIndexed(roleIndex(scope.id()));
            case TENANT -> deleteIndexed(tenantIndex(scope.id()));
            case ALL -> deleteByPattern(prefix + "entry:*")
                    .then(deleteByPattern(prefix + "role:*"))
                    .then(deleteByPattern(prefix + "tenant:*"));
        };
    }

    private Mono<Void> deleteIndexed(String indexKey) {
        return redis.opsForSet().members(indexKey)
                .buffer(SCAN_BATCH)
                .concatMap(keys -> redis.delete(keys.toArray(new String[0])))
                .then(redis.delete(indexKey))
                .then();
    }

    private Mono<Void> deleteByPattern(String pattern) {
        return redis.scan(ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build())
                .buffer(SCAN_BATCH)
                .concatMap(keys -> redis.delete(keys.toArray(new String[0])))
                .then();
    }

    /* =========================
       Keys
       ========================= */

    private String entryKey(DecisionCacheKey key) {
        return prefix + "entry:" + key.asString();
    }

    private String roleIndex(String roleId) {
        return prefix + "role:" + roleId;
    }

    private String tenantIndex(String tenantId) {
        return prefix + "tenant:" + tenantId;
    }

    private String generationKey() {
        return prefix + "generation";
    }

    static String escapeGlob(String value) {
        return value.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
    }

    private Optional<CachedDecision> deserialize(String entryKey, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, CachedDecision.class));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Discarding unreadable cache entry {}: {}", entryKey, e.getMessage());
            return Optional.empty();
        }
    }

    private record ReadState(boolean available, long generation, Optional<CachedDecision> cached) {
    }
}
