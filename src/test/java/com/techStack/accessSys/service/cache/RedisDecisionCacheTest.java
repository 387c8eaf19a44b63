package com.techStack.accessSys.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.accessSys.exception.data.CacheException;
import com.techStack.accessSys.models.decision.AccessDecision;
import com.techStack.accessSys.models.decision.DecisionCacheKey;
import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.service.observability.EngineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisDecisionCacheTest {

    @Mock
    private ReactiveRedisTemplate<String, String> redis;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private RedisDecisionCache cache;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        when(redis.opsForValue()).thenReturn(valueOps);
        cache = new RedisDecisionCache(redis, objectMapper, new EngineMetrics(registry, "access"),
                Duration.ofMinutes(5), "test:");
    }

    @Test
    void servesStoredEntryWithoutComputing() throws Exception {
        AccessDecision decision = AccessDecision.granted(List.of("p1"), new TreeMap<>());
        String json = objectMapper.writeValueAsString(new CachedDecision(decision, Set.of("r1"), "t1"));
        when(valueOps.get("test:generation")).thenReturn(Mono.just("3"));
        when(valueOps.get("test:entry:" + key().asString())).thenReturn(Mono.just(json));

        StepVerifier.create(cache.getOrCompute(key(), Mono.error(new AssertionError("must not compute"))))
                .assertNext(lookup -> {
                    assertThat(lookup.hit()).isTrue();
                    assertThat(lookup.decision()).isEqualTo(decision);
                })
                .verifyComplete();
    }

    @Test
    void unreachableRedisFallsBackToComputing() {
        when(valueOps.get(anyString())).thenReturn(Mono.error(new RedisConnectionFailureException("refused")));
        AccessDecision decision = AccessDecision.granted(List.of("p1"), new TreeMap<>());

        StepVerifier.create(cache.getOrCompute(key(), Mono.just(new CachedDecision(decision, Set.of("r1"), "t1"))))
                .assertNext(lookup -> {
                    assertThat(lookup.hit()).isFalse();
                    assertThat(lookup.decision()).isEqualTo(decision);
                })
                .verifyComplete();

        verify(valueOps, never()).set(anyString(), anyString(), eq(Duration.ofMinutes(5)));
        assertThat(registry.find("access.cache.failures").tag("operation", "get").counter().count()).isEqualTo(1.0);
    }

    @Test
    void invalidationFailureSurfacesAsCacheException() {
        when(valueOps.increment("test:generation")).thenReturn(Mono.error(new RedisConnectionFailureException("refused")));

        StepVerifier.create(cache.invalidate(InvalidationScope.all()))
                .expectError(CacheException.class)
                .verify();
    }

    @Test
    void globCharactersInIdsAreEscaped() {
        assertThat(RedisDecisionCache.escapeGlob("user*[1]?")).isEqualTo("user\\*\\[1\\]\\?");
    }

    private static DecisionCacheKey key() {
        return new DecisionCacheKey("u1", "t1", "doc", "d1", "read", "fp");
    }
}
