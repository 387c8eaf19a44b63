package com.techStack.accessSys.config.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.service.cache.CaffeineDecisionCache;
import com.techStack.accessSys.service.cache.DecisionCache;
import com.techStack.accessSys.service.cache.RedisDecisionCache;
import com.techStack.accessSys.service.observability.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

/**
 * Decision cache backend selection.
 *
 * ARCHITECTURE:
 * - local: Caffeine, per-instance, default
 * - redis: shared across instances, see RedisConfig for the connection
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "access.engine.cache.backend", havingValue = "local", matchIfMissing = true)
    public DecisionCache caffeineDecisionCache(EngineProperties properties) {
        EngineProperties.Cache cache = properties.getCache();
        log.info("💾 Decision cache: Caffeine (ttl={}, maxSize={})", cache.getTtl(), cache.getMaxSize());
        return new CaffeineDecisionCache(cache.getTtl(), cache.getMaxSize());
    }

    @Bean
    @ConditionalOnProperty(name = "access.engine.cache.backend", havingValue = "redis")
    public DecisionCache redisDecisionCache(
            @Qualifier("decisionRedisTemplate") ReactiveRedisTemplate<String, String> decisionRedisTemplate,
            ObjectMapper objectMapper,
            EngineMetrics metrics,
            EngineProperties properties) {

        EngineProperties.Cache cache = properties.getCache();
        ObjectMapper cacheMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        log.info("💾 Decision cache: Redis (ttl={}, prefix={})", cache.getTtl(), cache.getKeyPrefix());
        return new RedisDecisionCache(decisionRedisTemplate, cacheMapper, metrics, cache.getTtl(), cache.getKeyPrefix());
    }
}
