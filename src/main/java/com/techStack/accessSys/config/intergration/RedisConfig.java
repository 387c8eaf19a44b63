package com.techStack.accessSys.config.intergration;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Redis Configuration
 *
 * Connection pool and reactive template for the shared decision cache.
 * Only active when access.engine.cache.backend=redis.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "access.engine.cache.backend", havingValue = "redis")
public class RedisConfig {

    /* =========================
       Redis Connection Settings
       ========================= */

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.timeout:2000}")
    private long commandTimeoutMs;

    /* =========================
       Pool Configuration
       ========================= */

    @Value("${spring.data.redis.lettuce.pool.max-active:16}")
    private int maxTotal;

    @Value("${spring.data.redis.lettuce.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.data.redis.lettuce.pool.min-idle:2}")
    private int minIdle;

    @Bean
    public GenericObjectPoolConfig<?> lettucePoolConfig() {
        GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxTotal);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);

        log.info("📊 Redis pool config - MaxTotal: {}, MaxIdle: {}, MinIdle: {}", maxTotal, maxIdle, minIdle);
        return poolConfig;
    }

    /* =========================
       Connection Factory
       ========================= */

    @Bean
    @Primary
    public LettuceConnectionFactory lettuceConnectionFactory(GenericObjectPoolConfig<?> poolConfig, Clock clock) {
        Instant startTime = clock.instant();
        log.info("🔌 Connecting to Redis at {}:{}", redisHost, redisPort);

        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration(redisHost, redisPort);
        if (!redisPassword.isEmpty()) {
            redisConfig.setPassword(redisPassword);
            log.debug("🔐 Redis password configured");
        }

        LettuceClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .commandTimeout(Duration.ofMillis(commandTimeoutMs))
                .shutdownTimeout(Duration.ZERO)
                .poolConfig(poolConfig)
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, clientConfig);
        factory.setValidateConnection(true);

        log.info("✅ Redis connection factory created (duration: {}, command timeout: {}ms)",
                Duration.between(startTime, clock.instant()), commandTimeoutMs);
        return factory;
    }

    /* =========================
       Reactive Template
       ========================= */

    /**
     * String keys and JSON string values; the decision cache does its own Jackson mapping.
     */
    @Bean
    public ReactiveRedisTemplate<String, String> decisionRedisTemplate(LettuceConnectionFactory lettuceConnectionFactory) {
        RedisSerializationContext<String, String> context = RedisSerializationContext
                .<String, String>newSerializationContext(new StringRedisSerializer())
                .value(new StringRedisSerializer())
                .hashKey(new StringRedisSerializer())
                .hashValue(new StringRedisSerializer())
                .build();

        log.info("⚡ Reactive decision cache template configured");
        return new ReactiveRedisTemplate<>(lettuceConnectionFactory, context);
    }
}
