package com.techStack.accessSys.service.observability;

import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.models.decision.ReasonCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters of the decision engine. Recording never fails the caller.
 */
@Slf4j
@Component
public class EngineMetrics {

    private final MeterRegistry meterRegistry;
    private final String prefix;

    @Autowired
    public EngineMetrics(MeterRegistry meterRegistry,
                         @Value("${app.metrics.prefix:access}") String metricsPrefix) {
        this.meterRegistry = meterRegistry;
        this.prefix = metricsPrefix;
    }

    /* =========================
       Decisions
       ========================= */

    public void recordDecision(ReasonCode reason, boolean cacheHit, Duration elapsed) {
        try {
            Counter.builder(prefix + ".decisions")
                    .description("Access decisions by outcome")
                    .tags("reason", reason.code(), "cache", cacheHit ? "hit" : "miss")
                    .register(meterRegistry)
                    .increment();
            Timer.builder(prefix + ".evaluation.latency")
                    .description("Time to produce an access decision")
                    .tags("cache", cacheHit ? "hit" : "miss")
                    .register(meterRegistry)
                    .record(elapsed);
        } catch (Exception e) {
            log.error("Failed to record decision metrics: {}", e.getMessage(), e);
        }
    }

    public void recordBatch(int size) {
        increment(prefix + ".batch.checks", size);
    }

    /* =========================
       Data quality
       ========================= */

    public void recordCycle(HierarchyKind kind) {
        increment(prefix + ".hierarchy.cycles", 1, "kind", kind.name().toLowerCase(Locale.ROOT));
    }

    public void recordMalformedCondition() {
        increment(prefix + ".conditions.malformed", 1);
    }

    /* =========================
       Cache
       ========================= */

    public void recordInvalidation(InvalidationScope scope) {
        increment(prefix + ".cache.invalidations", 1, "scope", scope.type().value());
    }

    public void recordCacheFailure(String operation) {
        increment(prefix + ".cache.failures", 1, "operation", operation);
    }

    private void increment(String name, double amount, String... tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .register(meterRegistry)
                    .increment(amount);
        } catch (Exception e) {
            log.error("Failed to record metric {}: {}", name, e.getMessage(), e);
        }
    }
}
