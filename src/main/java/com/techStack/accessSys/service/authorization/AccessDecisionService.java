package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.dto.request.BatchCheckRequest;
import com.techStack.accessSys.dto.response.BatchCheckResult;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.decision.AccessDecision;
import com.techStack.accessSys.models.decision.DecisionCacheKey;
import com.techStack.accessSys.models.decision.ReasonCode;
import com.techStack.accessSys.models.graph.ResolvedRoles;
import com.techStack.accessSys.models.principal.AccessRequest;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.service.authorization.condition.EvaluationAttributes;
import com.techStack.accessSys.service.cache.CacheLookup;
import com.techStack.accessSys.service.cache.CachedDecision;
import com.techStack.accessSys.service.cache.ContextFingerprint;
import com.techStack.accessSys.service.cache.DecisionCache;
import com.techStack.accessSys.service.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Entry point of the permission resolution engine.
 *
 * <pre>
 *   roles → matching permissions → conditions → field merge   (read-through decision cache)
 * </pre>
 *
 * Never signals an error: every failure becomes a denial whose reason tells
 * an infrastructure problem ({@code timeout}, {@code evaluation_error}) apart
 * from a refusal ({@code no_matching_permission}, {@code ceiling_exceeded}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessDecisionService {

    private final RoleAggregator roleAggregator;
    private final PermissionMatcher permissionMatcher;
    private final ConditionEvaluator conditionEvaluator;
    private final FieldPermissionMerger fieldPermissionMerger;
    private final CeilingValidator ceilingValidator;
    private final DecisionCache decisionCache;
    private final ContextFingerprint contextFingerprint;
    private final EngineProperties properties;
    private final EngineMetrics metrics;
    private final Clock clock;

    /* =========================
       Single check
       ========================= */

    public Mono<AccessDecision> evaluate(AccessRequest request) {
        Optional<String> problem = describeProblem(request);
        if (problem.isPresent()) {
            log.warn("⚠️ Rejecting malformed access request: {}", problem.get());
            return Mono.just(AccessDecision.denied(ReasonCode.EVALUATION_ERROR));
        }

        Instant started = clock.instant();
        Duration budget = properties.getEvaluationTimeout();
        Mono<ResolvedRoles> roles = roleAggregator.activeRoles(request.getPrincipal()).cache();

        return lookup(request, roles)
                .timeout(budget)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("⏱️ Evaluation for principal {} exceeded {}ms; denying",
                            request.getPrincipal().getId(), budget.toMillis());
                    return Mono.just(CacheLookup.computed(AccessDecision.denied(ReasonCode.TIMEOUT)));
                })
                .doOnNext(result -> record(result, started))
                .map(CacheLookup::decision);
    }

    /* =========================
       Batch
       ========================= */

    /**
     * Evaluates every check against one role aggregation. The deadline covers the
     * whole batch; when it passes every check is reported as a timeout.
     */
    public Mono<List<BatchCheckResult>> evaluateBatch(BatchCheckRequest batch) {
        if (batch.getChecks() == null || batch.getChecks().isEmpty()) {
            return Mono.just(List.of());
        }
        Principal principal = batch.getPrincipal();
        Map<String, Object> context = batch.getContext() == null ? Map.of() : batch.getContext();

        List<AccessRequest> requests = batch.getChecks().stream()
                .map(check -> AccessRequest.builder()
                        .principal(principal)
                        .resource(check.getResource())
                        .action(check.getAction())
                        .context(context)
                        .build())
                .collect(Collectors.toList());

        Instant started = clock.instant();
        Duration budget = properties.getEvaluationTimeout();
        Mono<ResolvedRoles> sharedRoles = principal == null
                ? Mono.empty()
                : roleAggregator.activeRoles(principal).cache();
        metrics.recordBatch(requests.size());

        return Flux.fromIterable(requests)
                .concatMap(request -> describeProblem(request).isPresent()
                        ? Mono.just(CacheLookup.computed(AccessDecision.denied(ReasonCode.EVALUATION_ERROR)))
                        : lookup(request, sharedRoles))
                .collectList()
                .timeout(budget)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("⏱️ Batch of {} checks for principal {} exceeded {}ms; denying all",
                            requests.size(), principal == null ? null : principal.getId(), budget.toMillis());
                    List<CacheLookup> timedOut = new ArrayList<>();
                    requests.forEach(r -> timedOut.add(CacheLookup.computed(AccessDecision.denied(ReasonCode.TIMEOUT))));
                    return Mono.just(timedOut);
                })
                .map(lookups -> {
                    List<BatchCheckResult> results = new ArrayList<>(lookups.size());
                    for (int i = 0; i < lookups.size(); i++) {
                        AccessRequest request = requests.get(i);
                        record(lookups.get(i), started);
                        results.add(BatchCheckResult.of(request.getResource(), request.getAction(),
                                lookups.get(i).decision()));
                    }
                    return results;
                });
    }

    /* =========================
       Pipeline
       ========================= */

    private Mono<CacheLookup> lookup(AccessRequest request, Mono<ResolvedRoles> roles) {
        Mono<CachedDecision> compute = roles
                .switchIfEmpty(Mono.error(new IllegalStateException("role aggregation produced nothing")))
                .flatMap(resolved -> decide(request, resolved));

        return contextFingerprint.of(request)
                .map(fingerprint -> decisionCache.getOrCompute(cacheKey(request, fingerprint), compute))
                .orElseGet(() -> compute.map(c -> CacheLookup.computed(c.decision())))
                .onErrorResume(e -> {
                    if (e instanceof CycleDetectedException) {
                        log.warn("⚠️ Denying {} on {}: {}", request.getPrincipal().getId(),
                                request.getResource().getType(), e.getMessage());
                    } else {
                        log.error("❌ Evaluation failed for principal {}: {}",
                                request.getPrincipal().getId(), e.getMessage(), e);
                    }
                    return Mono.just(CacheLookup.computed(AccessDecision.denied(ReasonCode.EVALUATION_ERROR)));
                });
    }

    private Mono<CachedDecision> decide(AccessRequest request, ResolvedRoles resolved) {
        String tenantId = request.getPrincipal().getTenantId();
        Mono<Optional<CapabilityCeiling>> ceiling = properties.isCeilingRecheck()
                ? ceilingValidator.effectiveCeiling(tenantId)
                : Mono.just(Optional.empty());

        return ceiling.map(envelope -> {
            String action = request.normalizedAction();
            String resourceType = request.getResource().getType();
            if (envelope.isPresent() && !envelope.get().allows(resourceType, action)) {
                log.debug("Tenant {} ceiling excludes {}:{}", tenantId, resourceType, action);
                return new CachedDecision(AccessDecision.denied(ReasonCode.CEILING_EXCEEDED),
                        resolved.getActiveRoleIds(), tenantId);
            }
            return new CachedDecision(match(request, resolved, action), resolved.getActiveRoleIds(), tenantId);
        });
    }

    private AccessDecision match(AccessRequest request, ResolvedRoles resolved, String action) {
        List<PermissionRecord> candidates = permissionMatcher.candidates(resolved, request.getResource(), clock.instant());
        EvaluationAttributes attributes = EvaluationAttributes.of(request);

        List<PermissionRecord> satisfied = candidates.stream()
                .filter(permission -> permission.grants(action))
                .filter(permission -> conditionEvaluator.isSatisfied(permission, attributes))
                .collect(Collectors.toList());

        if (satisfied.isEmpty()) {
            log.debug("No permission grants {} {} on {}:{}", request.getPrincipal().getId(), action,
                    request.getResource().getType(), request.getResource().matchTarget());
            return AccessDecision.denied(ReasonCode.NO_MATCHING_PERMISSION);
        }

        List<String> ids = satisfied.stream().map(PermissionRecord::getId).sorted().collect(Collectors.toList());
        SortedMap<String, FieldLevel> fields = fieldPermissionMerger.merge(satisfied);
        log.debug("Granted {} {} on {}:{} via {}", request.getPrincipal().getId(), action,
                request.getResource().getType(), request.getResource().matchTarget(), ids);
        return AccessDecision.granted(ids, fields);
    }

    /* =========================
       Helpers
       ========================= */

    private static DecisionCacheKey cacheKey(AccessRequest request, String fingerprint) {
        ResourceRef resource = request.getResource();
        return new DecisionCacheKey(
                request.getPrincipal().getId(),
                request.getPrincipal().getTenantId(),
                resource.getType(),
                resource.matchTarget(),
                request.normalizedAction(),
                fingerprint);
    }

    private static Optional<String> describeProblem(AccessRequest request) {
        if (request == null) {
            return Optional.of("request is missing");
        }
        Principal principal = request.getPrincipal();
        if (principal == null || isBlank(principal.getId()) || isBlank(principal.getTenantId())) {
            return Optional.of("principal id and tenantId are required");
        }
        if (request.getResource() == null || isBlank(request.getResource().getType())) {
            return Optional.of("resource type is required");
        }
        if (isBlank(request.getAction())) {
            return Optional.of("action is required");
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void record(CacheLookup lookup, Instant started) {
        metrics.recordDecision(lookup.decision().getReasonCode(), lookup.hit(),
                Duration.between(started, clock.instant()));
    }
}
