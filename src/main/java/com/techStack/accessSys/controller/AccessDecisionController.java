package com.techStack.accessSys.controller;

import com.techStack.accessSys.dto.request.AccessCheckRequest;
import com.techStack.accessSys.dto.request.BatchCheckRequest;
import com.techStack.accessSys.dto.request.ScopeFilterRequest;
import com.techStack.accessSys.dto.response.ApiResponse;
import com.techStack.accessSys.dto.response.BatchCheckResult;
import com.techStack.accessSys.dto.response.EffectivePermissionsReport;
import com.techStack.accessSys.models.decision.AccessDecision;
import com.techStack.accessSys.models.decision.ScopeFilter;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.service.authorization.AccessDecisionService;
import com.techStack.accessSys.service.authorization.EffectivePermissionService;
import com.techStack.accessSys.service.authorization.ScopeFilterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Access Decision Controller
 *
 * Decision endpoints for callers that have already authenticated the principal.
 * A denial is a normal 200 response; the reason code tells a refusal apart from
 * an infrastructure failure.
 */
@Slf4j
@RestController
@RequestMapping("/api/access")
@RequiredArgsConstructor
public class AccessDecisionController {

    /* =========================
       Dependencies
       ========================= */

    private final AccessDecisionService accessDecisionService;
    private final ScopeFilterService scopeFilterService;
    private final EffectivePermissionService effectivePermissionService;
    private final Clock clock;

    /* =========================
       Decisions
       ========================= */

    @PostMapping("/check")
    public Mono<ResponseEntity<AccessDecision>> check(@Valid @RequestBody AccessCheckRequest request) {
        return accessDecisionService.evaluate(request.toAccessRequest())
                .map(ResponseEntity::ok);
    }

    /**
     * Evaluates several resource/action pairs for one principal. Results come back
     * in request order.
     */
    @PostMapping("/check/batch")
    public Mono<ResponseEntity<List<BatchCheckResult>>> checkBatch(@Valid @RequestBody BatchCheckRequest request) {
        log.debug("Batch of {} checks for principal {}", request.getChecks().size(), request.getPrincipal().getId());
        return accessDecisionService.evaluateBatch(request)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/scope-filter")
    public Mono<ResponseEntity<ScopeFilter>> scopeFilter(@Valid @RequestBody ScopeFilterRequest request) {
        return scopeFilterService.filterFor(request.getPrincipal(), request.getContext())
                .map(ResponseEntity::ok);
    }

    /* =========================
       Introspection
       ========================= */

    @GetMapping("/effective/{tenantId}/{principalId}")
    public Mono<ResponseEntity<ApiResponse<EffectivePermissionsReport>>> effectivePermissions(
            @PathVariable String tenantId,
            @PathVariable String principalId,
            @RequestParam(required = false) String branchId) {

        log.info("Effective permissions requested for {} in tenant {} at {}", principalId, tenantId, clock.instant());

        Principal principal = Principal.builder()
                .id(principalId)
                .tenantId(tenantId)
                .branchId(branchId)
                .build();

        return effectivePermissionService.report(principal)
                .map(report -> ResponseEntity.ok(
                        ApiResponse.success("Effective permissions resolved", report, clock.instant())));
    }
}
