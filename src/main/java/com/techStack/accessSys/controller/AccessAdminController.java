package com.techStack.accessSys.controller;

import com.techStack.accessSys.dto.request.CeilingValidationRequest;
import com.techStack.accessSys.dto.request.InvalidationRequest;
import com.techStack.accessSys.dto.request.ReparentRequest;
import com.techStack.accessSys.dto.response.ApiResponse;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.service.authorization.CeilingValidator;
import com.techStack.accessSys.service.authorization.DecisionInvalidationService;
import com.techStack.accessSys.service.authorization.HierarchyMutationGuard;
import com.techStack.accessSys.service.authorization.PermissionDefinitionValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access Admin Controller
 *
 * Write-path hooks used by the admin surface: cache invalidation after a graph
 * change, ceiling and permission validation before a write, and guarded reparenting.
 * Failures are mapped by the global exception handler.
 */
@Slf4j
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class AccessAdminController {

    private final DecisionInvalidationService invalidationService;
    private final CeilingValidator ceilingValidator;
    private final PermissionDefinitionValidator permissionDefinitionValidator;
    private final HierarchyMutationGuard hierarchyMutationGuard;
    private final Clock clock;

    /* =========================
       Cache
       ========================= */

    @PostMapping("/invalidate")
    public Mono<ResponseEntity<ApiResponse<Void>>> invalidate(@Valid @RequestBody InvalidationRequest request) {
        return Mono.fromCallable(request::toScope)
                .flatMap(scope -> invalidationService.invalidate(scope)
                        .thenReturn(ResponseEntity.ok(
                                ApiResponse.success("Invalidated " + scope, clock.instant()))));
    }

    /* =========================
       Validation
       ========================= */

    @PostMapping("/ceilings/validate")
    public Mono<ResponseEntity<ApiResponse<Void>>> validateCeiling(
            @Valid @RequestBody CeilingValidationRequest request) {

        Instant requestTime = clock.instant();
        log.info("Validating ceiling for tenant {} at {}", request.getTenantId(), requestTime);

        return Mono.fromCallable(() -> CapabilityCeiling.of(request.getCeiling()))
                .flatMap(ceiling -> ceilingValidator.validate(request.getTenantId(), ceiling))
                .thenReturn(ResponseEntity.ok(ApiResponse.success("Ceiling is within its parent allowance",
                        clock.instant())));
    }

    @PostMapping("/permissions/validate")
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> validatePermission(
            @RequestBody PermissionDefinition definition) {

        return Mono.fromCallable(() -> permissionDefinitionValidator.validate(definition))
                .map(record -> ResponseEntity.ok(
                        ApiResponse.success("Permission definition is valid", summary(record), clock.instant())));
    }

    /* =========================
       Hierarchy
       ========================= */

    @PostMapping("/hierarchy/reparent")
    public Mono<ResponseEntity<ApiResponse<Void>>> reparent(@Valid @RequestBody ReparentRequest request) {
        log.info("Reparent {} {} to {} requested at {}", request.getKind(), request.getNodeId(),
                request.getNewParentId(), clock.instant());

        return hierarchyMutationGuard.reparent(request.getKind(), request.getNodeId(), request.getNewParentId())
                .thenReturn(ResponseEntity.ok(ApiResponse.success(
                        request.getNodeId() + " now under " + request.getNewParentId(), clock.instant())));
    }

    private static Map<String, Object> summary(PermissionRecord record) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", record.getId());
        summary.put("resourceType", record.getResourceType());
        summary.put("resourceId", record.getResourceId());
        summary.put("resourcePath", record.getResourcePath());
        summary.put("actions", record.getActions());
        summary.put("conditionCount", record.getConditions() == null ? 0 : record.getConditions().size());
        summary.put("fieldPermissions", record.getFieldPermissions());
        return summary;
    }
}
