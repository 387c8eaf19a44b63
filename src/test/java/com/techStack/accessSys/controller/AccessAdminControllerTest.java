package com.techStack.accessSys.controller;

import com.techStack.accessSys.exception.authorization.CeilingViolationException;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.decision.InvalidationScope;
import com.techStack.accessSys.service.authorization.CeilingValidator;
import com.techStack.accessSys.service.authorization.DecisionInvalidationService;
import com.techStack.accessSys.service.authorization.HierarchyMutationGuard;
import com.techStack.accessSys.service.authorization.PermissionDefinitionValidator;
import com.techStack.accessSys.service.authorization.condition.ConditionParser;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = AccessAdminController.class)
@Import({PermissionDefinitionValidator.class, PermissionCompiler.class, ConditionParser.class})
@ActiveProfiles("test")
class AccessAdminControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private DecisionInvalidationService invalidationService;

    @MockBean
    private CeilingValidator ceilingValidator;

    @MockBean
    private HierarchyMutationGuard hierarchyMutationGuard;

    @Test
    void invalidateForwardsScope() {
        when(invalidationService.invalidate(any())).thenReturn(Mono.empty());

        webTestClient.post().uri("/internal/invalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scope\": \"role\", \"id\": \"shipping_agent\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.success").isEqualTo(true);

        verify(invalidationService).invalidate(InvalidationScope.role("shipping_agent"));
    }

    @Test
    void scopedInvalidationWithoutIdIsBadRequest() {
        webTestClient.post().uri("/internal/invalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scope\": \"principal\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void ceilingViolationIsUnprocessable() {
        when(ceilingValidator.validate(eq("branch"), any()))
                .thenReturn(Mono.error(new CeilingViolationException("branch", "DGD_DECLARATION", "read")));

        webTestClient.post().uri("/internal/ceilings/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tenantId\": \"branch\", \"ceiling\": {\"DGD_DECLARATION\": [\"read\"]}}")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("CEILING_VIOLATION")
                .jsonPath("$.data.capability").isEqualTo("DGD_DECLARATION");
    }

    @Test
    void ambiguousPermissionIsRejected() {
        webTestClient.post().uri("/internal/permissions/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"id": "p1", "resourceType": "vessel", "resourceId": "v1", "resourcePath": "vessel/*",
                         "actions": ["read"]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errorCode").isEqualTo("AMBIGUOUS_RESOURCE_SPECIFICATION");
    }

    @Test
    void validPermissionIsSummarised() {
        webTestClient.post().uri("/internal/permissions/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"id": "p1", "resourceType": "vessel", "resourcePath": "vessel/*",
                         "actions": ["Read", "create"], "conditions": {"status": ["draft"]},
                         "fieldPermissions": {"eta": "write"}}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.actions[0]").isEqualTo("create")
                .jsonPath("$.data.conditionCount").isEqualTo(1)
                .jsonPath("$.data.fieldPermissions.eta").isEqualTo("write");
    }

    @Test
    void reparentCycleIsConflict() {
        when(hierarchyMutationGuard.reparent(HierarchyKind.ROLE, "admin", "clerk"))
                .thenReturn(Mono.error(new CycleDetectedException(HierarchyKind.ROLE, "admin", "admin")));

        webTestClient.post().uri("/internal/hierarchy/reparent")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"kind\": \"role\", \"nodeId\": \"admin\", \"newParentId\": \"clerk\"}")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("CYCLE_DETECTED")
                .jsonPath("$.data.kind").isEqualTo("ROLE");
    }
}
