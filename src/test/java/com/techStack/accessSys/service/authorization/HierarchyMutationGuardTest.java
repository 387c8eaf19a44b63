package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.exception.resource.ResourceNotFoundException;
import com.techStack.accessSys.models.authorization.Group;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.techStack.accessSys.service.authorization.EngineFixture.request;
import static org.assertj.core.api.Assertions.assertThat;

class HierarchyMutationGuardTest {

    private EngineFixture fixture;
    private HierarchyMutationGuard guard;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.role("admin", null).role("manager", "admin").role("clerk", "manager");
        guard = new HierarchyMutationGuard(fixture.repository, fixture.invalidationService());
    }

    @Test
    void refusesToMakeANodeItsOwnAncestor() {
        StepVerifier.create(guard.reparent(HierarchyKind.ROLE, "admin", "clerk"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(CycleDetectedException.class);
                    assertThat(((CycleDetectedException) e).getKind()).isEqualTo(HierarchyKind.ROLE);
                })
                .verify();

        assertThat(fixture.repository.getRoleAncestryAndPermissions(List.of("admin")).block().parentOf("admin")).isNull();
    }

    @Test
    void refusesSelfParent() {
        fixture.repository.putGroup(Group.builder().id("g").build());

        StepVerifier.create(guard.reparent(HierarchyKind.GROUP, "g", "g"))
                .expectError(CycleDetectedException.class)
                .verify();
    }

    @Test
    void acceptsValidMoveAndInvalidatesEverything() {
        fixture.permission("p", "doc", "*", List.of("read")).role("reader", null, "p").principal("u1", "clerk");
        AccessDecisionService service = fixture.decisionService();
        assertThat(service.evaluate(request("u1", "doc", "d1", "read")).block().isAllowed()).isFalse();

        StepVerifier.create(guard.reparent(HierarchyKind.ROLE, "admin", "reader")).verifyComplete();

        assertThat(fixture.counter("access.cache.invalidations", "scope", "all")).isEqualTo(1.0);
        assertThat(service.evaluate(request("u1", "doc", "d1", "read")).block().isAllowed()).isTrue();
    }

    @Test
    void detachingMakesARoot() {
        fixture.repository
                .putTenant(Tenant.builder().id("community").build())
                .putTenant(Tenant.builder().id("org").parentTenantId("community").build());

        StepVerifier.create(guard.reparent(HierarchyKind.TENANT, "org", null)).verifyComplete();

        StepVerifier.create(fixture.repository.getTenantAncestry("org"))
                .assertNext(tenants -> assertThat(tenants).containsOnlyKeys("org"))
                .verifyComplete();
    }

    @Test
    void unknownParentIsNotFound() {
        StepVerifier.create(guard.reparent(HierarchyKind.ROLE, "clerk", "ghost"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
