package com.techStack.accessSys.repository.authorization;

import com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.HierarchyKind;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.models.tenant.Tenant;
import com.techStack.accessSys.service.authorization.condition.ConditionParser;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAccessGraphRepositoryTest {

    private InMemoryAccessGraphRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAccessGraphRepository(new PermissionCompiler(new ConditionParser()));
        repository
                .putPermission(PermissionDefinition.builder().id("p1").resourceType("doc").resourcePath("*")
                        .action("read").build())
                .putRole(Role.builder().id("admin").permissionGrant(Assignment.of("p1")).build())
                .putRole(Role.builder().id("clerk").parentRoleId("admin").build());
    }

    @Test
    void roleClosureIncludesAncestorsAndTheirPermissions() {
        StepVerifier.create(repository.getRoleAncestryAndPermissions(List.of("clerk")))
                .assertNext(graph -> {
                    assertThat(graph.getRoles()).containsOnlyKeys("clerk", "admin");
                    assertThat(graph.getPermissions()).containsOnlyKeys("p1");
                })
                .verifyComplete();
    }

    @Test
    void closureTerminatesOnStoredCycle() {
        repository.putRole(Role.builder().id("admin").parentRoleId("clerk").build());

        StepVerifier.create(repository.getRoleAncestryAndPermissions(List.of("clerk")))
                .assertNext(graph -> assertThat(graph.getRoles()).containsOnlyKeys("clerk", "admin"))
                .verifyComplete();
    }

    @Test
    void tenantCeilingReadIsEmptyForUnknownTenant() {
        repository.putTenant(Tenant.builder().id("org")
                .ceiling(CapabilityCeiling.of(Map.of("VESSEL_CALL", List.of("read")))).build());

        StepVerifier.create(repository.getTenantCeiling("org"))
                .assertNext(tenant -> assertThat(tenant.getCeiling().allows("VESSEL_CALL", "read")).isTrue())
                .verifyComplete();
        StepVerifier.create(repository.getTenantCeiling("ghost")).verifyComplete();
    }

    @Test
    void ambiguousPermissionIsRefusedOnPut() {
        PermissionDefinition both = PermissionDefinition.builder().id("bad").resourceType("doc")
                .resourceId("d1").resourcePath("*").action("read").build();

        assertThatThrownBy(() -> repository.putPermission(both))
                .isInstanceOf(AmbiguousResourceSpecificationException.class);
    }

    @Test
    void updateParentWritesOnlyWhenCheckPasses() {
        StepVerifier.create(repository.updateParent(HierarchyKind.ROLE, "admin", "clerk", parentOf -> {
                    throw new CycleDetectedException(HierarchyKind.ROLE, "admin", "admin");
                }))
                .expectError(CycleDetectedException.class)
                .verify();

        StepVerifier.create(repository.getRoleAncestryAndPermissions(List.of("admin")))
                .assertNext(graph -> assertThat(graph.parentOf("admin")).isNull())
                .verifyComplete();
    }
}
