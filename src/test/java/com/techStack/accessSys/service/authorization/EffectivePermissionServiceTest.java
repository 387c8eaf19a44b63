package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.models.authorization.PermissionDefinition;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffectivePermissionServiceTest {

    @Test
    void reportsRolesPermissionsAndScopes() {
        EngineFixture fixture = new EngineFixture();
        fixture.repository.putPermission(PermissionDefinition.builder()
                .id("vessel-42").resourceType("vessel").resourceId("42").action("read").build());
        fixture.permission("vessel-rw", "vessel", "vessel/*", List.of("create", "read"))
                .role("agent", null, "vessel-rw")
                .role("senior", "agent", "vessel-42")
                .principal("u1", "senior");

        EffectivePermissionService service = new EffectivePermissionService(fixture.roleAggregator(), fixture.clock);

        StepVerifier.create(service.report(EngineFixture.user("u1")))
                .assertNext(report -> {
                    assertThat(report.getDirectRoleIds()).containsExactly("senior");
                    assertThat(report.getResolvedRoleIds()).containsExactly("agent", "senior");
                    assertThat(report.getPermissionIdsByRole())
                            .containsEntry("agent", List.of("vessel-rw"))
                            .containsEntry("senior", List.of("vessel-42"));
                    assertThat(report.getScopes())
                            .containsExactly("vessel:create", "vessel:read", "vessel:read:42");
                })
                .verifyComplete();
    }
}
