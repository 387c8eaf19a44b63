package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.CeilingViolationException;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.exception.resource.ResourceNotFoundException;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.models.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CeilingValidatorTest {

    private EngineFixture fixture;
    private CeilingValidator validator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        validator = fixture.ceilingValidator();

        fixture.repository
                .putTenant(Tenant.builder().id("community").ceiling(CapabilityCeiling.of(Map.of(
                        "VESSEL_CALL", List.of("create", "read"),
                        "DGD_DECLARATION", List.of("read")))).build())
                .putTenant(Tenant.builder().id("org").parentTenantId("community").ceiling(CapabilityCeiling.of(Map.of(
                        "VESSEL_CALL", List.of("create", "read")))).build())
                .putTenant(Tenant.builder().id("branch").parentTenantId("org").build());
    }

    @Test
    void rejectsCapabilityTheParentExcludes() {
        CapabilityCeiling proposed = CapabilityCeiling.of(Map.of("DGD_DECLARATION", List.of("read")));

        StepVerifier.create(validator.validate("branch", proposed))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(CeilingViolationException.class);
                    CeilingViolationException violation = (CeilingViolationException) e;
                    assertThat(violation.getTenantId()).isEqualTo("branch");
                    assertThat(violation.getCapability()).isEqualTo("DGD_DECLARATION");
                    assertThat(violation.getAction()).isEqualTo("read");
                })
                .verify();
    }

    @Test
    void rejectsActionBeyondParentAllowance() {
        CapabilityCeiling proposed = CapabilityCeiling.of(Map.of("VESSEL_CALL", List.of("read", "delete")));

        StepVerifier.create(validator.validate("org", proposed))
                .expectErrorMatches(e -> e instanceof CeilingViolationException v && "delete".equals(v.getAction()))
                .verify();
    }

    @Test
    void acceptsSubsetOfNearestConfiguredAncestor() {
        CapabilityCeiling proposed = CapabilityCeiling.of(Map.of("VESSEL_CALL", List.of("READ")));

        StepVerifier.create(validator.validate("branch", proposed)).verifyComplete();
    }

    @Test
    void rootIsCheckedAgainstProductCatalog() {
        fixture.properties.setProductCatalog(Map.of("VESSEL_CALL", List.of("create", "read")));

        StepVerifier.create(validator.validate("community",
                        CapabilityCeiling.of(Map.of("DGD_DECLARATION", List.of("read")))))
                .expectError(CeilingViolationException.class)
                .verify();
    }

    @Test
    void unknownTenantIsNotFound() {
        StepVerifier.create(validator.validate("ghost", CapabilityCeiling.of(Map.of("X", List.of("read")))))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void effectiveCeilingIntersectsEveryConfiguredLayer() {
        StepVerifier.create(validator.effectiveCeiling("branch"))
                .assertNext(ceiling -> {
                    assertThat(ceiling).isPresent();
                    assertThat(ceiling.get().allows("VESSEL_CALL", "create")).isTrue();
                    assertThat(ceiling.get().allows("DGD_DECLARATION", "read")).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void effectiveCeilingIsAbsentWhenNothingIsConfigured() {
        fixture.repository.putTenant(Tenant.builder().id("solo").build());

        StepVerifier.create(validator.effectiveCeiling("solo"))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    void inactiveAncestorEmptiesTheCeiling() {
        fixture.repository.putTenant(Tenant.builder().id("org").parentTenantId("community").active(false).build());

        StepVerifier.create(validator.effectiveCeiling("branch"))
                .assertNext(ceiling -> assertThat(ceiling).contains(CapabilityCeiling.empty()))
                .verifyComplete();
    }

    @Test
    void tenantCycleFailsTheWalk() {
        fixture.repository
                .putTenant(Tenant.builder().id("x").parentTenantId("y").build())
                .putTenant(Tenant.builder().id("y").parentTenantId("x").build());

        StepVerifier.create(validator.effectiveCeiling("x"))
                .expectError(CycleDetectedException.class)
                .verify();
    }
}
