package com.techStack.accessSys.service.authorization.condition;

import com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException;
import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionCompilerTest {

    private final PermissionCompiler compiler = new PermissionCompiler(new ConditionParser());

    private final PermissionDefinition base = PermissionDefinition.builder()
            .id("contact-read")
            .resourceType("contact")
            .resourcePath("*")
            .action("read")
            .build();

    @Test
    void emptyLevelListHidesTheField() {
        PermissionRecord record = compiler.compile(base.toBuilder()
                .fieldPermission("ssn", List.of())
                .fieldPermission("email", List.of("read", "write"))
                .build());

        assertThat(record.getFieldPermissions()).containsExactly(
                Map.entry("email", FieldLevel.WRITE),
                Map.entry("ssn", FieldLevel.HIDDEN));
    }

    @Test
    void levelListKeepsMostPermissiveKnownEntry() {
        PermissionRecord record = compiler.compile(base.toBuilder()
                .fieldPermission("phone", List.of("hidden", "READ", "bogus"))
                .fieldPermission("notes", "admin")
                .build());

        assertThat(record.getFieldPermissions()).containsOnly(Map.entry("phone", FieldLevel.READ));
    }

    @Test
    void unknownLevelsAreReportedPerEntry() {
        assertThat(PermissionCompiler.unknownLevels(List.of("read", "bogus", 3))).containsExactly("bogus", 3);
        assertThat(PermissionCompiler.unknownLevels(List.of())).isEmpty();
        assertThat(PermissionCompiler.unknownLevels("write")).isEmpty();
        assertThat(PermissionCompiler.unknownLevels("admin")).containsExactly("admin");
    }

    @Test
    void nonFiniteComparisonOperandDoesNotFailCompilation() {
        PermissionRecord record = compiler.compile(base.toBuilder()
                .condition("amount", Map.of("lte", Double.POSITIVE_INFINITY))
                .build());

        assertThat(record.getConditions()).hasSize(1);
        assertThat(record.isUnconditional()).isFalse();
    }

    @Test
    void actionsAreTrimmedAndLowerCased() {
        PermissionRecord record = compiler.compile(base.toBuilder().clearActions().action(" Approve ").action("READ").build());

        assertThat(record.getActions()).containsExactly("approve", "read");
    }

    @Test
    void rejectsPathAndIdTogether() {
        assertThatThrownBy(() -> compiler.compile(base.toBuilder().resourceId("c-1").build()))
                .isInstanceOf(AmbiguousResourceSpecificationException.class);
    }
}
