package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException;
import com.techStack.accessSys.exception.authorization.MalformedConditionException;
import com.techStack.accessSys.exception.validation.ValidationException;
import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import com.techStack.accessSys.service.authorization.condition.ConditionParser;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionDefinitionValidatorTest {

    private final PermissionDefinitionValidator validator =
            new PermissionDefinitionValidator(new PermissionCompiler(new ConditionParser()));

    private final PermissionDefinition valid = PermissionDefinition.builder()
            .id("vessel-rw")
            .resourceType("vessel")
            .resourcePath("vessel/*")
            .action("Create")
            .action("read")
            .condition("status", List.of("draft", "submitted"))
            .fieldPermission("eta", "write")
            .build();

    @Test
    void compilesValidDefinition() {
        PermissionRecord record = validator.validate(valid);

        assertThat(record.getActions()).containsExactly("create", "read");
        assertThat(record.getConditions()).hasSize(1);
        assertThat(record.getFieldPermissions()).containsEntry("eta", FieldLevel.WRITE);
    }

    @Test
    void rejectsBothIdAndPath() {
        assertThatThrownBy(() -> validator.validate(valid.toBuilder().resourceId("v-1").build()))
                .isInstanceOf(AmbiguousResourceSpecificationException.class);
    }

    @Test
    void rejectsNeitherIdNorPath() {
        assertThatThrownBy(() -> validator.validate(valid.toBuilder().resourcePath(null).build()))
                .isInstanceOf(AmbiguousResourceSpecificationException.class);
    }

    @Test
    void rejectsUnsupportedOperator() {
        PermissionDefinition definition = valid.toBuilder()
                .condition("eta", Map.of("between", List.of(1, 2)))
                .build();

        assertThatThrownBy(() -> validator.validate(definition))
                .isInstanceOf(MalformedConditionException.class)
                .hasMessageContaining("between");
    }

    @Test
    void rejectsUnknownFieldLevel() {
        assertThatThrownBy(() -> validator.validate(valid.toBuilder().fieldPermission("eta", "admin").build()))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("fieldPermissions.eta"));
    }

    @Test
    void rejectsUnknownLevelInsideList() {
        PermissionDefinition definition = valid.toBuilder().fieldPermission("eta", List.of("read", "bogus")).build();

        assertThatThrownBy(() -> validator.validate(definition))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("bogus")
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("fieldPermissions.eta"));
    }

    @Test
    void acceptsEmptyLevelListAsHidden() {
        PermissionRecord record = validator.validate(valid.toBuilder().fieldPermission("ssn", List.of()).build());

        assertThat(record.getFieldPermissions()).containsEntry("ssn", FieldLevel.HIDDEN);
    }

    @Test
    void rejectsMissingActions() {
        assertThatThrownBy(() -> validator.validate(valid.toBuilder().clearActions().build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("action");
    }
}
