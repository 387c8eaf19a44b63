package com.techStack.accessSys.models.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * What a committed write affects: one principal, every holder of a role,
 * every principal of a tenant, or everything (hierarchy-shape changes).
 */
public record InvalidationScope(Type type, String id) {

    public enum Type {
        PRINCIPAL, ROLE, TENANT, ALL;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return Type.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public InvalidationScope {
        Objects.requireNonNull(type, "type");
        if (type != Type.ALL && (id == null || id.isBlank())) {
            throw new IllegalArgumentException("Invalidation scope " + type.value() + " requires an id");
        }
    }

    public static InvalidationScope principal(String principalId) {
        return new InvalidationScope(Type.PRINCIPAL, principalId);
    }

    public static InvalidationScope role(String roleId) {
        return new InvalidationScope(Type.ROLE, roleId);
    }

    public static InvalidationScope tenant(String tenantId) {
        return new InvalidationScope(Type.TENANT, tenantId);
    }

    public static InvalidationScope all() {
        return new InvalidationScope(Type.ALL, null);
    }
}
