package com.techStack.accessSys.models.authorization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Field-level visibility granted by a permission.
 * Ordered from least to most permissive: HIDDEN &lt; READ &lt; WRITE.
 */
@Getter
public enum FieldLevel {

    HIDDEN("hidden", 0),
    READ("read", 1),
    WRITE("write", 2);

    private final String value;
    private final int rank;

    FieldLevel(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static FieldLevel mostPermissive(FieldLevel a, FieldLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.rank >= b.rank ? a : b;
    }

    public static Optional<FieldLevel> fromValueSafe(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FieldLevel level : values()) {
            if (level.value.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static FieldLevel fromValue(String value) {
        return fromValueSafe(value)
                .orElseThrow(() -> new IllegalArgumentException("Invalid field level: " + value));
    }
}
