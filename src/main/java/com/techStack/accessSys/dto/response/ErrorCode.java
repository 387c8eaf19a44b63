package com.techStack.accessSys.dto.response;

import lombok.Getter;

/**
 * Centralized list of error codes used across the application.
 * Ensures consistency and avoids duplication.
 */
@Getter
public enum ErrorCode {

    // Hierarchy errors
    CYCLE_DETECTED("CYCLE_DETECTED"),

    // Permission definition errors
    AMBIGUOUS_RESOURCE_SPECIFICATION("AMBIGUOUS_RESOURCE_SPECIFICATION"),
    MALFORMED_CONDITION("MALFORMED_CONDITION"),

    // Ceiling errors
    CEILING_VIOLATION("CEILING_VIOLATION"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR"),
    RESOURCE_NOT_FOUND("RESOURCE_NOT_FOUND"),

    // Service errors
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE"),
    DATABASE_ERROR("DATABASE_ERROR"),
    CACHE_ERROR("CACHE_ERROR"),

    // Fallback
    UNEXPECTED_ERROR("UNEXPECTED_ERROR");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

}
