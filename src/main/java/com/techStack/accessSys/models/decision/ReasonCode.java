package com.techStack.accessSys.models.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReasonCode {

    GRANTED("granted", true),
    NO_MATCHING_PERMISSION("no_matching_permission", true),
    CEILING_EXCEEDED("ceiling_exceeded", true),
    TIMEOUT("timeout", false),
    EVALUATION_ERROR("evaluation_error", false);

    private final String code;
    private final boolean cacheable;

    ReasonCode(String code, boolean cacheable) {
        this.code = code;
        this.cacheable = cacheable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Infrastructure outcomes are never memoised. */
    public boolean isCacheable() {
        return cacheable;
    }

    @JsonCreator
    public static ReasonCode fromCode(String code) {
        for (ReasonCode reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown reason code: " + code);
    }
}
