package com.techStack.accessSys.dto.request;

import com.techStack.accessSys.models.decision.InvalidationScope;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class InvalidationRequest {

    @NotNull
    private InvalidationScope.Type scope;

    /** Required unless scope is {@code all}. */
    private String id;

    public InvalidationScope toScope() {
        return new InvalidationScope(scope, id);
    }
}
