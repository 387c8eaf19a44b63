package com.techStack.accessSys.models.principal;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * The resource an action is requested on. Path is optional; when absent the id
 * is what wildcard patterns are matched against.
 */
@Value
@Builder
@Jacksonized
public class ResourceRef {

    @NotBlank
    String type;

    String id;
    String path;

    @Singular
    Map<String, Object> attributes;

    public String matchTarget() {
        return path != null ? path : id;
    }
}
