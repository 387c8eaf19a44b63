package com.techStack.accessSys.models.principal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class AccessRequest {

    Principal principal;
    ResourceRef resource;
    String action;

    @Singular("contextEntry")
    Map<String, Object> context;

    public String normalizedAction() {
        return action == null ? null : action.trim().toLowerCase(Locale.ROOT);
    }
}
