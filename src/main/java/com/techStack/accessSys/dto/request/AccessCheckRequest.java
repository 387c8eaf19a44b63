package com.techStack.accessSys.dto.request;

import com.techStack.accessSys.models.principal.AccessRequest;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class AccessCheckRequest {

    @NotNull
    @Valid
    private Principal principal;

    @NotNull
    @Valid
    private ResourceRef resource;

    @NotBlank
    private String action;

    private Map<String, Object> context = new HashMap<>();

    public AccessRequest toAccessRequest() {
        return AccessRequest.builder()
                .principal(principal)
                .resource(resource)
                .action(action)
                .context(context == null ? Map.of() : context)
                .build();
    }
}
