package com.techStack.accessSys.dto.request;

import com.techStack.accessSys.models.principal.Principal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class ScopeFilterRequest {

    @NotNull
    @Valid
    private Principal principal;

    private Map<String, Object> context = new HashMap<>();
}
