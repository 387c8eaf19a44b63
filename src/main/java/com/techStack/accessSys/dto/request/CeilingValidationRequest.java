package com.techStack.accessSys.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class CeilingValidationRequest {

    @NotBlank
    private String tenantId;

    /** Capability id → permitted actions. */
    @NotNull
    private Map<String, List<String>> ceiling;
}
