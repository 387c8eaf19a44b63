package com.techStack.accessSys.dto.request;

import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Several checks for one principal. The context applies to every check.
 */
@Data
public class BatchCheckRequest {

    @NotNull
    @Valid
    private Principal principal;

    private Map<String, Object> context = new HashMap<>();

    @NotEmpty
    @Valid
    private List<Check> checks = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Check {

        @NotNull
        @Valid
        private ResourceRef resource;

        @NotBlank
        private String action;
    }
}
