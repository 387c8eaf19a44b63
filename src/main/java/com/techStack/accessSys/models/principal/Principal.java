package com.techStack.accessSys.models.principal;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * User or service account being evaluated. Supplied already authenticated by the caller.
 */
@Value
@Builder
@Jacksonized
public class Principal {

    @NotBlank
    String id;

    @NotBlank
    String tenantId;

    String branchId;

    @JsonProperty("isServiceAccount")
    boolean serviceAccount;
}
