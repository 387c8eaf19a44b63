package com.techStack.accessSys.dto.request;

import com.techStack.accessSys.models.authorization.HierarchyKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ReparentRequest {

    @NotNull
    private HierarchyKind kind;

    @NotBlank
    private String nodeId;

    /** Null detaches the node and makes it a root. */
    private String newParentId;
}
