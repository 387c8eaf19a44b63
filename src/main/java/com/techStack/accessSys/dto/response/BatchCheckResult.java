package com.techStack.accessSys.dto.response;

import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.decision.AccessDecision;
import com.techStack.accessSys.models.decision.ReasonCode;
import com.techStack.accessSys.models.principal.ResourceRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.SortedMap;

@Value
@Builder
@Jacksonized
public class BatchCheckResult {

    ResourceRef resource;
    String action;
    boolean allowed;
    SortedMap<String, FieldLevel> fieldPermissions;
    List<String> matchedPermissionIds;
    ReasonCode reasonCode;

    public static BatchCheckResult of(ResourceRef resource, String action, AccessDecision decision) {
        return BatchCheckResult.builder()
                .resource(resource)
                .action(action)
                .allowed(decision.isAllowed())
                .fieldPermissions(decision.getFieldPermissions())
                .matchedPermissionIds(decision.getMatchedPermissionIds())
                .reasonCode(decision.getReasonCode())
                .build();
    }
}
