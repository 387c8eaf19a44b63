package com.techStack.accessSys.models.authorization;

import com.techStack.accessSys.models.authorization.condition.ConditionPredicate;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Load-time compiled permission used on the evaluation path.
 * Exactly one of resourceId / resourcePath is set; actions are lower case.
 */
@Value
@Builder
public class PermissionRecord {

    String id;
    String tenantId;
    String name;
    String resourceType;
    String resourceId;
    String resourcePath;
    Set<String> actions;
    List<ConditionPredicate> conditions;
    Map<String, FieldLevel> fieldPermissions;
    boolean active;

    public boolean isUnconditional() {
        return conditions == null || conditions.isEmpty();
    }

    public boolean grants(String action) {
        return action != null && actions.contains(action);
    }
}
