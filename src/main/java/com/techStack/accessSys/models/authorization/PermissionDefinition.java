package com.techStack.accessSys.models.authorization;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Permission as stored: conditions and field permissions are still the loosely
 * typed payloads written by the admin path. Compiled into a {@link PermissionRecord}
 * when loaded.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PermissionDefinition {

    String id;
    String tenantId;
    String name;
    String resourceType;
    String resourceId;
    String resourcePath;

    @Singular
    List<String> actions;

    @Singular
    Map<String, Object> conditions;

    @Singular
    Map<String, Object> fieldPermissions;

    @Builder.Default
    boolean active = true;
}
