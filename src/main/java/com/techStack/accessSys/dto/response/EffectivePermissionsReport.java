package com.techStack.accessSys.dto.response;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Read-only audit view of everything a principal can reach.
 * Scopes are {@code type:action}, plus {@code type:action:resourceId} for id-anchored permissions.
 */
@Value
@Builder
@Jacksonized
public class EffectivePermissionsReport {

    String principalId;
    String tenantId;
    SortedSet<String> directRoleIds;
    SortedSet<String> groupRoleIds;
    SortedSet<String> resolvedRoleIds;
    SortedMap<String, List<String>> permissionIdsByRole;
    SortedSet<String> scopes;
}
