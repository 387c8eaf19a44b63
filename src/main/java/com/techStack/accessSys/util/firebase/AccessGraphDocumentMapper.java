package com.techStack.accessSys.util.firebase;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.Group;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.models.tenant.Tenant;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the access-graph collections to domain objects.
 *
 * <pre>
 *   tenants/{id}     name, parentTenantId, ceiling{capability: [actions]}, active
 *   roles/{id}       tenantId, name, parentRoleId, assignable, priority, active, permissionGrants[]
 *   groups/{id}      tenantId, name, parentGroupId, active, roleGrants[]
 *   principals/{id}  roleGrants[], groupGrants[]
 *   permissions/{id} tenantId, name, resourceType, resourceId | resourcePath, actions[],
 *                    conditions{}, fieldPermissions{}, active
 *   grant            {targetId, expiresAt?, active?}
 * </pre>
 */
@Slf4j
public final class AccessGraphDocumentMapper {

    public static final String TENANTS = "tenants";
    public static final String ROLES = "roles";
    public static final String GROUPS = "groups";
    public static final String PRINCIPALS = "principals";
    public static final String PERMISSIONS = "permissions";

    public static final String TENANT_PARENT = "parentTenantId";
    public static final String ROLE_PARENT = "parentRoleId";
    public static final String GROUP_PARENT = "parentGroupId";

    private AccessGraphDocumentMapper() {
    }

    /* =========================
       Documents
       ========================= */

    public static Tenant toTenant(DocumentSnapshot doc) {
        return Tenant.builder()
                .id(doc.getId())
                .name(getString(doc.getData(), "name"))
                .parentTenantId(getString(doc.getData(), TENANT_PARENT))
                .ceiling(toCeiling(doc.get("ceiling")))
                .active(getBoolean(doc.getData(), "active", true))
                .build();
    }

    public static Role toRole(DocumentSnapshot doc) {
        Map<String, Object> data = doc.getData();
        return Role.builder()
                .id(doc.getId())
                .tenantId(getString(data, "tenantId"))
                .name(getString(data, "name"))
                .parentRoleId(getString(data, ROLE_PARENT))
                .assignable(getBoolean(data, "assignable", true))
                .priority(getInteger(data, "priority", 0))
                .active(getBoolean(data, "active", true))
                .permissionGrants(toAssignments(data, "permissionGrants"))
                .build();
    }

    public static Group toGroup(DocumentSnapshot doc) {
        Map<String, Object> data = doc.getData();
        return Group.builder()
                .id(doc.getId())
                .tenantId(getString(data, "tenantId"))
                .name(getString(data, "name"))
                .parentGroupId(getString(data, GROUP_PARENT))
                .active(getBoolean(data, "active", true))
                .roleGrants(toAssignments(data, "roleGrants"))
                .build();
    }

    public static PrincipalAssignments toPrincipalAssignments(DocumentSnapshot doc) {
        Map<String, Object> data = doc.getData();
        return PrincipalAssignments.builder()
                .principalId(doc.getId())
                .roles(toAssignments(data, "roleGrants"))
                .groups(toAssignments(data, "groupGrants"))
                .build();
    }

    @SuppressWarnings("unchecked")
    public static PermissionDefinition toPermissionDefinition(DocumentSnapshot doc) {
        Map<String, Object> data = doc.getData();
        Object conditions = data == null ? null : data.get("conditions");
        Object fields = data == null ? null : data.get("fieldPermissions");
        return PermissionDefinition.builder()
                .id(doc.getId())
                .tenantId(getString(data, "tenantId"))
                .name(getString(data, "name"))
                .resourceType(getString(data, "resourceType"))
                .resourceId(getString(data, "resourceId"))
                .resourcePath(getString(data, "resourcePath"))
                .actions(getStringList(data, "actions"))
                .conditions(conditions instanceof Map ? (Map<String, Object>) conditions : Map.of())
                .fieldPermissions(fields instanceof Map ? (Map<String, Object>) fields : Map.of())
                .active(getBoolean(data, "active", true))
                .build();
    }

    /* =========================
       Field helpers
       ========================= */

    private static CapabilityCeiling toCeiling(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, List<String>> ceiling = new LinkedHashMap<>();
        map.forEach((capability, actions) -> {
            List<String> list = new ArrayList<>();
            if (actions instanceof Collection<?> values) {
                values.forEach(v -> list.add(String.valueOf(v)));
            }
            ceiling.put(String.valueOf(capability), list);
        });
        return CapabilityCeiling.of(ceiling);
    }

    private static List<Assignment> toAssignments(Map<String, Object> data, String key) {
        Object raw = data == null ? null : data.get(key);
        List<Assignment> assignments = new ArrayList<>();
        if (!(raw instanceof Collection<?> entries)) {
            return assignments;
        }
        for (Object entry : entries) {
            if (entry instanceof String targetId) {
                assignments.add(Assignment.of(targetId));
            } else if (entry instanceof Map<?, ?> map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> grant = (Map<String, Object>) map;
                assignments.add(Assignment.builder()
                        .targetId(getString(grant, "targetId"))
                        .expiresAt(parseTimestampToInstant(grant, "expiresAt"))
                        .active(getBoolean(grant, "active", true))
                        .build());
            } else {
                log.warn("⚠️ Ignoring unreadable {} entry: {}", key, entry);
            }
        }
        return assignments;
    }

    private static String getString(Map<String, Object> data, String key) {
        Object value = data == null ? null : data.get(key);
        return value == null ? null : value.toString();
    }

    private static boolean getBoolean(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data == null ? null : data.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    private static int getInteger(Map<String, Object> data, String key, int defaultValue) {
        Object value = data == null ? null : data.get(key);
        return value instanceof Number n ? n.intValue() : defaultValue;
    }

    private static List<String> getStringList(Map<String, Object> data, String key) {
        Object value = data == null ? null : data.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            values.forEach(v -> result.add(String.valueOf(v)));
        }
        return result;
    }

    private static Instant parseTimestampToInstant(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (Exception e) {
                log.warn("⚠️ Unparseable {} '{}'; treating grant as expired", key, text);
                return Instant.EPOCH;
            }
        }
        if (value instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        log.warn("⚠️ Unsupported timestamp type for {}: {}; treating grant as expired", key, value.getClass().getName());
        return Instant.EPOCH;
    }
}
