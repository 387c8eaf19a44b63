package com.techStack.accessSys.util.firebase;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.tenant.Tenant;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessGraphDocumentMapperTest {

    @Test
    void roleGrantsAcceptPlainIdsAndGrantMaps() {
        Map<String, Object> data = new HashMap<>();
        data.put("tenantId", "t1");
        data.put("parentRoleId", "admin");
        data.put("priority", 3L);
        data.put("permissionGrants", List.of(
                "vessel-read",
                Map.of("targetId", "vessel-write", "expiresAt", Timestamp.ofTimeSecondsAndNanos(1_800_000_000L, 0)),
                Map.of("targetId", "legacy", "expiresAt", "not-a-date")));

        Role role = AccessGraphDocumentMapper.toRole(snapshot("manager", data));

        assertThat(role.getId()).isEqualTo("manager");
        assertThat(role.getParentRoleId()).isEqualTo("admin");
        assertThat(role.getPriority()).isEqualTo(3);
        assertThat(role.isActive()).isTrue();
        assertThat(role.getPermissionGrants()).containsExactly(
                Assignment.of("vessel-read"),
                Assignment.expiringAt("vessel-write", Instant.ofEpochSecond(1_800_000_000L)),
                Assignment.expiringAt("legacy", Instant.EPOCH));
    }

    @Test
    void tenantCeilingIsNormalised() {
        Map<String, Object> data = new HashMap<>();
        data.put("parentTenantId", "community");
        data.put("ceiling", Map.of("VESSEL_CALL", List.of("Read", "create")));
        data.put("active", false);

        Tenant tenant = AccessGraphDocumentMapper.toTenant(snapshot("org", data));

        assertThat(tenant.getParentTenantId()).isEqualTo("community");
        assertThat(tenant.isActive()).isFalse();
        assertThat(tenant.getCeiling().allows("VESSEL_CALL", "read")).isTrue();
    }

    @Test
    void tenantWithoutCeilingInherits() {
        Map<String, Object> data = Map.of("parentTenantId", "org");

        Tenant tenant = AccessGraphDocumentMapper.toTenant(snapshot("branch", data));

        assertThat(tenant.hasCeiling()).isFalse();
    }

    @Test
    void permissionKeepsRawConditionsForCompilation() {
        Map<String, Object> data = new HashMap<>();
        data.put("resourceType", "vessel");
        data.put("resourcePath", "vessel/*");
        data.put("actions", List.of("read"));
        data.put("conditions", Map.of("status", Map.of("ne", "closed")));
        data.put("fieldPermissions", Map.of("eta", "read"));

        PermissionDefinition definition = AccessGraphDocumentMapper.toPermissionDefinition(snapshot("p1", data));

        assertThat(definition.getActions()).containsExactly("read");
        assertThat(definition.getConditions()).containsKey("status");
        assertThat(definition.getFieldPermissions()).containsEntry("eta", "read");
        assertThat(definition.isActive()).isTrue();
    }

    private static DocumentSnapshot snapshot(String id, Map<String, Object> data) {
        DocumentSnapshot doc = mock(DocumentSnapshot.class);
        when(doc.getId()).thenReturn(id);
        when(doc.exists()).thenReturn(true);
        when(doc.getData()).thenReturn(data);
        when(doc.get("ceiling")).thenReturn(data.get("ceiling"));
        return doc;
    }
}
