package com.techStack.accessSys.service.authorization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.models.authorization.Assignment;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.Role;
import com.techStack.accessSys.models.graph.PrincipalAssignments;
import com.techStack.accessSys.models.principal.AccessRequest;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;
import com.techStack.accessSys.repository.authorization.AccessGraphRepository;
import com.techStack.accessSys.repository.authorization.InMemoryAccessGraphRepository;
import com.techStack.accessSys.service.authorization.condition.ConditionParser;
import com.techStack.accessSys.service.authorization.condition.PermissionCompiler;
import com.techStack.accessSys.service.cache.CaffeineDecisionCache;
import com.techStack.accessSys.service.cache.ContextFingerprint;
import com.techStack.accessSys.service.observability.EngineMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Wires the engine by hand over the in-memory store, a fixed clock and a local cache.
 */
public class EngineFixture {

    public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final PermissionCompiler compiler = new PermissionCompiler(new ConditionParser());
    public final InMemoryAccessGraphRepository repository = new InMemoryAccessGraphRepository(compiler);
    public final EngineProperties properties = new EngineProperties();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final EngineMetrics metrics = new EngineMetrics(registry, "access");
    public final CaffeineDecisionCache cache = new CaffeineDecisionCache(Duration.ofMinutes(5), 1_000);
    public final ContextFingerprint fingerprint = new ContextFingerprint(new ObjectMapper().findAndRegisterModules());

    public RoleAggregator roleAggregator() {
        return roleAggregator(repository);
    }

    public RoleAggregator roleAggregator(AccessGraphRepository store) {
        return new RoleAggregator(store, properties, metrics, clock);
    }

    public CeilingValidator ceilingValidator() {
        return new CeilingValidator(repository, properties);
    }

    public DecisionInvalidationService invalidationService() {
        return new DecisionInvalidationService(cache, metrics);
    }

    public AccessDecisionService decisionService() {
        return decisionService(repository);
    }

    public AccessDecisionService decisionService(AccessGraphRepository store) {
        return new AccessDecisionService(
                roleAggregator(store),
                new PermissionMatcher(),
                new ConditionEvaluator(metrics),
                new FieldPermissionMerger(),
                new CeilingValidator(store, properties),
                cache,
                fingerprint,
                properties,
                metrics,
                clock);
    }

    /* ===== Graph helpers ===== */

    public EngineFixture role(String id, String parentId, String... permissionIds) {
        Role.RoleBuilder builder = Role.builder().id(id).tenantId("t1").name(id).parentRoleId(parentId);
        Arrays.stream(permissionIds).forEach(p -> builder.permissionGrant(Assignment.of(p)));
        repository.putRole(builder.build());
        return this;
    }

    public EngineFixture principal(String id, String... roleIds) {
        PrincipalAssignments.PrincipalAssignmentsBuilder builder = PrincipalAssignments.builder().principalId(id);
        Arrays.stream(roleIds).forEach(r -> builder.role(Assignment.of(r)));
        repository.putPrincipal(builder.build());
        return this;
    }

    public EngineFixture permission(String id, String type, String path, List<String> actions) {
        repository.putPermission(PermissionDefinition.builder()
                .id(id)
                .tenantId("t1")
                .resourceType(type)
                .resourcePath(path)
                .actions(actions)
                .build());
        return this;
    }

    public static Principal user(String id) {
        return Principal.builder().id(id).tenantId("t1").branchId("b1").build();
    }

    public static AccessRequest request(String principalId, String type, String path, String action) {
        return request(principalId, type, path, action, Map.of());
    }

    public static AccessRequest request(String principalId, String type, String path, String action,
                                        Map<String, Object> context) {
        return AccessRequest.builder()
                .principal(user(principalId))
                .resource(ResourceRef.builder().type(type).path(path).build())
                .action(action)
                .context(context)
                .build();
    }

    public double counter(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }
}
