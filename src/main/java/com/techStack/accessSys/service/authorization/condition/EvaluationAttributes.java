package com.techStack.accessSys.service.authorization.condition;

import com.techStack.accessSys.models.principal.AccessRequest;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute view a condition is evaluated against.
 *
 * <p>Top-level keys of the request context are addressable directly
 * ({@code department}). The namespaces {@code context.*}, {@code resource.*},
 * {@code attributes.*} (resource attributes) and {@code principal.*} are always
 * present and shadow context keys of the same name.
 */
public final class EvaluationAttributes {

    private final Map<String, Object> root;

    private EvaluationAttributes(Map<String, Object> root) {
        this.root = root;
    }

    public static EvaluationAttributes of(AccessRequest request) {
        Map<String, Object> context = request.getContext() == null ? Map.of() : request.getContext();
        Map<String, Object> root = new HashMap<>(context);

        ResourceRef resource = request.getResource();
        Map<String, Object> resourceAttributes = resource == null || resource.getAttributes() == null
                ? Map.of() : resource.getAttributes();

        Map<String, Object> resourceView = new HashMap<>();
        if (resource != null) {
            putIfPresent(resourceView, "type", resource.getType());
            putIfPresent(resourceView, "id", resource.getId());
            putIfPresent(resourceView, "path", resource.getPath());
        }
        resourceView.put("attributes", resourceAttributes);

        Map<String, Object> principalView = new HashMap<>();
        Principal principal = request.getPrincipal();
        if (principal != null) {
            putIfPresent(principalView, "id", principal.getId());
            putIfPresent(principalView, "tenantId", principal.getTenantId());
            putIfPresent(principalView, "branchId", principal.getBranchId());
            principalView.put("serviceAccount", principal.isServiceAccount());
        }

        root.put("context", context);
        root.put("resource", resourceView);
        root.put("attributes", resourceAttributes);
        root.put("principal", principalView);
        return new EvaluationAttributes(root);
    }

    /**
     * Resolves a dotted path. A context key that literally contains the dots is
     * used when the segment walk finds nothing.
     *
     * @return empty when the attribute is absent or null
     */
    public Optional<Object> resolve(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                current = null;
                break;
            }
            current = map.get(segment);
            if (current == null) {
                break;
            }
        }
        if (current == null) {
            current = root.get(path);
        }
        return Optional.ofNullable(current);
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
