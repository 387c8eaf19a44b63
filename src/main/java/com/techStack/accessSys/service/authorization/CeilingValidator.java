package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.exception.authorization.CeilingViolationException;
import com.techStack.accessSys.exception.resource.ResourceNotFoundException;
import com.techStack.accessSys.models.tenant.CapabilityCeiling;
import com.techStack.accessSys.models.tenant.Tenant;
import com.techStack.accessSys.repository.authorization.AccessGraphRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability ceilings along the tenant tree.
 *
 * <p>{@link #validate} runs on the write path: a proposed ceiling must be a subset
 * of the nearest configured ceiling above it (the product catalog above a root).
 * Violations are rejected, never truncated.
 *
 * <p>{@link #effectiveCeiling} is the intersection of every configured ceiling on
 * the path to the root, used by the optional evaluation-time re-check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CeilingValidator {

    private final AccessGraphRepository repository;
    private final EngineProperties properties;

    /**
     * @throws CeilingViolationException naming the first capability/action the parent layer lacks
     * @throws ResourceNotFoundException if the tenant or one of its ancestors is missing
     */
    public Mono<Void> validate(String childTenantId, CapabilityCeiling proposed) {
        if (proposed == null || proposed.isEmpty()) {
            return Mono.empty();
        }
        return repository.getTenantAncestry(childTenantId)
                .flatMap(tenants -> {
                    if (!tenants.containsKey(childTenantId)) {
                        return Mono.<Void>error(new ResourceNotFoundException("tenant", childTenantId));
                    }
                    CapabilityCeiling parentCeiling = nearestConfiguredAbove(childTenantId, tenants);
                    if (parentCeiling == null) {
                        log.debug("No ceiling configured above tenant {}; nothing to validate against", childTenantId);
                        return Mono.<Void>empty();
                    }
                    Optional<CapabilityCeiling.Violation> violation = proposed.firstViolationAgainst(parentCeiling);
                    if (violation.isPresent()) {
                        CapabilityCeiling.Violation v = violation.get();
                        log.warn("🚫 Ceiling for tenant {} rejected: {}:{} exceeds parent allowance",
                                childTenantId, v.capability(), v.action());
                        return Mono.<Void>error(new CeilingViolationException(childTenantId, v.capability(), v.action()));
                    }
                    log.info("✅ Ceiling for tenant {} is within its parent allowance", childTenantId);
                    return Mono.<Void>empty();
                });
    }

    /**
     * @return empty when no layer restricts the tenant; an empty ceiling when the
     *         tenant or an ancestor is inactive
     * @throws ResourceNotFoundException if the tenant or one of its ancestors is missing
     * @throws com.techStack.accessSys.exception.authorization.CycleDetectedException if the tenant tree loops
     */
    public Mono<Optional<CapabilityCeiling>> effectiveCeiling(String tenantId) {
        return repository.getTenantAncestry(tenantId)
                .map(tenants -> {
                    List<Tenant> chain = chain(tenantId, tenants);
                    CapabilityCeiling effective = null;
                    for (Tenant tenant : chain) {
                        if (!tenant.isActive()) {
                            log.debug("Tenant {} is inactive; {} has no capabilities", tenant.getId(), tenantId);
                            return Optional.of(CapabilityCeiling.empty());
                        }
                        if (tenant.hasCeiling()) {
                            effective = effective == null ? tenant.getCeiling() : effective.intersect(tenant.getCeiling());
                        }
                    }
                    CapabilityCeiling product = properties.productCeiling();
                    if (!product.isEmpty()) {
                        effective = effective == null ? product : effective.intersect(product);
                    }
                    return Optional.ofNullable(effective);
                });
    }

    private CapabilityCeiling nearestConfiguredAbove(String tenantId, Map<String, Tenant> tenants) {
        List<Tenant> chain = chain(tenantId, tenants);
        for (Tenant ancestor : chain.subList(1, chain.size())) {
            if (ancestor.hasCeiling()) {
                return ancestor.getCeiling();
            }
        }
        CapabilityCeiling product = properties.productCeiling();
        return product.isEmpty() ? null : product;
    }

    /** The tenant followed by its ancestors, nearest first. */
    private static List<Tenant> chain(String tenantId, Map<String, Tenant> tenants) {
        Tenant start = tenants.get(tenantId);
        if (start == null) {
            throw new ResourceNotFoundException("tenant", tenantId);
        }
        List<Tenant> chain = new ArrayList<>();
        chain.add(start);
        for (String ancestorId : HierarchyWalker.TENANTS.ancestors(tenantId, id -> parentOf(id, tenants))) {
            Tenant ancestor = tenants.get(ancestorId);
            if (ancestor == null) {
                throw new ResourceNotFoundException("tenant", ancestorId);
            }
            chain.add(ancestor);
        }
        return chain;
    }

    private static String parentOf(String id, Map<String, Tenant> tenants) {
        Tenant tenant = tenants.get(id);
        return tenant == null ? null : tenant.getParentTenantId();
    }
}
