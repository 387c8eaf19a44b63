package com.techStack.accessSys.service.authorization;

import com.techStack.accessSys.config.EngineProperties;
import com.techStack.accessSys.models.decision.AccessDecision;
import com.techStack.accessSys.models.decision.ScopeFilter;
import com.techStack.accessSys.models.principal.AccessRequest;
import com.techStack.accessSys.models.principal.Principal;
import com.techStack.accessSys.models.principal.ResourceRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Row-level filter for list queries: principals holding the cross-branch
 * capability see the whole tenant, everyone else only their own branch.
 * A principal without a branch is restricted to rows without one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScopeFilterService {

    private final AccessDecisionService accessDecisionService;
    private final EngineProperties properties;

    public Mono<ScopeFilter> filterFor(Principal principal, Map<String, Object> context) {
        AccessRequest crossBranchCheck = AccessRequest.builder()
                .principal(principal)
                .resource(ResourceRef.builder()
                        .type(properties.crossBranchResourceType())
                        .id(principal.getTenantId())
                        .build())
                .action(properties.crossBranchAction())
                .context(context == null ? Map.of() : context)
                .build();

        return accessDecisionService.evaluate(crossBranchCheck)
                .map(decision -> fromDecision(principal, decision))
                .doOnNext(filter -> log.debug("Scope filter for {}: {}", principal.getId(), filter));
    }

    /** Filter for a principal given the outcome of the cross-branch check. */
    public static ScopeFilter fromDecision(Principal principal, AccessDecision crossBranchDecision) {
        if (crossBranchDecision.isAllowed()) {
            return ScopeFilter.unrestricted();
        }
        return ScopeFilter.branch(principal.getTenantId(), principal.getBranchId());
    }
}
