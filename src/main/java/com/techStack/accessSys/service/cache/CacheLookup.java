package com.techStack.accessSys.service.cache;

import com.techStack.accessSys.models.decision.AccessDecision;

public record CacheLookup(AccessDecision decision, boolean hit) {

    public static CacheLookup hit(AccessDecision decision) {
        return new CacheLookup(decision, true);
    }

    public static CacheLookup computed(AccessDecision decision) {
        return new CacheLookup(decision, false);
    }
}
