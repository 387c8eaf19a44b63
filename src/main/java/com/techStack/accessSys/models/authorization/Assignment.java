package com.techStack.accessSys.models.authorization;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single assignment edge (user→role, user→group, group→role or role→permission).
 * Only the target side is stored; the source is the record that owns the edge.
 */
@Value
@Builder
@Jacksonized
public class Assignment {

    String targetId;

    /** Null means the edge never expires. */
    Instant expiresAt;

    @Builder.Default
    boolean active = true;

    public static Assignment of(String targetId) {
        return Assignment.builder().targetId(targetId).build();
    }

    public static Assignment expiringAt(String targetId, Instant expiresAt) {
        return Assignment.builder().targetId(targetId).expiresAt(expiresAt).build();
    }

    public boolean isEffectiveAt(Instant now) {
        return active && targetId != null && (expiresAt == null || expiresAt.isAfter(now));
    }
}
