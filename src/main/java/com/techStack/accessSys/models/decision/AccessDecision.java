package com.techStack.accessSys.models.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.techStack.accessSys.models.authorization.FieldLevel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one evaluation. Permission ids are sorted and the field map is
 * key-ordered so identical inputs serialise identically.
 */
@Value
@Builder
@Jacksonized
public class AccessDecision {

    boolean allowed;

    @Builder.Default
    List<String> matchedPermissionIds = List.of();

    @Builder.Default
    SortedMap<String, FieldLevel> fieldPermissions = Collections.emptySortedMap();

    ReasonCode reasonCode;

    public static AccessDecision granted(List<String> matchedPermissionIds, SortedMap<String, FieldLevel> fields) {
        return AccessDecision.builder()
                .allowed(true)
                .matchedPermissionIds(List.copyOf(matchedPermissionIds))
                .fieldPermissions(Collections.unmodifiableSortedMap(new TreeMap<>(fields)))
                .reasonCode(ReasonCode.GRANTED)
                .build();
    }

    public static AccessDecision denied(ReasonCode reasonCode) {
        return AccessDecision.builder()
                .allowed(false)
                .reasonCode(reasonCode)
                .build();
    }

    @JsonIgnore
    public boolean isCacheable() {
        return reasonCode != null && reasonCode.isCacheable();
    }
}
