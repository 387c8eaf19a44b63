package com.techStack.accessSys.models.authorization;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/** The three parent-linked hierarchies the engine walks. */
public enum HierarchyKind {
    TENANT,
    ROLE,
    GROUP;

    @JsonCreator
    public static HierarchyKind fromValue(String value) {
        return HierarchyKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
