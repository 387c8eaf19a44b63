package com.techStack.accessSys.models.tenant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Capability envelope of one administrative layer: capability id → permitted actions.
 * Immutable; actions are normalised to lower case.
 */
public final class CapabilityCeiling {

    private static final CapabilityCeiling EMPTY = new CapabilityCeiling(new TreeMap<>());

    private final SortedMap<String, SortedSet<String>> capabilities;

    private CapabilityCeiling(SortedMap<String, SortedSet<String>> capabilities) {
        this.capabilities = capabilities;
    }

    public static CapabilityCeiling empty() {
        return EMPTY;
    }

    @JsonCreator
    public static CapabilityCeiling of(Map<String, ? extends Collection<String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        SortedMap<String, SortedSet<String>> normalized = new TreeMap<>();
        raw.forEach((capability, actions) -> {
            if (capability == null || capability.isBlank()) {
                throw new IllegalArgumentException("Capability identifier must not be blank");
            }
            SortedSet<String> set = new TreeSet<>();
            if (actions != null) {
                actions.stream()
                        .filter(Objects::nonNull)
                        .map(a -> a.trim().toLowerCase(Locale.ROOT))
                        .filter(a -> !a.isEmpty())
                        .forEach(set::add);
            }
            normalized.put(capability.trim(), Collections.unmodifiableSortedSet(set));
        });
        return new CapabilityCeiling(Collections.unmodifiableSortedMap(normalized));
    }

    @JsonValue
    public SortedMap<String, SortedSet<String>> asMap() {
        return capabilities;
    }

    public boolean isEmpty() {
        return capabilities.isEmpty();
    }

    public boolean allows(String capability, String action) {
        SortedSet<String> actions = capabilities.get(capability);
        return actions != null && action != null && actions.contains(action.toLowerCase(Locale.ROOT));
    }

    /**
     * First capability/action of this ceiling that the parent does not allow, in
     * capability then action order. A capability listed with no actions is a
     * violation when the parent does not list the capability at all.
     */
    public Optional<Violation> firstViolationAgainst(CapabilityCeiling parent) {
        for (Map.Entry<String, SortedSet<String>> entry : capabilities.entrySet()) {
            SortedSet<String> allowed = parent.capabilities.get(entry.getKey());
            if (allowed == null) {
                String action = entry.getValue().isEmpty() ? null : entry.getValue().first();
                return Optional.of(new Violation(entry.getKey(), action));
            }
            for (String action : entry.getValue()) {
                if (!allowed.contains(action)) {
                    return Optional.of(new Violation(entry.getKey(), action));
                }
            }
        }
        return Optional.empty();
    }

    public CapabilityCeiling intersect(CapabilityCeiling other) {
        SortedMap<String, SortedSet<String>> result = new TreeMap<>();
        capabilities.forEach((capability, actions) -> {
            SortedSet<String> otherActions = other.capabilities.get(capability);
            if (otherActions != null) {
                SortedSet<String> common = new TreeSet<>(actions);
                common.retainAll(otherActions);
                result.put(capability, Collections.unmodifiableSortedSet(common));
            }
        });
        return new CapabilityCeiling(Collections.unmodifiableSortedMap(result));
    }

    public record Violation(String capability, String action) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapabilityCeiling that)) return false;
        return capabilities.equals(that.capabilities);
    }

    @Override
    public int hashCode() {
        return capabilities.hashCode();
    }

    @Override
    public String toString() {
        return "CapabilityCeiling" + capabilities;
    }
}
