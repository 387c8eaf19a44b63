package com.techStack.accessSys.service.authorization.condition;

import com.techStack.accessSys.exception.authorization.AmbiguousResourceSpecificationException;
import com.techStack.accessSys.models.authorization.FieldLevel;
import com.techStack.accessSys.models.authorization.PermissionDefinition;
import com.techStack.accessSys.models.authorization.PermissionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compiles stored {@link PermissionDefinition}s into the {@link PermissionRecord}s
 * used on the evaluation path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PermissionCompiler {

    private final ConditionParser conditionParser;

    /**
     * @throws AmbiguousResourceSpecificationException unless exactly one of
     *         resourceId / resourcePath is set
     */
    public PermissionRecord compile(PermissionDefinition definition) {
        boolean hasId = isSet(definition.getResourceId());
        boolean hasPath = isSet(definition.getResourcePath());
        if (hasId == hasPath) {
            throw new AmbiguousResourceSpecificationException(definition.getId());
        }

        return PermissionRecord.builder()
                .id(definition.getId())
                .tenantId(definition.getTenantId())
                .name(definition.getName())
                .resourceType(definition.getResourceType())
                .resourceId(hasId ? definition.getResourceId().trim() : null)
                .resourcePath(hasPath ? definition.getResourcePath().trim() : null)
                .actions(normalizeActions(definition.getActions()))
                .conditions(conditionParser.parse(definition.getConditions()))
                .fieldPermissions(compileFieldPermissions(definition.getId(), definition.getFieldPermissions()))
                .active(definition.isActive())
                .build();
    }

    public static SortedSet<String> normalizeActions(Collection<String> actions) {
        SortedSet<String> normalized = new TreeSet<>();
        if (actions != null) {
            actions.stream()
                    .filter(Objects::nonNull)
                    .map(a -> a.trim().toLowerCase(Locale.ROOT))
                    .filter(a -> !a.isEmpty())
                    .forEach(normalized::add);
        }
        return Collections.unmodifiableSortedSet(normalized);
    }

    /**
     * A field may carry a single level or a list of levels. A list resolves to its
     * most permissive valid entry and an empty list means no access ({@code hidden}).
     * Unknown levels are dropped.
     */
    private SortedMap<String, FieldLevel> compileFieldPermissions(String permissionId, Map<String, Object> raw) {
        SortedMap<String, FieldLevel> result = new TreeMap<>();
        if (raw == null) {
            return Collections.unmodifiableSortedMap(result);
        }
        raw.forEach((field, value) -> {
            Optional<FieldLevel> level = parseLevel(value);
            List<Object> unknown = unknownLevels(value);
            if (level.isPresent()) {
                result.put(field, level.get());
                if (!unknown.isEmpty()) {
                    log.warn("⚠️ Ignoring unknown levels {} of field {} on permission {}", unknown, field, permissionId);
                }
            } else {
                log.warn("⚠️ Ignoring field permission {}={} on permission {}", field, value, permissionId);
            }
        });
        return Collections.unmodifiableSortedMap(result);
    }

    public static Optional<FieldLevel> parseLevel(Object value) {
        if (value instanceof String text) {
            return FieldLevel.fromValueSafe(text);
        }
        if (value instanceof Collection<?> values) {
            if (values.isEmpty()) {
                return Optional.of(FieldLevel.HIDDEN);
            }
            FieldLevel best = null;
            for (Object item : values) {
                if (item instanceof String text) {
                    best = FieldLevel.mostPermissive(best, FieldLevel.fromValueSafe(text).orElse(null));
                }
            }
            return Optional.ofNullable(best);
        }
        return Optional.empty();
    }

    /** Entries of a field permission value that are not a known level. */
    public static List<Object> unknownLevels(Object value) {
        if (value instanceof Collection<?> values) {
            List<Object> unknown = new ArrayList<>();
            for (Object item : values) {
                if (!(item instanceof String text) || FieldLevel.fromValueSafe(text).isEmpty()) {
                    unknown.add(item);
                }
            }
            return unknown;
        }
        if (value instanceof String text && FieldLevel.fromValueSafe(text).isPresent()) {
            return List.of();
        }
        return Collections.singletonList(value);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
