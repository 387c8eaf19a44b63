package com.techStack.accessSys.service.authorization.condition;

import com.techStack.accessSys.models.authorization.condition.ComparisonOperator;
import com.techStack.accessSys.models.authorization.condition.ComparisonPredicate;
import com.techStack.accessSys.models.authorization.condition.ConditionPredicate;
import com.techStack.accessSys.models.authorization.condition.ConditionValues;
import com.techStack.accessSys.models.authorization.condition.EqualsPredicate;
import com.techStack.accessSys.models.authorization.condition.MalformedPredicate;
import com.techStack.accessSys.models.authorization.condition.MembershipPredicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns the JSON condition payload of a permission into typed predicates.
 *
 * <pre>
 *   "department": "engineering"            equality
 *   "attributes.region": ["APAC", "EMEA"]  membership
 *   "context.amount": {"lte": 5000}        comparison (numbers or ISO-8601 instants)
 *   "status": {"ne": "closed", "in": [..]} every operator must hold
 * </pre>
 *
 * Entries that cannot be parsed become {@link MalformedPredicate}s so the permission
 * is never satisfied.
 */
@Slf4j
@Component
public class ConditionParser {

    public List<ConditionPredicate> parse(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<ConditionPredicate> predicates = new ArrayList<>();
        // key order keeps compiled permissions deterministic
        new TreeMap<>(raw).forEach((path, spec) -> predicates.addAll(parseEntry(path, spec)));
        return List.copyOf(predicates);
    }

    private List<ConditionPredicate> parseEntry(String path, Object spec) {
        if (path == null || path.isBlank()) {
            return List.of(malformed(String.valueOf(path), "blank attribute path"));
        }
        if (spec == null) {
            return List.of(malformed(path, "null operand"));
        }
        if (ConditionValues.isScalar(spec)) {
            return List.of(equality(path, spec, false));
        }
        if (spec instanceof Collection<?> values) {
            return List.of(membership(path, values, false));
        }
        if (spec instanceof Map<?, ?> operators) {
            if (operators.isEmpty()) {
                return List.of(malformed(path, "empty operator object"));
            }
            List<ConditionPredicate> predicates = new ArrayList<>();
            new TreeMap<>(stringKeys(operators)).forEach((op, operand) ->
                    predicates.add(parseOperator(path, op, operand)));
            return predicates;
        }
        return List.of(malformed(path, "unsupported operand type " + spec.getClass().getSimpleName()));
    }

    private ConditionPredicate parseOperator(String path, String op, Object operand) {
        String normalized = op.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "eq":
            case "ne":
                if (!ConditionValues.isScalar(operand)) {
                    return malformed(path, normalized + " expects a scalar operand");
                }
                return equality(path, operand, normalized.equals("ne"));
            case "in":
            case "nin":
                if (!(operand instanceof Collection<?> values)) {
                    return malformed(path, normalized + " expects a list operand");
                }
                return membership(path, values, normalized.equals("nin"));
            default:
                Optional<ComparisonOperator> comparison = ComparisonOperator.fromToken(normalized);
                if (comparison.isEmpty()) {
                    return malformed(path, "unsupported operator '" + op + "'");
                }
                return comparison(path, comparison.get(), operand);
        }
    }

    private ConditionPredicate comparison(String path, ComparisonOperator operator, Object operand) {
        if (operand instanceof Number) {
            return ConditionValues.asNumber(operand)
                    .<ConditionPredicate>map(number -> ComparisonPredicate.numeric(path, operator, number))
                    .orElseGet(() -> malformed(path, operator.token() + " expects a finite number, got " + operand));
        }
        if (operand instanceof String) {
            Optional<Instant> instant = ConditionValues.asInstant(operand);
            if (instant.isPresent()) {
                return ComparisonPredicate.temporal(path, operator, instant.get());
            }
            Optional<BigDecimal> number = ConditionValues.asNumber(operand);
            if (number.isPresent()) {
                return ComparisonPredicate.numeric(path, operator, number.get());
            }
        }
        return malformed(path, operator.token() + " expects a number or ISO-8601 timestamp, got " + operand);
    }

    private ConditionPredicate membership(String path, Collection<?> values, boolean negated) {
        if (values.isEmpty()) {
            return malformed(path, "empty membership list");
        }
        for (Object value : values) {
            if (!ConditionValues.isScalar(value)) {
                return malformed(path, "membership list may only hold scalars");
            }
            if (isNonFinite(value)) {
                return malformed(path, "membership list holds a non-finite number " + value);
            }
        }
        return new MembershipPredicate(path, new ArrayList<>(values), negated);
    }

    private ConditionPredicate equality(String path, Object operand, boolean negated) {
        if (isNonFinite(operand)) {
            return malformed(path, "non-finite number " + operand);
        }
        return new EqualsPredicate(path, operand, negated);
    }

    private static boolean isNonFinite(Object value) {
        return value instanceof Number && ConditionValues.asNumber(value).isEmpty();
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new TreeMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private MalformedPredicate malformed(String path, String reason) {
        log.warn("⚠️ Malformed condition on '{}': {} (permission will never be satisfied)", path, reason);
        return new MalformedPredicate(path, reason);
    }
}
