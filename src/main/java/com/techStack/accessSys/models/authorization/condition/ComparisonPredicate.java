package com.techStack.accessSys.models.authorization.condition;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ordered comparison against a numeric or temporal operand; exactly one operand is set.
 */
public record ComparisonPredicate(String attributePath,
                                  ComparisonOperator operator,
                                  BigDecimal numericOperand,
                                  Instant temporalOperand) implements ConditionPredicate {

    public static ComparisonPredicate numeric(String path, ComparisonOperator operator, BigDecimal operand) {
        return new ComparisonPredicate(path, operator, operand, null);
    }

    public static ComparisonPredicate temporal(String path, ComparisonOperator operator, Instant operand) {
        return new ComparisonPredicate(path, operator, null, operand);
    }

    @Override
    public boolean test(Object actual) {
        if (numericOperand != null) {
            BigDecimal value = ConditionValues.asNumber(actual)
                    .orElseThrow(() -> mismatch(actual, "number"));
            return operator.holds(value.compareTo(numericOperand));
        }
        Instant value = ConditionValues.asInstant(actual)
                .orElseThrow(() -> mismatch(actual, "timestamp"));
        return operator.holds(value.compareTo(temporalOperand));
    }

    private MalformedConditionException mismatch(Object actual, String expectedKind) {
        return new MalformedConditionException(attributePath,
                operator.token() + " expects a " + expectedKind + " but got " + EqualsPredicate.typeName(actual));
    }
}
