package com.techStack.accessSys.models.authorization.condition;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;

/**
 * {@code attr == literal}, or {@code attr != literal} when negated.
 */
public record EqualsPredicate(String attributePath, Object expected, boolean negated) implements ConditionPredicate {

    @Override
    public boolean test(Object actual) {
        boolean equal = ConditionValues.scalarEquals(expected, actual)
                .orElseThrow(() -> new MalformedConditionException(attributePath,
                        "cannot compare " + typeName(actual) + " with " + typeName(expected)));
        return negated != equal;
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
