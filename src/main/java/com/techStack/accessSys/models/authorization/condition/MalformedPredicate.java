package com.techStack.accessSys.models.authorization.condition;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;

/**
 * Placeholder for a condition entry that could not be parsed. Never satisfied.
 */
public record MalformedPredicate(String attributePath, String reason) implements ConditionPredicate {

    @Override
    public boolean test(Object actual) {
        throw new MalformedConditionException(attributePath, reason);
    }
}
