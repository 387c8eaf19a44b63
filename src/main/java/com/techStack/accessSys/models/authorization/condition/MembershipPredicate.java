package com.techStack.accessSys.models.authorization.condition;

import com.techStack.accessSys.exception.authorization.MalformedConditionException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@code attr in [..]}, or {@code attr not in [..]} when negated.
 * A collection-valued attribute is a member when any of its elements is.
 */
public record MembershipPredicate(String attributePath, List<Object> values, boolean negated) implements ConditionPredicate {

    public MembershipPredicate {
        values = List.copyOf(values);
    }

    @Override
    public boolean test(Object actual) {
        Collection<?> candidates = actual instanceof Collection<?> collection ? collection : List.of(actual);
        boolean comparable = false;
        boolean member = false;

        for (Object candidate : candidates) {
            for (Object value : values) {
                Optional<Boolean> equal = ConditionValues.scalarEquals(value, candidate);
                if (equal.isPresent()) {
                    comparable = true;
                    if (equal.get()) {
                        member = true;
                        break;
                    }
                }
            }
            if (member) break;
        }

        if (!comparable && !candidates.isEmpty()) {
            throw new MalformedConditionException(attributePath,
                    "no member of " + values + " is comparable with " + EqualsPredicate.typeName(actual));
        }
        return negated != member;
    }
}
