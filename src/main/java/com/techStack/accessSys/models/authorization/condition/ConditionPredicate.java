package com.techStack.accessSys.models.authorization.condition;

/**
 * Typed form of one condition-map entry, parsed once when the permission is loaded.
 */
public sealed interface ConditionPredicate
        permits EqualsPredicate, MembershipPredicate, ComparisonPredicate, MalformedPredicate {

    /** Dotted path of the attribute this predicate reads. */
    String attributePath();

    /**
     * @param actual resolved attribute value, never null
     * @throws com.techStack.accessSys.exception.authorization.MalformedConditionException
     *         when the value cannot be compared with the operand
     */
    boolean test(Object actual);
}
