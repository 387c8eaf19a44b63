package com.techStack.accessSys.service.authorization.condition;

import com.techStack.accessSys.models.authorization.condition.ComparisonOperator;
import com.techStack.accessSys.models.authorization.condition.ComparisonPredicate;
import com.techStack.accessSys.models.authorization.condition.ConditionPredicate;
import com.techStack.accessSys.models.authorization.condition.EqualsPredicate;
import com.techStack.accessSys.models.authorization.condition.MalformedPredicate;
import com.techStack.accessSys.models.authorization.condition.MembershipPredicate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionParserTest {

    private final ConditionParser parser = new ConditionParser();

    @Test
    void scalarBecomesEquality() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("department", "cardiology"));

        assertThat(predicates).containsExactly(new EqualsPredicate("department", "cardiology", false));
    }

    @Test
    void listBecomesMembership() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("shift", List.of("day", "night")));

        assertThat(predicates).singleElement().isInstanceOf(MembershipPredicate.class);
        assertThat(((MembershipPredicate) predicates.get(0)).negated()).isFalse();
    }

    @Test
    void operatorObjectIsAConjunctionInOperatorOrder() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("amount", Map.of("lte", 500, "gt", 0)));

        assertThat(predicates).containsExactly(
                ComparisonPredicate.numeric("amount", ComparisonOperator.GT, BigDecimal.ZERO),
                ComparisonPredicate.numeric("amount", ComparisonOperator.LTE, BigDecimal.valueOf(500)));
    }

    @Test
    void isoStringOperandIsTemporal() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("context.time", Map.of("lt", "2026-12-31T00:00:00Z")));

        assertThat(predicates).containsExactly(ComparisonPredicate.temporal("context.time", ComparisonOperator.LT,
                Instant.parse("2026-12-31T00:00:00Z")));
    }

    @Test
    void keysAreParsedInSortedOrder() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("b", "x", "a", "y"));

        assertThat(predicates).extracting(ConditionPredicate::attributePath).containsExactly("a", "b");
    }

    @Test
    void unsupportedOperatorIsMalformed() {
        List<ConditionPredicate> predicates = parser.parse(Map.of("status", Map.of("regex", ".*")));

        assertThat(predicates).singleElement().isInstanceOf(MalformedPredicate.class);
        assertThat(((MalformedPredicate) predicates.get(0)).reason()).contains("regex");
    }

    @Test
    void nestedObjectsAndEmptyListsAreMalformed() {
        assertThat(parser.parse(Map.of("tags", List.of()))).singleElement().isInstanceOf(MalformedPredicate.class);
        assertThat(parser.parse(Map.of("tags", List.of(Map.of("a", 1))))).singleElement()
                .isInstanceOf(MalformedPredicate.class);
        assertThat(parser.parse(Map.of("amount", Map.of("gt", "lots")))).singleElement()
                .isInstanceOf(MalformedPredicate.class);
    }

    @Test
    void nonFiniteOperandsAreMalformed() {
        assertThat(parser.parse(Map.of("amount", Map.of("lte", Double.POSITIVE_INFINITY)))).singleElement()
                .isInstanceOf(MalformedPredicate.class);
        assertThat(parser.parse(Map.of("amount", Double.NaN))).singleElement()
                .isInstanceOf(MalformedPredicate.class);
        assertThat(parser.parse(Map.of("amount", List.of(1, Double.NEGATIVE_INFINITY)))).singleElement()
                .isInstanceOf(MalformedPredicate.class);
    }

    @Test
    void emptyConditionsParseToNothing() {
        assertThat(parser.parse(Map.of())).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
