package com.techStack.accessSys.models.authorization.condition;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;
import java.util.function.Function;

/**
 * Normalisation helpers shared by the predicate kinds.
 */
public final class ConditionValues {

    private ConditionValues() {
    }

    /**
     * @return empty for non-numbers and for NaN or infinite floating point values
     */
    public static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return Optional.empty();
        }
        if (value instanceof Float f && !Float.isFinite(f)) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(new BigDecimal(number.toString()));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Instant> asInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof String text) {
            return parseInstant(text.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseInstant(String text) {
        return tryParse(text, Instant::parse)
                .or(() -> tryParse(text, t -> OffsetDateTime.parse(t).toInstant()))
                .or(() -> tryParse(text, t -> LocalDate.parse(t).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    private static Optional<Instant> tryParse(String text, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    /**
     * Equality across the scalar kinds. When either side is a number both sides
     * compare numerically, so {@code 5} and {@code "5"} are equal whichever side
     * holds the string. Otherwise both must be the same kind.
     *
     * @return empty when the two values are of incomparable kinds, or a number is not finite
     */
    public static Optional<Boolean> scalarEquals(Object expected, Object actual) {
        if (expected instanceof String && actual instanceof String) {
            return Optional.of(expected.equals(actual));
        }
        if (expected instanceof Boolean && actual instanceof Boolean) {
            return Optional.of(expected.equals(actual));
        }
        if (expected instanceof Number || actual instanceof Number) {
            if (!isNumeric(expected) || !isNumeric(actual)) {
                return Optional.empty();
            }
            Optional<BigDecimal> left = asNumber(expected);
            Optional<BigDecimal> right = asNumber(actual);
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(left.get().compareTo(right.get()) == 0);
        }
        return Optional.empty();
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof String;
    }
}
