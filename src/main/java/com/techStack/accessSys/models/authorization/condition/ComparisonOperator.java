package com.techStack.accessSys.models.authorization.condition;

import java.util.Locale;
import java.util.Optional;

public enum ComparisonOperator {

    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte");

    private final String token;

    ComparisonOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean holds(int comparison) {
        return switch (this) {
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
        };
    }

    public static Optional<ComparisonOperator> fromToken(String token) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op.token.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
