package com.medassist.guideline;

import java.util.Optional;

public enum ComparisonOperator {
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    EQUAL("=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        return switch (this) {
            case GREATER_THAN -> actual > threshold;
            case GREATER_OR_EQUAL -> actual >= threshold;
            case LESS_THAN -> actual < threshold;
            case LESS_OR_EQUAL -> actual <= threshold;
            case EQUAL -> Double.compare(actual, threshold) == 0;
        };
    }

    /**
     * Accepts ASCII and Unicode forms ("≥", "≤", "＞", "＜").
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return switch (symbol.trim()) {
            case ">", "＞" -> Optional.of(GREATER_THAN);
            case ">=", "≥", "=>" -> Optional.of(GREATER_OR_EQUAL);
            case "<", "＜" -> Optional.of(LESS_THAN);
            case "<=", "≤", "=<" -> Optional.of(LESS_OR_EQUAL);
            case "=", "==" -> Optional.of(EQUAL);
            default -> Optional.empty();
        };
    }
}
