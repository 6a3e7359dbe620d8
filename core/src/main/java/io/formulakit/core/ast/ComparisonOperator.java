package io.formulakit.core.ast;

/**
 * Relational operators. {@code ==} and {@code !=} compare with an absolute tolerance of
 * {@link #EPSILON}; ordering operators compare exactly.
 */
public enum ComparisonOperator {
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    /** Absolute tolerance used by {@link #EQUAL} and {@link #NOT_EQUAL}. */
    public static final double EPSILON = 1e-4;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double left, double right) {
        return switch (this) {
            case LESS -> left < right;
            case LESS_EQUAL -> left <= right;
            case GREATER -> left > right;
            case GREATER_EQUAL -> left >= right;
            case EQUAL -> Math.abs(left - right) < EPSILON;
            case NOT_EQUAL -> Math.abs(left - right) >= EPSILON;
        };
    }
}
