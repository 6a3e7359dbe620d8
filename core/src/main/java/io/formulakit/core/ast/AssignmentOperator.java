package io.formulakit.core.ast;

/** Plain and compound assignment operators. */
public enum AssignmentOperator {
    ASSIGN("="),
    ADD("+="),
    SUBTRACT("-="),
    MULTIPLY("*="),
    DIVIDE("/=");

    private final String symbol;

    AssignmentOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Combines the target's current value with the right-hand side.
     *
     * @param current the target's current value, {@code 0} when the target is unbound
     * @param value the evaluated right-hand side
     * @return the value to write back
     */
    public double combine(double current, double value) {
        return switch (this) {
            case ASSIGN -> value;
            case ADD -> current + value;
            case SUBTRACT -> current - value;
            case MULTIPLY -> current * value;
            case DIVIDE -> current / value;
        };
    }
}
