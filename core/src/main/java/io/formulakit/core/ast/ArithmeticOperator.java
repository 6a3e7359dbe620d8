package io.formulakit.core.ast;

/** Binary arithmetic operators. Division by zero follows IEEE 754 and is never an error. */
public enum ArithmeticOperator {
    ADD("+") {
        @Override
        public double apply(double left, double right) {
            return left + right;
        }
    },
    SUBTRACT("-") {
        @Override
        public double apply(double left, double right) {
            return left - right;
        }
    },
    MULTIPLY("*") {
        @Override
        public double apply(double left, double right) {
            return left * right;
        }
    },
    DIVIDE("/") {
        @Override
        public double apply(double left, double right) {
            return left / right;
        }
    },
    POWER("^") {
        @Override
        public double apply(double left, double right) {
            return Math.pow(left, right);
        }
    };

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public abstract double apply(double left, double right);

    /** The operator as written in source text. */
    public String symbol() {
        return symbol;
    }
}
