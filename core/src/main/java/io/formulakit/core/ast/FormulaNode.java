package io.formulakit.core.ast;

import io.formulakit.core.spi.RandomProvider;
import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed formula's syntax tree. Every node evaluates to a {@code double} against an
 * {@link EvaluationContext}; declarations and assignments also write into the context.
 *
 * <p>
 * The hierarchy is sealed: the parser only ever builds the variants below. Nodes are immutable and
 * own their children, so a tree can be evaluated concurrently as long as each evaluation uses its
 * own context.
 *
 * <p>
 * Truth values follow one rule throughout: zero is false, anything else (including NaN) is true.
 * Nodes that produce a truth value always produce exactly {@code 1.0} or {@code 0.0}.
 */
public sealed interface FormulaNode {

    /**
     * Evaluates this node.
     *
     * @param context bindings for this evaluation
     * @return the node's value
     * @throws io.formulakit.core.error.MissingVariableException if a referenced variable is unbound
     */
    double evaluate(EvaluationContext context);

    static boolean isTrue(double value) {
        return value != 0;
    }

    static double truth(boolean value) {
        return value ? 1 : 0;
    }

    // ── Values ──

    record Constant(double value) implements FormulaNode {
        @Override
        public double evaluate(EvaluationContext context) {
            return value;
        }
    }

    /** Reads a bound variable; unbound names fail the evaluation. */
    record Variable(String name) implements FormulaNode {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            return context.get(name);
        }
    }

    /** Evaluates to {@code 0}. Produced for empty input and empty blocks. */
    record Empty() implements FormulaNode {
        @Override
        public double evaluate(EvaluationContext context) {
            return 0;
        }
    }

    // ── Operators ──

    /** Prefix {@code -} or {@code +}. */
    record UnaryOp(Sign sign, FormulaNode operand) implements FormulaNode {
        public enum Sign {
            PLUS,
            MINUS
        }

        public UnaryOp {
            Objects.requireNonNull(sign, "sign must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double value = operand.evaluate(context);
            return sign == Sign.MINUS ? -value : value;
        }
    }

    record BinaryOp(ArithmeticOperator operator, FormulaNode left, FormulaNode right) implements FormulaNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double l = left.evaluate(context);
            return operator.apply(l, right.evaluate(context));
        }
    }

    /** Floating-point remainder; the result takes the sign of the dividend. */
    record Modulo(FormulaNode left, FormulaNode right) implements FormulaNode {
        public Modulo {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double l = left.evaluate(context);
            return l % right.evaluate(context);
        }
    }

    record Comparison(ComparisonOperator operator, FormulaNode left, FormulaNode right) implements FormulaNode {
        public Comparison {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double l = left.evaluate(context);
            return truth(operator.test(l, right.evaluate(context)));
        }
    }

    /** Short-circuit {@code &&}: the right side is not evaluated when the left is false. */
    record And(FormulaNode left, FormulaNode right) implements FormulaNode {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            if (!isTrue(left.evaluate(context))) {
                return 0;
            }
            return truth(isTrue(right.evaluate(context)));
        }
    }

    /** Short-circuit {@code ||}: the right side is not evaluated when the left is true. */
    record Or(FormulaNode left, FormulaNode right) implements FormulaNode {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            if (isTrue(left.evaluate(context))) {
                return 1;
            }
            return truth(isTrue(right.evaluate(context)));
        }
    }

    record Not(FormulaNode operand) implements FormulaNode {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            return truth(!isTrue(operand.evaluate(context)));
        }
    }

    // ── Control flow ──

    /** {@code condition ? whenTrue : whenFalse}; only the selected branch is evaluated. */
    record Ternary(FormulaNode condition, FormulaNode whenTrue, FormulaNode whenFalse) implements FormulaNode {
        public Ternary {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(whenTrue, "whenTrue must not be null");
            Objects.requireNonNull(whenFalse, "whenFalse must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            return isTrue(condition.evaluate(context)) ? whenTrue.evaluate(context) : whenFalse.evaluate(context);
        }
    }

    /**
     * {@code if (condition) then else otherwise}. A false condition without an else branch evaluates
     * to {@code 0}.
     *
     * @param elseBranch may be null
     */
    record Conditional(FormulaNode condition, FormulaNode thenBranch, FormulaNode elseBranch) implements FormulaNode {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenBranch, "thenBranch must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            if (isTrue(condition.evaluate(context))) {
                return thenBranch.evaluate(context);
            }
            return elseBranch != null ? elseBranch.evaluate(context) : 0;
        }
    }

    /**
     * Statements evaluated in order; the value is that of the last one, or {@code 0} when empty. Used
     * for both top-level statement lists and braced blocks.
     */
    record Sequence(List<FormulaNode> statements) implements FormulaNode {
        public Sequence {
            Objects.requireNonNull(statements, "statements must not be null");
            statements = List.copyOf(statements);
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double result = 0;
            for (FormulaNode statement : statements) {
                result = statement.evaluate(context);
            }
            return result;
        }
    }

    // ── Statements ──

    /**
     * {@code let name = initializer}. Writes the value (or {@code 0} without an initializer) and
     * returns it.
     *
     * @param initializer may be null
     */
    record Declaration(String name, FormulaNode initializer) implements FormulaNode {
        public Declaration {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double value = initializer != null ? initializer.evaluate(context) : 0;
            context.set(name, value);
            return value;
        }
    }

    /**
     * Plain or compound assignment. Compound forms read the current value, defaulting to {@code 0}
     * when unbound. Returns the value written.
     */
    record Assignment(String name, AssignmentOperator operator, FormulaNode value) implements FormulaNode {
        public Assignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double newValue = value.evaluate(context);
            if (operator != AssignmentOperator.ASSIGN) {
                newValue = operator.combine(context.getOrDefault(name, 0), newValue);
            }
            context.set(name, newValue);
            return newValue;
        }
    }

    // ── Functions ──

    record FunctionCall(MathFunction function, FormulaNode argument) implements FormulaNode {
        public FunctionCall {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            return function.apply(argument.evaluate(context));
        }
    }

    /** Call to a {@link MultiArgFunction}; every argument is evaluated, in order. */
    record MultiArgFunctionCall(MultiArgFunction function, List<FormulaNode> arguments) implements FormulaNode {
        public MultiArgFunctionCall {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double[] values = new double[arguments.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = arguments.get(i).evaluate(context);
            }
            return function.apply(values);
        }
    }

    /** {@code random()}: uniform in [0, 1). */
    record RandomValue(RandomProvider provider) implements FormulaNode {
        public RandomValue {
            Objects.requireNonNull(provider, "provider must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            return context.random(provider).nextDouble();
        }
    }

    /** {@code rand(max)}: uniform integer in [0, max), with {@code max} truncated toward zero. */
    record RandomInt(FormulaNode max, RandomProvider provider) implements FormulaNode {
        public RandomInt {
            Objects.requireNonNull(max, "max must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double bound = max.evaluate(context);
            return context.random(provider).nextInt((int) bound);
        }
    }

    /** {@code randf(max)}: uniform in [0, max). */
    record RandomFloat(FormulaNode max, RandomProvider provider) implements FormulaNode {
        public RandomFloat {
            Objects.requireNonNull(max, "max must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
        }

        @Override
        public double evaluate(EvaluationContext context) {
            double bound = max.evaluate(context);
            return context.random(provider).nextDouble(bound);
        }
    }
}
