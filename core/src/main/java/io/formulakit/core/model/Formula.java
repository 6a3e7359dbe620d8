package io.formulakit.core.model;

import io.formulakit.core.ast.EvaluationContext;
import io.formulakit.core.ast.FormulaNode;
import io.formulakit.core.spi.RandomProvider;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed formula: its source text, syntax tree and the input variables the caller must supply.
 * Created by {@link io.formulakit.core.parser.FormulaParser}; immutable and evaluable any number of
 * times without reparsing.
 *
 * <p>
 * Thread-safe: each {@link #evaluate(Map)} call works on its own context.
 */
public final class Formula {

    private final String expression;
    private final FormulaNode root;
    private final Set<String> requiredInputs;
    private final Set<String> localVariables;

    public Formula(String expression, FormulaNode root, Set<String> requiredInputs, Set<String> localVariables) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.requiredInputs = Set.copyOf(requiredInputs);
        this.localVariables = Set.copyOf(localVariables);
    }

    /** The source text this formula was parsed from. */
    public String expression() {
        return expression;
    }

    public FormulaNode root() {
        return root;
    }

    /** Names read by the formula that are never declared or assigned locally before being read. */
    public Set<String> requiredInputs() {
        return requiredInputs;
    }

    /** Names declared with {@code let} or targeted by an assignment. */
    public Set<String> localVariables() {
        return localVariables;
    }

    /**
     * Evaluates against a copy of {@code inputs}; the caller's map is never modified.
     *
     * @throws io.formulakit.core.error.MissingVariableException if a read variable is not bound
     */
    public double evaluate(Map<String, Double> inputs) {
        return evaluate(new EvaluationContext(inputs));
    }

    /** Evaluates against a copy of {@code inputs}, drawing random values from {@code random}. */
    public double evaluate(Map<String, Double> inputs, RandomProvider random) {
        return evaluate(new EvaluationContext(inputs).withRandom(random));
    }

    /**
     * Evaluates directly against {@code context}. Locals written by the formula stay in the
     * context afterwards.
     */
    public double evaluate(EvaluationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        return root.evaluate(context);
    }

    @Override
    public String toString() {
        return "Formula[" + expression + ", inputs=" + requiredInputs + "]";
    }
}
