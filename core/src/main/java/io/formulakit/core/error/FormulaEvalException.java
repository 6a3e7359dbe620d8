package io.formulakit.core.error;

/**
 * Abstract parent for evaluation-time errors. Thrown from {@code Formula.evaluate(...)} and the
 * runner lookups; an evaluation that throws produces no partial result.
 */
public abstract class FormulaEvalException extends FormulaException {

    private static final long serialVersionUID = 1L;

    protected FormulaEvalException(String message, String formulaId) {
        super(message, formulaId, Phase.EVALUATION);
    }

    protected FormulaEvalException(String message, Throwable cause, String formulaId) {
        super(message, cause, formulaId, Phase.EVALUATION);
    }
}
