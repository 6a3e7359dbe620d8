package io.formulakit.core.error;

/** Thrown when a formula identifier is looked up but nothing is registered under it. */
public final class FormulaNotFoundException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    public FormulaNotFoundException(String formulaId) {
        super("Formula '" + formulaId + "' not found", formulaId);
    }

    /** The message already names the formula. */
    @Override
    public String detail() {
        return getMessage();
    }
}
