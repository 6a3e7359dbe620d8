package io.formulakit.core.error;

/** Thrown when a formula reads a variable that is neither supplied by the caller nor assigned locally. */
public final class MissingVariableException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    private final String variableName;

    public MissingVariableException(String variableName) {
        this(variableName, null);
    }

    public MissingVariableException(String variableName, String formulaId) {
        super("Variable '" + variableName + "' not found in inputs", formulaId);
        this.variableName = variableName;
    }

    /** The name of the variable that could not be resolved. */
    public String variableName() {
        return variableName;
    }

    /** Returns a copy of this exception attributed to the given formula. */
    public MissingVariableException withFormulaId(String formulaId) {
        MissingVariableException copy = new MissingVariableException(variableName, formulaId);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
