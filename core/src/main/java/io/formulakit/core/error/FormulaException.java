package io.formulakit.core.error;

/**
 * Abstract base for all formulakit exceptions. Never thrown directly; use the concrete subclasses
 * under {@link FormulaLoadException} or {@link FormulaEvalException}.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String formulaId;
    private final Phase phase;

    protected FormulaException(String message, String formulaId, Phase phase) {
        super(message);
        this.formulaId = formulaId;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, String formulaId, Phase phase) {
        super(message, cause);
        this.formulaId = formulaId;
        this.phase = phase;
    }

    /** The formula identifier that triggered the error, or {@code null} if not known. */
    public String formulaId() {
        return formulaId;
    }

    /**
     * The message prefixed with the formula it concerns, e.g. {@code Formula 'damage': Variable
     * 'strength' not found in inputs}. Without a formula id this is just {@link #getMessage()}.
     */
    public String detail() {
        return formulaId == null ? getMessage() : "Formula '" + formulaId + "': " + getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
