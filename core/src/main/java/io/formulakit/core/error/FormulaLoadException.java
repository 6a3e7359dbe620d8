package io.formulakit.core.error;

/**
 * Abstract parent for load-time errors: an expression that does not parse, or a catalog document
 * that cannot be read. Carries a {@code source} field identifying the text or file that caused the
 * error.
 */
public abstract class FormulaLoadException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected FormulaLoadException(String message, String formulaId, String source) {
        super(message, formulaId, Phase.LOAD);
        this.source = source;
    }

    protected FormulaLoadException(String message, Throwable cause, String formulaId, String source) {
        super(message, cause, formulaId, Phase.LOAD);
        this.source = source;
    }

    /** The expression text, file path or resource name that caused the error. */
    public String source() {
        return source;
    }
}
