package io.formulakit.core.error;

/** Thrown when a formula catalog document is missing, unreadable or not shaped as expected. */
public final class FormulaCatalogException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    public FormulaCatalogException(String message, String source) {
        super(message, null, source);
    }

    public FormulaCatalogException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
    }
}
