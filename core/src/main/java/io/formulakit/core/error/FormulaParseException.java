package io.formulakit.core.error;

/**
 * Thrown when an expression violates the formula grammar. Carries the error classification, the
 * character offset of the failure, the derived 1-based line and column, the offending line's text
 * and a caret pointer under the failing column.
 *
 * <p>{@link #getMessage()} renders all of it:
 *
 * <pre>
 * Parse error at line 1, column 3: Unexpected end of expression
 * a +
 *   ^
 * Expression:
 * a +
 * </pre>
 */
public final class FormulaParseException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    private final ParseErrorKind kind;
    private final String reason;
    private final int offset;
    private final int line;
    private final int column;
    private final String lineText;
    private final String pointer;

    public FormulaParseException(
            ParseErrorKind kind,
            String reason,
            String expression,
            int offset,
            int line,
            int column,
            String lineText,
            String pointer,
            String formulaId,
            Throwable cause) {
        super(render(reason, expression, line, column, lineText, pointer), cause, formulaId, expression);
        this.kind = kind;
        this.reason = reason;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.lineText = lineText;
        this.pointer = pointer;
    }

    public ParseErrorKind kind() {
        return kind;
    }

    /** The short description of the violation, without location context. */
    public String reason() {
        return reason;
    }

    /**
     * Zero-based character offset at which parsing stopped. Equals the expression length when the
     * input ended early; {@link #line()} and {@link #column()} then point at the last character.
     */
    public int offset() {
        return offset;
    }

    /** One-based line number. */
    public int line() {
        return line;
    }

    /** One-based column number. */
    public int column() {
        return column;
    }

    /** The full text of the line containing the error. */
    public String lineText() {
        return lineText;
    }

    /** Spaces followed by a single {@code ^} under the failing column. */
    public String pointer() {
        return pointer;
    }

    /** The expression that failed to parse. */
    public String expression() {
        return source();
    }

    /** Returns a copy of this exception attributed to the given formula. */
    public FormulaParseException withFormulaId(String formulaId) {
        FormulaParseException copy = new FormulaParseException(
                kind, reason, source(), offset, line, column, lineText, pointer, formulaId, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    private static String render(
            String reason, String expression, int line, int column, String lineText, String pointer) {
        StringBuilder sb = new StringBuilder();
        sb.append("Parse error at line ")
                .append(line)
                .append(", column ")
                .append(column)
                .append(": ")
                .append(reason);
        if (lineText != null && !lineText.isEmpty()) {
            sb.append('\n').append(lineText).append('\n').append(pointer);
        }
        sb.append("\nExpression:\n").append(expression);
        return sb.toString();
    }
}
