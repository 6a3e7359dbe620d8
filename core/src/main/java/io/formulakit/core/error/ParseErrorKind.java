package io.formulakit.core.error;

/** Classification of grammar violations reported by {@link FormulaParseException}. */
public enum ParseErrorKind {
    /** A character that cannot start or continue the current construct. */
    UNEXPECTED_CHARACTER,
    /** Input ended where an operand or statement was required. */
    UNEXPECTED_END,
    /** A {@code (} group without its closing {@code )}. */
    UNTERMINATED_PARENTHESIS,
    /** A {@code ?} without the matching {@code :}. */
    UNTERMINATED_TERNARY,
    /** A function argument list without its closing {@code )}. */
    UNTERMINATED_FUNCTION_CALL,
    /** A <code>{</code> block without its closing <code>}</code>. */
    UNTERMINATED_BLOCK,
    /** A call to a function name (or arity) that no function table knows. */
    UNKNOWN_FUNCTION,
    /** A keyword construct missing a required token, e.g. {@code (} after {@code if}. */
    EXPECTED_TOKEN,
    /** A numeric literal that does not parse, e.g. {@code 1.2.3}. */
    INVALID_NUMBER,
    /** Parentheses, blocks or unary operators nested deeper than the parser can follow. */
    NESTING_TOO_DEEP
}
