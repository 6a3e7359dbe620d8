package io.formulakit.core.parser;

/**
 * Location details for a parse failure: 1-based line and column, the text of the offending line
 * and a caret pointer under the failing column.
 */
record ErrorContext(int line, int column, String lineText, String pointer) {

    static ErrorContext at(String expression, int offset) {
        if (expression.isEmpty()) {
            return new ErrorContext(1, 1, "", "^");
        }
        int position = Math.max(0, Math.min(offset, expression.length() - 1));

        int line = 1;
        int column = 1;
        for (int i = 0; i < position; i++) {
            char c = expression.charAt(i);
            if (c == '\n') {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
        }

        int start = position;
        while (start > 0 && !isLineBreak(expression.charAt(start - 1))) {
            start--;
        }
        int end = position;
        while (end < expression.length() && !isLineBreak(expression.charAt(end))) {
            end++;
        }
        String lineText = expression.substring(start, end);

        int maxColumn = lineText.isEmpty() ? 1 : lineText.length() + 1;
        int pointerColumn = Math.max(1, Math.min(column, maxColumn));
        return new ErrorContext(line, column, lineText, " ".repeat(pointerColumn - 1) + "^");
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
