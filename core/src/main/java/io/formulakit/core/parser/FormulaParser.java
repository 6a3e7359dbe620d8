package io.formulakit.core.parser;

import io.formulakit.core.ast.ArithmeticOperator;
import io.formulakit.core.ast.AssignmentOperator;
import io.formulakit.core.ast.ComparisonOperator;
import io.formulakit.core.ast.FormulaNode;
import io.formulakit.core.ast.MathFunction;
import io.formulakit.core.ast.MultiArgFunction;
import io.formulakit.core.error.FormulaParseException;
import io.formulakit.core.error.ParseErrorKind;
import io.formulakit.core.model.Formula;
import io.formulakit.core.random.ThreadLocalRandomProvider;
import io.formulakit.core.spi.RandomProvider;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser turning formula source text into a {@link Formula}.
 *
 * <p>
 * Grammar, lowest precedence first:
 *
 * <pre>
 * statements  := statement ((';' | newline) statement)*
 * statement   := 'let' ident ('=' expression)?
 *              | 'if' '(' expression ')' statement ('else' statement)?
 *              | '{' statements '}'
 *              | ident ('=' | '+=' | '-=' | '*=' | '/=') expression
 *              | expression
 * expression  := or ('?' or ':' expression)?
 * or          := and ('||' and)*
 * and         := comparison ('&amp;&amp;' comparison)*
 * comparison  := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=' | '==' | '!=') additive)?
 * additive    := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := power (('*' | '/' | '%') power)*
 * power       := unary ('^' power)?
 * unary       := ('-' | '+' | '!') unary | primary
 * primary     := '(' expression ')' | number | ident | ident '(' arguments? ')'
 * </pre>
 *
 * Within an expression only spaces and tabs separate tokens; a newline ends the current statement.
 *
 * <p>
 * While parsing, every identifier read as a value is classified: it is a required input unless a
 * {@code let} or an assignment has already made it local. The classification is flat per formula,
 * so a name made local inside a block stays local for the rest of the formula.
 *
 * <p>
 * Thread-safe: each {@link #parse} call works on its own cursor. Random intrinsics bind to the
 * provider given at construction.
 */
public final class FormulaParser {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaParser.class);

    /**
     * Maximum syntax tree depth: statements, parentheses, unary operators and every binary operator
     * in a chain each add a level.
     */
    public static final int MAX_NESTING_DEPTH = 1000;

    private final RandomProvider randomProvider;

    /** Creates a parser whose random intrinsics use {@link ThreadLocalRandomProvider}. */
    public FormulaParser() {
        this(ThreadLocalRandomProvider.INSTANCE);
    }

    public FormulaParser(RandomProvider randomProvider) {
        this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider must not be null");
    }

    public RandomProvider randomProvider() {
        return randomProvider;
    }

    /**
     * Parses an expression. Empty or whitespace-only text yields a formula evaluating to {@code 0}.
     *
     * @param expression the formula source text
     * @return the parsed formula
     * @throws FormulaParseException if the text violates the grammar
     */
    public Formula parse(String expression) {
        return parse(null, expression);
    }

    /**
     * Parses an expression on behalf of a named formula; the id is attached to any {@link
     * FormulaParseException} thrown.
     */
    public Formula parse(String formulaId, String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        try {
            return new Cursor(formulaId, expression).parseFormula();
        } catch (FormulaParseException e) {
            LOG.debug("Formula parse failed: id={}\n{}", formulaId, e.getMessage());
            throw e;
        }
    }

    private final class Cursor {

        private final String formulaId;
        private final String text;
        private final Set<String> inputs = new LinkedHashSet<>();
        private final Set<String> locals = new LinkedHashSet<>();
        private int pos;
        private int depth;

        Cursor(String formulaId, String text) {
            this.formulaId = formulaId;
            this.text = text;
        }

        Formula parseFormula() {
            List<FormulaNode> statements = new ArrayList<>();
            skipWhitespaceAndNewlines();
            while (!atEnd()) {
                statements.add(parseStatement());
                skipStatementSeparator();
            }
            return new Formula(text, collapse(statements), inputs, locals);
        }

        // ── Statements ──

        private FormulaNode parseStatement() {
            enter();
            try {
                skipWhitespaceAndNewlines();
                if (atEnd()) {
                    throw fail(ParseErrorKind.EXPECTED_TOKEN, "Expected a statement");
                }
                String word = peekWord();
                if (word.equals("let")) {
                    return parseDeclaration();
                }
                if (word.equals("if")) {
                    return parseIf();
                }
                if (peek() == '{') {
                    return parseBlock();
                }
                return parseAssignmentOrExpression();
            } finally {
                depth--;
            }
        }

        private FormulaNode parseDeclaration() {
            consumeWord("let");
            skipWhitespace();
            if (!isIdentifierStart(peek())) {
                throw fail(ParseErrorKind.EXPECTED_TOKEN, "Expected variable name after 'let'");
            }
            String name = parseIdentifier();
            // local before the initializer, so 'let x = x + 1' does not require x as an input
            locals.add(name);
            skipWhitespace();
            FormulaNode initializer = null;
            if (peek() == '=' && peekNext() != '=') {
                pos++;
                skipWhitespace();
                initializer = parseExpression();
            }
            return new FormulaNode.Declaration(name, initializer);
        }

        private FormulaNode parseIf() {
            consumeWord("if");
            skipWhitespace();
            expect('(', ParseErrorKind.EXPECTED_TOKEN, "Expected '(' after 'if'");
            skipWhitespace();
            FormulaNode condition = parseExpression();
            skipWhitespace();
            expect(')', ParseErrorKind.EXPECTED_TOKEN, "Expected ')' after if condition");
            skipWhitespace();
            FormulaNode thenBranch = parseStatement();

            int afterThen = pos;
            skipWhitespaceAndNewlines();
            if (peekWord().equals("else")) {
                consumeWord("else");
                skipWhitespace();
                FormulaNode elseBranch = parseStatement();
                return new FormulaNode.Conditional(condition, thenBranch, elseBranch);
            }
            pos = afterThen;
            return new FormulaNode.Conditional(condition, thenBranch, null);
        }

        private FormulaNode parseBlock() {
            int open = pos;
            pos++; // '{'
            List<FormulaNode> statements = new ArrayList<>();
            skipWhitespaceAndNewlines();
            while (!atEnd() && peek() != '}') {
                statements.add(parseStatement());
                skipStatementSeparator();
            }
            if (atEnd()) {
                throw fail(ParseErrorKind.UNTERMINATED_BLOCK, "Expected '}' to close block opened at offset " + open);
            }
            pos++; // '}'
            return collapse(statements);
        }

        private FormulaNode parseAssignmentOrExpression() {
            if (!isIdentifierStart(peek())) {
                return parseExpression();
            }
            int start = pos;
            String name = parseIdentifier();
            skipWhitespace();
            AssignmentOperator operator = matchAssignmentOperator();
            if (operator == null) {
                pos = start;
                return parseExpression();
            }
            skipWhitespace();
            FormulaNode value = parseExpression();
            locals.add(name);
            return new FormulaNode.Assignment(name, operator, value);
        }

        private AssignmentOperator matchAssignmentOperator() {
            char c = peek();
            char next = peekNext();
            if (c == '=' && next != '=') {
                pos++;
                return AssignmentOperator.ASSIGN;
            }
            if (next != '=') {
                return null;
            }
            AssignmentOperator operator =
                    switch (c) {
                        case '+' -> AssignmentOperator.ADD;
                        case '-' -> AssignmentOperator.SUBTRACT;
                        case '*' -> AssignmentOperator.MULTIPLY;
                        case '/' -> AssignmentOperator.DIVIDE;
                        default -> null;
                    };
            if (operator != null) {
                pos += 2;
            }
            return operator;
        }

        // ── Expressions ──

        private FormulaNode parseExpression() {
            return parseTernary();
        }

        private FormulaNode parseTernary() {
            enter();
            try {
                FormulaNode condition = parseOr();
                skipWhitespace();
                if (peek() != '?') {
                    return condition;
                }
                pos++;
                skipWhitespace();
                FormulaNode whenTrue = parseOr();
                skipWhitespace();
                if (peek() != ':') {
                    throw fail(ParseErrorKind.UNTERMINATED_TERNARY, "Expected ':' in ternary operator");
                }
                pos++;
                skipWhitespace();
                FormulaNode whenFalse = parseTernary();
                return new FormulaNode.Ternary(condition, whenTrue, whenFalse);
            } finally {
                depth--;
            }
        }

        private FormulaNode parseOr() {
            int entered = depth;
            try {
                FormulaNode node = parseAnd();
                skipWhitespace();
                while (peek() == '|' && peekNext() == '|') {
                    enter();
                    pos += 2;
                    skipWhitespace();
                    node = new FormulaNode.Or(node, parseAnd());
                    skipWhitespace();
                }
                return node;
            } finally {
                depth = entered;
            }
        }

        private FormulaNode parseAnd() {
            int entered = depth;
            try {
                FormulaNode node = parseComparison();
                skipWhitespace();
                while (peek() == '&' && peekNext() == '&') {
                    enter();
                    pos += 2;
                    skipWhitespace();
                    node = new FormulaNode.And(node, parseComparison());
                    skipWhitespace();
                }
                return node;
            } finally {
                depth = entered;
            }
        }

        private FormulaNode parseComparison() {
            FormulaNode left = parseAdditive();
            skipWhitespace();
            ComparisonOperator operator = matchComparisonOperator();
            if (operator == null) {
                return left;
            }
            skipWhitespace();
            return new FormulaNode.Comparison(operator, left, parseAdditive());
        }

        private ComparisonOperator matchComparisonOperator() {
            char c = peek();
            boolean orEqual = peekNext() == '=';
            ComparisonOperator operator;
            if (c == '<') {
                operator = orEqual ? ComparisonOperator.LESS_EQUAL : ComparisonOperator.LESS;
            } else if (c == '>') {
                operator = orEqual ? ComparisonOperator.GREATER_EQUAL : ComparisonOperator.GREATER;
            } else if (c == '=' && orEqual) {
                operator = ComparisonOperator.EQUAL;
            } else if (c == '!' && orEqual) {
                operator = ComparisonOperator.NOT_EQUAL;
            } else {
                return null;
            }
            pos += operator.symbol().length();
            return operator;
        }

        private FormulaNode parseAdditive() {
            int entered = depth;
            try {
                FormulaNode node = parseMultiplicative();
                skipWhitespace();
                while ((peek() == '+' || peek() == '-') && peekNext() != '=') {
                    enter();
                    ArithmeticOperator operator =
                            peek() == '+' ? ArithmeticOperator.ADD : ArithmeticOperator.SUBTRACT;
                    pos++;
                    skipWhitespace();
                    node = new FormulaNode.BinaryOp(operator, node, parseMultiplicative());
                    skipWhitespace();
                }
                return node;
            } finally {
                depth = entered;
            }
        }

        private FormulaNode parseMultiplicative() {
            int entered = depth;
            try {
                FormulaNode node = parsePower();
                skipWhitespace();
                while (true) {
                    char c = peek();
                    if (c == '%') {
                        enter();
                        pos++;
                        skipWhitespace();
                        node = new FormulaNode.Modulo(node, parsePower());
                    } else if ((c == '*' || c == '/') && peekNext() != '=') {
                        enter();
                        ArithmeticOperator operator =
                                c == '*' ? ArithmeticOperator.MULTIPLY : ArithmeticOperator.DIVIDE;
                        pos++;
                        skipWhitespace();
                        node = new FormulaNode.BinaryOp(operator, node, parsePower());
                    } else {
                        return node;
                    }
                    skipWhitespace();
                }
            } finally {
                depth = entered;
            }
        }

        private FormulaNode parsePower() {
            enter();
            try {
                FormulaNode base = parseUnary();
                skipWhitespace();
                if (peek() != '^') {
                    return base;
                }
                pos++;
                skipWhitespace();
                return new FormulaNode.BinaryOp(ArithmeticOperator.POWER, base, parsePower());
            } finally {
                depth--;
            }
        }

        private FormulaNode parseUnary() {
            enter();
            try {
                skipWhitespace();
                char c = peek();
                if (c == '-' || c == '+' || c == '!') {
                    pos++;
                    skipWhitespace();
                    FormulaNode operand = parseUnary();
                    return switch (c) {
                        case '-' -> new FormulaNode.UnaryOp(FormulaNode.UnaryOp.Sign.MINUS, operand);
                        case '+' -> new FormulaNode.UnaryOp(FormulaNode.UnaryOp.Sign.PLUS, operand);
                        default -> new FormulaNode.Not(operand);
                    };
                }
                return parsePrimary();
            } finally {
                depth--;
            }
        }

        private FormulaNode parsePrimary() {
            skipWhitespace();
            char c = peek();
            if (c == '(') {
                int open = pos;
                pos++;
                skipWhitespace();
                FormulaNode inner = parseExpression();
                skipWhitespace();
                if (peek() != ')') {
                    throw fail(
                            ParseErrorKind.UNTERMINATED_PARENTHESIS,
                            "Expected ')' to close parenthesis opened at offset " + open);
                }
                pos++;
                return inner;
            }
            if (isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (isIdentifierStart(c)) {
                int start = pos;
                String name = parseIdentifier();
                skipWhitespace();
                if (peek() == '(') {
                    return parseFunctionCall(name, start);
                }
                if (!locals.contains(name)) {
                    inputs.add(name);
                }
                return new FormulaNode.Variable(name);
            }
            if (atEnd()) {
                throw fail(ParseErrorKind.UNEXPECTED_END, "Unexpected end of expression");
            }
            throw fail(ParseErrorKind.UNEXPECTED_CHARACTER, "Unexpected character '" + printable(c) + "'");
        }

        private FormulaNode parseNumber() {
            int start = pos;
            while (isDigit(peek()) || peek() == '.') {
                pos++;
            }
            String literal = text.substring(start, pos);
            try {
                return new FormulaNode.Constant(Double.parseDouble(literal));
            } catch (NumberFormatException e) {
                pos = start;
                throw fail(ParseErrorKind.INVALID_NUMBER, "Invalid number '" + literal + "'", e);
            }
        }

        private FormulaNode parseFunctionCall(String name, int nameOffset) {
            pos++; // '('
            skipWhitespace();
            List<FormulaNode> arguments = new ArrayList<>();
            if (peek() != ')') {
                arguments.add(parseExpression());
                skipWhitespace();
                while (peek() == ',') {
                    pos++;
                    skipWhitespace();
                    arguments.add(parseExpression());
                    skipWhitespace();
                }
            }
            if (peek() != ')') {
                throw fail(
                        ParseErrorKind.UNTERMINATED_FUNCTION_CALL, "Expected ')' to close call to '" + name + "'");
            }
            pos++;
            return resolveFunction(name, arguments, nameOffset);
        }

        private FormulaNode resolveFunction(String name, List<FormulaNode> arguments, int nameOffset) {
            Optional<MathFunction> unary = MathFunction.byName(name);
            if (unary.isPresent() && arguments.size() == 1) {
                return new FormulaNode.FunctionCall(unary.get(), arguments.get(0));
            }
            Optional<MultiArgFunction> multi = MultiArgFunction.byName(name);
            if (multi.isPresent()) {
                return new FormulaNode.MultiArgFunctionCall(multi.get(), arguments);
            }
            if (name.equals("rand") && arguments.size() == 1) {
                return new FormulaNode.RandomInt(arguments.get(0), randomProvider);
            }
            if (name.equals("randf") && arguments.size() == 1) {
                return new FormulaNode.RandomFloat(arguments.get(0), randomProvider);
            }
            if (name.equals("random") && arguments.isEmpty()) {
                return new FormulaNode.RandomValue(randomProvider);
            }
            pos = nameOffset;
            throw fail(
                    ParseErrorKind.UNKNOWN_FUNCTION,
                    "Unknown function '" + name + "' with " + arguments.size() + " argument(s)");
        }

        // ── Lexical helpers ──

        private String parseIdentifier() {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                pos++;
            }
            return text.substring(start, pos);
        }

        private String peekWord() {
            int saved = pos;
            skipWhitespace();
            String word = Character.isLetter(peek()) ? parseIdentifier() : "";
            pos = saved;
            return word;
        }

        private void consumeWord(String expected) {
            skipWhitespace();
            String word = parseIdentifier();
            if (!word.equals(expected)) {
                throw fail(ParseErrorKind.EXPECTED_TOKEN, "Expected '" + expected + "' but got '" + word + "'");
            }
        }

        private void expect(char c, ParseErrorKind kind, String reason) {
            if (peek() != c) {
                throw fail(kind, reason);
            }
            pos++;
        }

        private void skipStatementSeparator() {
            skipWhitespaceAndNewlines();
            if (peek() == ';') {
                pos++;
                skipWhitespaceAndNewlines();
            }
        }

        private void skipWhitespace() {
            while (!atEnd() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
                pos++;
            }
        }

        private void skipWhitespaceAndNewlines() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private char peek() {
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        private char peekNext() {
            return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
        }

        private void enter() {
            if (++depth > MAX_NESTING_DEPTH) {
                throw fail(
                        ParseErrorKind.NESTING_TOO_DEEP,
                        "Expression nested deeper than " + MAX_NESTING_DEPTH + " levels");
            }
        }

        private FormulaParseException fail(ParseErrorKind kind, String reason) {
            return fail(kind, reason, null);
        }

        private FormulaParseException fail(ParseErrorKind kind, String reason, Throwable cause) {
            ErrorContext context = ErrorContext.at(text, pos);
            return new FormulaParseException(
                    kind,
                    reason,
                    text,
                    pos,
                    context.line(),
                    context.column(),
                    context.lineText(),
                    context.pointer(),
                    formulaId,
                    cause);
        }
    }

    private static FormulaNode collapse(List<FormulaNode> statements) {
        return switch (statements.size()) {
            case 0 -> new FormulaNode.Empty();
            case 1 -> statements.get(0);
            default -> new FormulaNode.Sequence(statements);
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static String printable(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> String.valueOf(c);
        };
    }
}
