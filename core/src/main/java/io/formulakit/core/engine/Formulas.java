package io.formulakit.core.engine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static entry point for one-off evaluations with transparent caching. Each distinct expression is
 * parsed once and kept in a process-wide registry, under either a caller-chosen cache id or the
 * SHA-256 of its text.
 *
 * <pre>
 * double damage = Formulas.run("baseDamage * (1 + strength * 0.1)")
 *         .set("baseDamage", 10)
 *         .set("strength", 5)
 *         .evaluate();
 * </pre>
 *
 * Evaluation failures are logged and yield {@code 0}; an unparsable expression throws {@link
 * io.formulakit.core.error.FormulaParseException}.
 */
public final class Formulas {

    private static final Object LOCK = new Object();
    private static final FormulaRegistry REGISTRY = new FormulaRegistry();
    private static final FormulaRunner RUNNER = new FormulaRunner(REGISTRY);

    private Formulas() {}

    /**
     * Starts a fluent request for {@code expression}.
     *
     * @throws IllegalArgumentException if expression is null or blank
     */
    public static Request run(String expression) {
        requireText(expression, "expression");
        return new Request(expression);
    }

    /** Evaluates {@code expression} against {@code inputs}, cached under the expression's hash. */
    public static double run(String expression, Map<String, Double> inputs) {
        return run(expression, inputs, null);
    }

    /**
     * Evaluates {@code expression} against {@code inputs}, cached under {@code cacheId}. A blank or
     * null cache id falls back to the expression's hash. A cache id already holding a different
     * expression is re-registered with the new one.
     *
     * @throws IllegalArgumentException if expression is null or blank
     * @throws io.formulakit.core.error.FormulaParseException if the expression violates the grammar
     */
    public static double run(String expression, Map<String, Double> inputs, String cacheId) {
        requireText(expression, "expression");
        Objects.requireNonNull(inputs, "inputs must not be null");
        String formulaId = ensureFormula(expression, cacheId);
        return RUNNER.evaluate(formulaId, inputs);
    }

    /** Removes every cached formula and pooled context. */
    public static void clearCache() {
        synchronized (LOCK) {
            REGISTRY.clear();
            RUNNER.clearPools();
        }
    }

    /** Cached expressions keyed by cache id. */
    public static Map<String, String> allFormulas() {
        synchronized (LOCK) {
            Map<String, String> formulas = new LinkedHashMap<>();
            for (String id : REGISTRY.ids()) {
                REGISTRY.expression(id).ifPresent(expression -> formulas.put(id, expression));
            }
            return formulas;
        }
    }

    /** Lowercase hex SHA-256 of the UTF-8 expression text. */
    static String cacheIdFor(String expression) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(expression.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String ensureFormula(String expression, String cacheId) {
        String formulaId = cacheId == null || cacheId.isBlank() ? cacheIdFor(expression) : cacheId;
        synchronized (LOCK) {
            boolean current =
                    REGISTRY.expression(formulaId).map(expression::equals).orElse(false);
            if (!current) {
                REGISTRY.registerOrThrow(formulaId, expression);
            }
        }
        return formulaId;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    /** Fluent builder collecting inputs for one evaluation. Not thread-safe. */
    public static final class Request {

        private final String expression;
        private final Map<String, Double> inputs = new HashMap<>();

        private Request(String expression) {
            this.expression = expression;
        }

        /**
         * Sets one input.
         *
         * @throws IllegalArgumentException if key is null or blank
         */
        public Request set(String key, double value) {
            requireText(key, "input key");
            inputs.put(key, value);
            return this;
        }

        /** Replaces all inputs with a copy of {@code values}. */
        public Request withInputs(Map<String, Double> values) {
            Objects.requireNonNull(values, "inputs must not be null");
            inputs.clear();
            inputs.putAll(values);
            return this;
        }

        /** Evaluates, caching the formula under the expression's hash. */
        public double evaluate() {
            return run(expression, inputs, null);
        }

        /**
         * Evaluates, caching the formula under {@code cacheId}.
         *
         * @throws IllegalArgumentException if cacheId is null or blank
         */
        public double withCache(String cacheId) {
            requireText(cacheId, "cache id");
            return run(expression, inputs, cacheId);
        }
    }
}
