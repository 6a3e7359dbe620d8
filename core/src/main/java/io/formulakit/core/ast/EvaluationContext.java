package io.formulakit.core.ast;

import io.formulakit.core.error.MissingVariableException;
import io.formulakit.core.spi.RandomProvider;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable name-to-value bindings for one evaluation. Holds the caller's inputs and, while the
 * evaluation runs, every {@code let}-declared or assigned local.
 *
 * <p>
 * NOT thread-safe. A context belongs to exactly one evaluation at a time; runners that pool
 * contexts hand each one out exclusively and {@link #reset} it between calls.
 */
public final class EvaluationContext {

    private final Map<String, Double> bindings;
    private RandomProvider randomOverride;

    /** Creates an empty context. */
    public EvaluationContext() {
        this.bindings = new HashMap<>();
    }

    /**
     * Creates a context holding a copy of {@code inputs}. Later changes to either side are not
     * visible to the other.
     *
     * @throws NullPointerException if inputs, any key or any value is null
     */
    public EvaluationContext(Map<String, Double> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        this.bindings = new HashMap<>(Math.max(16, inputs.size() * 2));
        inputs.forEach((name, value) -> {
            Objects.requireNonNull(value, () -> "value for '" + name + "' must not be null");
            set(name, value.doubleValue());
        });
    }

    /**
     * Returns the value bound to {@code name}.
     *
     * @throws MissingVariableException if nothing is bound under this name
     */
    public double get(String name) {
        Double value = bindings.get(name);
        if (value == null) {
            throw new MissingVariableException(name);
        }
        return value;
    }

    public double getOrDefault(String name, double defaultValue) {
        Double value = bindings.get(name);
        return value != null ? value : defaultValue;
    }

    /** Binds {@code name} to {@code value}, replacing any previous binding. */
    public EvaluationContext set(String name, double value) {
        Objects.requireNonNull(name, "name must not be null");
        bindings.put(name, value);
        return this;
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public int size() {
        return bindings.size();
    }

    /** Removes every binding and the random override. */
    public void clear() {
        bindings.clear();
        randomOverride = null;
    }

    /**
     * Prepares a pooled context for reuse: drops every binding and the random override, then binds
     * each of {@code seeded} to {@code 0}.
     *
     * @param seeded names to pre-bind, typically the formula's required inputs
     */
    public void reset(Iterable<String> seeded) {
        clear();
        for (String name : seeded) {
            bindings.put(name, 0.0);
        }
    }

    /**
     * Replaces the random source for this evaluation only. Random intrinsics fall back to the
     * provider bound at parse time when no override is set.
     */
    public EvaluationContext withRandom(RandomProvider provider) {
        this.randomOverride = provider;
        return this;
    }

    /** Returns the override if one is set, otherwise {@code fallback}. */
    public RandomProvider random(RandomProvider fallback) {
        return randomOverride != null ? randomOverride : fallback;
    }

    /** An immutable copy of the current bindings. */
    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(bindings));
    }

    @Override
    public String toString() {
        return "EvaluationContext" + bindings;
    }
}
