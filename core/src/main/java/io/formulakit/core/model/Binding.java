package io.formulakit.core.model;

import java.util.Objects;

/**
 * A single {@code name = value} input for the varargs runner entry point.
 *
 * @see io.formulakit.core.engine.FormulaRunner#evaluate(String, Binding...)
 */
public record Binding(String name, double value) {

    public Binding {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Binding of(String name, double value) {
        return new Binding(name, value);
    }
}
