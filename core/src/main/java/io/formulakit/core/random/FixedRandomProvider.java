package io.formulakit.core.random;

import io.formulakit.core.spi.RandomProvider;

/**
 * Test provider that always yields the same fraction: {@code nextDouble()} returns it as-is and
 * the bounded variants scale it by {@code max}. Immutable and thread-safe.
 */
public final class FixedRandomProvider implements RandomProvider {

    private final double value;

    /** Creates a provider fixed at {@code 0.5}. */
    public FixedRandomProvider() {
        this(0.5);
    }

    /**
     * @param value the fraction to return, in {@code [0, 1)}
     * @throws IllegalArgumentException if {@code value} is outside {@code [0, 1)}
     */
    public FixedRandomProvider(double value) {
        if (!(value >= 0 && value < 1)) {
            throw new IllegalArgumentException("value must be in [0, 1), got: " + value);
        }
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public double nextDouble() {
        return value;
    }

    @Override
    public double nextDouble(double max) {
        if (!(max > 0)) {
            return 0;
        }
        return value * max;
    }

    @Override
    public int nextInt(int max) {
        if (max <= 0) {
            return 0;
        }
        return (int) (value * max);
    }
}
