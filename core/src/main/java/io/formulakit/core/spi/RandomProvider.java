package io.formulakit.core.spi;

/**
 * Source of randomness for the {@code random()}, {@code randf(max)} and {@code rand(max)}
 * intrinsics. Bound into the random nodes when a formula is parsed, and optionally overridden for a
 * single evaluation.
 *
 * <p>Implementations used by concurrent evaluations MUST be thread-safe.
 *
 * @see io.formulakit.core.random.ThreadLocalRandomProvider
 * @see io.formulakit.core.random.SeededRandomProvider
 * @see io.formulakit.core.random.FixedRandomProvider
 */
public interface RandomProvider {

    /**
     * Returns a uniformly distributed value in {@code [0, 1)}.
     *
     * @return the next value
     */
    double nextDouble();

    /**
     * Returns a uniformly distributed value in {@code [0, max)}.
     *
     * @param max exclusive upper bound
     * @return the next value, or {@code 0} when {@code max} is not positive
     */
    double nextDouble(double max);

    /**
     * Returns a uniformly distributed integer in {@code [0, max)}.
     *
     * @param max exclusive upper bound
     * @return the next value, or {@code 0} when {@code max} is not positive
     */
    int nextInt(int max);
}
