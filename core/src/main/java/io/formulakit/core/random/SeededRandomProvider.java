package io.formulakit.core.random;

import io.formulakit.core.spi.RandomProvider;
import java.util.Random;

/**
 * Deterministic provider: two instances created with the same seed produce the same sequence.
 * Thread-safe (backed by {@link Random}), but the sequence observed by each thread depends on
 * interleaving, so reproducibility holds only for single-threaded use.
 */
public final class SeededRandomProvider implements RandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /** The seed this provider was created with. */
    public long seed() {
        return seed;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public double nextDouble(double max) {
        if (!(max > 0)) {
            return 0;
        }
        return random.nextDouble() * max;
    }

    @Override
    public int nextInt(int max) {
        if (max <= 0) {
            return 0;
        }
        return random.nextInt(max);
    }
}
