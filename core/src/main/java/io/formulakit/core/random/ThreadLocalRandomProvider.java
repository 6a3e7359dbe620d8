package io.formulakit.core.random;

import io.formulakit.core.spi.RandomProvider;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Default provider backed by {@link ThreadLocalRandom}. Every calling thread draws from its own
 * generator, so concurrent evaluations never contend on shared state.
 */
public final class ThreadLocalRandomProvider implements RandomProvider {

    /** Shared instance; the provider itself holds no state. */
    public static final ThreadLocalRandomProvider INSTANCE = new ThreadLocalRandomProvider();

    private ThreadLocalRandomProvider() {}

    @Override
    public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }

    @Override
    public double nextDouble(double max) {
        if (!(max > 0)) {
            return 0;
        }
        return ThreadLocalRandom.current().nextDouble() * max;
    }

    @Override
    public int nextInt(int max) {
        if (max <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextInt(max);
    }
}
