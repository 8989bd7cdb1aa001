package io.shuffle.core.sampling;

import java.util.concurrent.ThreadLocalRandom;

/// Process-wide uniform generator backed by {@link ThreadLocalRandom}.
///
/// @implNote Thread-safe. Each calling thread draws from its own generator.
public final class DefaultRandomSource implements RandomSource {

    /// Shared instance; the class holds no state of its own.
    public static final DefaultRandomSource INSTANCE = new DefaultRandomSource();

    private DefaultRandomSource() {}

    @Override
    public double uniform(double min, double max) {
        return ThreadLocalRandom.current().nextDouble(min, max);
    }
}
