package io.shuffle.core.sampling;

import java.util.Random;

/// Uniform generator with a fixed seed, for reproducible routing runs.
///
/// @implNote Thread-safe, but the sequence is only reproducible when a single
/// thread draws from the instance.
public final class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    /// Creates a generator that replays the same sequence for the same seed.
    ///
    /// @param seed initial seed
    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    /// Returns the seed this generator was created with.
    ///
    /// @return initial seed
    public long getSeed() {
        return seed;
    }
}
