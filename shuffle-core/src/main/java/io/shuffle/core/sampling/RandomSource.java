package io.shuffle.core.sampling;

/// Source of uniformly distributed values for route selection.
///
/// Injected into the {@link Sampler} so tests can supply deterministic draws.
///
/// @see DefaultRandomSource for the production source
/// @see SeededRandomSource for reproducible sequences
@FunctionalInterface
public interface RandomSource {

    /// Draws a uniformly distributed value.
    ///
    /// @param min inclusive lower bound
    /// @param max exclusive upper bound, greater than `min`
    /// @return value in `[min, max)`
    double uniform(double min, double max);
}
