package io.shuffle.core;

import io.shuffle.core.dispatch.DispatchEngine;
import io.shuffle.core.sampling.DefaultRandomSource;
import io.shuffle.core.sampling.RandomSource;
import io.shuffle.core.sampling.Sampler;
import io.shuffle.core.sampling.SeededRandomSource;
import java.util.Properties;
import java.util.logging.Logger;

/// Factory for wiring {@link DispatchEngine} instances from configuration.
///
/// {@snippet :
/// DispatchEngine engine = ShuffleFactory.createEngine(
///     ShuffleConfig.builder().randomSeed(42L).build());
/// }
///
/// @see ShuffleConfig
public final class ShuffleFactory {

    private static final Logger logger = Logger.getLogger(ShuffleFactory.class.getName());

    private ShuffleFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine from the `shuffle.*` system properties.
    ///
    /// @return a configured engine, never null
    /// @throws IllegalArgumentException if a system property holds an invalid value
    public static DispatchEngine createEngine() {
        return createEngine(ShuffleConfig.fromProperties(System.getProperties()));
    }

    /// Creates an engine from explicit properties.
    ///
    /// @param properties source of `shuffle.*` keys, not null
    /// @return a configured engine, never null
    /// @throws IllegalArgumentException if a property holds an invalid value
    public static DispatchEngine createEngine(Properties properties) {
        return createEngine(ShuffleConfig.fromProperties(properties));
    }

    /// Creates an engine from a configuration.
    ///
    /// @param config engine options, not null
    /// @return a configured engine, never null
    public static DispatchEngine createEngine(ShuffleConfig config) {
        return new DispatchEngine(
                new Sampler(), createRandomSource(config), config.getUnsetOverrideSentinels());
    }

    /// Chooses the random source for a configuration.
    ///
    /// @param config engine options, not null
    /// @return seeded source when a seed is configured, the process-wide one otherwise
    static RandomSource createRandomSource(ShuffleConfig config) {
        if (config.getRandomSeed() != null) {
            logger.info("Using seeded random source: " + config.getRandomSeed());
            return new SeededRandomSource(config.getRandomSeed());
        }
        return DefaultRandomSource.INSTANCE;
    }
}
