package io.shuffle.core;

import io.shuffle.core.dispatch.DispatchEngine;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/// Configuration options for a Shuffle dispatch engine.
///
/// Use the {@link Builder} for fluent configuration, setters for mutable
/// configuration, or {@link #fromProperties(Properties)} to read it from
/// host-provided properties.
///
/// ### Default Values
/// - `randomSeed`: `null` (draw from the process-wide generator)
/// - `unsetOverrideSentinels`: `{"none"}`
///
/// ### Property Keys
/// - `shuffle.random.seed` - long seed for reproducible draws
/// - `shuffle.override.sentinels` - comma separated override values meaning "not set"
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ShuffleFactory};
/// do not modify after the engine is created.
///
/// @see ShuffleFactory#createEngine(ShuffleConfig)
public class ShuffleConfig {

    /// Property key of the random seed.
    public static final String RANDOM_SEED_PROPERTY = "shuffle.random.seed";

    /// Property key of the override sentinels.
    public static final String OVERRIDE_SENTINELS_PROPERTY = "shuffle.override.sentinels";

    private Long randomSeed;
    private Set<String> unsetOverrideSentinels = DispatchEngine.DEFAULT_UNSET_SENTINELS;

    /// Creates a configuration with default values.
    public ShuffleConfig() {}

    /// Returns the seed for reproducible draws.
    ///
    /// @return the seed, or null to use the process-wide generator
    public Long getRandomSeed() {
        return randomSeed;
    }

    /// Sets the seed for reproducible draws.
    ///
    /// @param randomSeed the seed, null for unseeded draws
    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    /// Returns the override values treated as "not set".
    ///
    /// @return sentinel values, never null
    public Set<String> getUnsetOverrideSentinels() {
        return unsetOverrideSentinels;
    }

    /// Sets the override values treated as "not set".
    ///
    /// @param unsetOverrideSentinels sentinel values, not null (may be empty)
    public void setUnsetOverrideSentinels(Set<String> unsetOverrideSentinels) {
        this.unsetOverrideSentinels = Set.copyOf(unsetOverrideSentinels);
    }

    /// Reads a configuration from properties, keeping defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if `shuffle.random.seed` is not a long
    public static ShuffleConfig fromProperties(Properties properties) {
        ShuffleConfig config = new ShuffleConfig();

        String seed = properties.getProperty(RANDOM_SEED_PROPERTY);
        if (seed != null && !seed.isBlank()) {
            try {
                config.setRandomSeed(Long.parseLong(seed.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + RANDOM_SEED_PROPERTY + ": " + seed, e);
            }
        }

        String sentinels = properties.getProperty(OVERRIDE_SENTINELS_PROPERTY);
        if (sentinels != null) {
            config.setUnsetOverrideSentinels(
                    Arrays.stream(sentinels.split(","))
                            .map(String::strip)
                            .filter(s -> !s.isEmpty())
                            .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        return config;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ShuffleConfig} instances.
    public static class Builder {
        private final ShuffleConfig config = new ShuffleConfig();

        /// Sets the seed for reproducible draws.
        ///
        /// @param randomSeed the seed, null for unseeded draws
        /// @return this builder for chaining, never null
        public Builder randomSeed(Long randomSeed) {
            config.randomSeed = randomSeed;
            return this;
        }

        /// Sets the override values treated as "not set".
        ///
        /// @param sentinels sentinel values, not null
        /// @return this builder for chaining, never null
        public Builder unsetOverrideSentinels(Set<String> sentinels) {
            config.setUnsetOverrideSentinels(sentinels);
            return this;
        }

        /// Builds and returns the configured {@link ShuffleConfig} instance.
        ///
        /// @return the configured instance, never null
        public ShuffleConfig build() {
            return config;
        }
    }
}
