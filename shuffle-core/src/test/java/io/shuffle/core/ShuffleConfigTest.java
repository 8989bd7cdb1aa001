package io.shuffle.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ShuffleConfigTest {

    @Test
    void shouldUseDefaults() {
        ShuffleConfig config = new ShuffleConfig();

        assertThat(config.getRandomSeed()).isNull();
        assertThat(config.getUnsetOverrideSentinels()).containsExactly("none");
    }

    @Test
    void shouldBuildFluently() {
        ShuffleConfig config =
                ShuffleConfig.builder()
                        .randomSeed(42L)
                        .unsetOverrideSentinels(Set.of("null", "n/a"))
                        .build();

        assertThat(config.getRandomSeed()).isEqualTo(42L);
        assertThat(config.getUnsetOverrideSentinels()).containsExactlyInAnyOrder("null", "n/a");
    }

    @Test
    void shouldReadProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ShuffleConfig.RANDOM_SEED_PROPERTY, " 1234 ");
        properties.setProperty(ShuffleConfig.OVERRIDE_SENTINELS_PROPERTY, "none, null,,-");

        // When
        ShuffleConfig config = ShuffleConfig.fromProperties(properties);

        // Then
        assertThat(config.getRandomSeed()).isEqualTo(1234L);
        assertThat(config.getUnsetOverrideSentinels())
                .containsExactlyInAnyOrder("none", "null", "-");
    }

    @Test
    void shouldKeepDefaultsForAbsentProperties() {
        ShuffleConfig config = ShuffleConfig.fromProperties(new Properties());

        assertThat(config.getRandomSeed()).isNull();
        assertThat(config.getUnsetOverrideSentinels()).containsExactly("none");
    }

    @Test
    void shouldRejectInvalidSeed() {
        Properties properties = new Properties();
        properties.setProperty(ShuffleConfig.RANDOM_SEED_PROPERTY, "lucky");

        assertThatThrownBy(() -> ShuffleConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shuffle.random.seed");
    }
}
