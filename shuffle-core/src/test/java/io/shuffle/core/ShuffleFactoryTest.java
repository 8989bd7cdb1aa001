package io.shuffle.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.shuffle.core.dispatch.DispatchEngine;
import io.shuffle.core.dispatch.EvaluationContext;
import io.shuffle.core.route.RouterConfig;
import io.shuffle.core.sampling.DefaultRandomSource;
import io.shuffle.core.sampling.SeededRandomSource;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ShuffleFactoryTest {

    private static final RouterConfig ROUTES =
            RouterConfig.builder().route("A", 25).route("B", 25).route("C", 50).build();

    @Test
    void shouldUseProcessWideSourceWithoutSeed() {
        assertThat(ShuffleFactory.createRandomSource(new ShuffleConfig()))
                .isSameAs(DefaultRandomSource.INSTANCE);
    }

    @Test
    void shouldUseSeededSourceWithSeed() {
        ShuffleConfig config = ShuffleConfig.builder().randomSeed(9L).build();

        assertThat(ShuffleFactory.createRandomSource(config))
                .isInstanceOfSatisfying(
                        SeededRandomSource.class, s -> assertThat(s.getSeed()).isEqualTo(9L));
    }

    @Test
    void shouldReplaySelectionsForSameSeed() {
        // Given
        ShuffleConfig config = ShuffleConfig.builder().randomSeed(5L).build();
        DispatchEngine first = ShuffleFactory.createEngine(config);
        DispatchEngine second = ShuffleFactory.createEngine(config);

        // Then
        for (int i = 0; i < 100; i++) {
            assertThat(first.resolve(EvaluationContext.open(ROUTES)))
                    .isEqualTo(second.resolve(EvaluationContext.open(ROUTES)));
        }
    }

    @Test
    void shouldApplyConfiguredSentinels() {
        // Given
        DispatchEngine engine =
                ShuffleFactory.createEngine(
                        ShuffleConfig.builder().unsetOverrideSentinels(Set.of("skip")).build());
        RouterConfig config = RouterConfig.builder().route("A", 100, "skip").build();

        // Then
        assertThat(engine.getRouteOutput(EvaluationContext.open(config), "A", "in").payload())
                .isEqualTo("in");
    }

    @Test
    void shouldCreateEngineFromProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(ShuffleConfig.RANDOM_SEED_PROPERTY, "11");

        // When
        DispatchEngine engine = ShuffleFactory.createEngine(properties);

        // Then
        assertThat(engine.resolve(EvaluationContext.open(ROUTES)).hasSelection()).isTrue();
    }
}
