package io.shuffle.core.route;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RouteTableTest {

    // -- Helpers --

    private static void assertEntries(RouteTable table, int[] indexes, double... weights) {
        assertThat(table.getEntries()).extracting(RouteEntry::routeIndex)
                .containsExactly(Arrays.stream(indexes).boxed().toArray(Integer[]::new));
        for (int i = 0; i < weights.length; i++) {
            assertThat(table.getEntries().get(i).normalizedWeight())
                    .isCloseTo(weights[i], within(1e-9));
        }
    }

    @Nested
    class NormalizationTest {

        @Test
        void shouldKeepWeightsThatAlreadySumToHundred() {
            // Given
            List<Route> routes = List.of(Route.of("A", 70), Route.of("B", 30));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertEntries(table, new int[] {0, 1}, 70.0, 30.0);
        }

        @Test
        void shouldRescaleWeightsThatSumBelowHundred() {
            // Given: 20 + 20 = 40
            List<Route> routes = List.of(Route.of("A", 20), Route.of("B", 20));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries()).extracting(RouteEntry::normalizedWeight)
                    .containsExactly(50.0, 50.0);
        }

        @Test
        void shouldRescaleWeightsThatSumAboveHundred() {
            // Given: 90 + 60 + 50 = 200
            List<Route> routes =
                    List.of(Route.of("A", 90), Route.of("B", 60), Route.of("C", 50));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertEntries(table, new int[] {0, 1, 2}, 45.0, 30.0, 25.0);
        }

        @Test
        void shouldDistributeEquallyWhenAllWeightsAreZero() {
            // Given
            List<Route> routes = List.of(Route.of("A", 0), Route.of("B", 0));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries())
                    .containsExactly(new RouteEntry(0, 50.0), new RouteEntry(1, 50.0));
        }

        @Test
        void shouldSumToHundredForArbitraryWeights() {
            // Given
            Random random = new Random(7);

            for (int run = 0; run < 200; run++) {
                List<Route> routes = new ArrayList<>();
                int count = 1 + random.nextInt(12);
                for (int i = 0; i < count; i++) {
                    routes.add(Route.of("R" + i, random.nextDouble() * 300 - 100));
                }

                // When
                RouteTable table = RouteTable.build(routes);

                // Then
                assertThat(table.totalWeight())
                        .isCloseTo(RouteTable.TOTAL_WEIGHT, within(RouteTable.TOLERANCE));
                assertThat(table.getEntries())
                        .allSatisfy(e -> assertThat(e.normalizedWeight()).isNotNegative());
            }
        }

        @Test
        void shouldPreserveConfigurationOrder() {
            // Given: descending weights must not be re-sorted
            List<Route> routes =
                    List.of(Route.of("small", 10), Route.of("large", 80), Route.of("mid", 10));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries()).extracting(RouteEntry::routeIndex)
                    .containsExactly(0, 1, 2);
        }

        @Test
        void shouldKeepDuplicateNamesAsSeparateEntries() {
            // Given
            List<Route> routes = List.of(Route.of("A", 50), Route.of("A", 50));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.size()).isEqualTo(2);
        }
    }

    @Nested
    class MalformedWeightTest {

        @Test
        void shouldClampOutOfRangeWeights() {
            // Given: -20 clamps to 0, 250 clamps to 100
            List<Route> routes = List.of(Route.of("A", -20), Route.of("B", 250));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries())
                    .containsExactly(new RouteEntry(0, 0.0), new RouteEntry(1, 100.0));
        }

        @Test
        void shouldDropWeightsThatAreNotNumbers() {
            // Given
            List<Route> routes =
                    List.of(
                            new Route("A", "abc", null),
                            new Route("B", 40, null),
                            new Route("C", null, null),
                            new Route("D", true, null));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then: only B survives and takes the whole distribution
            assertThat(table.getEntries()).containsExactly(new RouteEntry(1, 100.0));
        }

        @Test
        void shouldParseNumericText() {
            // Given
            List<Route> routes =
                    List.of(new Route("A", " 30 ", null), new Route("B", "7e1", null));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertEntries(table, new int[] {0, 1}, 30.0, 70.0);
        }

        @Test
        void shouldDropNonFiniteWeights() {
            // Given
            List<Route> routes =
                    List.of(
                            new Route("A", Double.NaN, null),
                            new Route("B", Double.POSITIVE_INFINITY, null),
                            new Route("C", "Infinity", null),
                            new Route("D", "NaN", null),
                            new Route("E", 10, null));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries()).containsExactly(new RouteEntry(4, 100.0));
        }

        @Test
        void shouldRejectJavaTypeSuffixes() {
            assertThat(RouteTable.coerce("50f")).isEmpty();
            assertThat(RouteTable.coerce("50d")).isEmpty();
            assertThat(RouteTable.coerce("")).isEmpty();
        }

        @Test
        void shouldSkipNullRouteElements() {
            // Given
            List<Route> routes = Arrays.asList(null, Route.of("B", 10));

            // When
            RouteTable table = RouteTable.build(routes);

            // Then
            assertThat(table.getEntries()).containsExactly(new RouteEntry(1, 100.0));
        }
    }

    @Nested
    class EmptyTableTest {

        @Test
        void shouldBeEmptyWhenNoRoutesConfigured() {
            assertThat(RouteTable.build(List.of()).isEmpty()).isTrue();
            assertThat(RouteTable.build(null).isEmpty()).isTrue();
        }

        @Test
        void shouldBeEmptyWhenNoWeightIsUsable() {
            // Given
            List<Route> routes = List.of(new Route("A", "x", null), new Route("B", null, null));

            // When
            RouteTable table = RouteTable.build(routes, true);

            // Then
            assertThat(table.isEmpty()).isTrue();
            assertThat(table.hasElse()).isTrue();
            assertThat(table.totalWeight()).isZero();
        }
    }

    @Test
    void shouldExposeUnmodifiableEntries() {
        RouteTable table = RouteTable.build(List.of(Route.of("A", 100)));

        assertThatThrownBy(() -> table.getEntries().add(new RouteEntry(1, 1.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
