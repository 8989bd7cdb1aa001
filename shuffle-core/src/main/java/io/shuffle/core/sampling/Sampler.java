package io.shuffle.core.sampling;

import io.shuffle.core.route.RouteEntry;
import io.shuffle.core.route.RouteTable;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Maps a uniform draw onto a route using cumulative-weight intervals.
///
/// For a draw `r` in `[0, 100)`, entries are walked in table order and the first
/// entry whose cumulative weight reaches `r` is selected. Entries with zero weight
/// own no interval and are never selected.
///
/// ### Boundary Handling
/// Normalized weights can sum to slightly under 100 after floating-point rounding.
/// A draw past the last cumulative bound falls back to the last entry with positive
/// weight, so every draw on a non-empty table yields exactly one route.
///
/// @implNote Stateless and thread-safe.
///
/// @see RouteTable for the distribution being sampled
public class Sampler {

    private static final Logger logger = Logger.getLogger(Sampler.class.getName());

    /// Lower bound of the draw interval.
    public static final double MIN_DRAW = 0.0;

    /// Upper bound of the draw interval.
    public static final double MAX_DRAW = RouteTable.TOTAL_WEIGHT;

    /// Draws once and selects a route.
    ///
    /// The random source is not consulted when the table is empty.
    ///
    /// @param table normalized distribution, not null
    /// @param rng source of the uniform draw, not null
    /// @return selection result, never null
    public SelectionResult select(RouteTable table, RandomSource rng) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(rng, "rng");

        if (table.isEmpty()) {
            return SelectionResult.none();
        }
        double draw = rng.uniform(MIN_DRAW, MAX_DRAW);
        return new SelectionResult(locate(table.getEntries(), draw), draw);
    }

    /// Finds the route owning the interval that contains the draw.
    ///
    /// @param entries non-empty normalized entries in table order
    /// @param draw value to locate
    /// @return zero-based route position of the owning entry
    int locate(List<RouteEntry> entries, double draw) {
        double cumulative = 0.0;
        RouteEntry lastPositive = null;
        for (RouteEntry entry : entries) {
            if (entry.normalizedWeight() <= 0.0) {
                continue;
            }
            cumulative += entry.normalizedWeight();
            lastPositive = entry;
            if (draw <= cumulative) {
                return entry.routeIndex();
            }
        }

        // non-empty tables always sum to 100, so some entry is positive
        logger.fine(
                "Draw "
                        + draw
                        + " beyond cumulative bound "
                        + cumulative
                        + ", falling back to route "
                        + lastPositive.routeIndex());
        return lastPositive.routeIndex();
    }
}
