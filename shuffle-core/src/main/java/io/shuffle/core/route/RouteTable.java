package io.shuffle.core.route;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/// Normalized probability distribution over the routes of one evaluation.
///
/// Built from raw route configuration by {@link #build(List, boolean)}:
/// 1. Weights that cannot be read as a finite number are dropped
/// 2. Remaining weights are clamped to `[0, 100]`
/// 3. When every weight is zero, each route gets an equal share
/// 4. Otherwise each weight is rescaled to `weight / total * 100`
///
/// Entries keep the configuration order; the sampler relies on it for tie-breaking.
/// Malformed configuration never fails the build, it only shrinks the table, possibly to empty.
///
/// @implNote Immutable after construction and safe to share.
///
/// @see io.shuffle.core.sampling.Sampler for selection over the table
public final class RouteTable {

    /// Sum of all normalized weights in a non-empty table.
    public static final double TOTAL_WEIGHT = 100.0;

    /// Floating-point tolerance on {@link #TOTAL_WEIGHT}.
    public static final double TOLERANCE = 1e-6;

    private final List<RouteEntry> entries;
    private final boolean hasElse;

    private RouteTable(List<RouteEntry> entries, boolean hasElse) {
        this.entries = Collections.unmodifiableList(entries);
        this.hasElse = hasElse;
    }

    /// Builds a table without an else branch.
    ///
    /// @param routes configured routes in order, may be null or empty
    /// @return normalized table, never null
    public static RouteTable build(List<Route> routes) {
        return build(routes, false);
    }

    /// Validates and normalizes the configured routes.
    ///
    /// @param routes configured routes in order, may be null or empty
    /// @param hasElse whether the node declares a catch-all output
    /// @return normalized table, empty when no route has a usable weight, never null
    public static RouteTable build(List<Route> routes, boolean hasElse) {
        if (routes == null || routes.isEmpty()) {
            return empty(hasElse);
        }

        List<RouteEntry> valid = new ArrayList<>();
        double total = 0.0;
        for (int i = 0; i < routes.size(); i++) {
            Route route = routes.get(i);
            OptionalDouble weight = route == null ? OptionalDouble.empty() : coerce(route.weight());
            if (weight.isEmpty()) {
                continue;
            }
            double clamped = Math.max(0.0, Math.min(TOTAL_WEIGHT, weight.getAsDouble()));
            valid.add(new RouteEntry(i, clamped));
            total += clamped;
        }

        if (valid.isEmpty()) {
            return empty(hasElse);
        }

        List<RouteEntry> normalized = new ArrayList<>(valid.size());
        if (total == 0.0) {
            // all 0%: no preference expressed
            double share = TOTAL_WEIGHT / valid.size();
            for (RouteEntry entry : valid) {
                normalized.add(new RouteEntry(entry.routeIndex(), share));
            }
        } else {
            for (RouteEntry entry : valid) {
                normalized.add(
                        new RouteEntry(
                                entry.routeIndex(),
                                entry.normalizedWeight() / total * TOTAL_WEIGHT));
            }
        }
        return new RouteTable(normalized, hasElse);
    }

    /// Creates a table with no selectable routes.
    ///
    /// @param hasElse whether the node declares a catch-all output
    /// @return empty table, never null
    public static RouteTable empty(boolean hasElse) {
        return new RouteTable(new ArrayList<>(), hasElse);
    }

    /// Reads a raw configured weight as a finite number.
    ///
    /// Numbers are taken by value. Text is parsed as a plain decimal literal after trimming,
    /// so `"NaN"`, `"Infinity"` and type suffixes such as `"50f"` are rejected.
    ///
    /// @param raw configured weight, may be null
    /// @return the finite value, or empty when the weight is unusable
    static OptionalDouble coerce(Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof CharSequence text) {
            try {
                value = new BigDecimal(text.toString().strip()).doubleValue();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /// Returns the normalized entries in configuration order.
    ///
    /// @return unmodifiable entry list, never null
    public List<RouteEntry> getEntries() {
        return entries;
    }

    /// Returns whether the node declares a catch-all output.
    ///
    /// @return true if the else branch is enabled
    public boolean hasElse() {
        return hasElse;
    }

    /// Checks whether any route can be selected.
    ///
    /// @return true if the table has no entries
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Returns the number of selectable routes.
    ///
    /// @return entry count, never negative
    public int size() {
        return entries.size();
    }

    /// Sums the normalized weights.
    ///
    /// @return 100 within {@link #TOLERANCE} for a non-empty table, 0 otherwise
    public double totalWeight() {
        return entries.stream().mapToDouble(RouteEntry::normalizedWeight).sum();
    }

    @Override
    public String toString() {
        return "RouteTable{entries=" + entries + ", hasElse=" + hasElse + "}";
    }
}
