package io.shuffle.core.route;

/// A route's share of the normalized distribution.
///
/// @param routeIndex zero-based position of the route in the original configuration
/// @param normalizedWeight percentage of the draw interval owned by the route, never negative
public record RouteEntry(int routeIndex, double normalizedWeight) {}
