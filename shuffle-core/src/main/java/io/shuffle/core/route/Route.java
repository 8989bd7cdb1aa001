package io.shuffle.core.route;

/// One configured output branch of a random router node.
///
/// The weight is kept exactly as the host supplied it. It is normally a
/// percentage in `[0, 100]`, but upstream configuration may hand over text,
/// out-of-range numbers or null; {@link RouteTable#build} decides what is usable.
///
/// @param name output identifier, may be null or blank (displayed as `Route {i+1}`)
/// @param weight raw configured percentage, may be any object or null
/// @param override literal value emitted when this route is selected, may be null
///
/// @see RouteTable for normalization
public record Route(String name, Object weight, String override) {

    /// Creates a route that forwards the passthrough payload when selected.
    ///
    /// @param name output identifier, not null
    /// @param weight configured percentage
    /// @return new route, never null
    public static Route of(String name, double weight) {
        return new Route(name, weight, null);
    }

    /// Creates a route with a literal override value.
    ///
    /// @param name output identifier, not null
    /// @param weight configured percentage
    /// @param override literal output value, may be null
    /// @return new route, never null
    public static Route of(String name, double weight, String override) {
        return new Route(name, weight, override);
    }

    /// Returns the name shown for this route at the given position.
    ///
    /// @param index zero-based position of the route in its configuration
    /// @return the configured name, or `Route {index+1}` when blank, never null
    public String displayName(int index) {
        return name == null || name.isBlank() ? "Route " + (index + 1) : name;
    }
}
