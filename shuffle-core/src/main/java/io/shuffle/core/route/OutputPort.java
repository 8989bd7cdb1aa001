package io.shuffle.core.route;

/// A declared output of a random router node, as the host renders it.
///
/// Route ports are named `route_{i+1}_result`; the catch-all port is `default_result`.
///
/// @param id stable output identifier used by the host to wire edges, not null
/// @param displayName label shown for the output, not null
/// @param routeIndex zero-based route position, or null for the else port
///
/// @see RouterConfig#outputPorts()
public record OutputPort(String id, String displayName, Integer routeIndex) {

    /// Identifier of the catch-all output.
    public static final String ELSE_ID = "default_result";

    /// Label of the catch-all output.
    public static final String ELSE_DISPLAY_NAME = "Else";

    /// Returns the output identifier for the route at the given position.
    ///
    /// @param routeIndex zero-based route position
    /// @return identifier such as `route_1_result`, never null
    public static String routeId(int routeIndex) {
        return "route_" + (routeIndex + 1) + "_result";
    }

    /// Creates the port for a configured route.
    ///
    /// @param routeIndex zero-based route position
    /// @param route the configured route, not null
    /// @return new port, never null
    public static OutputPort forRoute(int routeIndex, Route route) {
        return new OutputPort(
                routeId(routeIndex),
                route.displayName(routeIndex) + " (" + route.weight() + "%)",
                routeIndex);
    }

    /// Creates the catch-all port.
    ///
    /// @return new else port, never null
    public static OutputPort elsePort() {
        return new OutputPort(ELSE_ID, ELSE_DISPLAY_NAME, null);
    }

    /// Checks whether this is the catch-all port.
    ///
    /// @return true if the port belongs to no route
    public boolean isElse() {
        return routeIndex == null;
    }
}
