package io.shuffle.core.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/// Host-supplied configuration of a random router node for one evaluation.
///
/// Holds the ordered route list and whether a catch-all else output is declared.
/// Configuration may change between evaluations; each evaluation reads the
/// instance it was opened with.
///
/// ### Usage
/// {@snippet :
/// RouterConfig config = RouterConfig.builder()
///     .route("Route A", 70)
///     .route("Route B", 30, "fallback text")
///     .elseEnabled(true)
///     .build();
/// }
///
/// @implNote Immutable after construction. The route list is copied by the builder.
///
/// @see io.shuffle.core.dispatch.EvaluationContext#open(RouterConfig)
public final class RouterConfig {

    private final List<Route> routes;
    private final boolean elseEnabled;

    private RouterConfig(Builder builder) {
        this.routes = Collections.unmodifiableList(new ArrayList<>(builder.routes));
        this.elseEnabled = builder.elseEnabled;
    }

    /// Returns the configured routes in order.
    ///
    /// @return unmodifiable route list, never null (may be empty)
    public List<Route> getRoutes() {
        return routes;
    }

    /// Returns whether the catch-all else output is declared.
    ///
    /// @return true if the else output exists
    public boolean isElseEnabled() {
        return elseEnabled;
    }

    /// Checks whether at least one route is configured.
    ///
    /// @return true if the route list is non-empty
    public boolean hasRoutes() {
        return !routes.isEmpty();
    }

    /// Returns the display name of the route at the given position.
    ///
    /// @param routeIndex zero-based position, must be within the route list
    /// @return configured name or its positional default, never null
    /// @throws IndexOutOfBoundsException if the index is outside the route list
    public String routeName(int routeIndex) {
        return routes.get(routeIndex).displayName(routeIndex);
    }

    /// Finds the first route with the given display name.
    ///
    /// Duplicate names are independent routes; only the first one is reachable by name.
    /// The same holds when a configured name equals the positional default of a later
    /// blank route (`Route 2` before an unnamed second route). Such routes are reached
    /// by position or through their {@link OutputPort#routeId(int)}.
    ///
    /// @param name display name to look up, may be null
    /// @return zero-based route position, or empty if no route has that name
    public OptionalInt findRouteIndex(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < routes.size(); i++) {
            if (routes.get(i).displayName(i).equals(name)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /// Lists the outputs the node exposes: one per route, then else when enabled.
    ///
    /// @return declared ports in host order, never null
    public List<OutputPort> outputPorts() {
        List<OutputPort> ports = new ArrayList<>(routes.size() + 1);
        for (int i = 0; i < routes.size(); i++) {
            ports.add(OutputPort.forRoute(i, routes.get(i)));
        }
        if (elseEnabled) {
            ports.add(OutputPort.elsePort());
        }
        return ports;
    }

    /// Creates an empty configuration with no routes and no else output.
    ///
    /// @return new configuration, never null
    public static RouterConfig empty() {
        return builder().build();
    }

    /// Creates a new configuration builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouterConfig that)) {
            return false;
        }
        return elseEnabled == that.elseEnabled && routes.equals(that.routes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(routes, elseEnabled);
    }

    @Override
    public String toString() {
        return "RouterConfig{routes=" + routes + ", elseEnabled=" + elseEnabled + "}";
    }

    /// Builder for constructing RouterConfig instances.
    public static final class Builder {
        private final List<Route> routes = new ArrayList<>();
        private boolean elseEnabled;

        private Builder() {}

        /// Replaces the configured routes.
        ///
        /// Null elements keep their position as routes with no usable weight.
        ///
        /// @param routes routes in order, null clears the list
        /// @return this builder for chaining
        public Builder routes(List<Route> routes) {
            this.routes.clear();
            if (routes != null) {
                for (Route route : routes) {
                    this.routes.add(route != null ? route : new Route(null, null, null));
                }
            }
            return this;
        }

        /// Appends a route.
        ///
        /// @param route the route to add, not null
        /// @return this builder for chaining
        public Builder route(Route route) {
            this.routes.add(Objects.requireNonNull(route, "route"));
            return this;
        }

        /// Appends a passthrough route.
        ///
        /// @param name output identifier, not null
        /// @param weight configured percentage
        /// @return this builder for chaining
        public Builder route(String name, double weight) {
            return route(Route.of(name, weight));
        }

        /// Appends a route with a literal override.
        ///
        /// @param name output identifier, not null
        /// @param weight configured percentage
        /// @param override literal output value, may be null
        /// @return this builder for chaining
        public Builder route(String name, double weight, String override) {
            return route(Route.of(name, weight, override));
        }

        /// Declares or removes the catch-all else output.
        ///
        /// @param elseEnabled true to declare the else output
        /// @return this builder for chaining
        public Builder elseEnabled(boolean elseEnabled) {
            this.elseEnabled = elseEnabled;
            return this;
        }

        /// Builds the immutable RouterConfig.
        ///
        /// @return new RouterConfig instance, never null
        public RouterConfig build() {
            return new RouterConfig(this);
        }
    }
}
