package io.shuffle.core.dispatch;

import io.shuffle.core.route.RouteTable;
import io.shuffle.core.route.RouterConfig;
import io.shuffle.core.sampling.SelectionResult;
import java.util.Objects;
import java.util.Optional;

/// Lifetime scope of one router node execution.
///
/// The host opens a context per node execution and passes it to every output
/// accessor of that execution. The first accessor call resolves the context:
/// the route table is built and the draw is made exactly once. Every later call
/// reads the cached outcome, so the order in which the host queries outputs
/// cannot activate more than one branch.
///
/// ### Lifecycle
/// 1. `open(config)` - unresolved, holds only the configuration
/// 2. First {@link DispatchEngine} accessor - resolved, table and selection fixed
/// 3. Discarded by the host after all outputs are read; no cleanup needed
///
/// @implNote **Not thread-safe**. A context belongs to one evaluation; parallel
/// evaluations must each open their own.
///
/// @see DispatchEngine for the accessors that resolve the context
public final class EvaluationContext {

    private final RouterConfig config;
    private RouteTable routeTable;
    private SelectionResult selection;
    private String status;

    private EvaluationContext(RouterConfig config) {
        this.config = config;
    }

    /// Opens a context for one node execution.
    ///
    /// @param config the routing configuration for this execution, not null
    /// @return new unresolved context, never null
    public static EvaluationContext open(RouterConfig config) {
        return new EvaluationContext(Objects.requireNonNull(config, "config"));
    }

    /// Returns the configuration this context was opened with.
    ///
    /// @return router configuration, never null
    public RouterConfig getConfig() {
        return config;
    }

    /// Returns the route table built on resolution.
    ///
    /// @return the table, or empty if the context is unresolved
    public Optional<RouteTable> getRouteTable() {
        return Optional.ofNullable(routeTable);
    }

    /// Returns the cached selection.
    ///
    /// @return the selection, or empty if the context is unresolved
    public Optional<SelectionResult> getSelection() {
        return Optional.ofNullable(selection);
    }

    /// Returns the advisory status of the evaluation.
    ///
    /// @return status text, or null if the context is unresolved
    public String getStatus() {
        return status;
    }

    /// Checks whether the draw for this evaluation has been made.
    ///
    /// @return true once the first accessor has run
    public boolean isResolved() {
        return selection != null;
    }

    void resolve(RouteTable routeTable, SelectionResult selection, String status) {
        if (isResolved()) {
            throw new IllegalStateException("Evaluation context already resolved");
        }
        this.routeTable = Objects.requireNonNull(routeTable, "routeTable");
        this.selection = Objects.requireNonNull(selection, "selection");
        this.status = status;
    }
}
