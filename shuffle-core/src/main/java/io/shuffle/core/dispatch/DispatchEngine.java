package io.shuffle.core.dispatch;

import io.shuffle.core.route.OutputPort;
import io.shuffle.core.route.Route;
import io.shuffle.core.route.RouteTable;
import io.shuffle.core.route.RouterConfig;
import io.shuffle.core.sampling.DefaultRandomSource;
import io.shuffle.core.sampling.RandomSource;
import io.shuffle.core.sampling.Sampler;
import io.shuffle.core.sampling.SelectionResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Decides which single output of a random router node fires in an evaluation.
///
/// Every accessor takes the {@link EvaluationContext} of the current node execution.
/// The first accessor call resolves the context (builds the {@link RouteTable} and
/// samples once); later calls read the cached selection. Outputs other than the
/// selected one are returned as {@link RouteOutput#suppressed()}.
///
/// ### Output Rules
/// - **Route output**: active only for the selected route; emits the route's override
///   when set, the passthrough payload otherwise
/// - **Else output**: active only when routes are configured, none has a usable
///   weight, and the else output is enabled
/// - **No routes configured**: every output is suppressed, else included
///
/// Malformed configuration never raises; a broken node only leaves its outputs inert.
///
/// @implNote Stateless apart from its injected collaborators. A single engine can
/// serve any number of contexts, including concurrently, as long as each context
/// is used by one thread.
///
/// @see EvaluationContext for the per-execution scope
/// @see Sampler for the selection rule
public class DispatchEngine {

    private static final Logger logger = Logger.getLogger(DispatchEngine.class.getName());

    /// Status when the node has no routes at all.
    public static final String NO_ROUTES_STATUS = "No routes configured";

    /// Status when no route has a usable weight and the else output takes the payload.
    public static final String ELSE_FALLBACK_STATUS =
            "No valid routes - using input data for Else output";

    /// Status when no route has a usable weight and there is no else output.
    public static final String NO_SELECTION_STATUS =
            "No valid routes and Else output is disabled";

    /// Prefix of the status naming the selected route.
    public static final String SELECTED_STATUS_PREFIX = "Selected: ";

    /// Override values that mean "not set" unless configured otherwise.
    public static final Set<String> DEFAULT_UNSET_SENTINELS = Set.of("none");

    private final Sampler sampler;
    private final RandomSource randomSource;
    private final Set<String> unsetOverrideSentinels;

    /// Creates an engine drawing from the process-wide generator.
    public DispatchEngine() {
        this(DefaultRandomSource.INSTANCE);
    }

    /// Creates an engine with the default sampler and sentinels.
    ///
    /// @param randomSource source of uniform draws, not null
    public DispatchEngine(RandomSource randomSource) {
        this(new Sampler(), randomSource, DEFAULT_UNSET_SENTINELS);
    }

    /// Creates a fully configured engine.
    ///
    /// @param sampler selection strategy, not null
    /// @param randomSource source of uniform draws, not null
    /// @param unsetOverrideSentinels override values treated as "not set", compared
    ///        case-insensitively after trimming, not null
    public DispatchEngine(
            Sampler sampler, RandomSource randomSource, Set<String> unsetOverrideSentinels) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
        this.unsetOverrideSentinels =
                Objects.requireNonNull(unsetOverrideSentinels, "unsetOverrideSentinels").stream()
                        .map(s -> s.strip().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    /// Returns the verdict for the first route with the given name.
    ///
    /// Names are matched against display names, so a blank route is reachable as
    /// `Route {i+1}`. When several routes share a display name (duplicates, or a
    /// configured name equal to another route's positional default), only the first
    /// is reachable here and a later one can be selected while this returns suppressed.
    /// Hosts with such configurations should read outputs through
    /// {@link #getOutput(EvaluationContext, String, Object)} with the port id, or
    /// {@link #getRouteOutput(EvaluationContext, int, Object)}.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @param routeName display name of the route, may be null
    /// @param passthrough payload forwarded when the route has no override, may be null
    /// @return active verdict if that route was selected, suppressed otherwise, never null
    public RouteOutput getRouteOutput(
            EvaluationContext context, String routeName, Object passthrough) {
        resolve(context);
        OptionalInt index = context.getConfig().findRouteIndex(routeName);
        if (index.isEmpty()) {
            logger.fine("No route named '" + routeName + "', suppressing output");
            return RouteOutput.suppressed();
        }
        return getRouteOutput(context, index.getAsInt(), passthrough);
    }

    /// Returns the verdict for the route at the given position.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @param routeIndex zero-based route position
    /// @param passthrough payload forwarded when the route has no override, may be null
    /// @return active verdict if that route was selected, suppressed otherwise, never null
    public RouteOutput getRouteOutput(
            EvaluationContext context, int routeIndex, Object passthrough) {
        SelectionResult selection = resolve(context);
        if (!selection.isSelected(routeIndex)) {
            return RouteOutput.suppressed();
        }
        Route route = context.getConfig().getRoutes().get(routeIndex);
        Object payload = isOverrideSet(route.override()) ? route.override() : passthrough;
        return RouteOutput.emit(payload);
    }

    /// Returns the verdict for the catch-all output.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @param passthrough payload forwarded when else fires, may be null
    /// @return active verdict only when no route was selectable and else is enabled,
    ///         never null
    public RouteOutput getElseOutput(EvaluationContext context, Object passthrough) {
        SelectionResult selection = resolve(context);
        RouterConfig config = context.getConfig();
        if (config.isElseEnabled() && config.hasRoutes() && !selection.hasSelection()) {
            return RouteOutput.emit(passthrough);
        }
        return RouteOutput.suppressed();
    }

    /// Returns the verdict for a declared output port.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @param outputId port identifier such as `route_2_result` or `default_result`
    /// @param passthrough payload forwarded to the active output, may be null
    /// @return verdict for the port, suppressed for unknown ports, never null
    /// @see RouterConfig#outputPorts()
    public RouteOutput getOutput(EvaluationContext context, String outputId, Object passthrough) {
        resolve(context);
        if (OutputPort.ELSE_ID.equals(outputId)) {
            return getElseOutput(context, passthrough);
        }
        int routeCount = context.getConfig().getRoutes().size();
        for (int i = 0; i < routeCount; i++) {
            if (OutputPort.routeId(i).equals(outputId)) {
                return getRouteOutput(context, i, passthrough);
            }
        }
        logger.warning("Unknown output '" + outputId + "', suppressing it");
        return RouteOutput.suppressed();
    }

    /// Returns the verdict of every declared output, in port order.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @param passthrough payload forwarded to the active output, may be null
    /// @return port id to verdict, insertion-ordered, never null
    public Map<String, RouteOutput> evaluateAll(EvaluationContext context, Object passthrough) {
        resolve(context);
        Map<String, RouteOutput> outputs = new LinkedHashMap<>();
        for (OutputPort port : context.getConfig().outputPorts()) {
            RouteOutput output =
                    port.isElse()
                            ? getElseOutput(context, passthrough)
                            : getRouteOutput(context, port.routeIndex(), passthrough);
            outputs.put(port.id(), output);
        }
        return outputs;
    }

    /// Summarizes the evaluation for observability.
    ///
    /// Resolves the context if no accessor has run yet.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @return snapshot of the outcome, never null
    public DispatchReport report(EvaluationContext context) {
        SelectionResult selection = resolve(context);
        RouterConfig config = context.getConfig();
        Integer index = selection.selectedRouteIndex();
        return new DispatchReport(
                context.getStatus(),
                index,
                index != null ? config.routeName(index) : null,
                selection.drawValue(),
                context.getRouteTable().map(RouteTable::getEntries).orElse(List.of()),
                config.isElseEnabled());
    }

    /// Makes the draw for the context if it has not been made yet.
    ///
    /// @param context evaluation scope of the current node execution, not null
    /// @return the cached selection, never null
    public SelectionResult resolve(EvaluationContext context) {
        Objects.requireNonNull(context, "context");
        if (context.isResolved()) {
            return context.getSelection().orElseThrow();
        }

        RouterConfig config = context.getConfig();
        if (!config.hasRoutes()) {
            logger.info(NO_ROUTES_STATUS + ", all outputs suppressed");
            context.resolve(
                    RouteTable.empty(config.isElseEnabled()),
                    SelectionResult.none(),
                    NO_ROUTES_STATUS);
            return SelectionResult.none();
        }

        RouteTable table = RouteTable.build(config.getRoutes(), config.isElseEnabled());
        SelectionResult selection = sampler.select(table, randomSource);

        String status;
        if (selection.hasSelection()) {
            int index = selection.selectedRouteIndex();
            String name = config.routeName(index);
            status = SELECTED_STATUS_PREFIX + name;
            logger.info(
                    String.format(
                            Locale.ROOT,
                            "Random selection: %s (route index: %d, random value: %.2f)",
                            name,
                            index,
                            selection.drawValue()));
        } else {
            status = config.isElseEnabled() ? ELSE_FALLBACK_STATUS : NO_SELECTION_STATUS;
            logger.warning(
                    "None of "
                            + config.getRoutes().size()
                            + " configured routes has a usable weight: "
                            + status);
        }

        context.resolve(table, selection, status);
        return selection;
    }

    private boolean isOverrideSet(String override) {
        if (override == null || override.isBlank()) {
            return false;
        }
        return !unsetOverrideSentinels.contains(override.strip().toLowerCase(Locale.ROOT));
    }
}
