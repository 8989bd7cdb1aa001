package io.shuffle.core.dispatch;

/// Verdict for one output of a random router node.
///
/// An inactive output is an explicit suppression signal: the host engine must not
/// execute anything downstream of that edge, rather than running it with an empty value.
///
/// @param payload value to emit when active (override text or the passthrough payload),
///        null when suppressed
/// @param active true if the host should traverse this edge
public record RouteOutput(Object payload, boolean active) {

    private static final RouteOutput SUPPRESSED = new RouteOutput(null, false);

    /// Creates an active verdict.
    ///
    /// @param payload value to emit, may be null if the passthrough payload was null
    /// @return new active verdict, never null
    public static RouteOutput emit(Object payload) {
        return new RouteOutput(payload, true);
    }

    /// Returns the suppression verdict.
    ///
    /// @return shared inactive verdict, never null
    public static RouteOutput suppressed() {
        return SUPPRESSED;
    }

    /// Checks whether the host should prune this edge.
    ///
    /// @return true if the output is inactive
    public boolean isSuppressed() {
        return !active;
    }
}
