package io.shuffle.core.sampling;

/// Outcome of one sampler draw.
///
/// @param selectedRouteIndex zero-based position of the selected route, null only when
///        the table had no entries
/// @param drawValue raw uniform sample in `[0, 100)`, 0 when no draw was made
public record SelectionResult(Integer selectedRouteIndex, double drawValue) {

    private static final SelectionResult NONE = new SelectionResult(null, 0.0);

    /// Returns the result for a table with nothing to select.
    ///
    /// @return shared empty result, never null
    public static SelectionResult none() {
        return NONE;
    }

    /// Checks whether a route was selected.
    ///
    /// @return true if a route index is present
    public boolean hasSelection() {
        return selectedRouteIndex != null;
    }

    /// Checks whether the given route was the one selected.
    ///
    /// @param routeIndex zero-based route position
    /// @return true if that route was selected
    public boolean isSelected(int routeIndex) {
        return selectedRouteIndex != null && selectedRouteIndex == routeIndex;
    }
}
