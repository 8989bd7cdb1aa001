package io.shuffle.core.dispatch;

import io.shuffle.core.route.RouteEntry;
import java.util.List;

/// Snapshot of a resolved evaluation, for logs and host diagnostics.
///
/// Advisory only; nothing in the dispatch contract reads it back.
///
/// @param status human-readable outcome such as `Selected: Route A`, not null
/// @param selectedRouteIndex zero-based position of the selected route, may be null
/// @param selectedRouteName display name of the selected route, may be null
/// @param drawValue raw uniform sample in `[0, 100)`, 0 when no draw was made
/// @param distribution normalized entries the draw was made against, not null
/// @param elseEnabled whether the else output was declared
public record DispatchReport(
        String status,
        Integer selectedRouteIndex,
        String selectedRouteName,
        double drawValue,
        List<RouteEntry> distribution,
        boolean elseEnabled) {

    public DispatchReport {
        distribution = distribution == null ? List.of() : List.copyOf(distribution);
    }
}
