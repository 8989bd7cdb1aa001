package io.shuffle.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.shuffle.core.route.Route;
import java.util.List;

/// Jackson mixin for `RouterConfig.Builder`.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder methods, and
/// accepts `enable_else_output` as an alias of `elseEnabled`. The single-route
/// `route(Route)` method is hidden so a stray `route` field cannot append to the list.
///
/// @see RouterConfigMixin
/// @see io.shuffle.serialization.ShuffleJacksonModule
@JsonPOJOBuilder(withPrefix = "")
public abstract class RouterConfigBuilderMixin {

    /// @param routes configured routes in order
    /// @return this builder for chaining
    public abstract RouterConfigBuilderMixin routes(List<Route> routes);

    /// @param elseEnabled true to declare the else output
    /// @return this builder for chaining
    @JsonAlias("enable_else_output")
    public abstract RouterConfigBuilderMixin elseEnabled(boolean elseEnabled);

    /// Excluded from deserialization.
    ///
    /// @param route ignored
    /// @return this builder for chaining
    @JsonIgnore
    public abstract RouterConfigBuilderMixin route(Route route);
}
