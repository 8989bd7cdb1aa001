package io.shuffle.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.shuffle.core.route.RouterConfig;

/// Jackson mixin that binds `RouterConfig` deserialization to its builder.
///
/// Applied to `RouterConfig.class` via `ShuffleJacksonModule.setupModule()`.
///
/// @apiNote The companion mixin {@link RouterConfigBuilderMixin} must also be registered so
/// Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see RouterConfigBuilderMixin
/// @see io.shuffle.serialization.ShuffleJacksonModule
@JsonDeserialize(builder = RouterConfig.Builder.class)
public abstract class RouterConfigMixin {}
