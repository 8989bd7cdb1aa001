package io.shuffle.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.shuffle.core.route.Route;
import io.shuffle.core.route.RouterConfig;
import io.shuffle.serialization.mixin.RouterConfigBuilderMixin;
import io.shuffle.serialization.mixin.RouterConfigMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Shuffle serialization configuration in one place.
///
/// - `Route` - `RouteSerializer` / `RouteDeserializer`, tolerant of both field naming schemes
///   and of raw, unvalidated weights
/// - `RouterConfig` + `RouterConfig.Builder` - mixin/builder pair
///
/// `DispatchReport` and `RouteEntry` are records and need no registration.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see RouterConfigSerializer for the convenience factory API
public class ShuffleJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 7753806116429530478L;

    /// Constructs the module and registers the `Route` serializer/deserializer pair.
    public ShuffleJacksonModule() {
        super("ShuffleJacksonModule");

        addSerializer(Route.class, new RouteSerializer());
        addDeserializer(Route.class, new RouteDeserializer());
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(RouterConfig.class, RouterConfigMixin.class);
        context.setMixInAnnotations(RouterConfig.Builder.class, RouterConfigBuilderMixin.class);
    }
}
