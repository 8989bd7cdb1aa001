package io.shuffle.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.shuffle.core.route.Route;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `Route` with its raw weight kept as configured.
///
/// Numeric weights are written as JSON numbers, textual ones as strings, so a
/// round-trip preserves exactly what the host supplied.
///
/// @see RouteDeserializer for the inverse operation
class RouteSerializer extends StdSerializer<Route> {

    @Serial private static final long serialVersionUID = 3214470915120548351L;

    RouteSerializer() {
        super(Route.class);
    }

    @Override
    public void serialize(Route route, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", route.name());

        Object weight = route.weight();
        if (weight == null) {
            gen.writeNullField("weight");
        } else if (weight instanceof Number) {
            gen.writeObjectField("weight", weight);
        } else {
            gen.writeStringField("weight", weight.toString());
        }

        gen.writeStringField("override", route.override());
        gen.writeEndObject();
    }
}
