package io.shuffle.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.shuffle.core.route.Route;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `Route` from either field naming scheme.
///
/// | Field | Accepted names |
/// |---|---|
/// | name | `name`, `route_name` |
/// | weight | `weight`, `percentage` |
/// | override | `override`, `output_value` |
///
/// The weight is never validated here: numbers and strings are kept as they are,
/// an absent weight reads as `0.0`, and any other JSON value (explicit null, boolean,
/// object, array) becomes a null weight that `RouteTable` drops.
///
/// @see RouteSerializer for the inverse operation
class RouteDeserializer extends StdDeserializer<Route> {

    @Serial private static final long serialVersionUID = -6072514834102256413L;

    private static final double ABSENT_WEIGHT = 0.0;

    RouteDeserializer() {
        super(Route.class);
    }

    @Override
    public Route deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw JsonMappingException.from(
                    p, "Route must be a JSON object, got: " + root.getNodeType());
        }

        String name = text(field(root, "name", "route_name"));
        String override = text(field(root, "override", "output_value"));
        return new Route(name, weight(root), override);
    }

    private static Object weight(JsonNode root) {
        JsonNode node = field(root, "weight", "percentage");
        if (node == null) {
            return ABSENT_WEIGHT;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return null;
    }

    private static JsonNode field(JsonNode root, String name, String alias) {
        JsonNode node = root.get(name);
        return node != null ? node : root.get(alias);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
