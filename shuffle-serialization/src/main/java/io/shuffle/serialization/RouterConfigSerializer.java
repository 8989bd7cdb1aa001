package io.shuffle.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.shuffle.core.dispatch.DispatchReport;
import io.shuffle.core.route.Route;
import io.shuffle.core.route.RouterConfig;
import java.util.List;

/// Utility class for reading router configuration from JSON and writing it back.
///
/// ### Usage
/// {@snippet :
/// RouterConfig config = RouterConfigSerializer.fromJson("""
///     {"routes": [{"route_name": "A", "percentage": 70},
///                 {"route_name": "B", "percentage": 30, "output_value": "fixed"}],
///      "enable_else_output": true}
///     """);
///
/// String json = RouterConfigSerializer.toJson(config);
/// String report = RouterConfigSerializer.reportToJson(engine.report(context));
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see ShuffleJacksonModule for the registered type handlers
public final class RouterConfigSerializer {

    private static final TypeReference<List<Route>> ROUTE_LIST = new TypeReference<>() {};

    private RouterConfigSerializer() {}

    /// Serializes a configuration to pretty-printed JSON.
    ///
    /// @param config the configuration to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RouterConfig config) {
        try {
            return createMapper().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize router config: " + e.getMessage(), e);
        }
    }

    /// Deserializes a configuration from JSON.
    ///
    /// @param json JSON object with `routes` and an optional else flag, not null
    /// @return deserialized configuration, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static RouterConfig fromJson(String json) {
        try {
            return createMapper().readValue(json, RouterConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize router config: " + e.getMessage(), e);
        }
    }

    /// Deserializes a bare route list, as supplied by a routes table input.
    ///
    /// @param json JSON array of route objects, not null
    /// @return routes in order, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static List<Route> routesFromJson(String json) {
        try {
            List<Route> routes = createMapper().readValue(json, ROUTE_LIST);
            return routes != null ? routes : List.of();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize routes: " + e.getMessage(), e);
        }
    }

    /// Serializes a dispatch report for logs or host diagnostics.
    ///
    /// @param report the report to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String reportToJson(DispatchReport report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize dispatch report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Shuffle types.
    ///
    /// Registers:
    /// - `ShuffleJacksonModule` for route and configuration types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so host-specific fields are ignored
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ShuffleJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
