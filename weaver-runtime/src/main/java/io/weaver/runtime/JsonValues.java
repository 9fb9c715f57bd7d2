package io.weaver.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/// JSON conversions behind the `json` and `object` targets of `@coerce` lines.
///
/// @implNote Thread-safe. The shared mapper is configured once and never changed.
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {}

    /// Renders a port value as JSON text. `null` renders as `null`.
    ///
    /// @throws IllegalArgumentException if the value cannot be serialized
    public static String stringify(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot render " + value.getClass().getName() + " as JSON", e);
        }
    }

    /// Parses JSON text into maps, lists, strings, numbers and booleans.
    ///
    /// Values that are not text are returned unchanged, `null` included.
    ///
    /// @throws IllegalArgumentException if the text is not valid JSON
    public static Object parse(Object value) {
        if (!(value instanceof CharSequence text)) {
            return value;
        }
        try {
            return MAPPER.readValue(text.toString(), Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
