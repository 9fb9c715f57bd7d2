package io.weaver.core.model;

import java.util.Locale;

/// Closed set of port data types.
///
/// `STEP` marks control-flow ports (triggers and success/failure signals); every other
/// type carries data. `ANY` is compatible with everything.
public enum DataType {
    NUMBER,
    STRING,
    BOOLEAN,
    OBJECT,
    ARRAY,
    FUNCTION,
    STEP,
    ANY;

    /// Parses a type name case-insensitively.
    ///
    /// @param text type name such as `number` or `STRING`, may be null
    /// @return the type, or null when the name is not a known type
    public static DataType parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
