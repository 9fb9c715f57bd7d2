package io.weaver.core.model;

import java.util.Locale;

/// Strategy for combining several connections into one input port.
///
/// A port with a merge strategy may receive more than one connection without a
/// `MULTIPLE_CONNECTIONS_TO_INPUT` finding.
public enum MergeStrategy {
    /// Use the first non-null source value in connection order.
    FIRST,

    /// Use the last non-null source value in connection order.
    LAST,

    /// Collect all source values into a list, nulls included. Output: List&lt;Object&gt;.
    COLLECT,

    /// Merge all map-valued sources. Later sources override earlier ones for duplicate keys.
    MERGE;

    /// Parses a strategy name case-insensitively.
    ///
    /// @return the strategy, or null when the name is unknown
    public static MergeStrategy parse(String text) {
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
