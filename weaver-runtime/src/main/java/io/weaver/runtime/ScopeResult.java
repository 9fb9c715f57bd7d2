package io.weaver.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Values returned by one activation of a scope closure.
///
/// `success` and `failure` are the scope's control-flow signals; `values` holds the scoped
/// input ports of the owning node (the ports the children write back into), keyed by port name.
///
/// @param success whether the scope's children reported success
/// @param failure whether the scope's children reported failure
/// @param values scoped input port values, never null
public record ScopeResult(boolean success, boolean failure, Map<String, Object> values) {

    /// Compact constructor with defensive copy.
    public ScopeResult {
        values =
                values != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                        : Map.of();
    }

    /// Returns a single scoped value.
    ///
    /// @param port scoped input port name, not null
    /// @return the value, or null when the children never wrote it
    public Object get(String port) {
        return values.get(port);
    }
}
