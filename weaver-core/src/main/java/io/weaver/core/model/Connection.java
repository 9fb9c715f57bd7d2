package io.weaver.core.model;

import java.util.Objects;

/// Directed edge between two ports.
///
/// @param from source endpoint, not null
/// @param to target endpoint, not null
public record Connection(PortRef from, PortRef to) {

    public Connection {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static Connection of(String fromNode, String fromPort, String toNode, String toPort) {
        return new Connection(PortRef.of(fromNode, fromPort), PortRef.of(toNode, toPort));
    }

    /// Returns whether either endpoint is scope-qualified.
    public boolean isScoped() {
        return from.isScoped() || to.isScoped();
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
