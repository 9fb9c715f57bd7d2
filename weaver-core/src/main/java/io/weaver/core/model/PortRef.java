package io.weaver.core.model;

import java.util.Objects;

/// One endpoint of a connection: `node.port[:scope]`.
///
/// @param node instance id, or `Start`/`Exit`, not null
/// @param port port name, not null
/// @param scope scope name for a scope-boundary endpoint, null otherwise
public record PortRef(String node, String port, String scope) {

    public PortRef {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(port, "port");
    }

    public static PortRef of(String node, String port) {
        return new PortRef(node, port, null);
    }

    public boolean isScoped() {
        return scope != null;
    }

    @Override
    public String toString() {
        return node + "." + port + (scope != null ? ":" + scope : "");
    }
}
