package io.weaver.core.plan;

import java.util.List;
import java.util.Objects;

/// Nodes that run together: the workflow body, or the children of one scope.
///
/// @param key `""` for the workflow body, `owner.scope` for a scope, not null
/// @param ownerId owning instance of the scope, null for the workflow body
/// @param scopeName scope name, null for the workflow body
/// @param order eagerly scheduled nodes in execution order, not null
/// @param pullNodes lazily executed nodes in declaration order, not null
public record ScopeLayer(
        String key, String ownerId, String scopeName, List<String> order, List<String> pullNodes) {

    public static final String ROOT = "";

    public ScopeLayer {
        Objects.requireNonNull(key, "key must not be null");
        order = List.copyOf(order);
        pullNodes = List.copyOf(pullNodes);
    }

    public boolean isRoot() {
        return ROOT.equals(key);
    }

    /// Returns the key of the layer of a scope.
    public static String keyOf(String ownerId, String scopeName) {
        return ownerId + "." + scopeName;
    }
}
