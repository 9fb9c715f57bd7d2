package io.weaver.core.model;

import java.util.List;
import java.util.Objects;

/// Named nested execution region owned by one instance.
///
/// @param ownerId id of the owning instance, not null
/// @param name scope name, not null
/// @param children member instance ids in declaration order, not null
public record Scope(String ownerId, String name, List<String> children) {

    public Scope {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(name, "name");
        children = children != null ? List.copyOf(children) : List.of();
    }

    /// Returns `owner.scope`.
    public String key() {
        return ownerId + "." + name;
    }
}
