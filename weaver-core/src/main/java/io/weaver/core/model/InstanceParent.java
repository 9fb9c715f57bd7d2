package io.weaver.core.model;

import java.util.Objects;

/// Scope an instance is nested in.
///
/// @param ownerId id of the instance owning the scope, not null
/// @param scopeName scope name, not null
public record InstanceParent(String ownerId, String scopeName) {

    public InstanceParent {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(scopeName, "scopeName");
    }

    @Override
    public String toString() {
        return ownerId + "." + scopeName;
    }
}
