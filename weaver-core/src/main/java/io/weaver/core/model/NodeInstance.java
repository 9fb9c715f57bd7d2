package io.weaver.core.model;

import java.util.Objects;

/// Placement of a node type inside a workflow.
///
/// @param id unique instance id, not null
/// @param nodeType name of the bound node type, not null; may not resolve (the validator
///     reports it)
/// @param parent scope the instance is nested in, null at top level
/// @param config per-instance overrides, never null
public record NodeInstance(String id, String nodeType, InstanceParent parent, InstanceConfig config) {

    public NodeInstance {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(nodeType, "nodeType");
        config = config != null ? config : InstanceConfig.EMPTY;
    }

    public static NodeInstance of(String id, String nodeType) {
        return new NodeInstance(id, nodeType, null, InstanceConfig.EMPTY);
    }

    public boolean isScoped() {
        return parent != null;
    }

    public NodeInstance withParent(InstanceParent parent) {
        return new NodeInstance(id, nodeType, parent, config);
    }

    public NodeInstance withConfig(InstanceConfig config) {
        return new NodeInstance(id, nodeType, parent, config);
    }
}
