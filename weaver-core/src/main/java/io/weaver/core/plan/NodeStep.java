package io.weaver.core.plan;

import java.util.List;
import java.util.Objects;

/// Planned execution of one node instance.
///
/// @param nodeId instance id, not null
/// @param layer key of the layer the node runs in, `""` for the workflow body or
///     `owner.scope` inside a scope, not null
/// @param guard STEP condition, {@link StepGuard#NONE} when unguarded, not null
/// @param dataGuard same-layer data sources that must have executed first; only set for nodes
///     without STEP guard, not null
/// @param pull whether the node runs lazily on first demand
/// @param async whether the node's call returns a stage to await
/// @param recursive whether the node calls a workflow and needs a depth guard
public record NodeStep(
        String nodeId,
        String layer,
        StepGuard guard,
        List<String> dataGuard,
        boolean pull,
        boolean async,
        boolean recursive) {

    public NodeStep {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(layer, "layer must not be null");
        guard = guard != null ? guard : StepGuard.NONE;
        dataGuard = dataGuard != null ? List.copyOf(dataGuard) : List.of();
    }

    /// Returns true when the node runs only under a STEP or data condition.
    public boolean isGuarded() {
        return !guard.isEmpty() || !dataGuard.isEmpty();
    }
}
