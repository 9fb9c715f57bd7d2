package io.weaver.core.plan;

import io.weaver.core.model.PortRef;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.validation.Diagnostic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Everything the code generator needs to emit one workflow, decided ahead of generation.
///
/// ### Contracts
/// - **Precondition**: the graph passed validation without errors
/// - **Invariant**: every instance of the graph has exactly one {@link NodeStep}
/// - **Invariant**: every node of a layer's `order` is not a pull node
///
/// @param graph the planned workflow, not null
/// @param async whether the generated entry point returns a future
/// @param root layer of the workflow body, not null
/// @param scopes layers of scopes, by `owner.scope`, not null
/// @param steps planned node executions, by instance id, not null
/// @param materialized output ports that get a state slot, not null
/// @param warnings planning findings, not null
/// @see ExecutionPlanner for how plans are derived
public record ExecutionPlan(
        WorkflowGraph graph,
        boolean async,
        ScopeLayer root,
        Map<String, ScopeLayer> scopes,
        Map<String, NodeStep> steps,
        Set<PortRef> materialized,
        List<Diagnostic> warnings) {

    public ExecutionPlan {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(root, "root must not be null");
        scopes = Collections.unmodifiableMap(new LinkedHashMap<>(scopes));
        steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        materialized = Collections.unmodifiableSet(new LinkedHashSet<>(materialized));
        warnings = List.copyOf(warnings);
    }

    public String workflowName() {
        return graph.getName();
    }

    public NodeStep step(String nodeId) {
        NodeStep step = steps.get(nodeId);
        if (step == null) {
            throw new IllegalArgumentException("No planned step for node '" + nodeId + "'");
        }
        return step;
    }

    public Optional<ScopeLayer> scope(String ownerId, String scopeName) {
        return Optional.ofNullable(scopes.get(ScopeLayer.keyOf(ownerId, scopeName)));
    }

    /// Returns whether an output port holds a state slot.
    ///
    /// @param node instance id or `Start`, not null
    /// @param port output port name, not null
    /// @param scope scope of a scoped output, null otherwise
    public boolean isMaterialized(String node, String port, String scope) {
        return materialized.contains(new PortRef(node, port, scope));
    }

    /// Returns a copy with an extra warning.
    public ExecutionPlan withWarning(Diagnostic warning) {
        List<Diagnostic> all = new ArrayList<>(warnings);
        all.add(warning);
        return new ExecutionPlan(graph, async, root, scopes, steps, materialized, all);
    }

    /// Returns a copy with a different synchronicity.
    public ExecutionPlan withAsync(boolean async) {
        return new ExecutionPlan(graph, async, root, scopes, steps, materialized, warnings);
    }
}
