package io.weaver.core.plan;

import io.weaver.core.builder.SourceUnit;
import io.weaver.core.model.Connection;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.model.Scope;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/// Derives an {@link ExecutionPlan} from a validated workflow graph.
///
/// ### Layers
/// The workflow body is one layer; the children of every scope form a layer of their own,
/// keyed `owner.scope`. Each layer is ordered separately. An edge between nodes of different
/// layers orders the ancestors that share a layer, so a node feeding a scope child runs before
/// the scope's owner.
///
/// ### Ordering
/// Kahn's algorithm over the control and data edges of a layer. Ready nodes leave the queue in
/// declaration order, which keeps the generated program stable across runs. Nodes left over
/// when the queue drains form a cycle and fail planning.
///
/// ### Synchronicity
/// {@link #planUnit(SourceUnit)} decides synchronicity for all workflows of a unit together:
/// a workflow is asynchronous when it is declared so, places an asynchronous node type, or
/// places a workflow of the unit that is asynchronous. A workflow declared synchronous that
/// turns out asynchronous gets a `SYNC_DECLARED_ASYNC_REQUIRED` warning.
///
/// ### Usage
/// {@snippet :
/// ExecutionPlanner planner = new ExecutionPlanner();
/// Map<String, ExecutionPlan> plans = planner.planUnit(unit);
/// String source = generator.generate(unit, plans, GenerateOptions.DEFAULTS);
/// }
///
/// @implNote Stateless and thread-safe.
public class ExecutionPlanner {

    private static final Logger logger = Logger.getLogger(ExecutionPlanner.class.getName());

    /// Plans a single workflow.
    ///
    /// Workflows of the same unit placed as nodes count as asynchronous only when declared so;
    /// use {@link #planUnit(SourceUnit)} to take their bodies into account.
    ///
    /// @param graph validated workflow graph, not null
    /// @return the plan, never null
    /// @throws PlanCreationException when the graph contains an ordering cycle
    public ExecutionPlan plan(WorkflowGraph graph) throws PlanCreationException {
        Set<String> asyncWorkflows = new LinkedHashSet<>();
        if (requiresAsync(graph, asyncWorkflows)) {
            asyncWorkflows.add(graph.getName());
        }
        return plan(graph, asyncWorkflows);
    }

    /// Plans every workflow of a source unit.
    ///
    /// @param unit built source unit whose workflows passed validation, not null
    /// @return plans by workflow name, in declaration order, never null
    /// @throws PlanCreationException when a workflow contains an ordering cycle
    public Map<String, ExecutionPlan> planUnit(SourceUnit unit) throws PlanCreationException {
        Set<String> asyncWorkflows = asyncWorkflows(unit.workflows());
        Map<String, ExecutionPlan> plans = new LinkedHashMap<>();
        for (WorkflowGraph graph : unit.workflows()) {
            plans.put(graph.getName(), plan(graph, asyncWorkflows));
        }
        logger.info("Planned " + plans.size() + " workflow(s) of " + unit.fileName());
        return plans;
    }

    private ExecutionPlan plan(WorkflowGraph graph, Set<String> asyncWorkflows)
            throws PlanCreationException {
        Layout layout = new Layout(graph);

        Map<String, NodeStep> steps = new LinkedHashMap<>();
        ScopeLayer root = null;
        Map<String, ScopeLayer> scopes = new LinkedHashMap<>();
        for (String key : layout.layerKeys()) {
            List<String> ordered = order(graph, layout, key);
            List<String> eager = new ArrayList<>();
            for (String nodeId : ordered) {
                NodeStep step = planStep(graph, layout, key, nodeId, steps, asyncWorkflows);
                steps.put(nodeId, step);
                if (!step.pull()) {
                    eager.add(nodeId);
                }
            }
            List<String> pullNodes =
                    layout.members(key).stream().filter(id -> steps.get(id).pull()).toList();
            ScopeLayer layer =
                    new ScopeLayer(key, layout.ownerOf(key), layout.scopeOf(key), eager, pullNodes);
            if (layer.isRoot()) {
                root = layer;
            } else {
                scopes.put(key, layer);
            }
        }

        boolean async = asyncWorkflows.contains(graph.getName());
        List<Diagnostic> warnings = new ArrayList<>();
        if (async && !graph.isDeclaredAsync()) {
            warnings.add(
                    Diagnostic.warning(
                            DiagnosticCode.SYNC_DECLARED_ASYNC_REQUIRED,
                            "Workflow '"
                                    + graph.getName()
                                    + "' is declared synchronous but calls asynchronous nodes;"
                                    + " generating an asynchronous entry point"));
        }

        ExecutionPlan plan =
                new ExecutionPlan(
                        graph, async, root, scopes, steps, materialized(graph), warnings);
        logger.fine(
                () ->
                        "Planned workflow '"
                                + graph.getName()
                                + "': "
                                + steps.size()
                                + " node(s), "
                                + scopes.size()
                                + " scope(s), async="
                                + async);
        return plan;
    }

    // ---------------- Ordering ----------------

    private List<String> order(WorkflowGraph graph, Layout layout, String key)
            throws PlanCreationException {
        List<String> members = layout.members(key);
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        members.forEach(
                id -> {
                    successors.put(id, new LinkedHashSet<>());
                    inDegree.put(id, 0);
                });

        for (Connection connection : graph.getConnections()) {
            String fromNode = connection.from().node();
            String toNode = connection.to().node();
            if (isBoundary(fromNode) || isBoundary(toNode)) {
                continue;
            }
            String from = layout.ancestorIn(fromNode, key);
            String to = layout.ancestorIn(toNode, key);
            if (from == null || to == null) {
                continue;
            }
            boolean lifted = !from.equals(fromNode) || !to.equals(toNode);
            if (lifted && from.equals(to)) {
                continue;
            }
            if (successors.get(from).add(to)) {
                inDegree.merge(to, 1, Integer::sum);
            }
        }

        Comparator<String> declarationOrder = Comparator.comparingInt(layout::indexOf);
        PriorityQueue<String> ready = new PriorityQueue<>(declarationOrder);
        members.stream().filter(id -> inDegree.get(id) == 0).forEach(ready::add);

        List<String> ordered = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            ordered.add(node);
            for (String next : successors.get(node)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        if (ordered.size() < members.size()) {
            List<String> cycle = members.stream().filter(id -> inDegree.get(id) > 0).toList();
            throw new PlanCreationException(
                    "Circular dependency detected in workflow '"
                            + graph.getName()
                            + "'"
                            + (key.isEmpty() ? "" : " (scope " + key + ")")
                            + ". Nodes in cycle: "
                            + String.join(", ", cycle));
        }
        return ordered;
    }

    // ---------------- Steps ----------------

    private NodeStep planStep(
            WorkflowGraph graph,
            Layout layout,
            String key,
            String nodeId,
            Map<String, NodeStep> planned,
            Set<String> asyncWorkflows) {
        NodeInstance instance = layout.instance(nodeId);
        NodeType type = graph.typeOf(instance).orElse(null);
        if (type == null) {
            throw new IllegalStateException(
                    "Instance '"
                            + nodeId
                            + "' is bound to unknown type '"
                            + instance.nodeType()
                            + "'");
        }

        boolean pull =
                instance.config().getPullExecution() != null || type.getPullExecution() != null;
        StepGuard guard = stepGuard(graph, layout, key, nodeId, type);
        List<String> dataGuard =
                guard.isEmpty() ? dataGuard(graph, layout, key, nodeId, type, planned) : List.of();
        boolean recursive = type.getVariant() == NodeVariant.IMPORTED_WORKFLOW;
        return new NodeStep(
                nodeId, key, guard, dataGuard, pull, isAsync(type, asyncWorkflows), recursive);
    }

    private StepGuard stepGuard(
            WorkflowGraph graph, Layout layout, String key, String nodeId, NodeType type) {
        Map<String, List<PortRef>> sources = new LinkedHashMap<>();
        for (Connection connection : graph.getConnections()) {
            if (!connection.to().node().equals(nodeId)) {
                continue;
            }
            Optional<Port> target = inputOf(type, connection.to());
            if (target.isEmpty() || !target.get().isStep() || target.get().isScoped()) {
                continue;
            }
            PortRef from = connection.from();
            if (from.node().equals(ReservedNames.START) || from.node().equals(nodeId)) {
                continue;
            }
            if (!isVisibleSource(layout, key, from)) {
                continue;
            }
            sources.computeIfAbsent(target.get().getName(), p -> new ArrayList<>()).add(from);
        }
        return sources.isEmpty() ? StepGuard.NONE : new StepGuard(type.getExecuteWhen(), sources);
    }

    private List<String> dataGuard(
            WorkflowGraph graph,
            Layout layout,
            String key,
            String nodeId,
            NodeType type,
            Map<String, NodeStep> planned) {
        Set<String> guards = new LinkedHashSet<>();
        for (Connection connection : graph.getConnections()) {
            if (!connection.to().node().equals(nodeId)) {
                continue;
            }
            Optional<Port> target = inputOf(type, connection.to());
            if (target.isEmpty() || target.get().isStep() || target.get().isScoped()) {
                continue;
            }
            String source = connection.from().node();
            if (isBoundary(source) || !key.equals(layout.layerOf(source))) {
                continue;
            }
            NodeStep sourceStep = planned.get(source);
            if (sourceStep != null && !sourceStep.pull() && sourceStep.isGuarded()) {
                guards.add(source);
            }
        }
        return List.copyOf(guards);
    }

    /// A source is visible when it runs in the same layer, or is the owner of the layer's
    /// scope signalling through its scoped ports.
    private boolean isVisibleSource(Layout layout, String key, PortRef from) {
        if (isBoundary(from.node())) {
            return false;
        }
        if (key.equals(layout.layerOf(from.node())) && !from.isScoped()) {
            return true;
        }
        return !key.isEmpty()
                && from.node().equals(layout.ownerOf(key))
                && key.equals(ScopeLayer.keyOf(from.node(), from.scope()));
    }

    private static Optional<Port> inputOf(NodeType type, PortRef ref) {
        String scope =
                ref.isScoped() && type.getScopes().contains(ref.scope()) ? ref.scope() : null;
        return type.findInput(ref.port(), scope);
    }

    // ---------------- Slots ----------------

    private Set<PortRef> materialized(WorkflowGraph graph) {
        Set<PortRef> slots = new LinkedHashSet<>();
        for (Connection connection : graph.getConnections()) {
            PortRef from = connection.from();
            if (from.node().equals(ReservedNames.START)) {
                slots.add(PortRef.of(from.node(), from.port()));
                continue;
            }
            Optional<NodeType> type = graph.findInstance(from.node()).flatMap(graph::typeOf);
            if (type.isEmpty()) {
                continue;
            }
            String scope =
                    from.isScoped() && type.get().getScopes().contains(from.scope())
                            ? from.scope()
                            : null;
            slots.add(new PortRef(from.node(), from.port(), scope));
        }
        return slots;
    }

    // ---------------- Synchronicity ----------------

    private Set<String> asyncWorkflows(List<WorkflowGraph> workflows) {
        Set<String> async = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (WorkflowGraph graph : workflows) {
                if (!async.contains(graph.getName()) && requiresAsync(graph, async)) {
                    async.add(graph.getName());
                    changed = true;
                }
            }
        }
        return async;
    }

    private boolean requiresAsync(WorkflowGraph graph, Set<String> asyncWorkflows) {
        if (graph.isDeclaredAsync()) {
            return true;
        }
        return graph.getInstances().stream()
                .map(graph::typeOf)
                .flatMap(Optional::stream)
                .anyMatch(type -> isAsync(type, asyncWorkflows));
    }

    private static boolean isAsync(NodeType type, Set<String> asyncWorkflows) {
        if (type.isAsync()) {
            return true;
        }
        return type.getImplementation() instanceof ImplementationRef.SameFile sameFile
                && asyncWorkflows.contains(sameFile.workflowName());
    }

    private static boolean isBoundary(String node) {
        return ReservedNames.isReservedNode(node);
    }

    /// Assignment of instances to layers.
    private static final class Layout {

        private final Map<String, NodeInstance> instances = new LinkedHashMap<>();
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, String> layerOf = new HashMap<>();
        private final Map<String, Scope> layers = new LinkedHashMap<>();

        Layout(WorkflowGraph graph) {
            List<NodeInstance> all = graph.getInstances();
            for (int i = 0; i < all.size(); i++) {
                NodeInstance instance = all.get(i);
                if (instances.putIfAbsent(instance.id(), instance) == null) {
                    index.put(instance.id(), i);
                }
            }

            layers.put(ScopeLayer.ROOT, null);
            for (NodeInstance instance : instances.values()) {
                List<String> scopes =
                        graph.typeOf(instance).map(NodeType::getScopes).orElse(List.of());
                for (String scope : scopes) {
                    layers.put(
                            ScopeLayer.keyOf(instance.id(), scope),
                            new Scope(instance.id(), scope, List.of()));
                }
            }

            for (NodeInstance instance : instances.values()) {
                String key = ScopeLayer.ROOT;
                if (instance.parent() != null) {
                    String candidate =
                            ScopeLayer.keyOf(
                                    instance.parent().ownerId(), instance.parent().scopeName());
                    if (layers.containsKey(candidate)) {
                        key = candidate;
                    }
                }
                layerOf.put(instance.id(), key);
            }
            for (Scope scope : graph.getScopes()) {
                if (!layers.containsKey(scope.key())) {
                    continue;
                }
                for (String child : scope.children()) {
                    if (ScopeLayer.ROOT.equals(layerOf.get(child))
                            && instances.get(child).parent() == null) {
                        layerOf.put(child, scope.key());
                    }
                }
            }
        }

        List<String> layerKeys() {
            return List.copyOf(layers.keySet());
        }

        List<String> members(String key) {
            return instances.keySet().stream().filter(id -> key.equals(layerOf.get(id))).toList();
        }

        NodeInstance instance(String id) {
            return instances.get(id);
        }

        int indexOf(String id) {
            return index.get(id);
        }

        String layerOf(String id) {
            return layerOf.get(id);
        }

        String ownerOf(String key) {
            Scope scope = layers.get(key);
            return scope != null ? scope.ownerId() : null;
        }

        String scopeOf(String key) {
            Scope scope = layers.get(key);
            return scope != null ? scope.name() : null;
        }

        /// Returns the node itself or its closest ancestor owner that runs in `key`.
        String ancestorIn(String id, String key) {
            String current = id;
            Set<String> seen = new LinkedHashSet<>();
            while (current != null && seen.add(current)) {
                String layer = layerOf.get(current);
                if (layer == null) {
                    return null;
                }
                if (layer.equals(key)) {
                    return current;
                }
                if (layer.isEmpty()) {
                    return null;
                }
                current = ownerOf(layer);
            }
            return null;
        }
    }
}
