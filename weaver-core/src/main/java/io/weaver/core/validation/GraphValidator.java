package io.weaver.core.validation;

import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortDirection;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.model.Scope;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.util.Suggestions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Checks a built workflow graph for structural, binding, typing and scoping problems.
///
/// Validation never mutates the graph and never stops at the first finding: every check runs
/// and contributes diagnostics in a fixed order, so validating the same graph twice yields
/// equal results.
///
/// ### Check order
/// 1. names and reserved ids
/// 2. type bindings and stubs
/// 3. connection endpoints and duplicate connections
/// 4. port type compatibility
/// 5. required inputs
/// 6. reachability and data flow
/// 7. cycles per scope layer
/// 8. multiply-connected inputs
/// 9. instance configuration
/// 10. scopes
///
/// ### Post-processing
/// Findings caused by an instance whose type does not resolve (unknown endpoints, undefined
/// nodes, missing inputs) are dropped; the `UNKNOWN_NODE_TYPE` error already names the cause.
/// In draft mode `STUB_NODE` and missing inputs of stub instances are reported as warnings.
/// Type-coercion findings are errors in strict mode, either from {@link ValidationOptions} or
/// from the workflow's `@strictTypes` tag.
///
/// @implNote Stateless and thread-safe. Each call works on its own {@link Run}.
/// @see TypeCoercionPolicy for the coercion table
public final class GraphValidator {

    private static final Logger logger = Logger.getLogger(GraphValidator.class.getName());

    private static final Set<DiagnosticCode> CASCADING =
            Set.of(
                    DiagnosticCode.UNKNOWN_SOURCE_NODE,
                    DiagnosticCode.UNKNOWN_TARGET_NODE,
                    DiagnosticCode.UNDEFINED_NODE,
                    DiagnosticCode.MISSING_REQUIRED_INPUT);

    /// Validates a workflow graph.
    ///
    /// @param graph the graph, not null
    /// @param options strict and draft switches, not null
    /// @return errors and warnings in check order, never null
    public ValidationResult validate(WorkflowGraph graph, ValidationOptions options) {
        Run run = new Run(graph, options);
        run.checkAll();
        ValidationResult result = run.result();
        logger.fine(
                () ->
                        "Validated workflow '"
                                + graph.getName()
                                + "': "
                                + result.errors().size()
                                + " error(s), "
                                + result.warnings().size()
                                + " warning(s)");
        return result;
    }

    /// Validates a pattern fragment.
    ///
    /// @param pattern the pattern, not null
    /// @return errors and warnings, never null
    public ValidationResult validatePattern(Pattern pattern) {
        List<Diagnostic> errors = new ArrayList<>();
        if (pattern.inputPorts().isEmpty() && pattern.outputPorts().isEmpty()) {
            errors.add(
                    Diagnostic.error(
                                    DiagnosticCode.PATTERN_NO_PORTS,
                                    "Pattern \""
                                            + pattern.name()
                                            + "\" declares no ports. Add @port IN.name or @port OUT.name.")
                            .atNode(pattern.name()));
        }
        for (NodeInstance instance : pattern.instances()) {
            if (!pattern.nodeTypes().containsKey(instance.nodeType())) {
                errors.add(unknownType(instance, pattern.nodeTypes().keySet()));
            }
        }
        return new ValidationResult(errors, List.of());
    }

    private static Diagnostic unknownType(NodeInstance instance, Collection<String> known) {
        return Diagnostic.error(
                        DiagnosticCode.UNKNOWN_NODE_TYPE,
                        "Node \""
                                + instance.id()
                                + "\" references unknown node type \""
                                + instance.nodeType()
                                + "\"."
                                + Suggestions.hint(instance.nodeType(), known))
                .atNode(instance.id());
    }

    /// State of one validation call.
    private static final class Run {

        private final WorkflowGraph graph;
        private final ValidationOptions options;
        private final boolean strict;
        private final List<Diagnostic> found = new ArrayList<>();
        private final Map<String, NodeInstance> instances = new LinkedHashMap<>();
        private final Map<String, NodeType> types = new HashMap<>();
        private final Set<String> unboundInstances = new HashSet<>();

        Run(WorkflowGraph graph, ValidationOptions options) {
            this.graph = graph;
            this.options = options;
            this.strict = options.strict() || graph.getOptions().strictTypes();
            for (NodeInstance instance : graph.getInstances()) {
                if (instances.putIfAbsent(instance.id(), instance) != null) {
                    continue;
                }
                NodeType type = graph.getNodeTypes().get(instance.nodeType());
                if (type != null) {
                    types.put(instance.id(), type);
                } else {
                    unboundInstances.add(instance.id());
                }
            }
        }

        void checkAll() {
            checkNames();
            checkBindings();
            checkConnections();
            checkTypes();
            checkRequiredInputs();
            checkUnusedNodes();
            checkStartAndExit();
            checkDataFlow();
            checkCycles();
            checkMultipleInputs();
            checkInstanceConfig();
            checkScopes();
        }

        ValidationResult result() {
            List<Diagnostic> errors = new ArrayList<>();
            List<Diagnostic> warnings = new ArrayList<>();
            for (Diagnostic diagnostic : found) {
                if (cascades(diagnostic)) {
                    continue;
                }
                Diagnostic adjusted = adjustForDraft(diagnostic);
                (adjusted.isError() ? errors : warnings).add(adjusted);
            }
            return new ValidationResult(errors, warnings);
        }

        private boolean cascades(Diagnostic diagnostic) {
            if (!CASCADING.contains(diagnostic.code())) {
                return false;
            }
            if (diagnostic.nodeId() != null && unboundInstances.contains(diagnostic.nodeId())) {
                return true;
            }
            Connection c = diagnostic.connection();
            return c != null
                    && (unboundInstances.contains(c.from().node())
                            || unboundInstances.contains(c.to().node()));
        }

        private Diagnostic adjustForDraft(Diagnostic diagnostic) {
            if (!options.draft()) {
                return diagnostic;
            }
            if (diagnostic.code() == DiagnosticCode.STUB_NODE) {
                return diagnostic.withSeverity(Severity.WARNING);
            }
            if (diagnostic.code() == DiagnosticCode.MISSING_REQUIRED_INPUT
                    && diagnostic.nodeId() != null
                    && isStub(diagnostic.nodeId())) {
                return diagnostic.withSeverity(Severity.WARNING);
            }
            return diagnostic;
        }

        private boolean isStub(String instanceId) {
            NodeType type = types.get(instanceId);
            return type != null && type.getVariant() == NodeVariant.STUB;
        }

        private void error(DiagnosticCode code, String message, String node) {
            found.add(Diagnostic.error(code, message).atNode(node));
        }

        private void warning(DiagnosticCode code, String message, String node) {
            found.add(Diagnostic.warning(code, message).atNode(node));
        }

        private void error(DiagnosticCode code, String message, Connection connection) {
            found.add(Diagnostic.error(code, message).atConnection(connection));
        }

        private void warning(DiagnosticCode code, String message, Connection connection) {
            found.add(Diagnostic.warning(code, message).atConnection(connection));
        }

        // ---------------- Names ----------------

        private void checkNames() {
            if (isBlank(graph.getName())) {
                error(DiagnosticCode.MISSING_WORKFLOW_NAME, "Workflow must have a name", (String) null);
            }
            if (isBlank(graph.getFunctionName())) {
                error(
                        DiagnosticCode.MISSING_FUNCTION_NAME,
                        "Workflow must have a function name",
                        (String) null);
            }
            Set<String> seen = new HashSet<>();
            for (NodeInstance instance : graph.getInstances()) {
                if (!seen.add(instance.id())) {
                    error(
                            DiagnosticCode.DUPLICATE_INSTANCE_ID,
                            "Duplicate instance ID \""
                                    + instance.id()
                                    + "\" in workflow. Each @node must have a unique ID.",
                            instance.id());
                }
            }
            for (String typeName : graph.getNodeTypes().keySet()) {
                if (ReservedNames.isReservedNode(typeName)) {
                    error(
                            DiagnosticCode.RESERVED_NODE_NAME,
                            "Node type name \"" + typeName + "\" is reserved. Reserved names: Start, Exit",
                            typeName);
                }
            }
            for (NodeInstance instance : graph.getInstances()) {
                if (ReservedNames.isReservedNode(instance.id())) {
                    error(
                            DiagnosticCode.RESERVED_INSTANCE_ID,
                            "Instance ID \""
                                    + instance.id()
                                    + "\" is reserved. Reserved names: Start, Exit",
                            instance.id());
                }
            }
        }

        // ---------------- Bindings ----------------

        private void checkBindings() {
            for (NodeInstance instance : graph.getInstances()) {
                NodeType type = graph.getNodeTypes().get(instance.nodeType());
                if (type == null) {
                    found.add(unknownType(instance, graph.getNodeTypes().keySet()));
                } else if (type.getVariant() == NodeVariant.STUB) {
                    error(
                            DiagnosticCode.STUB_NODE,
                            "Node \""
                                    + instance.id()
                                    + "\" uses stub type \""
                                    + type.getName()
                                    + "\" which has no implementation. Implement the method or"
                                    + " validate in draft mode.",
                            instance.id());
                }
            }
        }

        // ---------------- Connections ----------------

        private void checkConnections() {
            for (Connection c : graph.getConnections()) {
                checkSource(c);
                checkTarget(c);
            }
            Set<String> seen = new HashSet<>();
            for (Connection c : graph.getConnections()) {
                if (!seen.add(c.toString())) {
                    error(DiagnosticCode.DUPLICATE_CONNECTION, "Duplicate connection: " + c, c);
                }
            }
            Set<String> referenced = new LinkedHashSet<>();
            for (Connection c : graph.getConnections()) {
                referenced.add(c.from().node());
                referenced.add(c.to().node());
            }
            for (String node : referenced) {
                if (!ReservedNames.isReservedNode(node) && !instances.containsKey(node)) {
                    error(
                            DiagnosticCode.UNDEFINED_NODE,
                            "Workflow references undefined node: \"" + node + "\"",
                            node);
                }
            }
        }

        private void checkSource(Connection c) {
            PortRef from = c.from();
            if (ReservedNames.START.equals(from.node())) {
                if (names(graph.getStartPorts()).contains(from.port())) {
                    return;
                }
                error(
                        DiagnosticCode.UNKNOWN_SOURCE_PORT,
                        "Start node does not have output port \""
                                + from.port()
                                + "\"."
                                + Suggestions.hint(from.port(), names(graph.getStartPorts())),
                        c);
            } else if (ReservedNames.EXIT.equals(from.node())) {
                error(
                        DiagnosticCode.UNKNOWN_SOURCE_PORT,
                        "Exit node does not have output port \"" + from.port() + "\"",
                        c);
            } else if (!instances.containsKey(from.node())) {
                found.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_SOURCE_NODE,
                                        "Connection references unknown source node: \""
                                                + from.node()
                                                + "\"."
                                                + Suggestions.hint(from.node(), instances.keySet()))
                                .atNode(from.node())
                                .atConnection(c));
            } else {
                NodeType type = types.get(from.node());
                if (type == null || ownedByScopeChecks(type, from)) {
                    return;
                }
                if (type.findOutput(from.port(), null).isEmpty()) {
                    List<String> candidates = names(unscoped(type.getOutputs()));
                    found.add(
                            Diagnostic.error(
                                            DiagnosticCode.UNKNOWN_SOURCE_PORT,
                                            "Node \""
                                                    + from.node()
                                                    + "\" does not have output port \""
                                                    + from.port()
                                                    + "\"."
                                                    + Suggestions.hint(from.port(), candidates))
                                    .atPort(from.node(), from.port())
                                    .atConnection(c));
                }
            }
        }

        private void checkTarget(Connection c) {
            PortRef to = c.to();
            if (ReservedNames.EXIT.equals(to.node())) {
                if (names(graph.getExitPorts()).contains(to.port())) {
                    return;
                }
                error(
                        DiagnosticCode.UNKNOWN_TARGET_PORT,
                        "Exit node does not have input port \""
                                + to.port()
                                + "\"."
                                + Suggestions.hint(to.port(), names(graph.getExitPorts())),
                        c);
            } else if (ReservedNames.START.equals(to.node())) {
                error(
                        DiagnosticCode.UNKNOWN_TARGET_PORT,
                        "Start node does not have input port \"" + to.port() + "\"",
                        c);
            } else if (!instances.containsKey(to.node())) {
                found.add(
                        Diagnostic.error(
                                        DiagnosticCode.UNKNOWN_TARGET_NODE,
                                        "Connection references unknown target node: \""
                                                + to.node()
                                                + "\"."
                                                + Suggestions.hint(to.node(), instances.keySet()))
                                .atNode(to.node())
                                .atConnection(c));
            } else {
                NodeType type = types.get(to.node());
                if (type == null || ownedByScopeChecks(type, to)) {
                    return;
                }
                if (type.findInput(to.port(), null).isEmpty()) {
                    List<String> candidates = names(unscoped(type.getInputs()));
                    found.add(
                            Diagnostic.error(
                                            DiagnosticCode.UNKNOWN_TARGET_PORT,
                                            "Node \""
                                                    + to.node()
                                                    + "\" does not have input port \""
                                                    + to.port()
                                                    + "\"."
                                                    + Suggestions.hint(to.port(), candidates))
                                    .atPort(to.node(), to.port())
                                    .atConnection(c));
                }
            }
        }

        /// A qualified endpoint on a scope-owning type is checked with the scopes.
        private static boolean ownedByScopeChecks(NodeType type, PortRef ref) {
            return ref.isScoped() && !type.getScopes().isEmpty();
        }

        // ---------------- Types ----------------

        private void checkTypes() {
            for (Connection c : graph.getConnections()) {
                if (ReservedNames.isReservedNode(c.from().node())
                        || ReservedNames.isReservedNode(c.to().node())) {
                    continue;
                }
                Optional<Port> source = outputOf(c.from());
                Optional<Port> target = inputOf(c.to());
                if (source.isEmpty() || target.isEmpty()) {
                    continue;
                }
                checkTypes(c, source.get(), target.get());
            }
        }

        private void checkTypes(Connection c, Port source, Port target) {
            DataType from = source.getDataType();
            DataType to = target.getDataType();
            if (from == DataType.STEP && to != DataType.STEP) {
                error(
                        DiagnosticCode.STEP_PORT_TYPE_MISMATCH,
                        "STEP port \""
                                + c.from().port()
                                + "\" on node \""
                                + c.from().node()
                                + "\" cannot connect to non-STEP port \""
                                + c.to().port()
                                + "\" ("
                                + describe(target)
                                + ") on node \""
                                + c.to().node()
                                + "\"",
                        c);
                return;
            }
            if (to == DataType.STEP && from != DataType.STEP) {
                error(
                        DiagnosticCode.STEP_PORT_TYPE_MISMATCH,
                        "Non-STEP port \""
                                + c.from().port()
                                + "\" ("
                                + describe(source)
                                + ") on node \""
                                + c.from().node()
                                + "\" cannot connect to STEP port \""
                                + c.to().port()
                                + "\" on node \""
                                + c.to().node()
                                + "\"",
                        c);
                return;
            }
            if (from == DataType.STEP || c.isScoped() && (source.isScoped() || target.isScoped())) {
                return;
            }
            TypeCoercionPolicy.classify(from, to)
                    .ifPresent(finding -> reportCoercion(c, source, target, finding));
        }

        private void reportCoercion(
                Connection c, Port source, Port target, TypeCoercionPolicy.Finding finding) {
            String route = c.from() + " -> " + c.to();
            String message =
                    switch (finding.code()) {
                        case LOSSY_TYPE_COERCION -> "Lossy type coercion from "
                                + describe(source)
                                + " to "
                                + describe(target)
                                + " in connection "
                                + route
                                + ". "
                                + finding.reason()
                                + ". Add @strictTypes to the workflow to enforce type safety.";
                        case UNUSUAL_TYPE_COERCION -> "Unusual type coercion from "
                                + describe(source)
                                + " to "
                                + describe(target)
                                + " in connection "
                                + route
                                + ". "
                                + finding.reason()
                                + ".";
                        default -> "Type mismatch in connection "
                                + c.from()
                                + " ("
                                + describe(source)
                                + ") -> "
                                + c.to()
                                + " ("
                                + describe(target)
                                + "). Runtime coercion will be attempted.";
                    };
            Diagnostic diagnostic = strict
                    ? Diagnostic.error(finding.code(), message)
                    : Diagnostic.warning(finding.code(), message);
            found.add(diagnostic.atConnection(c));
        }

        private static String describe(Port port) {
            return port.getJavaType() != null
                    ? port.getJavaType() + " (" + port.getDataType() + ")"
                    : port.getDataType().name();
        }

        // ---------------- Inputs ----------------

        private void checkRequiredInputs() {
            for (NodeInstance instance : instances.values()) {
                NodeType type = types.get(instance.id());
                if (type == null || inDeclaredScope(instance)) {
                    continue;
                }
                for (String port : missingInputs(instance, type)) {
                    found.add(
                            Diagnostic.error(
                                            DiagnosticCode.MISSING_REQUIRED_INPUT,
                                            "Node \""
                                                    + instance.id()
                                                    + "\" has unconnected required input port \""
                                                    + port
                                                    + "\". Connect a value to it, or mark it optional"
                                                    + " with @input ["
                                                    + port
                                                    + "].")
                                    .atPort(instance.id(), port));
                }
            }
        }

        private List<String> missingInputs(NodeInstance instance, NodeType type) {
            List<String> missing = new ArrayList<>();
            for (Port port : type.getInputs()) {
                if (ReservedNames.EXECUTE.equals(port.getName())
                        || port.isScoped()
                        || port.isOptional()
                        || port.hasDefault()
                        || port.getExpression() != null
                        || instance.config().getPortExpressions().containsKey(port.getName())) {
                    continue;
                }
                boolean connected = graph.getConnections().stream()
                        .anyMatch(
                                c -> c.to().node().equals(instance.id())
                                        && c.to().port().equals(port.getName()));
                if (!connected) {
                    missing.add(port.getName());
                }
            }
            return missing;
        }

        private boolean inDeclaredScope(NodeInstance instance) {
            if (instance.parent() == null) {
                return false;
            }
            NodeType ownerType = types.get(instance.parent().ownerId());
            return ownerType != null && ownerType.getScopes().contains(instance.parent().scopeName());
        }

        // ---------------- Reachability ----------------

        private void checkUnusedNodes() {
            Set<String> used = new HashSet<>();
            for (Connection c : graph.getConnections()) {
                used.add(c.from().node());
                used.add(c.to().node());
            }
            for (String id : instances.keySet()) {
                if (!used.contains(id)) {
                    warning(
                            DiagnosticCode.UNUSED_NODE,
                            "Node \"" + id + "\" is defined but never used in workflow",
                            id);
                }
            }
        }

        private void checkStartAndExit() {
            List<Connection> connections = graph.getConnections();
            if (connections.stream().noneMatch(c -> ReservedNames.START.equals(c.from().node()))) {
                warning(
                        DiagnosticCode.NO_START_CONNECTIONS,
                        "Workflow has no connections from Start node",
                        (String) null);
            }
            if (connections.stream().noneMatch(c -> ReservedNames.EXIT.equals(c.to().node()))) {
                warning(
                        DiagnosticCode.NO_EXIT_CONNECTIONS,
                        "Workflow has no connections to Exit node (no return value)",
                        (String) null);
            }
            for (Port port : graph.getExitPorts()) {
                if (ReservedNames.isControlSignal(port.getName()) && port.getDataType() != DataType.STEP) {
                    error(
                            DiagnosticCode.INVALID_EXIT_PORT_TYPE,
                            "Exit port '"
                                    + port.getName()
                                    + "' must be of type STEP (control flow), found: "
                                    + port.getDataType(),
                            ReservedNames.EXIT);
                }
            }
        }

        private void checkDataFlow() {
            Set<String> connectedOutputs = new HashSet<>();
            for (Connection c : graph.getConnections()) {
                connectedOutputs.add(c.from().node() + "." + c.from().port());
            }
            for (NodeInstance instance : instances.values()) {
                NodeType type = types.get(instance.id());
                if (type == null) {
                    continue;
                }
                for (Port port : type.getOutputs()) {
                    if (port.isControlFlow() || port.isFailure() || port.isScoped() || port.isStep()) {
                        continue;
                    }
                    if (!connectedOutputs.contains(instance.id() + "." + port.getName())) {
                        found.add(
                                Diagnostic.warning(
                                                DiagnosticCode.UNUSED_OUTPUT_PORT,
                                                "Output port \""
                                                        + port.getName()
                                                        + "\" of node \""
                                                        + instance.id()
                                                        + "\" is never connected. Data will be discarded.")
                                        .atPort(instance.id(), port.getName()));
                    }
                }
            }

            Map<String, List<Connection>> exitSources = new LinkedHashMap<>();
            for (Connection c : graph.getConnections()) {
                if (ReservedNames.EXIT.equals(c.to().node())) {
                    exitSources.computeIfAbsent(c.to().port(), k -> new ArrayList<>()).add(c);
                }
            }
            for (Port port : graph.getExitPorts()) {
                if (port.isControlFlow() || port.isStep()) {
                    continue;
                }
                if (!exitSources.containsKey(port.getName())) {
                    found.add(
                            Diagnostic.warning(
                                            DiagnosticCode.UNREACHABLE_EXIT_PORT,
                                            "Exit port \""
                                                    + port.getName()
                                                    + "\" has no incoming connection. The result"
                                                    + " will hold null.")
                                    .atPort(ReservedNames.EXIT, port.getName()));
                }
            }
            for (Map.Entry<String, List<Connection>> entry : exitSources.entrySet()) {
                List<Connection> sources = entry.getValue();
                boolean step = graph.getExitPorts().stream()
                        .anyMatch(p -> p.getName().equals(entry.getKey()) && p.isStep());
                if (step || sources.size() < 2 || mutuallyExclusive(sources)) {
                    continue;
                }
                List<String> names = sources.stream().map(c -> c.from().toString()).toList();
                found.add(
                        Diagnostic.warning(
                                        DiagnosticCode.MULTIPLE_EXIT_CONNECTIONS,
                                        "Exit port \""
                                                + entry.getKey()
                                                + "\" has "
                                                + sources.size()
                                                + " incoming connections ("
                                                + String.join(", ", names)
                                                + "). The first non-null value is returned;"
                                                + " consider separate Exit ports.")
                                .atPort(ReservedNames.EXIT, entry.getKey()));
            }
        }

        /// Whether every pair of sources lies on opposite `onSuccess`/`onFailure` branches of a
        /// common node.
        private boolean mutuallyExclusive(List<Connection> sources) {
            List<Set<String>> branches = sources.stream().map(this::branchesLeadingTo).toList();
            for (int i = 0; i < branches.size(); i++) {
                for (int j = i + 1; j < branches.size(); j++) {
                    if (!opposite(branches.get(i), branches.get(j))) {
                        return false;
                    }
                }
            }
            return true;
        }

        /// Collects `node.onSuccess` / `node.onFailure` edges on any path ending in `c`.
        private Set<String> branchesLeadingTo(Connection c) {
            Set<String> branches = new HashSet<>();
            Set<String> visited = new HashSet<>();
            Deque<Connection> queue = new ArrayDeque<>();
            queue.add(c);
            while (!queue.isEmpty()) {
                Connection edge = queue.poll();
                if (ReservedNames.isControlSignal(edge.from().port())) {
                    branches.add(edge.from().node() + "." + edge.from().port());
                }
                if (visited.add(edge.from().node())) {
                    for (Connection incoming : graph.getConnections()) {
                        if (incoming.to().node().equals(edge.from().node())) {
                            queue.add(incoming);
                        }
                    }
                }
            }
            return branches;
        }

        private static boolean opposite(Set<String> a, Set<String> b) {
            for (String branch : a) {
                int dot = branch.lastIndexOf('.');
                String node = branch.substring(0, dot);
                String other = branch.endsWith(ReservedNames.ON_SUCCESS)
                        ? node + "." + ReservedNames.ON_FAILURE
                        : node + "." + ReservedNames.ON_SUCCESS;
                if (!a.contains(other) && b.contains(other) && !b.contains(branch)) {
                    return true;
                }
            }
            return false;
        }

        // ---------------- Cycles ----------------

        private void checkCycles() {
            Map<String, List<String>> layers = new LinkedHashMap<>();
            for (NodeInstance instance : instances.values()) {
                layers.computeIfAbsent(layerOf(instance), k -> new ArrayList<>()).add(instance.id());
            }
            for (Map.Entry<String, List<String>> layer : layers.entrySet()) {
                Set<String> members = new HashSet<>(layer.getValue());
                Map<String, List<String>> edges = new HashMap<>();
                for (Connection c : graph.getConnections()) {
                    if (c.isScoped()
                            || c.from().node().equals(c.to().node())
                            || !members.contains(c.from().node())
                            || !members.contains(c.to().node())) {
                        continue;
                    }
                    edges.computeIfAbsent(c.from().node(), k -> new ArrayList<>()).add(c.to().node());
                }
                new CycleSearch(layer.getKey(), edges).run(layer.getValue());
            }
        }

        private static String layerOf(NodeInstance instance) {
            return instance.parent() != null ? instance.parent().toString() : "";
        }

        /// Depth-first search for loops inside one scope layer.
        private final class CycleSearch {
            private final String layer;
            private final Map<String, List<String>> edges;
            private final Set<String> visited = new HashSet<>();
            private final Set<String> onStack = new HashSet<>();
            private final Set<Set<String>> reported = new HashSet<>();

            CycleSearch(String layer, Map<String, List<String>> edges) {
                this.layer = layer;
                this.edges = edges;
            }

            void run(List<String> nodes) {
                for (String node : nodes) {
                    if (!visited.contains(node)) {
                        visit(node, new ArrayList<>());
                    }
                }
            }

            private boolean visit(String node, List<String> path) {
                if (onStack.contains(node)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
                    if (reported.add(new HashSet<>(cycle))) {
                        cycle.add(node);
                        String where = layer.isEmpty() ? "" : " in scope \"" + layer + "\"";
                        error(
                                DiagnosticCode.CYCLE_DETECTED,
                                "Loop detected" + where + ": " + String.join(" -> ", cycle),
                                node);
                    }
                    return true;
                }
                if (visited.contains(node)) {
                    return false;
                }
                onStack.add(node);
                path.add(node);
                boolean cyclic = false;
                for (String next : edges.getOrDefault(node, List.of())) {
                    cyclic |= visit(next, path);
                }
                path.remove(path.size() - 1);
                onStack.remove(node);
                if (!cyclic) {
                    visited.add(node);
                }
                return cyclic;
            }
        }

        // ---------------- Multiple inputs ----------------

        private void checkMultipleInputs() {
            Map<String, List<Connection>> byTarget = new LinkedHashMap<>();
            for (Connection c : graph.getConnections()) {
                if (ReservedNames.EXIT.equals(c.to().node())) {
                    continue;
                }
                Optional<Port> target = inputOf(c.to());
                if (target.isPresent()
                        && (target.get().isStep() || target.get().getMergeStrategy() != null)) {
                    continue;
                }
                byTarget.computeIfAbsent(c.to().toString(), k -> new ArrayList<>()).add(c);
            }
            for (List<Connection> sources : byTarget.values()) {
                if (sources.size() < 2) {
                    continue;
                }
                Connection first = sources.get(0);
                List<String> names = sources.stream().map(c -> c.from().toString()).toList();
                found.add(
                        Diagnostic.error(
                                        DiagnosticCode.MULTIPLE_CONNECTIONS_TO_INPUT,
                                        "Input port \""
                                                + first.to().port()
                                                + "\" on node \""
                                                + first.to().node()
                                                + "\" has "
                                                + sources.size()
                                                + " connections ("
                                                + String.join(", ", names)
                                                + "). Only one value can be received.")
                                .atPort(first.to().node(), first.to().port())
                                .atConnection(first));
            }
        }

        // ---------------- Instance configuration ----------------

        private void checkInstanceConfig() {
            for (NodeType type : graph.getNodeTypes().values()) {
                String pull = type.getPullExecution();
                if (pull != null && type.findInput(pull, null).isEmpty()) {
                    error(
                            DiagnosticCode.INVALID_PULL_EXECUTION_PORT,
                            "Node type \""
                                    + type.getName()
                                    + "\" pulls on port \""
                                    + pull
                                    + "\", but it has no such input."
                                    + Suggestions.hint(pull, names(unscoped(type.getInputs()))),
                            type.getName());
                }
                for (String scope : type.getScopes()) {
                    if (type.scopedPorts(scope, PortDirection.INPUT).isEmpty()
                            && type.scopedPorts(scope, PortDirection.OUTPUT).isEmpty()) {
                        error(
                                DiagnosticCode.SCOPE_NO_PORTS,
                                "Node type \""
                                        + type.getName()
                                        + "\" declares scope \""
                                        + scope
                                        + "\" but none of its ports belongs to it.",
                                type.getName());
                    }
                }
            }

            for (NodeInstance instance : instances.values()) {
                NodeType type = types.get(instance.id());
                if (type == null) {
                    continue;
                }
                Set<String> ports = new LinkedHashSet<>(names(type.getInputs()));
                ports.addAll(names(type.getOutputs()));
                Set<String> referenced =
                        new LinkedHashSet<>(instance.config().getPortExpressions().keySet());
                referenced.addAll(instance.config().getPortOrder().keySet());
                referenced.addAll(instance.config().getPortLabels().keySet());
                for (String port : referenced) {
                    if (!ports.contains(port)) {
                        found.add(
                                Diagnostic.warning(
                                                DiagnosticCode.INVALID_PORT_CONFIG_REF,
                                                "Instance \""
                                                        + instance.id()
                                                        + "\" references port \""
                                                        + port
                                                        + "\" in its configuration, but this port does not"
                                                        + " exist on node type \""
                                                        + type.getName()
                                                        + "\"."
                                                        + Suggestions.hint(port, ports))
                                        .atPort(instance.id(), port));
                    }
                }
                String pull = instance.config().getPullExecution();
                if (pull != null && type.findInput(pull, null).isEmpty()) {
                    found.add(
                            Diagnostic.error(
                                            DiagnosticCode.INVALID_PULL_EXECUTION_PORT,
                                            "Instance \""
                                                    + instance.id()
                                                    + "\" pulls on port \""
                                                    + pull
                                                    + "\", but node type \""
                                                    + type.getName()
                                                    + "\" has no such input."
                                                    + Suggestions.hint(
                                                            pull, names(unscoped(type.getInputs()))))
                                    .atPort(instance.id(), pull));
                }
            }
        }

        // ---------------- Scopes ----------------

        private void checkScopes() {
            Map<String, String> membership = new HashMap<>();
            for (Scope scope : graph.getScopes()) {
                for (String child : scope.children()) {
                    String previous = membership.putIfAbsent(child, scope.key());
                    if (previous != null && !previous.equals(scope.key())) {
                        error(
                                DiagnosticCode.SCOPE_INCONSISTENT,
                                "Instance \""
                                        + child
                                        + "\" appears in multiple scopes: \""
                                        + previous
                                        + "\" and \""
                                        + scope.key()
                                        + "\". A node can only belong to one scope.",
                                child);
                    } else if (!instances.containsKey(child)) {
                        error(
                                DiagnosticCode.SCOPE_INCONSISTENT,
                                "Scope \"" + scope.key() + "\" lists unknown instance \"" + child + "\".",
                                child);
                    }
                }
                NodeType ownerType = types.get(scope.ownerId());
                if (ownerType != null && !ownerType.getScopes().contains(scope.name())) {
                    error(
                            DiagnosticCode.SCOPE_WRONG_SCOPE_NAME,
                            "Instance \""
                                    + scope.ownerId()
                                    + "\" has no scope \""
                                    + scope.name()
                                    + "\"."
                                    + available(ownerType),
                            scope.ownerId());
                }
            }

            for (NodeInstance owner : instances.values()) {
                NodeType type = types.get(owner.id());
                if (type == null || type.getScopes().isEmpty()) {
                    continue;
                }
                checkScopeQualifiers(owner, type);
                for (String scope : type.getScopes()) {
                    checkScope(owner, type, scope);
                }
            }
        }

        private void checkScopeQualifiers(NodeInstance owner, NodeType type) {
            for (Connection c : graph.getConnections()) {
                if (c.from().isScoped()
                        && c.from().node().equals(owner.id())
                        && !type.getScopes().contains(c.from().scope())) {
                    error(
                            DiagnosticCode.SCOPE_WRONG_SCOPE_NAME,
                            "Connection from \""
                                    + owner.id()
                                    + "."
                                    + c.from().port()
                                    + "\" uses scope qualifier \":"
                                    + c.from().scope()
                                    + "\" but node \""
                                    + owner.id()
                                    + "\" does not define scope \""
                                    + c.from().scope()
                                    + "\"."
                                    + available(type),
                            c);
                }
                if (c.to().isScoped()
                        && c.to().node().equals(owner.id())
                        && !type.getScopes().contains(c.to().scope())) {
                    error(
                            DiagnosticCode.SCOPE_WRONG_SCOPE_NAME,
                            "Connection to \""
                                    + owner.id()
                                    + "."
                                    + c.to().port()
                                    + "\" uses scope qualifier \":"
                                    + c.to().scope()
                                    + "\" but node \""
                                    + owner.id()
                                    + "\" does not define scope \""
                                    + c.to().scope()
                                    + "\"."
                                    + available(type),
                            c);
                }
            }
        }

        private static String available(NodeType type) {
            return " Available scopes: " + String.join(", ", type.getScopes()) + ".";
        }

        private void checkScope(NodeInstance owner, NodeType type, String scope) {
            String ownerId = owner.id();
            Set<String> children = new LinkedHashSet<>();
            graph.findScope(ownerId, scope).ifPresent(s -> children.addAll(s.children()));
            graph.childrenOf(ownerId, scope).forEach(child -> children.add(child.id()));
            children.retainAll(instances.keySet());
            if (children.isEmpty()) {
                warning(
                        DiagnosticCode.SCOPE_EMPTY,
                        "Scope \"" + scope + "\" on node \"" + ownerId + "\" has no child nodes.",
                        ownerId);
                return;
            }

            List<Connection> scoped = new ArrayList<>();
            for (Connection c : graph.getConnections()) {
                boolean fromOwner = ownerId.equals(c.from().node()) && scope.equals(c.from().scope());
                boolean toOwner = ownerId.equals(c.to().node()) && scope.equals(c.to().scope());
                if (fromOwner || toOwner) {
                    scoped.add(c);
                }
            }

            for (Connection c : scoped) {
                if (ownerId.equals(c.from().node()) && scope.equals(c.from().scope())) {
                    Optional<Port> port = type.findOutput(c.from().port(), scope);
                    if (port.isEmpty()) {
                        scopeUnknownPort(c, c.from(), type, scope, PortDirection.OUTPUT);
                    } else if (!children.contains(c.to().node()) && !ownerId.equals(c.to().node())) {
                        error(
                                DiagnosticCode.SCOPE_CONNECTION_OUTSIDE,
                                "Scoped output \""
                                        + c.from()
                                        + "\" targets \""
                                        + c.to().node()
                                        + "\" which is not inside scope \""
                                        + scope
                                        + "\" of \""
                                        + ownerId
                                        + "\".",
                                c);
                    } else {
                        inputOf(c.to()).ifPresent(child -> scopePortTypes(c, scope, port.get(), child));
                    }
                }
                if (ownerId.equals(c.to().node()) && scope.equals(c.to().scope())) {
                    Optional<Port> port = type.findInput(c.to().port(), scope);
                    if (port.isEmpty()) {
                        scopeUnknownPort(c, c.to(), type, scope, PortDirection.INPUT);
                    } else if (!children.contains(c.from().node()) && !ownerId.equals(c.from().node())) {
                        error(
                                DiagnosticCode.SCOPE_CONNECTION_OUTSIDE,
                                "Scoped input \""
                                        + c.to()
                                        + "\" is fed from \""
                                        + c.from().node()
                                        + "\" which is not inside scope \""
                                        + scope
                                        + "\" of \""
                                        + ownerId
                                        + "\".",
                                c);
                    } else {
                        outputOf(c.from()).ifPresent(child -> scopePortTypes(c, scope, child, port.get()));
                    }
                }
            }

            for (String childId : children) {
                NodeType childType = types.get(childId);
                if (childType == null) {
                    continue;
                }
                for (String port : missingInputs(instances.get(childId), childType)) {
                    found.add(
                            Diagnostic.error(
                                            DiagnosticCode.SCOPE_MISSING_REQUIRED_INPUT,
                                            "Scoped child \""
                                                    + childId
                                                    + "\" has unconnected required input \""
                                                    + port
                                                    + "\" within scope \""
                                                    + scope
                                                    + "\" of \""
                                                    + ownerId
                                                    + "\".")
                                    .atPort(childId, port));
                }
            }

            for (Port port : type.scopedPorts(scope, PortDirection.INPUT)) {
                if (ReservedNames.isScopedMandatoryPort(port.getName())) {
                    continue;
                }
                boolean wired = scoped.stream()
                        .anyMatch(
                                c -> ownerId.equals(c.to().node())
                                        && c.to().port().equals(port.getName()));
                if (!wired) {
                    found.add(
                            Diagnostic.warning(
                                            DiagnosticCode.SCOPE_UNUSED_INPUT,
                                            "Scoped input port \""
                                                    + port.getName()
                                                    + "\" of \""
                                                    + ownerId
                                                    + "\" (scope \""
                                                    + scope
                                                    + "\") has no connection from inner nodes. Data will"
                                                    + " not flow back from the scope.")
                                    .atPort(ownerId, port.getName()));
                }
            }

            for (String childId : children) {
                boolean linked = scoped.stream()
                        .anyMatch(c -> childId.equals(c.from().node()) || childId.equals(c.to().node()));
                if (!linked) {
                    warning(
                            DiagnosticCode.SCOPE_ORPHANED_CHILD,
                            "Child node \""
                                    + childId
                                    + "\" is declared inside scope \""
                                    + scope
                                    + "\" of \""
                                    + ownerId
                                    + "\" but has no scoped connections to or from the parent.",
                            childId);
                }
            }
        }

        private void scopeUnknownPort(
                Connection c, PortRef ref, NodeType type, String scope, PortDirection direction) {
            boolean output = direction == PortDirection.OUTPUT;
            Optional<Port> unscoped =
                    output ? type.findOutput(ref.port(), null) : type.findInput(ref.port(), null);
            String kind = output ? "output" : "input";
            String message;
            if (unscoped.isPresent()) {
                message = "Port \""
                        + ref.port()
                        + "\" on \""
                        + ref.node()
                        + "\" is not a scoped "
                        + kind
                        + " of scope \""
                        + scope
                        + "\" (it is an unscoped port).";
            } else {
                List<String> names = names(type.scopedPorts(scope, direction));
                message = "Scoped connection references non-existent "
                        + kind
                        + " port \""
                        + ref.port()
                        + "\" on \""
                        + ref.node()
                        + "\" in scope \""
                        + scope
                        + "\". Available scoped "
                        + kind
                        + "s: "
                        + (names.isEmpty() ? "none" : String.join(", ", names))
                        + ".";
            }
            error(DiagnosticCode.SCOPE_UNKNOWN_PORT, message, c);
        }

        private void scopePortTypes(Connection c, String scope, Port source, Port target) {
            DataType from = source.getDataType();
            DataType to = target.getDataType();
            if (from == DataType.STEP || to == DataType.STEP || from == to) {
                return;
            }
            if (from == DataType.ANY || to == DataType.ANY) {
                return;
            }
            warning(
                    DiagnosticCode.SCOPE_PORT_TYPE_MISMATCH,
                    "Type mismatch in scope \""
                            + scope
                            + "\": \""
                            + c.from()
                            + "\" outputs "
                            + describe(source)
                            + " but \""
                            + c.to()
                            + "\" expects "
                            + describe(target)
                            + ".",
                    c);
        }

        // ---------------- Lookups ----------------

        /// Resolves the output behind a connection source, honoring a scope qualifier only on
        /// the type that declares the scope.
        private Optional<Port> outputOf(PortRef ref) {
            NodeType type = types.get(ref.node());
            if (type == null) {
                return Optional.empty();
            }
            String scope = ref.isScoped() && type.getScopes().contains(ref.scope()) ? ref.scope() : null;
            return type.findOutput(ref.port(), scope);
        }

        private Optional<Port> inputOf(PortRef ref) {
            NodeType type = types.get(ref.node());
            if (type == null) {
                return Optional.empty();
            }
            String scope = ref.isScoped() && type.getScopes().contains(ref.scope()) ? ref.scope() : null;
            return type.findInput(ref.port(), scope);
        }

        private static List<Port> unscoped(List<Port> ports) {
            return ports.stream().filter(p -> !p.isScoped()).toList();
        }

        private static List<String> names(List<Port> ports) {
            return ports.stream().map(Port::getName).toList();
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
