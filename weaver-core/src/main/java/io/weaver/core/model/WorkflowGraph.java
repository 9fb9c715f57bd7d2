package io.weaver.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable workflow definition: the executable control-flow graph of one annotated method.
///
/// A graph is a pure data structure built from a source unit's annotations. It holds the
/// ports of the two reserved pseudo nodes (`Start` exposes the start ports, `Exit` the exit
/// ports), the node types available to its instances, the instances themselves, the
/// connections between their ports and the scope table describing nested regions.
///
/// ### Structure
/// - **Start ports**: `execute` followed by the workflow's parameters
/// - **Exit ports**: `onSuccess`, `onFailure` followed by the workflow's results
/// - **Node types**: every type the instances can bind to, keyed by name
/// - **Instances**: node placements, in declaration order
/// - **Connections**: port-to-port edges, in declaration order
/// - **Scopes**: owner instance, scope name and member instances
///
/// ### Validation
/// Building a graph checks nothing beyond required fields. Structural and type consistency
/// is checked by {@link io.weaver.core.validation.GraphValidator}; only graphs without errors
/// reach the planner.
///
/// @implNote Immutable and thread-safe after construction. All collections are unmodifiable.
/// Operations that change a graph return a new graph.
///
/// @see io.weaver.core.validation.GraphValidator for structural checks
/// @see io.weaver.core.plan.ExecutionPlanner for scheduling
public final class WorkflowGraph {

    private final String name;
    private final String functionName;
    private final String description;
    private final String sourceFile;
    private final List<Port> startPorts;
    private final List<Port> exitPorts;
    private final Map<String, NodeType> nodeTypes;
    private final List<NodeInstance> instances;
    private final List<Connection> connections;
    private final List<Scope> scopes;
    private final WorkflowOptions options;
    private final boolean declaredAsync;
    private final Map<String, Position> positions;

    private WorkflowGraph(Builder builder) {
        this.name = builder.name;
        this.functionName =
                builder.functionName != null
                        ? builder.functionName
                        : Objects.requireNonNullElse(builder.name, "");
        this.description = builder.description;
        this.sourceFile = builder.sourceFile;
        this.startPorts = List.copyOf(builder.startPorts);
        this.exitPorts = List.copyOf(builder.exitPorts);
        this.nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeTypes));
        this.instances = List.copyOf(builder.instances);
        this.connections = List.copyOf(builder.connections);
        this.scopes = List.copyOf(builder.scopes);
        this.options = builder.options != null ? builder.options : WorkflowOptions.DEFAULTS;
        this.declaredAsync = builder.declaredAsync;
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.positions));
    }

    /// Returns the workflow name.
    ///
    /// @return name, or null when the declaration lacked one (reported by the validator)
    public String getName() {
        return name;
    }

    /// Returns the name of the annotated method, used for the generated entry point.
    public String getFunctionName() {
        return functionName;
    }

    public String getDescription() {
        return description;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    /// Returns the ports exposed by `Start`: `execute` and the workflow parameters.
    public List<Port> getStartPorts() {
        return startPorts;
    }

    /// Returns the ports exposed by `Exit`: `onSuccess`, `onFailure` and the results.
    public List<Port> getExitPorts() {
        return exitPorts;
    }

    public Map<String, NodeType> getNodeTypes() {
        return nodeTypes;
    }

    public List<NodeInstance> getInstances() {
        return instances;
    }

    public List<Connection> getConnections() {
        return connections;
    }

    public List<Scope> getScopes() {
        return scopes;
    }

    public WorkflowOptions getOptions() {
        return options;
    }

    /// Returns whether the author declared the workflow asynchronous.
    public boolean isDeclaredAsync() {
        return declaredAsync;
    }

    /// Returns canvas positions of `Start` and `Exit`.
    public Map<String, Position> getPositions() {
        return positions;
    }

    /// Finds an instance by id.
    public Optional<NodeInstance> findInstance(String id) {
        return instances.stream().filter(i -> i.id().equals(id)).findFirst();
    }

    /// Resolves the node type bound to an instance.
    ///
    /// @param instance the instance, not null
    /// @return the bound type, empty when the binding does not resolve
    public Optional<NodeType> typeOf(NodeInstance instance) {
        return Optional.ofNullable(nodeTypes.get(instance.nodeType()));
    }

    /// Finds the scope an owner exposes under a name.
    public Optional<Scope> findScope(String ownerId, String scopeName) {
        return scopes.stream()
                .filter(s -> s.ownerId().equals(ownerId) && s.name().equals(scopeName))
                .findFirst();
    }

    /// Returns the instances nested in one scope, in declaration order.
    public List<NodeInstance> childrenOf(String ownerId, String scopeName) {
        return instances.stream()
                .filter(i -> i.parent() != null)
                .filter(i -> i.parent().ownerId().equals(ownerId))
                .filter(i -> i.parent().scopeName().equals(scopeName))
                .toList();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.name = name;
        b.functionName = functionName;
        b.description = description;
        b.sourceFile = sourceFile;
        b.startPorts.addAll(startPorts);
        b.exitPorts.addAll(exitPorts);
        b.nodeTypes.putAll(nodeTypes);
        b.instances.addAll(instances);
        b.connections.addAll(connections);
        b.scopes.addAll(scopes);
        b.options = options;
        b.declaredAsync = declaredAsync;
        b.positions.putAll(positions);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable WorkflowGraph instances.
    ///
    /// No field is required: an incomplete graph is still a value the validator can report
    /// on.
    public static final class Builder {
        private String name;
        private String functionName;
        private String description;
        private String sourceFile;
        private final List<Port> startPorts = new ArrayList<>();
        private final List<Port> exitPorts = new ArrayList<>();
        private final Map<String, NodeType> nodeTypes = new LinkedHashMap<>();
        private final List<NodeInstance> instances = new ArrayList<>();
        private final List<Connection> connections = new ArrayList<>();
        private final List<Scope> scopes = new ArrayList<>();
        private WorkflowOptions options = WorkflowOptions.DEFAULTS;
        private boolean declaredAsync;
        private final Map<String, Position> positions = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder startPort(Port port) {
            this.startPorts.add(port);
            return this;
        }

        public Builder startPorts(List<Port> ports) {
            this.startPorts.clear();
            this.startPorts.addAll(ports);
            return this;
        }

        public Builder exitPort(Port port) {
            this.exitPorts.add(port);
            return this;
        }

        public Builder exitPorts(List<Port> ports) {
            this.exitPorts.clear();
            this.exitPorts.addAll(ports);
            return this;
        }

        public Builder nodeType(NodeType nodeType) {
            this.nodeTypes.put(nodeType.getName(), nodeType);
            return this;
        }

        public Builder nodeTypes(Map<String, NodeType> nodeTypes) {
            this.nodeTypes.clear();
            this.nodeTypes.putAll(nodeTypes);
            return this;
        }

        public Builder instance(NodeInstance instance) {
            this.instances.add(instance);
            return this;
        }

        public Builder instances(List<NodeInstance> instances) {
            this.instances.clear();
            this.instances.addAll(instances);
            return this;
        }

        public Builder connection(Connection connection) {
            this.connections.add(connection);
            return this;
        }

        public Builder connections(List<Connection> connections) {
            this.connections.clear();
            this.connections.addAll(connections);
            return this;
        }

        public Builder scope(Scope scope) {
            this.scopes.add(scope);
            return this;
        }

        public Builder scopes(List<Scope> scopes) {
            this.scopes.clear();
            this.scopes.addAll(scopes);
            return this;
        }

        public Builder options(WorkflowOptions options) {
            this.options = options;
            return this;
        }

        public Builder declaredAsync(boolean declaredAsync) {
            this.declaredAsync = declaredAsync;
            return this;
        }

        public Builder position(String node, Position position) {
            this.positions.put(node, position);
            return this;
        }

        public Builder positions(Map<String, Position> positions) {
            this.positions.clear();
            this.positions.putAll(positions);
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowGraph that)) return false;
        return declaredAsync == that.declaredAsync
                && Objects.equals(name, that.name)
                && functionName.equals(that.functionName)
                && Objects.equals(description, that.description)
                && Objects.equals(sourceFile, that.sourceFile)
                && startPorts.equals(that.startPorts)
                && exitPorts.equals(that.exitPorts)
                && nodeTypes.equals(that.nodeTypes)
                && instances.equals(that.instances)
                && connections.equals(that.connections)
                && scopes.equals(that.scopes)
                && options.equals(that.options)
                && positions.equals(that.positions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, functionName, instances, connections);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{name='"
                + name
                + "', instances="
                + instances.size()
                + ", connections="
                + connections.size()
                + "}";
    }
}
