package io.weaver.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Reusable unit of work with typed input and output ports.
///
/// A node type is built from a documented static method (variant `FUNCTION` or `STUB`) or
/// from a workflow used as a node (variant `IMPORTED_WORKFLOW`). Its port lists always
/// contain the reserved `execute`, `onSuccess` and `onFailure` ports, plus the `start`,
/// `success` and `failure` ports of every scope it exposes.
///
/// ### Ports and scopes
/// Scoped ports belong to the boundary of a nested region, not to the node's outer
/// interface. A scoped output (for example `item` of scope `iteration`) is handed to the
/// scope's children; a scoped input (for example `processed`) is written back by them. A port
/// is identified by its name together with its scope, so a scoped and an unscoped port may
/// share a name.
///
/// @implNote Immutable and thread-safe after construction.
/// @see NodeInstance for placements of a node type inside a graph
public final class NodeType {

    private final String name;
    private final String functionName;
    private final String label;
    private final String description;
    private final ImplementationRef implementation;
    private final List<Port> inputs;
    private final List<Port> outputs;
    private final List<Parameter> parameters;
    private final String returnType;
    private final boolean async;
    private final ExecuteWhen executeWhen;
    private final BranchingStrategy branchingStrategy;
    private final String pullExecution;
    private final List<String> scopes;
    private final NodeVariant variant;
    private final String color;
    private final String icon;

    private NodeType(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Node type name required");
        this.functionName = builder.functionName != null ? builder.functionName : builder.name;
        this.label = builder.label;
        this.description = builder.description;
        this.implementation = builder.implementation;
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.parameters = List.copyOf(builder.parameters);
        this.returnType = builder.returnType;
        this.async = builder.async;
        this.executeWhen = builder.executeWhen;
        this.branchingStrategy = builder.branchingStrategy;
        this.pullExecution = builder.pullExecution;
        this.scopes = List.copyOf(new LinkedHashSet<>(builder.scopes));
        this.variant = builder.variant;
        this.color = builder.color;
        this.icon = builder.icon;
    }

    /// Returns the name instances bind to.
    public String getName() {
        return name;
    }

    /// Returns the name of the backing Java method.
    public String getFunctionName() {
        return functionName;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /// Returns where the implementation lives.
    ///
    /// @return implementation reference, null only for stubs
    public ImplementationRef getImplementation() {
        return implementation;
    }

    public List<Port> getInputs() {
        return inputs;
    }

    public List<Port> getOutputs() {
        return outputs;
    }

    /// Returns the parameters of the backing method in declaration order.
    ///
    /// @return parameters, empty for workflow-backed types
    public List<Parameter> getParameters() {
        return parameters;
    }

    /// Returns the declared return type of the backing method.
    ///
    /// @return return type text, `CompletableFuture<...>` included for async types; null for
    ///     workflow-backed types
    public String getReturnType() {
        return returnType;
    }

    /// Returns whether the backing method returns nothing.
    public boolean returnsVoid() {
        return returnType != null
                && (returnType.equals("void") || returnType.equals("Void"));
    }

    public boolean isAsync() {
        return async;
    }

    public ExecuteWhen getExecuteWhen() {
        return executeWhen;
    }

    public BranchingStrategy getBranchingStrategy() {
        return branchingStrategy;
    }

    public boolean isExpression() {
        return branchingStrategy == BranchingStrategy.EXCEPTION_BASED;
    }

    /// Returns the trigger port of the default pull execution, or null when instances execute
    /// eagerly unless configured otherwise.
    public String getPullExecution() {
        return pullExecution;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public NodeVariant getVariant() {
        return variant;
    }

    public String getColor() {
        return color;
    }

    public String getIcon() {
        return icon;
    }

    /// Finds an input port by name and scope.
    ///
    /// @param portName port name, not null
    /// @param scope scope qualifier, null for a top-level port
    public Optional<Port> findInput(String portName, String scope) {
        return inputs.stream().filter(p -> p.matches(portName, scope)).findFirst();
    }

    /// Finds an output port by name and scope.
    ///
    /// @param portName port name, not null
    /// @param scope scope qualifier, null for a top-level port
    public Optional<Port> findOutput(String portName, String scope) {
        return outputs.stream().filter(p -> p.matches(portName, scope)).findFirst();
    }

    /// Returns the ports of one scope in declaration order.
    ///
    /// @param scope scope name, not null
    /// @param direction port direction, not null
    public List<Port> scopedPorts(String scope, PortDirection direction) {
        List<Port> source = direction == PortDirection.INPUT ? inputs : outputs;
        return source.stream().filter(p -> scope.equals(p.getScope())).toList();
    }

    public Builder toBuilder() {
        return toBuilder(name);
    }

    /// Returns a builder copying this type under another name, as for an import alias.
    ///
    /// @param newName name instances bind to, not null
    public Builder toBuilder(String newName) {
        Builder b = new Builder(newName);
        b.functionName = functionName;
        b.label = label;
        b.description = description;
        b.implementation = implementation;
        b.inputs.addAll(inputs);
        b.outputs.addAll(outputs);
        b.parameters.addAll(parameters);
        b.returnType = returnType;
        b.async = async;
        b.executeWhen = executeWhen;
        b.branchingStrategy = branchingStrategy;
        b.pullExecution = pullExecution;
        b.scopes.addAll(scopes);
        b.variant = variant;
        b.color = color;
        b.icon = icon;
        return b;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String functionName;
        private String label;
        private String description;
        private ImplementationRef implementation;
        private final List<Port> inputs = new ArrayList<>();
        private final List<Port> outputs = new ArrayList<>();
        private final List<Parameter> parameters = new ArrayList<>();
        private String returnType;
        private boolean async;
        private ExecuteWhen executeWhen = ExecuteWhen.CONJUNCTION;
        private BranchingStrategy branchingStrategy = BranchingStrategy.VALUE_BASED;
        private String pullExecution;
        private final List<String> scopes = new ArrayList<>();
        private NodeVariant variant = NodeVariant.FUNCTION;
        private String color;
        private String icon;

        private Builder(String name) {
            this.name = name;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder implementation(ImplementationRef implementation) {
            this.implementation = implementation;
            return this;
        }

        public Builder input(Port port) {
            this.inputs.add(port);
            return this;
        }

        public Builder inputs(List<Port> ports) {
            this.inputs.clear();
            this.inputs.addAll(ports);
            return this;
        }

        public Builder output(Port port) {
            this.outputs.add(port);
            return this;
        }

        public Builder outputs(List<Port> ports) {
            this.outputs.clear();
            this.outputs.addAll(ports);
            return this;
        }

        public Builder parameters(List<Parameter> parameters) {
            this.parameters.clear();
            this.parameters.addAll(parameters);
            return this;
        }

        public Builder returnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder executeWhen(ExecuteWhen executeWhen) {
            this.executeWhen = executeWhen;
            return this;
        }

        public Builder branchingStrategy(BranchingStrategy branchingStrategy) {
            this.branchingStrategy = branchingStrategy;
            return this;
        }

        public Builder pullExecution(String triggerPort) {
            this.pullExecution = triggerPort;
            return this;
        }

        public Builder scope(String scope) {
            this.scopes.add(scope);
            return this;
        }

        public Builder variant(NodeVariant variant) {
            this.variant = variant;
            return this;
        }

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public NodeType build() {
            return new NodeType(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeType other)) return false;
        return name.equals(other.name)
                && functionName.equals(other.functionName)
                && Objects.equals(implementation, other.implementation)
                && inputs.equals(other.inputs)
                && outputs.equals(other.outputs)
                && variant == other.variant;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, functionName, variant);
    }

    @Override
    public String toString() {
        return "NodeType{name='" + name + "', variant=" + variant + "}";
    }
}
