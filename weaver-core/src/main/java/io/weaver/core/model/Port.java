package io.weaver.core.model;

import java.util.Objects;

/// Typed port of a node type, workflow boundary or pattern boundary.
///
/// Besides the data type a port carries its owning scope (for ports on a scope boundary),
/// the control-flow flags of the reserved signal ports, an optional default value, a merge
/// strategy for multi-source inputs and presentation metadata. `javaType` keeps the declared
/// Java type of the backing method parameter so the generator can convert values for it.
///
/// @implNote Immutable. Use {@link #toBuilder()} to derive a modified copy.
public final class Port {

    private final String name;
    private final PortDirection direction;
    private final DataType dataType;
    private final boolean optional;
    private final Object defaultValue;
    private final boolean hasDefault;
    private final String scope;
    private final boolean controlFlow;
    private final boolean failure;
    private final MergeStrategy mergeStrategy;
    private final String label;
    private final String description;
    private final Integer order;
    private final Placement placement;
    private final String expression;
    private final String javaType;

    private Port(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Port name required");
        this.direction = Objects.requireNonNull(builder.direction, "Port direction required");
        this.dataType = builder.dataType != null ? builder.dataType : DataType.ANY;
        this.optional = builder.optional;
        this.defaultValue = builder.defaultValue;
        this.hasDefault = builder.hasDefault;
        this.scope = builder.scope;
        this.controlFlow = builder.controlFlow;
        this.failure = builder.failure;
        this.mergeStrategy = builder.mergeStrategy;
        this.label = builder.label;
        this.description = builder.description;
        this.order = builder.order;
        this.placement = builder.placement;
        this.expression = builder.expression;
        this.javaType = builder.javaType;
    }

    public String getName() {
        return name;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public DataType getDataType() {
        return dataType;
    }

    public boolean isOptional() {
        return optional;
    }

    /// Returns the default value: a JSON literal (number, string, boolean, list, map) or the
    /// raw text when it was not valid JSON.
    ///
    /// @return default value, may be null; check {@link #hasDefault()} to distinguish an
    ///     explicit `null` default
    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /// Returns the scope this port belongs to.
    ///
    /// @return scope name, or null for a top-level port
    public String getScope() {
        return scope;
    }

    public boolean isScoped() {
        return scope != null;
    }

    public boolean isControlFlow() {
        return controlFlow;
    }

    public boolean isFailure() {
        return failure;
    }

    public boolean isStep() {
        return dataType == DataType.STEP;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public Integer getOrder() {
        return order;
    }

    public Placement getPlacement() {
        return placement;
    }

    /// Returns the constant Java expression backing this input, if any.
    public String getExpression() {
        return expression;
    }

    /// Returns the declared Java type of the backing parameter or record component.
    ///
    /// @return Java type text such as `double` or `List<String>`, or null when the port was
    ///     declared only by a tag
    public String getJavaType() {
        return javaType;
    }

    /// Returns whether this port matches a reference with an optional scope qualifier.
    public boolean matches(String portName, String portScope) {
        return name.equals(portName) && Objects.equals(scope, portScope);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name, direction);
        b.dataType = dataType;
        b.optional = optional;
        b.defaultValue = defaultValue;
        b.hasDefault = hasDefault;
        b.scope = scope;
        b.controlFlow = controlFlow;
        b.failure = failure;
        b.mergeStrategy = mergeStrategy;
        b.label = label;
        b.description = description;
        b.order = order;
        b.placement = placement;
        b.expression = expression;
        b.javaType = javaType;
        return b;
    }

    public static Builder input(String name) {
        return new Builder(name, PortDirection.INPUT);
    }

    public static Builder output(String name) {
        return new Builder(name, PortDirection.OUTPUT);
    }

    public static final class Builder {
        private final String name;
        private final PortDirection direction;
        private DataType dataType;
        private boolean optional;
        private Object defaultValue;
        private boolean hasDefault;
        private String scope;
        private boolean controlFlow;
        private boolean failure;
        private MergeStrategy mergeStrategy;
        private String label;
        private String description;
        private Integer order;
        private Placement placement;
        private String expression;
        private String javaType;

        private Builder(String name, PortDirection direction) {
            this.name = name;
            this.direction = direction;
        }

        public Builder dataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            this.hasDefault = true;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder controlFlow(boolean controlFlow) {
            this.controlFlow = controlFlow;
            return this;
        }

        public Builder failure(boolean failure) {
            this.failure = failure;
            return this;
        }

        public Builder mergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
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

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        public Builder placement(Placement placement) {
            this.placement = placement;
            return this;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder javaType(String javaType) {
            this.javaType = javaType;
            return this;
        }

        public Port build() {
            return new Port(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Port port)) return false;
        return optional == port.optional
                && hasDefault == port.hasDefault
                && controlFlow == port.controlFlow
                && failure == port.failure
                && name.equals(port.name)
                && direction == port.direction
                && dataType == port.dataType
                && Objects.equals(defaultValue, port.defaultValue)
                && Objects.equals(scope, port.scope)
                && mergeStrategy == port.mergeStrategy
                && Objects.equals(label, port.label)
                && Objects.equals(description, port.description)
                && Objects.equals(order, port.order)
                && placement == port.placement
                && Objects.equals(expression, port.expression)
                && Objects.equals(javaType, port.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, direction, dataType, scope);
    }

    @Override
    public String toString() {
        return "Port{" + name + (scope != null ? ":" + scope : "") + " " + dataType + "}";
    }
}
