package io.weaver.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Per-instance overrides attached to a `@node` declaration.
///
/// Constant expressions replace the connection-fed value of an input port. Pull execution
/// makes the instance lazy regardless of its type's default. Everything else is
/// presentation metadata.
///
/// @implNote Immutable.
public final class InstanceConfig {

    /// Tag shown on a node.
    ///
    /// @param label tag text, not null
    /// @param tooltip tooltip text, may be null
    public record Tag(String label, String tooltip) {}

    public static final InstanceConfig EMPTY = builder().build();

    private final String label;
    private final Map<String, String> portExpressions;
    private final Map<String, Integer> portOrder;
    private final Map<String, String> portLabels;
    private final boolean minimized;
    private final String pullExecution;
    private final Integer width;
    private final Integer height;
    private final String color;
    private final String icon;
    private final List<Tag> tags;
    private final Position position;

    private InstanceConfig(Builder builder) {
        this.label = builder.label;
        this.portExpressions = Map.copyOf(builder.portExpressions);
        this.portOrder = Map.copyOf(builder.portOrder);
        this.portLabels = Map.copyOf(builder.portLabels);
        this.minimized = builder.minimized;
        this.pullExecution = builder.pullExecution;
        this.width = builder.width;
        this.height = builder.height;
        this.color = builder.color;
        this.icon = builder.icon;
        this.tags = List.copyOf(builder.tags);
        this.position = builder.position;
    }

    public String getLabel() {
        return label;
    }

    /// Returns constant Java expressions keyed by input port name.
    public Map<String, String> getPortExpressions() {
        return portExpressions;
    }

    public Map<String, Integer> getPortOrder() {
        return portOrder;
    }

    public Map<String, String> getPortLabels() {
        return portLabels;
    }

    public boolean isMinimized() {
        return minimized;
    }

    /// Returns the trigger port for pull execution, or null when not overridden.
    public String getPullExecution() {
        return pullExecution;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public String getColor() {
        return color;
    }

    public String getIcon() {
        return icon;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public Position getPosition() {
        return position;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.label = label;
        b.portExpressions.putAll(portExpressions);
        b.portOrder.putAll(portOrder);
        b.portLabels.putAll(portLabels);
        b.minimized = minimized;
        b.pullExecution = pullExecution;
        b.width = width;
        b.height = height;
        b.color = color;
        b.icon = icon;
        b.tags = tags;
        b.position = position;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String label;
        private final Map<String, String> portExpressions = new LinkedHashMap<>();
        private final Map<String, Integer> portOrder = new LinkedHashMap<>();
        private final Map<String, String> portLabels = new LinkedHashMap<>();
        private boolean minimized;
        private String pullExecution;
        private Integer width;
        private Integer height;
        private String color;
        private String icon;
        private List<Tag> tags = List.of();
        private Position position;

        private Builder() {}

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder portExpression(String port, String expression) {
            this.portExpressions.put(port, expression);
            return this;
        }

        public Builder portExpressions(Map<String, String> expressions) {
            this.portExpressions.clear();
            this.portExpressions.putAll(expressions);
            return this;
        }

        public Builder portOrder(String port, int order) {
            this.portOrder.put(port, order);
            return this;
        }

        public Builder portOrders(Map<String, Integer> orders) {
            this.portOrder.clear();
            this.portOrder.putAll(orders);
            return this;
        }

        public Builder portLabel(String port, String label) {
            this.portLabels.put(port, label);
            return this;
        }

        public Builder portLabels(Map<String, String> labels) {
            this.portLabels.clear();
            this.portLabels.putAll(labels);
            return this;
        }

        public Builder minimized(boolean minimized) {
            this.minimized = minimized;
            return this;
        }

        public Builder pullExecution(String triggerPort) {
            this.pullExecution = triggerPort;
            return this;
        }

        public Builder size(Integer width, Integer height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder width(Integer width) {
            this.width = width;
            return this;
        }

        public Builder height(Integer height) {
            this.height = height;
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

        public Builder tags(List<Tag> tags) {
            this.tags = List.copyOf(tags);
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public InstanceConfig build() {
            return new InstanceConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstanceConfig that)) return false;
        return minimized == that.minimized
                && Objects.equals(label, that.label)
                && portExpressions.equals(that.portExpressions)
                && portOrder.equals(that.portOrder)
                && portLabels.equals(that.portLabels)
                && Objects.equals(pullExecution, that.pullExecution)
                && Objects.equals(width, that.width)
                && Objects.equals(height, that.height)
                && Objects.equals(color, that.color)
                && Objects.equals(icon, that.icon)
                && tags.equals(that.tags)
                && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, portExpressions, pullExecution);
    }
}
