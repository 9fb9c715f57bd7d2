package io.weaver.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Result of one invocation of a generated workflow entry point.
///
/// Carries the two control-flow signals every workflow exposes, `onSuccess` and
/// `onFailure`, plus the values of the workflow's declared exit ports keyed by port name.
/// Exit ports that no connection reached are present with a `null` value.
///
/// ### Usage
/// {@snippet :
/// WorkflowResult result = CalculatorWorkflows.calculate(true, Map.of("a", 1, "b", 2));
/// if (result.isOnSuccess()) {
///     Object sum = result.get("sum");
/// }
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class WorkflowResult {

    private final boolean onSuccess;
    private final boolean onFailure;
    private final Map<String, Object> outputs;

    private WorkflowResult(Builder builder) {
        this.onSuccess = builder.onSuccess;
        this.onFailure = builder.onFailure;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
    }

    /// Returns whether the workflow reported success.
    public boolean isOnSuccess() {
        return onSuccess;
    }

    /// Returns whether the workflow reported failure.
    public boolean isOnFailure() {
        return onFailure;
    }

    /// Returns the exit port values in declaration order.
    ///
    /// @return unmodifiable map of port name to value, never null, values may be null
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    /// Returns a single port value, including the `onSuccess` and `onFailure` signals.
    ///
    /// @param port exit port name, not null
    /// @return the port value, or null when the port is unknown or was not reached
    public Object get(String port) {
        return switch (port) {
            case "onSuccess" -> onSuccess;
            case "onFailure" -> onFailure;
            default -> outputs.get(port);
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean onSuccess = true;
        private boolean onFailure;
        private final Map<String, Object> outputs = new LinkedHashMap<>();

        private Builder() {}

        public Builder onSuccess(boolean onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(boolean onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public Builder output(String port, Object value) {
            outputs.put(Objects.requireNonNull(port, "port"), value);
            return this;
        }

        public WorkflowResult build() {
            return new WorkflowResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowResult that)) return false;
        return onSuccess == that.onSuccess
                && onFailure == that.onFailure
                && outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(onSuccess, onFailure, outputs);
    }

    @Override
    public String toString() {
        return "WorkflowResult{onSuccess="
                + onSuccess
                + ", onFailure="
                + onFailure
                + ", outputs="
                + outputs
                + "}";
    }
}
