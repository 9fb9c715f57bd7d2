package io.weaver.runtime;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Reads output port values out of whatever a node function returned.
///
/// Node functions return a `Map<String, Object>`, a record whose components are the output
/// ports, a {@link WorkflowResult} (nested workflows) or, for expression nodes with a single
/// output, the raw value.
public final class Ports {

    private Ports() {}

    /// Reads one port from a node result.
    ///
    /// @param result the value returned by the node function, may be null
    /// @param port output port name, not null
    /// @return the port value, or null when the result does not carry it
    public static Object read(Object result, String port) {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?> map) {
            return map.get(port);
        }
        if (result instanceof WorkflowResult workflowResult) {
            return workflowResult.get(port);
        }
        if (result instanceof ScopeResult scopeResult) {
            return scopeResult.get(port);
        }
        if (result.getClass().isRecord()) {
            return readComponent(result, port);
        }
        return null;
    }

    /// Reads a control-flow signal, falling back when the result does not carry it.
    ///
    /// @param result the value returned by the node function, may be null
    /// @param port `onSuccess` or `onFailure`, not null
    /// @param fallback value used when the port is absent
    public static boolean readFlag(Object result, String port, boolean fallback) {
        Object value = read(result, port);
        return value != null ? Coercions.isTruthy(value) : fallback;
    }

    /// Reads the single output of an expression node.
    ///
    /// A map or record carrying the port is unwrapped; any other value is the output itself.
    public static Object readSingle(Object result, String port) {
        if (result instanceof Map<?, ?> map && map.containsKey(port)) {
            return map.get(port);
        }
        if (result != null && result.getClass().isRecord() && hasComponent(result, port)) {
            return readComponent(result, port);
        }
        return result;
    }

    /// Combines the values of several connections into one input port.
    ///
    /// | Strategy  | Result                                                     |
    /// |-----------|------------------------------------------------------------|
    /// | `FIRST`   | first non-null value                                       |
    /// | `LAST`    | last non-null value                                        |
    /// | `COLLECT` | all values in connection order, nulls included             |
    /// | `MERGE`   | union of all map values, later keys override earlier ones  |
    ///
    /// @param strategy strategy name, not null
    /// @param values source values in connection order
    /// @throws IllegalArgumentException for an unknown strategy
    public static Object merge(String strategy, Object... values) {
        switch (strategy.toUpperCase(Locale.ROOT)) {
            case "FIRST":
                return Coercions.firstNonNull(values);
            case "LAST":
                for (int i = values.length - 1; i >= 0; i--) {
                    if (values[i] != null) {
                        return values[i];
                    }
                }
                return null;
            case "COLLECT":
                return new ArrayList<>(Arrays.asList(values));
            case "MERGE":
                Map<Object, Object> merged = new LinkedHashMap<>();
                for (Object value : values) {
                    if (value instanceof Map<?, ?> map) {
                        merged.putAll(map);
                    }
                }
                return merged;
            default:
                throw new IllegalArgumentException("Unknown merge strategy: " + strategy);
        }
    }

    /// Builds a map from alternating keys and values, keeping insertion order and nulls.
    ///
    /// Used to pass arguments to nested workflows.
    public static Map<String, Object> mapOf(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    /// Returns an immutable list of literal values, keeping nulls.
    public static List<Object> listOf(Object... values) {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    private static boolean hasComponent(Object record, String name) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            if (component.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static Object readComponent(Object record, String name) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            if (!component.getName().equals(name)) {
                continue;
            }
            try {
                var accessor = component.getAccessor();
                accessor.setAccessible(true);
                return accessor.invoke(record);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(
                        "Cannot read '" + name + "' from " + record.getClass().getName(), e);
            } catch (InvocationTargetException e) {
                throw NodeExecutionException.propagate(name, e.getCause());
            }
        }
        return null;
    }
}
