package io.weaver.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Node implementations behind `@map` lines.
///
/// A `@map loop child over source.port` line places an iteration node that owns the scope
/// `iterate`. The scope hands each element to the child through `item:iterate` and reads the
/// child's result back through `processed:iterate`.
public final class Iteration {

    /// Name of the scope an iteration node owns.
    public static final String SCOPE = "iterate";

    private Iteration() {}

    /// Runs the scope once per element and collects each run's `processed` value.
    ///
    /// Iteration stops at the first run whose children report failure; the node then fails and
    /// `results` holds the values collected before that run. A null list iterates nothing.
    ///
    /// @param execute trigger; when false nothing runs and neither signal fires
    /// @param items elements to iterate, may be null
    /// @param iterate closure of the `iterate` scope, not null
    /// @return `onSuccess`, `onFailure` and `results`, never null
    public static Map<String, Object> map(
            boolean execute, List<Object> items, ScopeFunction iterate) {
        if (!execute) {
            return outcome(false, false, null);
        }
        List<Object> results = new ArrayList<>();
        if (items != null) {
            for (Object item : items) {
                ScopeResult run = iterate.call(true, item);
                if (run.failure()) {
                    return outcome(false, true, results);
                }
                results.add(run.get("processed"));
            }
        }
        return outcome(true, false, results);
    }

    private static Map<String, Object> outcome(
            boolean success, boolean failure, List<Object> results) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("onSuccess", success);
        outputs.put("onFailure", failure);
        outputs.put("results", results);
        return outputs;
    }
}
