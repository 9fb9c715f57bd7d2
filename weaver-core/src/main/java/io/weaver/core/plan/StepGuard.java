package io.weaver.core.plan;

import io.weaver.core.model.ExecuteWhen;
import io.weaver.core.model.PortRef;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Condition under which a node runs, derived from its incoming STEP connections.
///
/// Sources are grouped by the node's STEP input they are wired to. A port is satisfied when
/// any of its sources signals `true`. With {@link ExecuteWhen#CONJUNCTION} the node runs once
/// every port is satisfied; with {@link ExecuteWhen#DISJUNCTION} it runs when any source
/// signals.
///
/// Connections from `Start` do not guard a node: the start trigger is passed as the node's
/// `execute` argument instead.
///
/// @param when join policy of the node's type, not null
/// @param sources STEP sources per input port, in connection order, not null
public record StepGuard(ExecuteWhen when, Map<String, List<PortRef>> sources) {

    public static final StepGuard NONE = new StepGuard(ExecuteWhen.CONJUNCTION, Map.of());

    public StepGuard {
        Objects.requireNonNull(when, "when must not be null");
        Map<String, List<PortRef>> copy = new LinkedHashMap<>();
        sources.forEach((port, refs) -> copy.put(port, List.copyOf(refs)));
        sources = Collections.unmodifiableMap(copy);
    }

    /// Returns true when no STEP source guards the node.
    public boolean isEmpty() {
        return sources.isEmpty();
    }

    /// Number of STEP sources over all ports.
    public int sourceCount() {
        return sources.values().stream().mapToInt(List::size).sum();
    }

    /// Returns whether the node buffers its sources in a `ConjunctionJoin`.
    public boolean needsJoin() {
        return when == ExecuteWhen.CONJUNCTION && sourceCount() > 1;
    }
}
