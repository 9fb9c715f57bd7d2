package io.weaver.runtime;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Rendezvous buffer of a node that waits for all of its STEP inputs.
///
/// Each required port may be fed by several sources; a port is satisfied once any of its
/// sources has reported a `true` signal. The join fires exactly once per activation, when
/// every port is satisfied.
///
/// {@snippet :
/// ConjunctionJoin join = new ConjunctionJoin("merge", List.of("left", "right"));
/// join.report("left", "a.onSuccess", true);
/// join.tryFire();   // false, "right" has not reported
/// join.report("right", "b.onSuccess", true);
/// join.tryFire();   // true
/// join.tryFire();   // false, already fired
/// }
public final class ConjunctionJoin {

    private final String nodeId;
    private final Map<String, Set<String>> reported = new LinkedHashMap<>();
    private final Map<String, Object> lastValues = new LinkedHashMap<>();
    private boolean fired;

    /// Creates a join.
    ///
    /// @param nodeId id of the joined node instance, not null
    /// @param requiredPorts STEP ports that must all be satisfied, not empty
    public ConjunctionJoin(String nodeId, List<String> requiredPorts) {
        if (requiredPorts.isEmpty()) {
            throw new IllegalArgumentException("Join '" + nodeId + "' requires at least one port");
        }
        this.nodeId = nodeId;
        requiredPorts.forEach(port -> reported.put(port, new LinkedHashSet<>()));
    }

    /// Records the signal of one source.
    ///
    /// @param port required port the source is wired to, not null
    /// @param source source identifier (`node.port`), not null
    /// @param value the source's signal value, may be null
    public void report(String port, String source, Object value) {
        Set<String> sources = reported.get(port);
        if (sources == null) {
            throw new IllegalArgumentException(
                    "Port '" + port + "' is not a required input of join '" + nodeId + "'");
        }
        lastValues.put(source, value);
        if (Coercions.isTruthy(value)) {
            sources.add(source);
        }
    }

    /// Returns whether every required port has a reporting source.
    public boolean isReady() {
        return reported.values().stream().noneMatch(Set::isEmpty);
    }

    /// Fires the join when ready and not yet fired.
    ///
    /// @return true exactly once, on the first call after every port is satisfied
    public boolean tryFire() {
        if (fired || !isReady()) {
            return false;
        }
        fired = true;
        return true;
    }

    /// Returns the last value reported by a source.
    public Object lastValue(String source) {
        return lastValues.get(source);
    }
}
