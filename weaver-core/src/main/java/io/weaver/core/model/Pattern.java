package io.weaver.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Reusable graph fragment declared with `@flowWeaver pattern`.
///
/// A pattern is spliced into workflows by tooling outside this module. Its boundary ports
/// (`@port IN.x`, `@port OUT.y`) are the only way data enters or leaves it.
///
/// @param name pattern name, not null
/// @param description description, may be null
/// @param nodeTypes types its instances bind to, not null
/// @param instances node placements, not null
/// @param connections edges, where `IN` and `OUT` name the boundary, not null
/// @param inputPorts boundary inputs, not null
/// @param outputPorts boundary outputs, not null
public record Pattern(
        String name,
        String description,
        Map<String, NodeType> nodeTypes,
        List<NodeInstance> instances,
        List<Connection> connections,
        List<Port> inputPorts,
        List<Port> outputPorts) {

    /// Boundary pseudo node for pattern inputs.
    public static final String IN = "IN";

    /// Boundary pseudo node for pattern outputs.
    public static final String OUT = "OUT";

    public Pattern {
        Objects.requireNonNull(name, "Pattern name required");
        nodeTypes = Map.copyOf(nodeTypes);
        instances = List.copyOf(instances);
        connections = List.copyOf(connections);
        inputPorts = List.copyOf(inputPorts);
        outputPorts = List.copyOf(outputPorts);
    }
}
