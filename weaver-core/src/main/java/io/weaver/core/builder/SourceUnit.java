package io.weaver.core.builder;

import io.weaver.core.model.NodeType;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.validation.Diagnostic;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Everything declared by one source unit.
///
/// @param fileName source file name, not null
/// @param packageName package of the unit, empty for the default package, not null
/// @param className primary class name, not null
/// @param imports the unit's import declarations, copied into generated code, not null
/// @param nodeTypes node types declared in the unit, by name, in declaration order, not null
/// @param workflows workflow graphs in declaration order, not null
/// @param patterns patterns in declaration order, not null
/// @param diagnostics parse warnings and build findings, not null
public record SourceUnit(
        String fileName,
        String packageName,
        String className,
        List<String> imports,
        Map<String, NodeType> nodeTypes,
        List<WorkflowGraph> workflows,
        List<Pattern> patterns,
        List<Diagnostic> diagnostics) {

    public SourceUnit {
        imports = List.copyOf(imports);
        nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(nodeTypes));
        workflows = List.copyOf(workflows);
        patterns = List.copyOf(patterns);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<WorkflowGraph> findWorkflow(String name) {
        return workflows.stream().filter(w -> name.equals(w.getName())).findFirst();
    }

    /// Simple name of the generated companion class: `<className>Workflows`.
    public String companionClassName() {
        return className + "Workflows";
    }
}
