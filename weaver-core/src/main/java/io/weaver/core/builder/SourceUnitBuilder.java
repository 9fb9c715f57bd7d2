package io.weaver.core.builder;

import io.weaver.core.exception.GraphBuildException;
import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.parser.AnnotatedFunction;
import io.weaver.core.parser.ParsedSource;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Turns a parsed source unit into node types, workflow graphs and patterns.
///
/// ### Two-pass resolution
/// The first pass collects every node type and every workflow signature of the unit. The
/// second pass builds the graphs and binds their instances, so a workflow may place itself,
/// a workflow declared further down, or one that places it in turn.
///
/// {@snippet :
/// SourceUnitBuilder builder = new SourceUnitBuilder(ExternalTypeResolver.NONE, false);
/// SourceUnit unit = builder.build(new SourceUnitParser().parse(path));
/// }
///
/// @implNote Stateless; each {@link #build} call uses fresh per-unit state.
public class SourceUnitBuilder {

    private static final Logger logger = Logger.getLogger(SourceUnitBuilder.class.getName());

    private final ExternalTypeResolver resolver;
    private final boolean strictExternalResolution;
    private final NodeTypeBuilder nodeTypeBuilder = new NodeTypeBuilder();
    private final WorkflowGraphBuilder workflowGraphBuilder = new WorkflowGraphBuilder();
    private final PatternBuilder patternBuilder = new PatternBuilder();

    /// Creates a builder.
    ///
    /// @param resolver resolver for `@fwImport` aliases, not null
    /// @param strictExternalResolution report imports without a discoverable shape as
    ///     `UNRESOLVED_IMPORT` warnings instead of skipping them silently
    public SourceUnitBuilder(ExternalTypeResolver resolver, boolean strictExternalResolution) {
        this.resolver = resolver;
        this.strictExternalResolution = strictExternalResolution;
    }

    /// Builds everything a parsed unit declares.
    ///
    /// @param source parsed unit, not null
    /// @return the unit, never null
    /// @throws GraphBuildException if a pattern lacks `@name` or two workflows share a name
    public SourceUnit build(ParsedSource source) throws GraphBuildException {
        BuildDiagnostics diagnostics = new BuildDiagnostics();
        source.functions().forEach(f -> diagnostics.addAll(f.annotations().warnings()));

        // pass 1: node types and workflow signatures
        Map<String, NodeType> nodeTypes = new LinkedHashMap<>();
        for (AnnotatedFunction function : source.functionsOfKind("nodeType")) {
            NodeType type = nodeTypeBuilder.build(function, source, diagnostics);
            if (nodeTypes.containsKey(type.getName())) {
                diagnostics.error(
                        DiagnosticCode.DUPLICATE_NODE_NAME,
                        "Duplicate node type name '" + type.getName() + "'",
                        function.line());
                continue;
            }
            nodeTypes.put(type.getName(), type);
        }

        Map<String, AnnotatedFunction> workflowFunctions = new LinkedHashMap<>();
        Map<String, WorkflowGraphBuilder.Boundary> boundaries = new LinkedHashMap<>();
        Map<String, NodeType> workflowTypes = new LinkedHashMap<>();
        for (AnnotatedFunction function : source.functionsOfKind("workflow")) {
            String name =
                    function.annotations()
                            .last(TagDeclaration.NameTag.class)
                            .map(TagDeclaration.NameTag::name)
                            .orElse(function.name());
            if (workflowFunctions.containsKey(name)) {
                throw new GraphBuildException(
                        source.fileName() + ": two workflows are named '" + name + "'");
            }
            WorkflowGraphBuilder.Boundary boundary =
                    workflowGraphBuilder.boundary(function, source, diagnostics);
            workflowFunctions.put(name, function);
            boundaries.put(name, boundary);
            workflowTypes.put(name, workflowGraphBuilder.asNodeType(name, function, boundary));
        }

        // pass 2: graphs and patterns
        List<WorkflowGraph> workflows = new ArrayList<>();
        for (Map.Entry<String, AnnotatedFunction> entry : workflowFunctions.entrySet()) {
            TypeTable types = new TypeTable(nodeTypes, workflowTypes, resolver, strictExternalResolution);
            workflows.add(
                    workflowGraphBuilder.build(
                            entry.getKey(),
                            entry.getValue(),
                            source,
                            boundaries.get(entry.getKey()),
                            types,
                            diagnostics));
        }

        List<Pattern> patterns = new ArrayList<>();
        for (AnnotatedFunction function : source.functionsOfKind("pattern")) {
            TypeTable types = new TypeTable(nodeTypes, Map.of(), resolver, strictExternalResolution);
            patterns.add(patternBuilder.build(function, types, diagnostics));
        }

        logger.info(
                source.fileName()
                        + ": built "
                        + nodeTypes.size()
                        + " node type(s), "
                        + workflows.size()
                        + " workflow(s), "
                        + patterns.size()
                        + " pattern(s)");

        return new SourceUnit(
                source.fileName(),
                source.packageName(),
                source.className(),
                source.imports(),
                nodeTypes,
                workflows,
                patterns,
                diagnostics.toList());
    }
}
