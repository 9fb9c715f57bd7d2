package io.weaver.core.builder;

import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.NodeType;
import io.weaver.core.validation.DiagnosticCode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Node types an instance of a source unit may bind to, collected before any graph is built.
///
/// Resolution order: node type of the unit, workflow of the unit, `@fwImport` alias.
final class TypeTable {

    private static final Logger logger = Logger.getLogger(TypeTable.class.getName());

    private final Map<String, NodeType> nodeTypes;
    private final Map<String, NodeType> workflows;
    private final Map<String, TagDeclaration.ImportTag> imports = new LinkedHashMap<>();
    private final Map<String, Optional<NodeType>> resolvedImports = new HashMap<>();
    private final ExternalTypeResolver resolver;
    private final boolean strictExternalResolution;

    TypeTable(
            Map<String, NodeType> nodeTypes,
            Map<String, NodeType> workflows,
            ExternalTypeResolver resolver,
            boolean strictExternalResolution) {
        this.nodeTypes = nodeTypes;
        this.workflows = workflows;
        this.resolver = resolver;
        this.strictExternalResolution = strictExternalResolution;
    }

    void addImport(TagDeclaration.ImportTag tag) {
        imports.put(tag.name(), tag);
    }

    /// Binds a type name used by an instance.
    ///
    /// @return the type, or empty when the name is unknown (the validator reports it)
    Optional<NodeType> resolve(String typeName, BuildDiagnostics diagnostics, int line) {
        NodeType local = nodeTypes.get(typeName);
        if (local != null) {
            return Optional.of(local);
        }
        NodeType workflow = workflows.get(typeName);
        if (workflow != null) {
            return Optional.of(workflow);
        }
        TagDeclaration.ImportTag tag = imports.get(typeName);
        if (tag == null) {
            return Optional.empty();
        }
        if (!resolvedImports.containsKey(typeName)) {
            Optional<NodeType> resolved =
                    resolver.resolve(tag.from(), tag.exportName())
                            .map(type -> type.toBuilder(tag.name()).build());
            if (resolved.isEmpty()) {
                String message =
                        "Import '"
                                + tag.name()
                                + "' ("
                                + tag.exportName()
                                + " from \""
                                + tag.from()
                                + "\") exposes no discoverable node type";
                if (strictExternalResolution) {
                    diagnostics.warning(DiagnosticCode.UNRESOLVED_IMPORT, message, line);
                } else {
                    logger.fine(message);
                }
            }
            resolvedImports.put(typeName, resolved);
        }
        return resolvedImports.get(typeName);
    }

    Map<String, NodeType> nodeTypes() {
        return nodeTypes;
    }

    Map<String, NodeType> workflows() {
        return workflows;
    }
}
