package io.weaver.core.builder;

import io.weaver.core.grammar.PortDeclaration;
import io.weaver.core.model.DataType;
import io.weaver.core.model.MergeStrategy;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortDirection;
import io.weaver.core.util.JsonLiterals;
import io.weaver.core.validation.DiagnosticCode;

/// Applies parsed port lines to ports.
final class PortDeclarations {

    private PortDeclarations() {}

    /// Overlays a declaration on a port builder: label, description, optionality, default,
    /// scope, merge strategy, type override and presentation metadata.
    static Port.Builder apply(
            Port.Builder port, PortDeclaration declaration, BuildDiagnostics diagnostics, int line) {
        if (declaration.description() != null) {
            port.description(declaration.description());
        }
        if (declaration.optional()) {
            port.optional(true);
        }
        if (declaration.hasDefault()) {
            port.defaultValue(JsonLiterals.parseOrRaw(declaration.defaultText()));
        }
        if (declaration.scope() != null) {
            port.scope(declaration.scope());
        }
        if (declaration.order() != null) {
            port.order(declaration.order());
        }
        if (declaration.placement() != null) {
            port.placement(declaration.placement());
        }
        if (declaration.expression() != null) {
            port.expression(declaration.expression());
        }
        if (declaration.type() != null) {
            DataType type = DataType.parse(declaration.type());
            if (type == null) {
                diagnostics.warning(
                        DiagnosticCode.PARSE_WARNING,
                        "Unknown type '" + declaration.type() + "' on port '" + declaration.name() + "'",
                        line);
            } else {
                port.dataType(type);
            }
        }
        if (declaration.mergeStrategy() != null) {
            MergeStrategy strategy = MergeStrategy.parse(declaration.mergeStrategy());
            if (strategy == null) {
                diagnostics.warning(
                        DiagnosticCode.PARSE_WARNING,
                        "Unknown merge strategy '"
                                + declaration.mergeStrategy()
                                + "' on port '"
                                + declaration.name()
                                + "'",
                        line);
            } else {
                port.mergeStrategy(strategy);
            }
        }
        return port;
    }

    /// Applies only label and description, as allowed on reserved ports.
    static Port.Builder applyDocumentation(Port.Builder port, PortDeclaration declaration) {
        if (declaration.description() != null) {
            port.description(declaration.description());
        }
        return port;
    }

    /// Copies a port with the opposite direction, as when a workflow boundary becomes the
    /// interface of a node type: start ports turn into inputs, exit ports into outputs.
    static Port redirect(Port port, PortDirection direction) {
        Port.Builder copy =
                direction == PortDirection.INPUT ? Port.input(port.getName()) : Port.output(port.getName());
        copy.dataType(port.getDataType())
                .optional(port.isOptional())
                .scope(port.getScope())
                .controlFlow(port.isControlFlow())
                .failure(port.isFailure())
                .mergeStrategy(port.getMergeStrategy())
                .label(port.getLabel())
                .description(port.getDescription())
                .order(port.getOrder())
                .placement(port.getPlacement())
                .expression(port.getExpression())
                .javaType(port.getJavaType());
        if (port.hasDefault()) {
            copy.defaultValue(port.getDefaultValue());
        }
        return copy.build();
    }
}
