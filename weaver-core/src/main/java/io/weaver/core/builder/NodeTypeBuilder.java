package io.weaver.core.builder;

import io.weaver.core.grammar.AnnotationBlock;
import io.weaver.core.grammar.PortDeclaration;
import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.BranchingStrategy;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ExecuteWhen;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Parameter;
import io.weaver.core.model.Port;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.parser.AnnotatedFunction;
import io.weaver.core.parser.JavaTypes;
import io.weaver.core.parser.MethodParameter;
import io.weaver.core.parser.ParsedSource;
import io.weaver.core.parser.RecordShape;
import io.weaver.core.util.Suggestions;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Builds a {@link NodeType} from an annotated method.
///
/// The method's signature supplies the ports: each parameter becomes an input (except the
/// leading `boolean execute`, `ScopeFunction` callbacks and the `WorkflowContext`), each
/// component of a returned record declared in the unit becomes an output. Tags refine them
/// with descriptions, defaults, optionality, type overrides and merge strategies, and add the
/// scoped ports of nested regions, which have no counterpart in the signature.
///
/// A method without a body is a stub. A method without an `execute` parameter, or tagged
/// `@expression`, is exception-based: its return value is its output and a thrown exception
/// is its failure.
final class NodeTypeBuilder {

    /// Single output port of a method that returns a plain value.
    static final String DEFAULT_OUTPUT = "result";

    NodeType build(AnnotatedFunction function, ParsedSource source, BuildDiagnostics diagnostics) {
        return build(
                function,
                source,
                new ImplementationRef.Local(function.declaringClass(), function.name()),
                diagnostics);
    }

    NodeType build(
            AnnotatedFunction function,
            ParsedSource source,
            ImplementationRef implementation,
            BuildDiagnostics diagnostics) {
        AnnotationBlock block = function.annotations();
        String name = block.last(TagDeclaration.NameTag.class).map(TagDeclaration.NameTag::name)
                .orElse(function.name());

        NodeType.Builder type =
                NodeType.builder(name)
                        .functionName(function.name())
                        .implementation(implementation)
                        .returnType(function.returnType())
                        .async(function.isAsync())
                        .variant(function.hasBody() ? NodeVariant.FUNCTION : NodeVariant.STUB);

        block.last(TagDeclaration.LabelTag.class).ifPresent(t -> type.label(t.label()));
        block.last(TagDeclaration.ColorTag.class).ifPresent(t -> type.color(t.color()));
        block.last(TagDeclaration.IconTag.class).ifPresent(t -> type.icon(t.icon()));
        type.description(
                block.last(TagDeclaration.DescriptionTag.class)
                        .map(TagDeclaration.DescriptionTag::text)
                        .orElse(block.summary()));
        block.last(TagDeclaration.PullExecutionTag.class)
                .ifPresent(t -> type.pullExecution(t.port()));
        executeWhen(block, name, function.line(), diagnostics).ifPresent(type::executeWhen);

        // signature
        List<Parameter> parameters = new ArrayList<>();
        Set<String> scopes = new LinkedHashSet<>();
        Map<String, Port.Builder> inputs = new LinkedHashMap<>();
        boolean hasExecute = false;

        List<MethodParameter> declared = function.parameters();
        for (int i = 0; i < declared.size(); i++) {
            MethodParameter parameter = declared.get(i);
            if (i == 0
                    && parameter.name().equals(ReservedNames.EXECUTE)
                    && JavaTypes.infer(parameter.type()) == DataType.BOOLEAN) {
                parameters.add(new Parameter(parameter.name(), parameter.type(), Parameter.Kind.EXECUTE));
                hasExecute = true;
            } else if (JavaTypes.isScopeFunction(parameter.type())) {
                parameters.add(new Parameter(parameter.name(), parameter.type(), Parameter.Kind.SCOPE));
                scopes.add(parameter.name());
            } else if (JavaTypes.isWorkflowContext(parameter.type())) {
                parameters.add(new Parameter(parameter.name(), parameter.type(), Parameter.Kind.CONTEXT));
            } else {
                parameters.add(new Parameter(parameter.name(), parameter.type(), Parameter.Kind.PORT));
                inputs.put(
                        parameter.name(),
                        Port.input(parameter.name())
                                .dataType(JavaTypes.infer(parameter.type()))
                                .javaType(parameter.type()));
            }
        }
        type.parameters(parameters);

        boolean expression = !hasExecute || block.has(TagDeclaration.ExpressionTag.class);
        type.branchingStrategy(
                expression ? BranchingStrategy.EXCEPTION_BASED : BranchingStrategy.VALUE_BASED);

        String valueType =
                function.isAsync() ? JavaTypes.unwrapAsync(function.returnType()) : function.returnType();
        Map<String, Port.Builder> outputs = signatureOutputs(valueType, source);
        boolean openOutputs = outputs == null;
        boolean single = isSingleValue(valueType, source);
        if (openOutputs) {
            outputs = new LinkedHashMap<>();
        }

        // tags
        Port.Builder execute = ReservedPorts.execute();
        Port.Builder onSuccess = ReservedPorts.onSuccess();
        Port.Builder onFailure = ReservedPorts.onFailure();
        List<Port.Builder> extraSteps = new ArrayList<>();
        Map<String, Port.Builder> scopedInputs = new LinkedHashMap<>();
        Map<String, Port.Builder> scopedOutputs = new LinkedHashMap<>();
        Map<String, PortDeclaration> reservedScopeDocs = new LinkedHashMap<>();

        for (AnnotationBlock.Entry entry : block.entries()) {
            if (entry.declaration() instanceof TagDeclaration.ScopeTag scope) {
                scopes.add(scope.name());
                continue;
            }
            if (!(entry.declaration() instanceof TagDeclaration.PortTag tag)) {
                continue;
            }
            PortDeclaration port = tag.port();
            int line = entry.line();
            switch (tag.tag()) {
                case "input", "param" -> {
                    if (port.scope() != null) {
                        scopes.add(port.scope());
                        if (ReservedNames.isScopedMandatoryPort(port.name())) {
                            reservedScopeDocs.put(port.scope() + ":" + port.name(), port);
                        } else {
                            scopedInputs.put(
                                    port.scope() + ":" + port.name(),
                                    PortDeclarations.apply(
                                            Port.input(port.name()), port, diagnostics, line));
                        }
                    } else if (port.name().equals(ReservedNames.EXECUTE)) {
                        PortDeclarations.applyDocumentation(execute, port);
                    } else if (inputs.containsKey(port.name())) {
                        PortDeclarations.apply(inputs.get(port.name()), port, diagnostics, line);
                    } else if (tag.tag().equals("input")) {
                        diagnostics.warning(
                                DiagnosticCode.PARSE_WARNING,
                                "Input '"
                                        + port.name()
                                        + "' of node type '"
                                        + name
                                        + "' has no matching parameter."
                                        + Suggestions.hint(port.name(), inputs.keySet()),
                                line);
                        inputs.put(
                                port.name(),
                                PortDeclarations.apply(Port.input(port.name()), port, diagnostics, line));
                    }
                }
                case "step" -> {
                    if (port.name().equals(ReservedNames.EXECUTE)) {
                        PortDeclarations.applyDocumentation(execute, port);
                    } else {
                        Port.Builder step = inputs.remove(port.name());
                        if (step == null) {
                            step = Port.input(port.name());
                        }
                        extraSteps.add(
                                PortDeclarations.apply(step, port, diagnostics, line)
                                        .dataType(DataType.STEP));
                    }
                }
                case "output", "returns" -> {
                    if (port.scope() != null) {
                        scopes.add(port.scope());
                        if (ReservedNames.isScopedMandatoryPort(port.name())) {
                            reservedScopeDocs.put(port.scope() + ":" + port.name(), port);
                        } else {
                            scopedOutputs.put(
                                    port.scope() + ":" + port.name(),
                                    PortDeclarations.apply(
                                            Port.output(port.name()), port, diagnostics, line));
                        }
                    } else if (port.name().equals(ReservedNames.ON_SUCCESS)) {
                        PortDeclarations.applyDocumentation(onSuccess, port);
                    } else if (port.name().equals(ReservedNames.ON_FAILURE)) {
                        PortDeclarations.applyDocumentation(onFailure, port);
                    } else if (outputs.containsKey(port.name())) {
                        PortDeclarations.apply(outputs.get(port.name()), port, diagnostics, line);
                    } else if (openOutputs && !single) {
                        outputs.put(
                                port.name(),
                                PortDeclarations.apply(Port.output(port.name()), port, diagnostics, line));
                    } else if (openOutputs && outputs.isEmpty()) {
                        Port.Builder value =
                                Port.output(port.name())
                                        .dataType(JavaTypes.infer(valueType))
                                        .javaType(valueType);
                        outputs.put(port.name(), PortDeclarations.apply(value, port, diagnostics, line));
                    } else if (tag.tag().equals("output")) {
                        diagnostics.warning(
                                DiagnosticCode.PARSE_WARNING,
                                "Output '"
                                        + port.name()
                                        + "' of node type '"
                                        + name
                                        + "' is not produced by its return type "
                                        + valueType
                                        + "."
                                        + Suggestions.hint(port.name(), outputs.keySet()),
                                line);
                    }
                }
                default -> {}
            }
        }

        if (openOutputs && outputs.isEmpty() && single) {
            outputs.put(
                    DEFAULT_OUTPUT,
                    Port.output(DEFAULT_OUTPUT)
                            .dataType(JavaTypes.infer(valueType))
                            .javaType(valueType));
        }

        // assemble
        type.input(execute.build());
        inputs.values().forEach(p -> type.input(p.build()));
        extraSteps.forEach(p -> type.input(p.build()));
        type.output(onSuccess.build());
        type.output(onFailure.build());
        outputs.values().forEach(p -> type.output(p.build()));

        for (String scope : scopes) {
            type.scope(scope);
            PortDeclaration success = reservedScopeDocs.get(scope + ":success");
            PortDeclaration failure = reservedScopeDocs.get(scope + ":failure");
            PortDeclaration start = reservedScopeDocs.get(scope + ":start");
            type.input(documented(ReservedPorts.scopeSuccess(scope), success).build());
            type.input(documented(ReservedPorts.scopeFailure(scope), failure).build());
            scopedInputs.forEach(
                    (key, port) -> {
                        if (key.startsWith(scope + ":")) {
                            type.input(port.build());
                        }
                    });
            type.output(documented(ReservedPorts.scopeStart(scope), start).build());
            scopedOutputs.forEach(
                    (key, port) -> {
                        if (key.startsWith(scope + ":")) {
                            type.output(port.build());
                        }
                    });
        }

        return type.build();
    }

    /// Outputs readable from the return type, or null when tags must declare them (maps,
    /// plain values).
    private static Map<String, Port.Builder> signatureOutputs(String valueType, ParsedSource source) {
        if (JavaTypes.isVoid(valueType)) {
            return new LinkedHashMap<>();
        }
        Optional<RecordShape> record = source.record(valueType);
        if (record.isEmpty()) {
            return null;
        }
        Map<String, Port.Builder> outputs = new LinkedHashMap<>();
        for (MethodParameter component : record.get().components()) {
            if (ReservedNames.isControlSignal(component.name())) {
                continue;
            }
            outputs.put(
                    component.name(),
                    Port.output(component.name())
                            .dataType(JavaTypes.infer(component.type()))
                            .javaType(component.type()));
        }
        return outputs;
    }

    /// Whether the method returns one value rather than a map of named outputs.
    static boolean isSingleValue(String valueType, ParsedSource source) {
        String raw = JavaTypes.simpleName(JavaTypes.rawType(valueType));
        return !JavaTypes.isVoid(valueType)
                && source.record(valueType).isEmpty()
                && !raw.equals("Map")
                && !raw.equals("WorkflowResult")
                && !raw.equals("ScopeResult");
    }

    private static Port.Builder documented(Port.Builder port, PortDeclaration declaration) {
        return declaration == null ? port : PortDeclarations.applyDocumentation(port, declaration);
    }

    private static Optional<ExecuteWhen> executeWhen(
            AnnotationBlock block, String typeName, int line, BuildDiagnostics diagnostics) {
        Optional<TagDeclaration.ExecuteWhenTag> tag = block.last(TagDeclaration.ExecuteWhenTag.class);
        if (tag.isEmpty()) {
            return Optional.empty();
        }
        String strategy = tag.get().strategy();
        try {
            return Optional.of(ExecuteWhen.valueOf(strategy.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            List<String> valid = Arrays.stream(ExecuteWhen.values()).map(Enum::name).toList();
            diagnostics.warning(
                    DiagnosticCode.INVALID_EXECUTE_WHEN,
                    "Node type \""
                            + typeName
                            + "\" has invalid @executeWhen value \""
                            + strategy
                            + "\"."
                            + Suggestions.hint(strategy, valid)
                            + " Valid values: "
                            + String.join(", ", valid)
                            + ".",
                    line);
            return Optional.empty();
        }
    }
}
