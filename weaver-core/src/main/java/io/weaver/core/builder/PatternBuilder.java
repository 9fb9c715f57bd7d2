package io.weaver.core.builder;

import io.weaver.core.exception.GraphBuildException;
import io.weaver.core.grammar.AnnotationBlock;
import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.Connection;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.Port;
import io.weaver.core.parser.AnnotatedFunction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds a {@link Pattern} from a method tagged `@flowWeaver pattern`.
final class PatternBuilder {

    Pattern build(AnnotatedFunction function, TypeTable types, BuildDiagnostics diagnostics)
            throws GraphBuildException {
        AnnotationBlock block = function.annotations();
        String name =
                block.last(TagDeclaration.NameTag.class)
                        .map(TagDeclaration.NameTag::name)
                        .orElseThrow(
                                () ->
                                        new GraphBuildException(
                                                "Pattern on method '"
                                                        + function.name()
                                                        + "' (line "
                                                        + function.line()
                                                        + ") has no @name"));

        List<NodeInstance> instances = new ArrayList<>();
        Map<String, NodeType> nodeTypes = new LinkedHashMap<>();
        List<Connection> connections = new ArrayList<>();
        List<Port> inputs = new ArrayList<>();
        List<Port> outputs = new ArrayList<>();

        for (AnnotationBlock.Entry entry : block.entries()) {
            TagDeclaration declaration = entry.declaration();
            if (declaration instanceof TagDeclaration.NodeTag tag) {
                instances.add(new NodeInstance(tag.id(), tag.type(), tag.parent(), tag.config()));
                types.resolve(tag.type(), diagnostics, entry.line())
                        .ifPresent(type -> nodeTypes.putIfAbsent(type.getName(), type));
            } else if (declaration instanceof TagDeclaration.ConnectTag tag) {
                connections.add(new Connection(tag.from(), tag.to()));
            } else if (declaration instanceof TagDeclaration.PatternPortTag tag) {
                Port.Builder port =
                        tag.input() ? Port.input(tag.port().name()) : Port.output(tag.port().name());
                PortDeclarations.apply(port, tag.port(), diagnostics, entry.line());
                (tag.input() ? inputs : outputs).add(port.build());
            }
        }

        String description =
                block.last(TagDeclaration.DescriptionTag.class)
                        .map(TagDeclaration.DescriptionTag::text)
                        .orElse(block.summary());
        return new Pattern(name, description, nodeTypes, instances, connections, inputs, outputs);
    }
}
