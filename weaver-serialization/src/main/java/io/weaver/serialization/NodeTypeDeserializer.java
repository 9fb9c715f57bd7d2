package io.weaver.serialization;

import static io.weaver.serialization.PortDeserializer.text;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.weaver.core.model.BranchingStrategy;
import io.weaver.core.model.ExecuteWhen;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Parameter;
import io.weaver.core.model.Port;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Deserializes a `NodeType` through its builder.
///
/// Ports and the implementation reference go through the mapper, so the module's
/// {@link PortDeserializer} and {@link ImplementationRefDeserializer} apply to them.
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see NodeTypeSerializer for the inverse operation
class NodeTypeDeserializer extends StdDeserializer<NodeType> {

    @Serial private static final long serialVersionUID = 5528803216647093114L;

    private static final TypeReference<List<Port>> PORT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Parameter>> PARAMETER_LIST =
            new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    NodeTypeDeserializer() {
        super(NodeType.class);
    }

    @Override
    public NodeType deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String name = text(root, "name");
        if (name == null) {
            throw new IOException("Node type requires 'name'");
        }
        NodeType.Builder builder =
                NodeType.builder(name)
                        .functionName(text(root, "functionName"))
                        .label(text(root, "label"))
                        .description(text(root, "description"))
                        .returnType(text(root, "returnType"))
                        .async(root.path("async").asBoolean(false))
                        .pullExecution(text(root, "pullExecution"))
                        .color(text(root, "color"))
                        .icon(text(root, "icon"));

        if (root.hasNonNull("variant")) {
            builder.variant(NodeVariant.valueOf(root.get("variant").asText()));
        }
        if (root.hasNonNull("executeWhen")) {
            builder.executeWhen(ExecuteWhen.valueOf(root.get("executeWhen").asText()));
        }
        if (root.hasNonNull("branchingStrategy")) {
            builder.branchingStrategy(
                    BranchingStrategy.valueOf(root.get("branchingStrategy").asText()));
        }
        if (root.hasNonNull("implementation")) {
            builder.implementation(
                    mapper.treeToValue(root.get("implementation"), ImplementationRef.class));
        }
        if (root.has("inputs")) {
            builder.inputs(mapper.convertValue(root.get("inputs"), PORT_LIST));
        }
        if (root.has("outputs")) {
            builder.outputs(mapper.convertValue(root.get("outputs"), PORT_LIST));
        }
        if (root.has("parameters")) {
            builder.parameters(mapper.convertValue(root.get("parameters"), PARAMETER_LIST));
        }
        if (root.has("scopes")) {
            mapper.convertValue(root.get("scopes"), STRING_LIST).forEach(builder::scope);
        }
        return builder.build();
    }
}
