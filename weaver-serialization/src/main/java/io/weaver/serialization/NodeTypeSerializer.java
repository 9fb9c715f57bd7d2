package io.weaver.serialization;

import static io.weaver.serialization.PortSerializer.writeIfNotNull;
import static io.weaver.serialization.PortSerializer.writeIfTrue;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.weaver.core.model.NodeType;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `NodeType` with its ports, parameters and implementation reference.
///
/// Derived views such as `isExpression()` are not written; they are recomputed from
/// `"branchingStrategy"` on the way back.
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see NodeTypeDeserializer for the inverse operation
class NodeTypeSerializer extends StdSerializer<NodeType> {

    @Serial private static final long serialVersionUID = -1486631932035902235L;

    NodeTypeSerializer() {
        super(NodeType.class);
    }

    @Override
    public void serialize(NodeType type, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", type.getName());
        gen.writeStringField("functionName", type.getFunctionName());
        gen.writeStringField("variant", type.getVariant().name());
        writeIfNotNull(gen, "label", type.getLabel());
        writeIfNotNull(gen, "description", type.getDescription());
        if (type.getImplementation() != null) {
            provider.defaultSerializeField("implementation", type.getImplementation(), gen);
        }
        provider.defaultSerializeField("inputs", type.getInputs(), gen);
        provider.defaultSerializeField("outputs", type.getOutputs(), gen);
        if (!type.getParameters().isEmpty()) {
            provider.defaultSerializeField("parameters", type.getParameters(), gen);
        }
        writeIfNotNull(gen, "returnType", type.getReturnType());
        writeIfTrue(gen, "async", type.isAsync());
        gen.writeStringField("executeWhen", type.getExecuteWhen().name());
        gen.writeStringField("branchingStrategy", type.getBranchingStrategy().name());
        writeIfNotNull(gen, "pullExecution", type.getPullExecution());
        if (!type.getScopes().isEmpty()) {
            provider.defaultSerializeField("scopes", type.getScopes(), gen);
        }
        writeIfNotNull(gen, "color", type.getColor());
        writeIfNotNull(gen, "icon", type.getIcon());
        gen.writeEndObject();
    }
}
