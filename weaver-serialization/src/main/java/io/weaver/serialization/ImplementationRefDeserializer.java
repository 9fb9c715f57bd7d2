package io.weaver.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.weaver.core.model.ImplementationRef;
import java.io.IOException;
import java.io.Serial;

/// Deserializes JSON to the `ImplementationRef` variant named by the `"kind"` field.
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see ImplementationRefSerializer for the inverse operation
class ImplementationRefDeserializer extends StdDeserializer<ImplementationRef> {

    @Serial private static final long serialVersionUID = -3358021774920156432L;

    ImplementationRefDeserializer() {
        super(ImplementationRef.class);
    }

    /// @throws IOException if `"kind"` is absent or unrecognized, or a required field is missing
    @Override
    public ImplementationRef deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode kind = root.get("kind");
        if (kind == null) {
            throw new IOException("Implementation reference without 'kind'");
        }
        return switch (kind.asText()) {
            case ImplementationRefSerializer.LOCAL ->
                    new ImplementationRef.Local(
                            required(root, "className"), required(root, "methodName"));
            case ImplementationRefSerializer.SAME_FILE ->
                    new ImplementationRef.SameFile(required(root, "workflowName"));
            case ImplementationRefSerializer.EXTERNAL ->
                    new ImplementationRef.External(
                            required(root, "className"), required(root, "exportName"));
            default -> throw new IOException("Unknown implementation kind: " + kind.asText());
        };
    }

    private static String required(JsonNode root, String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing required field '" + field + "'");
        }
        return value.asText();
    }
}
