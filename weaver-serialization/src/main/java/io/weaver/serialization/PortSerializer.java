package io.weaver.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.weaver.core.model.Port;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `Port`. Every object starts with `"name"`, `"direction"` and `"dataType"`;
/// flags are written only when set and optional fields only when present.
///
/// `"defaultValue"` is written whenever the port declares a default, including an explicit
/// `null`, so the two cases survive a round trip.
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see PortDeserializer for the inverse operation
class PortSerializer extends StdSerializer<Port> {

    @Serial private static final long serialVersionUID = 2960183514476327012L;

    PortSerializer() {
        super(Port.class);
    }

    @Override
    public void serialize(Port port, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", port.getName());
        gen.writeStringField("direction", port.getDirection().name());
        gen.writeStringField("dataType", port.getDataType().name());
        writeIfTrue(gen, "optional", port.isOptional());
        if (port.hasDefault()) {
            provider.defaultSerializeField("defaultValue", port.getDefaultValue(), gen);
        }
        writeIfNotNull(gen, "scope", port.getScope());
        writeIfTrue(gen, "controlFlow", port.isControlFlow());
        writeIfTrue(gen, "failure", port.isFailure());
        if (port.getMergeStrategy() != null) {
            gen.writeStringField("mergeStrategy", port.getMergeStrategy().name());
        }
        writeIfNotNull(gen, "label", port.getLabel());
        writeIfNotNull(gen, "description", port.getDescription());
        if (port.getOrder() != null) {
            gen.writeNumberField("order", port.getOrder());
        }
        if (port.getPlacement() != null) {
            gen.writeStringField("placement", port.getPlacement().name());
        }
        writeIfNotNull(gen, "expression", port.getExpression());
        writeIfNotNull(gen, "javaType", port.getJavaType());
        gen.writeEndObject();
    }

    static void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }

    static void writeIfTrue(JsonGenerator gen, String field, boolean value) throws IOException {
        if (value) {
            gen.writeBooleanField(field, true);
        }
    }
}
