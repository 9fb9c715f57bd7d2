package io.weaver.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.weaver.core.model.DataType;
import io.weaver.core.model.MergeStrategy;
import io.weaver.core.model.Placement;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortDirection;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `Port` through its builder.
///
/// Default values are read as untyped JSON: numbers become `Integer`, `Long` or `Double`,
/// arrays `List` and objects `Map`, which matches how defaults are parsed from source.
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see PortSerializer for the inverse operation
class PortDeserializer extends StdDeserializer<Port> {

    @Serial private static final long serialVersionUID = -7251904662034117385L;

    PortDeserializer() {
        super(Port.class);
    }

    @Override
    public Port deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode name = root.get("name");
        JsonNode direction = root.get("direction");
        if (name == null || direction == null) {
            throw new IOException("Port requires 'name' and 'direction'");
        }
        Port.Builder builder =
                PortDirection.valueOf(direction.asText()) == PortDirection.INPUT
                        ? Port.input(name.asText())
                        : Port.output(name.asText());

        if (root.hasNonNull("dataType")) {
            builder.dataType(DataType.valueOf(root.get("dataType").asText()));
        }
        builder.optional(root.path("optional").asBoolean(false));
        if (root.has("defaultValue")) {
            builder.defaultValue(mapper.treeToValue(root.get("defaultValue"), Object.class));
        }
        builder.scope(text(root, "scope"));
        builder.controlFlow(root.path("controlFlow").asBoolean(false));
        builder.failure(root.path("failure").asBoolean(false));
        if (root.hasNonNull("mergeStrategy")) {
            builder.mergeStrategy(MergeStrategy.valueOf(root.get("mergeStrategy").asText()));
        }
        builder.label(text(root, "label"));
        builder.description(text(root, "description"));
        if (root.hasNonNull("order")) {
            builder.order(root.get("order").asInt());
        }
        if (root.hasNonNull("placement")) {
            builder.placement(Placement.valueOf(root.get("placement").asText()));
        }
        builder.expression(text(root, "expression"));
        builder.javaType(text(root, "javaType"));
        return builder.build();
    }

    static String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
