package io.weaver.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.weaver.core.model.ImplementationRef;
import java.io.IOException;
import java.io.Serial;

/// Serializes `ImplementationRef` variants with a `"kind"` discriminator field.
///
/// ```
/// kind        | additional fields
/// ------------+--------------------------
/// LOCAL       | className, methodName
/// SAME_FILE   | workflowName
/// EXTERNAL    | className, exportName
/// ```
///
/// @implNote Package-private. Registered by {@link WeaverJacksonModule}.
/// @see ImplementationRefDeserializer for the inverse operation
class ImplementationRefSerializer extends StdSerializer<ImplementationRef> {

    @Serial private static final long serialVersionUID = 6190335214473580712L;

    static final String LOCAL = "LOCAL";
    static final String SAME_FILE = "SAME_FILE";
    static final String EXTERNAL = "EXTERNAL";

    ImplementationRefSerializer() {
        super(ImplementationRef.class);
    }

    @Override
    public void serialize(ImplementationRef ref, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (ref instanceof ImplementationRef.Local local) {
            gen.writeStringField("kind", LOCAL);
            gen.writeStringField("className", local.className());
            gen.writeStringField("methodName", local.methodName());
        } else if (ref instanceof ImplementationRef.SameFile sameFile) {
            gen.writeStringField("kind", SAME_FILE);
            gen.writeStringField("workflowName", sameFile.workflowName());
        } else if (ref instanceof ImplementationRef.External external) {
            gen.writeStringField("kind", EXTERNAL);
            gen.writeStringField("className", external.className());
            gen.writeStringField("exportName", external.exportName());
        } else {
            throw new IOException(
                    "Unknown implementation reference: " + ref.getClass().getSimpleName());
        }
        gen.writeEndObject();
    }
}
