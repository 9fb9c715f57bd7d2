package io.weaver.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.InstanceConfig;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.serialization.mixin.InstanceConfigBuilderMixin;
import io.weaver.serialization.mixin.InstanceConfigMixin;
import io.weaver.serialization.mixin.ScopedFlagMixin;
import io.weaver.serialization.mixin.WorkflowGraphBuilderMixin;
import io.weaver.serialization.mixin.WorkflowGraphMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Weaver serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `ImplementationRef`: `ImplementationRefSerializer` / `ImplementationRefDeserializer`,
///   discriminator: `"kind"`
/// - `NodeType`: `NodeTypeSerializer` / `NodeTypeDeserializer`
/// - `Port`: `PortSerializer` / `PortDeserializer`
///
/// **Mixin/builder pairs** (immutable builder-pattern model objects):
/// - `WorkflowGraph` + `WorkflowGraph.Builder`
/// - `InstanceConfig` + `InstanceConfig.Builder`
///
/// Records (`NodeInstance`, `Connection`, `PortRef`, `Scope`, `WorkflowOptions`, ...) bind
/// through their canonical constructors.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see GraphSerializer for the convenience factory API
public class WeaverJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3377061859526431829L;

    public WeaverJacksonModule() {
        super("WeaverJacksonModule");

        addSerializer(ImplementationRef.class, new ImplementationRefSerializer());
        addDeserializer(ImplementationRef.class, new ImplementationRefDeserializer());

        addSerializer(NodeType.class, new NodeTypeSerializer());
        addDeserializer(NodeType.class, new NodeTypeDeserializer());

        addSerializer(Port.class, new PortSerializer());
        addDeserializer(Port.class, new PortDeserializer());
    }

    /// Applies mixin annotations to builder-pattern model types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowGraph.class, WorkflowGraphMixin.class);
        context.setMixInAnnotations(WorkflowGraph.Builder.class, WorkflowGraphBuilderMixin.class);

        context.setMixInAnnotations(InstanceConfig.class, InstanceConfigMixin.class);
        context.setMixInAnnotations(
                InstanceConfig.Builder.class, InstanceConfigBuilderMixin.class);

        context.setMixInAnnotations(NodeInstance.class, ScopedFlagMixin.class);
        context.setMixInAnnotations(PortRef.class, ScopedFlagMixin.class);
    }
}
