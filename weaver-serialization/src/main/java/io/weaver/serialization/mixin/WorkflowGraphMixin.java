package io.weaver.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weaver.core.model.WorkflowGraph;

/// Jackson mixin that binds `WorkflowGraph` deserialization to its builder.
///
/// Applied to `WorkflowGraph.class` via `WeaverJacksonModule.setupModule()`. Serialization
/// uses the graph's getters; the `declaredAsync` flag comes from `isDeclaredAsync()`.
///
/// @apiNote The companion mixin {@link WorkflowGraphBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see WorkflowGraphBuilderMixin
/// @see io.weaver.serialization.WeaverJacksonModule
@JsonDeserialize(builder = WorkflowGraph.Builder.class)
public abstract class WorkflowGraphMixin {}
