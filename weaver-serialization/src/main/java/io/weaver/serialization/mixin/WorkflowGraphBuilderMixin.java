package io.weaver.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `WorkflowGraph.Builder`: JSON field names map directly to builder
/// method names (`startPorts`, `nodeTypes`, `positions`).
///
/// @see WorkflowGraphMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowGraphBuilderMixin {}
