package io.weaver.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weaver.core.model.InstanceConfig;

/// Jackson mixin that binds `InstanceConfig` deserialization to its builder.
///
/// @see InstanceConfigBuilderMixin
@JsonDeserialize(builder = InstanceConfig.Builder.class)
public abstract class InstanceConfigMixin {}
