package io.weaver.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.weaver.core.model.InstanceConfig;
import java.util.Map;

/// Jackson mixin for `InstanceConfig.Builder`.
///
/// The getter is `getPortOrder()` while the bulk builder method is `portOrders(Map)`; the
/// mixin binds the serialized `"portOrder"` field to the latter.
///
/// @see InstanceConfigMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class InstanceConfigBuilderMixin {

    @JsonProperty("portOrder")
    abstract InstanceConfig.Builder portOrders(Map<String, Integer> orders);
}
