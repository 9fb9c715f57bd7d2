package io.weaver.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin that drops the derived `isScoped()` view from records carrying an optional
/// scope, so only the record components are written.
///
/// Applied to `NodeInstance` and `PortRef`.
@JsonIgnoreProperties({"scoped"})
public abstract class ScopedFlagMixin {}
