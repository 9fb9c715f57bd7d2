package io.weaver.core.model;

/// Kind of implementation behind a node type.
public enum NodeVariant {
    /// A static method with a body.
    FUNCTION,

    /// A declaration without a body. Allowed only in draft mode.
    STUB,

    /// A workflow used as a node.
    IMPORTED_WORKFLOW,

    /// The iteration node of a `@map` line, backed by the runtime.
    MAP_ITERATOR,

    /// The conversion node of a `@coerce` line, backed by the runtime.
    COERCION
}
