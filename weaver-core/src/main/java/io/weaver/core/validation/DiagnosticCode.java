package io.weaver.core.validation;

/// Machine-readable codes of parse, build, validation and planning findings.
public enum DiagnosticCode {
    // parsing and building
    PARSE_WARNING,
    DEPRECATED_POSITION,
    UNRESOLVED_IMPORT,
    SYNC_DECLARED_ASYNC_REQUIRED,
    INVALID_MAP,
    INVALID_COERCE,

    // names
    MISSING_WORKFLOW_NAME,
    MISSING_FUNCTION_NAME,
    DUPLICATE_NODE_NAME,
    DUPLICATE_INSTANCE_ID,
    RESERVED_NODE_NAME,
    RESERVED_INSTANCE_ID,

    // binding
    UNKNOWN_NODE_TYPE,
    STUB_NODE,

    // connections
    UNKNOWN_SOURCE_NODE,
    UNKNOWN_TARGET_NODE,
    UNKNOWN_SOURCE_PORT,
    UNKNOWN_TARGET_PORT,
    DUPLICATE_CONNECTION,
    UNDEFINED_NODE,
    MULTIPLE_CONNECTIONS_TO_INPUT,

    // types
    STEP_PORT_TYPE_MISMATCH,
    LOSSY_TYPE_COERCION,
    UNUSUAL_TYPE_COERCION,
    TYPE_MISMATCH,

    // inputs and reachability
    MISSING_REQUIRED_INPUT,
    UNUSED_NODE,
    NO_START_CONNECTIONS,
    NO_EXIT_CONNECTIONS,
    UNUSED_OUTPUT_PORT,
    UNREACHABLE_EXIT_PORT,
    INVALID_EXIT_PORT_TYPE,
    MULTIPLE_EXIT_CONNECTIONS,
    CYCLE_DETECTED,

    // instance and type configuration
    INVALID_EXECUTE_WHEN,
    INVALID_PORT_CONFIG_REF,
    INVALID_PULL_EXECUTION_PORT,

    // scopes
    SCOPE_NO_PORTS,
    SCOPE_INCONSISTENT,
    SCOPE_WRONG_SCOPE_NAME,
    SCOPE_EMPTY,
    SCOPE_UNKNOWN_PORT,
    SCOPE_CONNECTION_OUTSIDE,
    SCOPE_PORT_TYPE_MISMATCH,
    SCOPE_MISSING_REQUIRED_INPUT,
    SCOPE_UNUSED_INPUT,
    SCOPE_ORPHANED_CHILD,

    // patterns
    PATTERN_NO_PORTS
}
