package io.weaver.runtime;

/// Listener for generated workflow execution events.
///
/// Provides hooks for tracing and debugging a generated program. All methods have default
/// no-op implementations, allowing listeners to override only the events they care about.
///
/// ### Callback Lifecycle
/// Each node execution triggers callbacks in this order:
///
/// ```
/// onNodeStatus(RUNNING)      - about to call the node function
/// onVariableSet(...)         - once per materialized output port
/// onNodeStatus(SUCCEEDED)    - node function returned
///   or
/// onNodeStatus(FAILED)       - node function threw
/// onNodeError(...)           - with the thrown exception
/// ```
///
/// `onWorkflowComplete` is called once per entry point invocation.
///
/// @implNote Programs generated in production mode do not emit node-level events.
/// @see WorkflowContext.Builder#listener(ExecutionListener)
public interface ExecutionListener {

    /// Called when a node execution changes status.
    ///
    /// @param nodeType name of the node type being executed, not null
    /// @param nodeId instance id, not null
    /// @param executionIndex execution index within the invocation
    /// @param status the new status, not null
    default void onNodeStatus(
            String nodeType, String nodeId, int executionIndex, NodeStatus status) {}

    /// Called when an output port value is stored.
    ///
    /// @param nodeId instance id, not null
    /// @param port output port name, not null
    /// @param executionIndex execution index within the invocation
    /// @param value the stored value, may be null
    default void onVariableSet(String nodeId, String port, int executionIndex, Object value) {}

    /// Called when a node function throws.
    ///
    /// @param nodeType name of the node type, not null
    /// @param nodeId instance id, not null
    /// @param executionIndex execution index within the invocation
    /// @param error the thrown exception, not null
    default void onNodeError(
            String nodeType, String nodeId, int executionIndex, Throwable error) {}

    /// Called when a workflow entry point completes normally.
    ///
    /// @param workflow workflow name, not null
    /// @param result the workflow result, not null
    default void onWorkflowComplete(String workflow, WorkflowResult result) {}
}
