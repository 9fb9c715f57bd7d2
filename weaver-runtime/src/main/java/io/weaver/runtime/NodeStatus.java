package io.weaver.runtime;

/// Lifecycle status reported for a node execution.
public enum NodeStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
