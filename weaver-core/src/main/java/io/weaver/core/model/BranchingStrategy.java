package io.weaver.core.model;

/// How a node function reports its success or failure branch.
public enum BranchingStrategy {
    /// The function takes `execute` and returns `onSuccess`/`onFailure` with its outputs.
    VALUE_BASED,

    /// The function returns its output; a thrown exception selects the failure branch.
    EXCEPTION_BASED
}
