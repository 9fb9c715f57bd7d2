package io.weaver.runtime;

import java.io.Serial;

/// Thrown when nested workflow invocations exceed {@link WorkflowContext#MAX_RECURSION_DEPTH}.
///
/// Fatal and non-retryable: it is raised before the nested call starts, so no partial state
/// of the nested workflow exists to resume from.
public class RecursionDepthExceededException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127031983205684716L;

    private final String workflow;
    private final int depth;

    /// Creates the exception for the workflow whose invocation was refused.
    ///
    /// @param workflow name of the workflow being entered, not null
    /// @param depth the depth that was refused
    public RecursionDepthExceededException(String workflow, int depth) {
        super(
                "Max recursion depth exceeded ("
                        + WorkflowContext.MAX_RECURSION_DEPTH
                        + ") in workflow "
                        + workflow);
        this.workflow = workflow;
        this.depth = depth;
    }

    public String getWorkflow() {
        return workflow;
    }

    public int getDepth() {
        return depth;
    }

    /// Always false.
    public boolean isRetryable() {
        return false;
    }
}
