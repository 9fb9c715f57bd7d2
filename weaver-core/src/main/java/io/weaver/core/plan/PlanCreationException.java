package io.weaver.core.plan;

import java.io.Serial;

/// Thrown when a workflow graph cannot be turned into an execution plan.
///
/// The only cause in a validated graph is an ordering cycle: nodes whose control or data
/// edges form a loop inside one layer, so no node of the loop can run first. The message
/// names the workflow and lists the nodes of the loop.
///
/// @see ExecutionPlanner#plan for plan creation
public class PlanCreationException extends Exception {

    @Serial private static final long serialVersionUID = 4117802938152170517L;

    /// Creates exception with message.
    ///
    /// @param message description of why plan creation failed
    public PlanCreationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of why plan creation failed
    /// @param cause the underlying exception
    public PlanCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
