package io.weaver.runtime;

/// Responder for human-approval steps.
///
/// Node functions that need an approval declare a `WorkflowContext` parameter and ask
/// `context.approvals()`. Tests substitute a canned responder through
/// {@link WorkflowContext.Builder#approvals(ApprovalProvider)}.
@FunctionalInterface
public interface ApprovalProvider {

    /// Provider that rejects every request.
    ApprovalProvider DENY_ALL = (nodeId, request) -> false;

    /// Decides an approval request.
    ///
    /// @param nodeId id of the requesting node instance, not null
    /// @param request request payload supplied by the node, may be null
    /// @return true when approved
    boolean approve(String nodeId, Object request);
}
