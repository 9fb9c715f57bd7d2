package io.weaver.runtime;

import java.util.Objects;
import java.util.concurrent.Executor;

/// Invocation context threaded through a generated workflow call.
///
/// Holds the optional collaborators a program may use, an {@link ExecutionListener} for
/// tracing and an {@link ApprovalProvider} for approval steps, plus the executor async entry
/// points run on and the current nesting depth of workflow-as-node calls. Nothing is looked
/// up from static state: callers pass a context in, or the generated single-argument overload
/// creates a default one.
///
/// ### Usage
/// {@snippet :
/// WorkflowContext context = WorkflowContext.builder()
///     .listener(traceListener)
///     .approvals((nodeId, request) -> true)
///     .build();
/// WorkflowResult result = OrdersWorkflows.approveOrder(true, params, context);
/// }
///
/// @implNote Immutable. {@link #descend(String)} returns a new context.
public final class WorkflowContext {

    /// Nesting ceiling for workflow-as-node calls.
    public static final int MAX_RECURSION_DEPTH = 1000;

    private static final ExecutionListener NO_OP_LISTENER = new ExecutionListener() {};

    private final ExecutionListener listener;
    private final ApprovalProvider approvals;
    private final Executor executor;
    private final int depth;

    private WorkflowContext(
            ExecutionListener listener, ApprovalProvider approvals, Executor executor, int depth) {
        this.listener = listener;
        this.approvals = approvals;
        this.executor = executor;
        this.depth = depth;
    }

    /// Creates a context with a no-op listener, a deny-all approval provider and a
    /// caller-thread executor.
    public static WorkflowContext create() {
        return builder().build();
    }

    public ExecutionListener listener() {
        return listener;
    }

    public ApprovalProvider approvals() {
        return approvals;
    }

    public Executor executor() {
        return executor;
    }

    /// Current nesting depth, 0 for a top-level invocation.
    public int depth() {
        return depth;
    }

    /// Returns the context for a nested workflow invocation.
    ///
    /// @param workflow name of the workflow about to be entered, not null
    /// @return a context one level deeper, never null
    /// @throws RecursionDepthExceededException when the ceiling is reached
    public WorkflowContext descend(String workflow) {
        int next = depth + 1;
        if (next >= MAX_RECURSION_DEPTH) {
            throw new RecursionDepthExceededException(workflow, next);
        }
        return new WorkflowContext(listener, approvals, executor, next);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExecutionListener listener = NO_OP_LISTENER;
        private ApprovalProvider approvals = ApprovalProvider.DENY_ALL;
        private Executor executor = Runnable::run;

        private Builder() {}

        /// Sets the trace listener.
        ///
        /// @param listener listener receiving execution events, not null
        /// @return this builder for chaining
        public Builder listener(ExecutionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /// Sets the approval responder.
        ///
        /// @param approvals approval provider, not null
        /// @return this builder for chaining
        public Builder approvals(ApprovalProvider approvals) {
            this.approvals = Objects.requireNonNull(approvals, "approvals");
            return this;
        }

        /// Sets the executor async entry points run on (default: the calling thread).
        ///
        /// @param executor executor, not null
        /// @return this builder for chaining
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public WorkflowContext build() {
            return new WorkflowContext(listener, approvals, executor, 0);
        }
    }
}
