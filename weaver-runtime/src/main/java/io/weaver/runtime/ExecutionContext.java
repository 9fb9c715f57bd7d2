package io.weaver.runtime;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Variable store of one generated workflow invocation.
///
/// Every node execution receives an execution index from {@link #addExecution(String)}; output
/// port values are stored under `id:port:index`. Reads without an explicit index resolve to
/// the node's latest execution. A node registered as a pull executor runs the first time one
/// of its outputs is read, so a pull node nobody reads never runs.
///
/// Scopes get their own context from {@link #createScope(String, String)}: variables start
/// empty, execution indices continue from the parent so they stay unique within the
/// invocation.
///
/// @implNote Not thread-safe. A generated program uses one context per invocation from a
/// single flow of control.
public final class ExecutionContext {

    private final WorkflowContext workflowContext;
    private final boolean traced;
    private final ExecutionContext parent;
    private final Map<String, Object> variables = new HashMap<>();
    private final Map<String, Integer> latestExecution = new HashMap<>();
    private final Map<String, Runnable> pullExecutors = new LinkedHashMap<>();
    private final Set<String> runningPullNodes = new HashSet<>();
    private int executionCounter;

    /// Creates the root context of an invocation.
    ///
    /// @param workflowContext invocation context, not null
    /// @param traced whether node events are forwarded to the listener
    public ExecutionContext(WorkflowContext workflowContext, boolean traced) {
        this(workflowContext, traced, null, 0);
    }

    private ExecutionContext(
            WorkflowContext workflowContext,
            boolean traced,
            ExecutionContext parent,
            int executionCounter) {
        this.workflowContext = Objects.requireNonNull(workflowContext, "workflowContext");
        this.traced = traced;
        this.parent = parent;
        this.executionCounter = executionCounter;
    }

    public WorkflowContext workflowContext() {
        return workflowContext;
    }

    /// Registers a new execution of a node.
    ///
    /// @param nodeId instance id, not null
    /// @return the execution index, unique within the invocation
    public int addExecution(String nodeId) {
        int index = nextIndex();
        latestExecution.put(nodeId, index);
        return index;
    }

    private int nextIndex() {
        if (parent != null) {
            int index = parent.nextIndex();
            executionCounter = index + 1;
            return index;
        }
        return executionCounter++;
    }

    /// Returns whether the node has executed in this context.
    public boolean hasExecuted(String nodeId) {
        return latestExecution.containsKey(nodeId);
    }

    /// Stores an output port value.
    ///
    /// @param nodeId instance id, not null
    /// @param port port name, not null
    /// @param executionIndex index returned by {@link #addExecution(String)}
    /// @param value the value, may be null
    public void setVariable(String nodeId, String port, int executionIndex, Object value) {
        variables.put(key(nodeId, port, executionIndex), value);
        if (traced) {
            workflowContext.listener().onVariableSet(nodeId, port, executionIndex, value);
        }
    }

    /// Reads a port value of the node's latest execution.
    ///
    /// Runs the node first when it is a registered pull executor that has not executed yet.
    ///
    /// @param nodeId instance id, not null
    /// @param port port name, not null
    /// @return the value, or null when the node never executed or never set the port
    public Object get(String nodeId, String port) {
        if (!latestExecution.containsKey(nodeId)) {
            runPullExecutor(nodeId);
        }
        Integer index = latestExecution.get(nodeId);
        if (index == null) {
            return null;
        }
        return variables.get(key(nodeId, port, index));
    }

    /// Returns whether the node executed and its port holds `true`.
    ///
    /// @param nodeId instance id, not null
    /// @param port STEP port name, not null
    public boolean isTrue(String nodeId, String port) {
        return Coercions.isTruthy(get(nodeId, port));
    }

    /// Registers the lazy executor of a pull node.
    ///
    /// @param nodeId instance id, not null
    /// @param executor body that executes the node once, not null
    public void registerPullExecutor(String nodeId, Runnable executor) {
        pullExecutors.put(nodeId, Objects.requireNonNull(executor, "executor"));
    }

    /// Returns whether a pull node is registered but has not been demanded yet.
    public boolean isPending(String nodeId) {
        return pullExecutors.containsKey(nodeId) && !latestExecution.containsKey(nodeId);
    }

    private void runPullExecutor(String nodeId) {
        Runnable executor = pullExecutors.get(nodeId);
        if (executor == null) {
            return;
        }
        if (!runningPullNodes.add(nodeId)) {
            throw new IllegalStateException("Pull node '" + nodeId + "' demanded its own output");
        }
        try {
            executor.run();
        } finally {
            runningPullNodes.remove(nodeId);
        }
    }

    /// Creates the context of one scope activation.
    ///
    /// @param ownerId id of the scope-owning instance, not null
    /// @param scopeName scope name, not null
    /// @return a clean child context, never null
    public ExecutionContext createScope(String ownerId, String scopeName) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(scopeName, "scopeName");
        return new ExecutionContext(workflowContext, traced, this, executionCounter);
    }

    /// Reports a node status change to the listener.
    public void nodeStatus(String nodeType, String nodeId, int executionIndex, NodeStatus status) {
        if (traced) {
            workflowContext.listener().onNodeStatus(nodeType, nodeId, executionIndex, status);
        }
    }

    /// Reports a node failure to the listener.
    public void nodeFailed(String nodeType, String nodeId, int executionIndex, Throwable error) {
        if (traced) {
            workflowContext
                    .listener()
                    .onNodeStatus(nodeType, nodeId, executionIndex, NodeStatus.FAILED);
            workflowContext.listener().onNodeError(nodeType, nodeId, executionIndex, error);
        }
    }

    /// Key of a port slot inside a scope: `port:scope`.
    public static String scoped(String port, String scope) {
        return port + ":" + scope;
    }

    private static String key(String nodeId, String port, int executionIndex) {
        return nodeId + ":" + port + ":" + executionIndex;
    }
}
