package io.weaver.runtime;

import java.io.Serial;

/// Wraps a checked exception thrown by a node function.
///
/// Unchecked exceptions thrown by node functions propagate unchanged.
public class NodeExecutionException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3390227315815932917L;

    private final String nodeId;

    /// Creates the exception.
    ///
    /// @param nodeId id of the failing node instance, not null
    /// @param cause the exception thrown by the node function, not null
    public NodeExecutionException(String nodeId, Throwable cause) {
        super("Node '" + nodeId + "' failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }

    /// Rethrows unchecked exceptions and errors unchanged and wraps checked ones.
    ///
    /// @param nodeId id of the failing node instance, not null
    /// @param error the caught throwable, not null
    /// @return never returns normally; declared so call sites can write `throw propagate(..)`
    public static RuntimeException propagate(String nodeId, Throwable error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        if (error instanceof Error e) {
            throw e;
        }
        return new NodeExecutionException(nodeId, error);
    }

    /// Fails the call of a node bound to a type without implementation.
    ///
    /// @param nodeType name of the stub type, not null
    /// @return never returns normally; typed so generated code can use it as the call result
    /// @throws UnsupportedOperationException always
    public static <T> T unimplemented(String nodeType) {
        throw new UnsupportedOperationException(
                "Node type '" + nodeType + "' has no implementation");
    }
}
