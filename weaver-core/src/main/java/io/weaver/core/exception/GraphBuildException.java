package io.weaver.core.exception;

import java.io.Serial;

/// Thrown when annotations are structurally unusable, for example a pattern without
/// `@name`. No partial graph is produced.
public class GraphBuildException extends Exception {

    @Serial private static final long serialVersionUID = -2381157190545527641L;

    /// Creates exception with message.
    ///
    /// @param message description of the structural problem
    public GraphBuildException(String message) {
        super(message);
    }

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
