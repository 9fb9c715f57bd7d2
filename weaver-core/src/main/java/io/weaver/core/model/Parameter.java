package io.weaver.core.model;

import java.util.Objects;

/// One parameter of the Java method behind a node type, in declaration order.
///
/// The generator passes arguments by walking these: `EXECUTE` receives the trigger,
/// `PORT` the value of the input port of the same name, `SCOPE` the closure of the named
/// scope and `CONTEXT` the invocation's `WorkflowContext`.
///
/// @param name parameter name, not null
/// @param javaType declared Java type text, not null
/// @param kind what the generator passes, not null
public record Parameter(String name, String javaType, Kind kind) {

    public enum Kind {
        EXECUTE,
        PORT,
        SCOPE,
        CONTEXT
    }

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(kind, "kind");
    }
}
