package io.weaver.core.model;

/// Join policy for nodes with several incoming STEP triggers.
public enum ExecuteWhen {
    /// Fire once every triggered port has reported.
    CONJUNCTION,

    /// Fire on the first reporting trigger.
    DISJUNCTION
}
