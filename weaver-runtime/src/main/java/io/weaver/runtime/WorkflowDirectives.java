package io.weaver.runtime;

import java.time.Duration;

/// Declarative scheduling directives of a workflow, for the runtime that hosts it.
///
/// Generated programs expose one constant per workflow. The generated code itself does not
/// act on them; a hosting scheduler reads them to decide when to start, cancel, retry or
/// throttle invocations.
///
/// @param triggerEvent event name that starts the workflow, may be null
/// @param triggerCron five-field cron expression that starts the workflow, may be null
/// @param cancelEvent event name that cancels a running invocation, may be null
/// @param cancelMatch payload field the cancel event must match, may be null
/// @param cancelTimeout how long the cancel condition stays armed, may be null
/// @param retries retry count, null when not declared
/// @param timeout invocation timeout, may be null
/// @param throttleLimit maximum invocations per period, null when not declared
/// @param throttlePeriod throttle window, may be null
public record WorkflowDirectives(
        String triggerEvent,
        String triggerCron,
        String cancelEvent,
        String cancelMatch,
        Duration cancelTimeout,
        Integer retries,
        Duration timeout,
        Integer throttleLimit,
        Duration throttlePeriod) {

    /// Directives of a workflow that declares none.
    public static final WorkflowDirectives NONE =
            new WorkflowDirectives(null, null, null, null, null, null, null, null, null);

    /// Returns true when no directive is set.
    public boolean isEmpty() {
        return equals(NONE);
    }
}
