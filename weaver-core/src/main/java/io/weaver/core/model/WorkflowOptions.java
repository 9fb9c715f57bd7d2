package io.weaver.core.model;

import java.time.Duration;

/// Workflow-level options and scheduling directives.
///
/// @param strictTypes promote type-coercion warnings to errors
/// @param autoConnect wire instances linearly when no connection is declared
/// @param trigger start trigger, may be null
/// @param cancelOn cancellation condition, may be null
/// @param retries retry count, null when not declared
/// @param timeout invocation timeout, may be null
/// @param throttle invocation throttle, may be null
public record WorkflowOptions(
        boolean strictTypes,
        boolean autoConnect,
        Trigger trigger,
        CancelOn cancelOn,
        Integer retries,
        Duration timeout,
        Throttle throttle) {

    public static final WorkflowOptions DEFAULTS =
            new WorkflowOptions(false, false, null, null, null, null, null);

    /// @param event event name, may be null
    /// @param cron five-field cron expression, may be null
    public record Trigger(String event, String cron) {}

    /// @param event event name, not null
    /// @param match payload field to match, may be null
    /// @param timeout how long the condition stays armed, may be null
    public record CancelOn(String event, String match, Duration timeout) {}

    /// @param limit maximum invocations per period
    /// @param period throttle window, may be null
    public record Throttle(int limit, Duration period) {}

    public WorkflowOptions withStrictTypes(boolean value) {
        return new WorkflowOptions(value, autoConnect, trigger, cancelOn, retries, timeout, throttle);
    }

    public WorkflowOptions withAutoConnect(boolean value) {
        return new WorkflowOptions(strictTypes, value, trigger, cancelOn, retries, timeout, throttle);
    }

    public WorkflowOptions withTrigger(Trigger value) {
        return new WorkflowOptions(strictTypes, autoConnect, value, cancelOn, retries, timeout, throttle);
    }

    public WorkflowOptions withCancelOn(CancelOn value) {
        return new WorkflowOptions(strictTypes, autoConnect, trigger, value, retries, timeout, throttle);
    }

    public WorkflowOptions withRetries(Integer value) {
        return new WorkflowOptions(strictTypes, autoConnect, trigger, cancelOn, value, timeout, throttle);
    }

    public WorkflowOptions withTimeout(Duration value) {
        return new WorkflowOptions(strictTypes, autoConnect, trigger, cancelOn, retries, value, throttle);
    }

    public WorkflowOptions withThrottle(Throttle value) {
        return new WorkflowOptions(strictTypes, autoConnect, trigger, cancelOn, retries, timeout, value);
    }
}
