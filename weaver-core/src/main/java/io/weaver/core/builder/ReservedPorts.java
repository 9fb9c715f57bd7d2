package io.weaver.core.builder;

import io.weaver.core.model.DataType;
import io.weaver.core.model.Port;
import io.weaver.core.model.ReservedNames;

/// Factories for the mandatory control-flow ports every node type and workflow boundary has.
final class ReservedPorts {

    private ReservedPorts() {}

    static Port.Builder execute() {
        return Port.input(ReservedNames.EXECUTE).dataType(DataType.STEP).label("Execute");
    }

    static Port.Builder onSuccess() {
        return Port.output(ReservedNames.ON_SUCCESS)
                .dataType(DataType.STEP)
                .controlFlow(true)
                .label("On Success");
    }

    static Port.Builder onFailure() {
        return Port.output(ReservedNames.ON_FAILURE)
                .dataType(DataType.STEP)
                .controlFlow(true)
                .failure(true)
                .label("On Failure");
    }

    /// `start:scope`, handed to the scope's children.
    static Port.Builder scopeStart(String scope) {
        return Port.output(ReservedNames.SCOPE_START)
                .dataType(DataType.STEP)
                .scope(scope)
                .label("Start");
    }

    /// `success:scope`, written back by the scope's children.
    static Port.Builder scopeSuccess(String scope) {
        return Port.input(ReservedNames.SCOPE_SUCCESS)
                .dataType(DataType.STEP)
                .scope(scope)
                .label("Success");
    }

    static Port.Builder scopeFailure(String scope) {
        return Port.input(ReservedNames.SCOPE_FAILURE)
                .dataType(DataType.STEP)
                .scope(scope)
                .failure(true)
                .label("Failure");
    }

    /// `Start.execute`, the trigger of a workflow.
    static Port.Builder startExecute() {
        return Port.output(ReservedNames.EXECUTE).dataType(DataType.STEP).label("Execute");
    }

    /// `Exit.onSuccess` and `Exit.onFailure`, the outcome of a workflow.
    static Port.Builder exitOnSuccess() {
        return Port.input(ReservedNames.ON_SUCCESS)
                .dataType(DataType.STEP)
                .controlFlow(true)
                .optional(true)
                .label("On Success");
    }

    static Port.Builder exitOnFailure() {
        return Port.input(ReservedNames.ON_FAILURE)
                .dataType(DataType.STEP)
                .controlFlow(true)
                .failure(true)
                .optional(true)
                .label("On Failure");
    }
}
