package io.weaver.core.exception;

import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.ValidationResult;
import java.io.Serial;
import java.util.stream.Collectors;

/// Thrown when a workflow cannot be compiled because validation reported errors.
///
/// @see ValidationResult#errors()
public class ValidationFailedException extends Exception {

    @Serial private static final long serialVersionUID = 7920466385817361208L;

    private final String workflow;
    private final transient ValidationResult result;

    public ValidationFailedException(String workflow, ValidationResult result) {
        super(message(workflow, result));
        this.workflow = workflow;
        this.result = result;
    }

    public String getWorkflow() {
        return workflow;
    }

    /// Returns the full validation result, warnings included.
    public ValidationResult getResult() {
        return result;
    }

    private static String message(String workflow, ValidationResult result) {
        return "Workflow '"
                + workflow
                + "' has "
                + result.errors().size()
                + " error(s):\n"
                + result.errors().stream()
                        .map(Diagnostic::toString)
                        .collect(Collectors.joining("\n  ", "  ", ""));
    }
}
