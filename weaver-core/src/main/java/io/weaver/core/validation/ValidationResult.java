package io.weaver.core.validation;

import java.util.ArrayList;
import java.util.List;

/// Ordered errors and warnings of one validation run.
///
/// @param errors findings that block code generation, never null
/// @param warnings findings that do not, never null
public record ValidationResult(List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /// Returns errors followed by warnings.
    public List<Diagnostic> all() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public boolean hasCode(DiagnosticCode code) {
        return all().stream().anyMatch(d -> d.code() == code);
    }
}
