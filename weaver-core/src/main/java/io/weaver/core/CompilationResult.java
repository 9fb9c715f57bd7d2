package io.weaver.core;

import io.weaver.core.validation.Diagnostic;
import java.util.List;
import java.util.Objects;

/// Outcome of compiling one source unit.
///
/// @param generatedSource Java source of the companion class, not null
/// @param diagnostics warnings collected while parsing, building, validating and planning,
///     in that order, not null
public record CompilationResult(String generatedSource, List<Diagnostic> diagnostics) {

    public CompilationResult {
        Objects.requireNonNull(generatedSource, "generatedSource must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }
}
