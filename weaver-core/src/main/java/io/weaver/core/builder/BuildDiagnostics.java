package io.weaver.core.builder;

import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.List;

/// Collects diagnostics raised while building one source unit.
final class BuildDiagnostics {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    void addAll(List<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    void warning(DiagnosticCode code, String message, int line) {
        diagnostics.add(Diagnostic.warning(code, message).atLine(line));
    }

    void error(DiagnosticCode code, String message, int line) {
        diagnostics.add(Diagnostic.error(code, message).atLine(line));
    }

    List<Diagnostic> toList() {
        return List.copyOf(diagnostics);
    }
}
