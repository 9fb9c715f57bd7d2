package io.weaver.core.validation;

import io.weaver.core.model.Connection;
import java.util.Objects;

/// One error or warning, pointing at the offending graph element.
///
/// @param severity error or warning, not null
/// @param code machine-readable code, not null
/// @param message human-readable message, not null
/// @param nodeId offending instance id, may be null
/// @param port offending port name, may be null
/// @param connection offending connection, may be null
/// @param line 1-based source line, 0 when unknown
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String message,
        String nodeId,
        String port,
        Connection connection,
        int line) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, null, null, null, 0);
    }

    public static Diagnostic warning(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.WARNING, code, message, null, null, null, 0);
    }

    public Diagnostic atNode(String nodeId) {
        return new Diagnostic(severity, code, message, nodeId, port, connection, line);
    }

    public Diagnostic atPort(String nodeId, String port) {
        return new Diagnostic(severity, code, message, nodeId, port, connection, line);
    }

    public Diagnostic atConnection(Connection connection) {
        return new Diagnostic(severity, code, message, nodeId, port, connection, line);
    }

    public Diagnostic atLine(int line) {
        return new Diagnostic(severity, code, message, nodeId, port, connection, line);
    }

    public Diagnostic withSeverity(Severity severity) {
        return new Diagnostic(severity, code, message, nodeId, port, connection, line);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}
