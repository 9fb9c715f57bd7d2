package io.weaver.core.exception;

import java.io.Serial;

/// Thrown when a source unit is not valid Java and cannot be read at all.
///
/// Malformed annotation lines never raise this; they become parse warnings.
public class SourceParseException extends Exception {

    @Serial private static final long serialVersionUID = 4417302558166048171L;

    private final String fileName;

    public SourceParseException(String fileName, String message) {
        super(fileName + ": " + message);
        this.fileName = fileName;
    }

    public SourceParseException(String fileName, String message, Throwable cause) {
        super(fileName + ": " + message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
