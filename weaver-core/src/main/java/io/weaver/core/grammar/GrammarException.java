package io.weaver.core.grammar;

import java.io.Serial;

/// Thrown by a grammar rule when a line starts with its tag but does not match its form.
///
/// Never escapes the grammar package: {@link AnnotationParser} turns it into a parse
/// warning and moves on to the next line.
class GrammarException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2671254405917736125L;

    GrammarException(String message) {
        super(message);
    }
}
