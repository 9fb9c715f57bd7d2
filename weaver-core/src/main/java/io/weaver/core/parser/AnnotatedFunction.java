package io.weaver.core.parser;

import io.weaver.core.grammar.AnnotationBlock;
import java.util.List;

/// A static method whose documentation comment carries the `@flowWeaver` marker.
///
/// @param name method name, not null
/// @param declaringClass declaring class relative to the package, such as `Outer.Inner`, not null
/// @param parameters declared parameters in order, not null
/// @param returnType return type text, not null
/// @param hasBody false for abstract and interface methods
/// @param annotations parsed comment, not null
/// @param line 1-based line of the method declaration
public record AnnotatedFunction(
        String name,
        String declaringClass,
        List<MethodParameter> parameters,
        String returnType,
        boolean hasBody,
        AnnotationBlock annotations,
        int line) {

    public AnnotatedFunction {
        parameters = List.copyOf(parameters);
    }

    /// Returns the declared kind: `nodeType`, `workflow` or `pattern`, or an empty string when
    /// the marker line itself was malformed.
    public String kind() {
        return annotations.kind().orElse("");
    }

    public boolean isAsync() {
        return JavaTypes.isAsync(returnType);
    }
}
