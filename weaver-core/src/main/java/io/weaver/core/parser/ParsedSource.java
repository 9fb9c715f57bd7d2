package io.weaver.core.parser;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Everything the builders need from one compilation unit.
///
/// @param fileName file name used in diagnostics, not null
/// @param packageName package, empty for the default package, not null
/// @param className name of the primary top-level type, not null
/// @param imports import declarations as written, without `import` and `;`, not null
/// @param functions annotated methods in source order, not null
/// @param records record types declared anywhere in the unit, by simple name, not null
public record ParsedSource(
        String fileName,
        String packageName,
        String className,
        List<String> imports,
        List<AnnotatedFunction> functions,
        Map<String, RecordShape> records) {

    public ParsedSource {
        imports = List.copyOf(imports);
        functions = List.copyOf(functions);
        records = Map.copyOf(records);
    }

    public Optional<RecordShape> record(String typeText) {
        return Optional.ofNullable(records.get(JavaTypes.simpleName(JavaTypes.rawType(typeText))));
    }

    public List<AnnotatedFunction> functionsOfKind(String kind) {
        return functions.stream().filter(f -> f.kind().equals(kind)).toList();
    }

    /// Fully qualified name of the primary class.
    public String qualifiedClassName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }
}
