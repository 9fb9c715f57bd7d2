package io.weaver.core.generator;

import io.weaver.core.parser.JavaTypes;
import java.util.Map;
import java.util.Set;

/// Wraps a port value expression so it fits the declared type of the parameter it feeds.
///
/// | Parameter type                   | Expression                          |
/// |----------------------------------|-------------------------------------|
/// | primitive                        | `Coercions.toInt(v)`, ...           |
/// | wrapper type                     | `Coercions.toBoxed(v, Integer.class)` |
/// | `String`                         | `Coercions.toStringValue(v)`        |
/// | `Object`, type variable          | `v`                                 |
/// | anything else                    | `Coercions.cast(v)`                 |
final class TypeConversions {

    private static final Map<String, String> PRIMITIVES =
            Map.of(
                    "int", "toInt",
                    "long", "toLong",
                    "double", "toDouble",
                    "float", "toFloat",
                    "short", "toShort",
                    "byte", "toByte",
                    "boolean", "toBoolean",
                    "char", "toChar");

    private static final Set<String> WRAPPERS =
            Set.of("Integer", "Long", "Double", "Float", "Short", "Byte", "Boolean", "Character");

    private TypeConversions() {}

    /// @param value Java expression of type `Object`, not null
    /// @param javaType declared parameter type, null when unknown
    static String convert(String value, String javaType) {
        if (javaType == null) {
            return value;
        }
        String type = javaType.trim();
        String primitive = PRIMITIVES.get(type);
        if (primitive != null) {
            return "Coercions." + primitive + "(" + value + ")";
        }
        String raw = JavaTypes.simpleName(JavaTypes.rawType(type));
        if (WRAPPERS.contains(raw)) {
            return "Coercions.toBoxed(" + value + ", " + raw + ".class)";
        }
        if (raw.equals("String")) {
            return "Coercions.toStringValue(" + value + ")";
        }
        if (raw.equals("Object") || (raw.length() == 1 && Character.isUpperCase(raw.charAt(0)))) {
            return value;
        }
        return "Coercions.cast(" + value + ")";
    }
}
