package io.weaver.core.parser;

import io.weaver.core.model.DataType;
import java.util.Set;

/// Maps Java type text, as written in source, to port data types.
///
/// Works on the simple or qualified type name without resolving it; generic arguments are
/// ignored except for unwrapping asynchronous return types.
public final class JavaTypes {

    public static final String SCOPE_FUNCTION = "ScopeFunction";
    public static final String WORKFLOW_CONTEXT = "WorkflowContext";

    private static final Set<String> NUMBERS =
            Set.of(
                    "byte", "short", "int", "long", "float", "double",
                    "Byte", "Short", "Integer", "Long", "Float", "Double",
                    "Number", "BigDecimal", "BigInteger");

    private static final Set<String> STRINGS = Set.of("String", "char", "Character", "CharSequence");

    private static final Set<String> BOOLEANS = Set.of("boolean", "Boolean");

    private static final Set<String> ARRAYS =
            Set.of("List", "Set", "Collection", "Iterable", "ArrayList", "LinkedList", "HashSet");

    private static final Set<String> FUNCTIONS =
            Set.of(
                    SCOPE_FUNCTION,
                    "Function",
                    "BiFunction",
                    "Supplier",
                    "Consumer",
                    "BiConsumer",
                    "Predicate",
                    "Runnable",
                    "Callable",
                    "UnaryOperator",
                    "BinaryOperator");

    private static final Set<String> ASYNC = Set.of("CompletableFuture", "CompletionStage");

    private static final Set<String> PRIMITIVES =
            Set.of("byte", "short", "int", "long", "float", "double", "boolean", "char");

    private JavaTypes() {}

    /// Infers the data type of a declared Java type.
    ///
    /// @param typeText type as written in source, not null
    /// @return the data type, never null
    public static DataType infer(String typeText) {
        String type = typeText.trim();
        if (type.endsWith("[]") || type.endsWith("...")) {
            return DataType.ARRAY;
        }
        if (isAsync(type)) {
            return infer(unwrapAsync(type));
        }
        String raw = simpleName(rawType(type));
        if (NUMBERS.contains(raw)) {
            return DataType.NUMBER;
        }
        if (STRINGS.contains(raw)) {
            return DataType.STRING;
        }
        if (BOOLEANS.contains(raw)) {
            return DataType.BOOLEAN;
        }
        if (ARRAYS.contains(raw)) {
            return DataType.ARRAY;
        }
        if (FUNCTIONS.contains(raw)) {
            return DataType.FUNCTION;
        }
        if (raw.equals("Object") || raw.equals("?") || isTypeVariable(raw)) {
            return DataType.ANY;
        }
        return DataType.OBJECT;
    }

    public static boolean isAsync(String typeText) {
        return ASYNC.contains(simpleName(rawType(typeText.trim())));
    }

    /// Returns the type argument of `CompletableFuture<T>`, or `Object` for a raw future.
    public static String unwrapAsync(String typeText) {
        String type = typeText.trim();
        int open = type.indexOf('<');
        if (open < 0 || !type.endsWith(">")) {
            return "Object";
        }
        return type.substring(open + 1, type.length() - 1).trim();
    }

    public static boolean isScopeFunction(String typeText) {
        return simpleName(rawType(typeText.trim())).equals(SCOPE_FUNCTION);
    }

    public static boolean isWorkflowContext(String typeText) {
        return simpleName(rawType(typeText.trim())).equals(WORKFLOW_CONTEXT);
    }

    public static boolean isPrimitive(String typeText) {
        return PRIMITIVES.contains(typeText.trim());
    }

    public static boolean isVoid(String typeText) {
        String raw = simpleName(rawType(typeText.trim()));
        return raw.equals("void") || raw.equals("Void");
    }

    /// Strips generic arguments: `Map<String, Object>` becomes `Map`.
    public static String rawType(String typeText) {
        int open = typeText.indexOf('<');
        return open < 0 ? typeText : typeText.substring(0, open).trim();
    }

    public static String simpleName(String typeText) {
        int dot = typeText.lastIndexOf('.');
        return dot < 0 ? typeText : typeText.substring(dot + 1);
    }

    private static boolean isTypeVariable(String raw) {
        return raw.length() == 1 && Character.isUpperCase(raw.charAt(0));
    }
}
