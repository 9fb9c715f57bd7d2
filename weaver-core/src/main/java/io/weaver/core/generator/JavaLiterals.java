package io.weaver.core.generator;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/// Renders values and names as Java source text.
final class JavaLiterals {

    private JavaLiterals() {}

    /// Quoted, escaped string literal; `null` for a null string.
    static String string(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /// Java expression producing a default value read from a port declaration.
    ///
    /// Lists and maps become `Ports.listOf(..)` and `Ports.mapOf(..)` calls.
    ///
    /// @param value string, number, boolean, list, map or null
    static String value(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return string(s);
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof Integer i) {
            return i.toString();
        }
        if (value instanceof Long l) {
            return l + "L";
        }
        if (value instanceof Double d) {
            if (d.isNaN()) {
                return "Double.NaN";
            }
            if (d.isInfinite()) {
                return d > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
            }
            return d.toString();
        }
        if (value instanceof Number n) {
            return value(n.doubleValue());
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(JavaLiterals::value)
                    .collect(Collectors.joining(", ", "Ports.listOf(", ")"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> string(String.valueOf(e.getKey())) + ", " + value(e.getValue()))
                    .collect(Collectors.joining(", ", "Ports.mapOf(", ")"));
        }
        return string(value.toString());
    }

    static String duration(Duration duration) {
        return duration == null ? "null" : "Duration.parse(" + string(duration.toString()) + ")";
    }

    static String integer(Integer value) {
        return value == null ? "null" : value.toString();
    }

    /// Turns an id into a valid Java identifier fragment: `fetch-user` becomes `fetch_user`.
    static String identifier(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 1);
        for (char c : text.toCharArray()) {
            sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
        }
        if (sb.length() == 0 || !Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /// Upper snake case: `processOrder` becomes `PROCESS_ORDER`.
    static String constantName(String text) {
        String id = identifier(text);
        StringBuilder sb = new StringBuilder(id.length() + 4);
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(id.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
