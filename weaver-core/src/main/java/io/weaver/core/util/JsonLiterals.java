package io.weaver.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads JSON literals written as port default values, without external dependencies.
///
/// Objects become insertion-ordered maps, arrays become lists, integral numbers become
/// {@link Integer} (or {@link Long} when out of range) and other numbers {@link Double}.
///
/// @implNote Handles the literal subset used by `[name=value]` defaults only.
public final class JsonLiterals {

    private JsonLiterals() {}

    /// Parses a default value, falling back to the raw text when it is not JSON.
    ///
    /// `[x=hello]` therefore defaults to the string `"hello"`, and `[x="hello"]` as well.
    ///
    /// @param text default text as written, not null
    /// @return the parsed value, possibly null for a JSON `null`
    public static Object parseOrRaw(String text) {
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            return text;
        }
    }

    /// Parses a complete JSON value.
    ///
    /// @param text JSON text, not null
    /// @return the parsed value, possibly null
    /// @throws IllegalArgumentException if the text is not a single JSON value
    public static Object parse(String text) {
        Reader reader = new Reader(text);
        reader.skipWhitespace();
        Object value = reader.value();
        reader.skipWhitespace();
        if (!reader.atEnd()) {
            throw reader.error("Unexpected trailing content");
        }
        return value;
    }

    private static final class Reader {

        private final String text;
        private int position;

        Reader(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return position >= text.length();
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
                position++;
            }
        }

        Object value() {
            if (atEnd()) {
                throw error("Unexpected end of input");
            }
            char c = text.charAt(position);
            return switch (c) {
                case '{' -> object();
                case '[' -> array();
                case '"' -> string();
                case 't' -> keyword("true", Boolean.TRUE);
                case 'f' -> keyword("false", Boolean.FALSE);
                case 'n' -> keyword("null", null);
                default -> number();
            };
        }

        private Map<String, Object> object() {
            position++;
            Map<String, Object> map = new LinkedHashMap<>();
            skipWhitespace();
            if (consume('}')) {
                return Collections.unmodifiableMap(map);
            }
            do {
                skipWhitespace();
                if (atEnd() || text.charAt(position) != '"') {
                    throw error("Expected object key");
                }
                String key = string();
                skipWhitespace();
                if (!consume(':')) {
                    throw error("Expected ':'");
                }
                skipWhitespace();
                map.put(key, value());
                skipWhitespace();
            } while (consume(','));
            if (!consume('}')) {
                throw error("Expected '}'");
            }
            return Collections.unmodifiableMap(map);
        }

        private List<Object> array() {
            position++;
            List<Object> list = new ArrayList<>();
            skipWhitespace();
            if (consume(']')) {
                return Collections.unmodifiableList(list);
            }
            do {
                skipWhitespace();
                list.add(value());
                skipWhitespace();
            } while (consume(','));
            if (!consume(']')) {
                throw error("Expected ']'");
            }
            return Collections.unmodifiableList(list);
        }

        private String string() {
            position++;
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(position++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (atEnd()) {
                    break;
                }
                char escaped = text.charAt(position++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> {
                        if (position + 4 > text.length()) {
                            throw error("Truncated unicode escape");
                        }
                        value.append((char) Integer.parseInt(text.substring(position, position + 4), 16));
                        position += 4;
                    }
                    default -> value.append(escaped);
                }
            }
            throw error("Unterminated string");
        }

        private Object keyword(String word, Object value) {
            if (!text.startsWith(word, position)) {
                throw error("Unexpected token");
            }
            position += word.length();
            return value;
        }

        private Number number() {
            int start = position;
            consume('-');
            while (!atEnd() && "0123456789.eE+-".indexOf(text.charAt(position)) >= 0) {
                position++;
            }
            String literal = text.substring(start, position);
            if (literal.isEmpty() || literal.equals("-")) {
                throw error("Unexpected character");
            }
            try {
                if (literal.contains(".") || literal.contains("e") || literal.contains("E")) {
                    return Double.parseDouble(literal);
                }
                long value = Long.parseLong(literal);
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return (int) value;
                }
                return value;
            } catch (NumberFormatException e) {
                throw error("Invalid number '" + literal + "'");
            }
        }

        private boolean consume(char expected) {
            if (!atEnd() && text.charAt(position) == expected) {
                position++;
                return true;
            }
            return false;
        }

        IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at offset " + position);
        }
    }
}
