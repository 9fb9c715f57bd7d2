package io.weaver.core.grammar;

/// One token of an annotation line.
///
/// @param type token kind, not null
/// @param text token text (see {@link TokenType} for prefix, key and string forms), not null
/// @param start offset of the first character in the line
/// @param end offset after the last character in the line
public record Token(TokenType type, String text, int start, int end) {

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')";
    }
}
