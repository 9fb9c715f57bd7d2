package io.weaver.core.grammar;

/// Token kinds of the annotation micro-language.
public enum TokenType {
    /// `@name`
    TAG,
    /// `scope:`, `order:`, `label:` and the other attribute prefixes. Text excludes the colon.
    PREFIX,
    /// `event=`, `cron=` and the other directive keys. Text excludes the equals sign.
    KEY,
    /// `TOP`, `BOTTOM`, `true`, `false`, `minimized`
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    /// Double-quoted string. Text is the unescaped content.
    STRING,
    ARROW,
    DASH,
    DOT,
    COLON,
    COMMA,
    EQUALS,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    PIPE,
    AMPERSAND,
    GT,
    LT,
    /// Free text following a top-level ` - ` separator.
    DESCRIPTION
}
