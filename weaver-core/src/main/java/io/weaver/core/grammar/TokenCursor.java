package io.weaver.core.grammar;

import java.util.List;

/// Read position over the tokens of one line.
final class TokenCursor {

    private final List<Token> tokens;
    private int position;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    boolean atEnd() {
        return position >= tokens.size();
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int index = position + ahead;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.is(type);
    }

    boolean check(TokenType type, String text) {
        Token token = peek();
        return token != null && token.is(type, text);
    }

    Token next() {
        if (atEnd()) {
            throw new GrammarException("Unexpected end of line");
        }
        return tokens.get(position++);
    }

    /// Consumes the next token when it has the given type.
    ///
    /// @return the consumed token, or null when the next token differs
    Token accept(TokenType type) {
        if (check(type)) {
            return next();
        }
        return null;
    }

    Token accept(TokenType type, String text) {
        if (check(type, text)) {
            return next();
        }
        return null;
    }

    Token expect(TokenType type, String what) {
        Token token = peek();
        if (token == null) {
            throw new GrammarException("Expected " + what + " but the line ended");
        }
        if (!token.is(type)) {
            throw new GrammarException("Expected " + what + " but found '" + token.text() + "'");
        }
        position++;
        return token;
    }

    /// Consumes a name: an identifier, or a prefix word whose colon then acts as a separator.
    ///
    /// Returns the token text; for a prefix the caller sees the colon as already consumed,
    /// which {@link #consumedColon()} reports.
    Token expectName(String what) {
        Token token = peek();
        if (token != null && (token.is(TokenType.PREFIX) || token.is(TokenType.KEYWORD))) {
            position++;
            return token;
        }
        return expect(TokenType.IDENTIFIER, what);
    }

    /// Consumes the left side of `name=value` and returns the name.
    ///
    /// Directive key words such as `limit` or `timeout` arrive as one {@link TokenType#KEY}
    /// token that already holds the equals sign.
    String expectAssignment(String what) {
        Token key = accept(TokenType.KEY);
        if (key != null) {
            return key.text();
        }
        String name = expect(TokenType.IDENTIFIER, what).text();
        expect(TokenType.EQUALS, "'='");
        return name;
    }

    /// Returns whether the tokens starting `ahead` positions on form the left side of
    /// `name=value`.
    boolean checkAssignment(int ahead) {
        Token token = peek(ahead);
        if (token == null) {
            return false;
        }
        if (token.is(TokenType.KEY)) {
            return true;
        }
        Token equals = peek(ahead + 1);
        return token.is(TokenType.IDENTIFIER) && equals != null && equals.is(TokenType.EQUALS);
    }

    /// Returns whether the previously consumed token was a prefix, which swallows its colon.
    boolean consumedColon() {
        return position > 0 && tokens.get(position - 1).is(TokenType.PREFIX);
    }

    String description() {
        Token token = accept(TokenType.DESCRIPTION);
        return token != null && !token.text().isEmpty() ? token.text() : null;
    }

    void expectEnd() {
        Token token = peek();
        if (token != null) {
            throw new GrammarException("Unexpected '" + token.text() + "'");
        }
    }
}
