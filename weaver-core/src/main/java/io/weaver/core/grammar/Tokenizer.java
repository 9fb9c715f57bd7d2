package io.weaver.core.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Splits one annotation line into tokens.
///
/// Identifiers follow `[a-zA-Z_$][a-zA-Z0-9_$/-]*`, numbers `-?\d+(\.\d+)?`, strings are
/// double-quoted with backslash escapes. A word followed by `:` becomes a {@link
/// TokenType#PREFIX} when it is a known attribute prefix, and a word followed by `=` becomes
/// a {@link TokenType#KEY} when it is a known directive key.
///
/// A dash standing alone at bracket depth 0 starts the line's description: the rest of the
/// line becomes one {@link TokenType#DESCRIPTION} token and is not tokenized, so prose may
/// contain any character.
public final class Tokenizer {

    static final Set<String> PREFIXES =
            Set.of(
                    "scope",
                    "order",
                    "placement",
                    "type",
                    "label",
                    "portOrder",
                    "portLabel",
                    "expr",
                    "mergeStrategy",
                    "pullExecution",
                    "size",
                    "position",
                    "color",
                    "icon",
                    "tags");

    static final Set<String> KEYS = Set.of("event", "cron", "match", "timeout", "limit", "period");

    static final Set<String> KEYWORDS = Set.of("TOP", "BOTTOM", "true", "false", "minimized");

    private Tokenizer() {}

    /// Tokenizes a line.
    ///
    /// @param line the annotation line, starting at its tag, not null
    /// @return tokens in order, never null
    /// @throws GrammarException on an unexpected character or an unterminated string
    static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int length = line.length();

        while (i < length) {
            char c = line.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '@') {
                int end = scanWhile(line, i + 1, Tokenizer::isWordChar);
                if (end == i + 1) {
                    throw new GrammarException("Expected tag name after '@' at column " + (i + 1));
                }
                tokens.add(new Token(TokenType.TAG, line.substring(i, end), i, end));
                i = end;
                continue;
            }

            if (c == '"') {
                i = scanString(line, i, tokens);
                continue;
            }

            if (c == '-') {
                char next = i + 1 < length ? line.charAt(i + 1) : '\0';
                if (next == '>') {
                    tokens.add(new Token(TokenType.ARROW, "->", i, i + 2));
                    i += 2;
                    continue;
                }
                if (Character.isDigit(next)) {
                    i = scanNumber(line, i, tokens);
                    continue;
                }
                if (depth == 0) {
                    String description = line.substring(i + 1).trim();
                    tokens.add(new Token(TokenType.DESCRIPTION, description, i, length));
                    break;
                }
                tokens.add(new Token(TokenType.DASH, "-", i, i + 1));
                i++;
                continue;
            }

            if (Character.isDigit(c)) {
                i = scanNumber(line, i, tokens);
                continue;
            }

            if (isIdentifierStart(c)) {
                i = scanWord(line, i, tokens);
                continue;
            }

            TokenType symbol = symbol(c);
            if (symbol == null) {
                throw new GrammarException("Unexpected character '" + c + "' at column " + (i + 1));
            }
            if (symbol == TokenType.LBRACKET
                    || symbol == TokenType.LPAREN
                    || symbol == TokenType.LBRACE) {
                depth++;
            } else if (symbol == TokenType.RBRACKET
                    || symbol == TokenType.RPAREN
                    || symbol == TokenType.RBRACE) {
                depth = Math.max(0, depth - 1);
            }
            tokens.add(new Token(symbol, String.valueOf(c), i, i + 1));
            i++;
        }

        return tokens;
    }

    private static int scanWord(String line, int start, List<Token> tokens) {
        int end = start + 1;
        while (end < line.length()) {
            char c = line.charAt(end);
            // a dash directly followed by '>' is an arrow, not part of the word
            if (c == '-' && end + 1 < line.length() && line.charAt(end + 1) == '>') {
                break;
            }
            if (!isIdentifierPart(c)) {
                break;
            }
            end++;
        }
        String word = line.substring(start, end);
        char next = end < line.length() ? line.charAt(end) : '\0';

        if (next == ':' && PREFIXES.contains(word)) {
            tokens.add(new Token(TokenType.PREFIX, word, start, end + 1));
            return end + 1;
        }
        if (next == '=' && KEYS.contains(word)) {
            tokens.add(new Token(TokenType.KEY, word, start, end + 1));
            return end + 1;
        }
        TokenType type = KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        tokens.add(new Token(type, word, start, end));
        return end;
    }

    private static int scanNumber(String line, int start, List<Token> tokens) {
        int end = start;
        if (line.charAt(end) == '-') {
            end++;
        }
        end = scanWhile(line, end, Character::isDigit);
        if (end + 1 < line.length()
                && line.charAt(end) == '.'
                && Character.isDigit(line.charAt(end + 1))) {
            end = scanWhile(line, end + 1, Character::isDigit);
        }
        tokens.add(new Token(TokenType.NUMBER, line.substring(start, end), start, end));
        return end;
    }

    private static int scanString(String line, int start, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\' && i + 1 < line.length()) {
                char escaped = line.charAt(i + 1);
                value.append(
                        switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            case 'r' -> '\r';
                            default -> escaped;
                        });
                i += 2;
                continue;
            }
            if (c == '"') {
                tokens.add(new Token(TokenType.STRING, value.toString(), start, i + 1));
                return i + 1;
            }
            value.append(c);
            i++;
        }
        throw new GrammarException("Unterminated string starting at column " + (start + 1));
    }

    private static TokenType symbol(char c) {
        return switch (c) {
            case '.' -> TokenType.DOT;
            case ':' -> TokenType.COLON;
            case ',' -> TokenType.COMMA;
            case '=' -> TokenType.EQUALS;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '|' -> TokenType.PIPE;
            case '&' -> TokenType.AMPERSAND;
            case '>' -> TokenType.GT;
            case '<' -> TokenType.LT;
            default -> null;
        };
    }

    private static int scanWhile(String line, int start, CharPredicate predicate) {
        int end = start;
        while (end < line.length() && predicate.test(line.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c) || c == '/' || c == '-';
    }

    private static boolean isWordChar(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
