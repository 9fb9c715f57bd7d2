package io.weaver.core.grammar;

import io.weaver.core.model.Placement;

/// Port lines: `@input`, `@output`, `@step`, `@param`, `@returns` and the pattern `@port`.
///
/// {@snippet :
/// @input [limit=10] scope:item [order:1, type:NUMBER] - Maximum number of results
/// }
final class PortGrammar {

    static final String FORM = "@input name [scope:X] [order:N, placement:TOP] - description";

    private static final String EXPRESSION_PREFIX = "Expression:";

    private PortGrammar() {}

    /// Parses the part of a port line after its tag.
    static PortDeclaration parse(String line, TokenCursor cursor) {
        String name;
        boolean optional = false;
        String defaultText = null;

        if (cursor.accept(TokenType.LBRACKET) != null) {
            optional = true;
            if (cursor.checkAssignment(0)) {
                name = cursor.expectAssignment("port name");
                defaultText = readDefault(line, cursor);
            } else {
                name = cursor.expect(TokenType.IDENTIFIER, "port name").text();
                cursor.expect(TokenType.RBRACKET, "']'");
            }
        } else {
            name = cursor.expect(TokenType.IDENTIFIER, "port name").text();
        }

        String scope = null;
        Integer order = null;
        Placement placement = null;
        String type = null;
        String mergeStrategy = null;

        while (!cursor.atEnd() && !cursor.check(TokenType.DESCRIPTION)) {
            if (cursor.accept(TokenType.PREFIX, "scope") != null) {
                scope = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
                continue;
            }
            cursor.expect(TokenType.LBRACKET, "'[' or ' - '");
            do {
                Token prefix = cursor.expect(TokenType.PREFIX, "port attribute");
                switch (prefix.text()) {
                    case "order" -> order = integer(cursor.expect(TokenType.NUMBER, "order"));
                    case "placement" -> placement = placement(cursor);
                    case "type" -> type = cursor.expect(TokenType.IDENTIFIER, "type").text();
                    case "mergeStrategy" ->
                            mergeStrategy =
                                    cursor.expect(TokenType.IDENTIFIER, "merge strategy").text();
                    case "scope" ->
                            scope = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
                    default ->
                            throw new GrammarException(
                                    "Unknown port attribute '" + prefix.text() + ":'");
                }
            } while (cursor.accept(TokenType.COMMA) != null);
            cursor.expect(TokenType.RBRACKET, "']'");
        }

        String description = cursor.description();
        String expression = null;
        if (description != null && description.startsWith(EXPRESSION_PREFIX)) {
            expression = description.substring(EXPRESSION_PREFIX.length()).trim();
            description = null;
        }
        cursor.expectEnd();

        return new PortDeclaration(
                name,
                optional,
                defaultText,
                scope,
                order,
                placement,
                type,
                mergeStrategy,
                description,
                expression);
    }

    /// Returns the raw text between `=` and the bracket closing the optional port name.
    private static String readDefault(String line, TokenCursor cursor) {
        Token first = cursor.peek();
        if (first == null) {
            throw new GrammarException("Expected default value but the line ended");
        }
        int depth = 1;
        while (true) {
            Token token = cursor.next();
            switch (token.type()) {
                case LBRACKET, LBRACE, LPAREN -> depth++;
                case RBRACKET, RBRACE, RPAREN -> depth--;
                default -> {}
            }
            if (depth == 0) {
                if (!token.is(TokenType.RBRACKET)) {
                    throw new GrammarException("Unbalanced brackets in default value");
                }
                return line.substring(first.start(), token.start()).trim();
            }
        }
    }

    private static Placement placement(TokenCursor cursor) {
        Token token = cursor.expect(TokenType.KEYWORD, "TOP or BOTTOM");
        return switch (token.text()) {
            case "TOP" -> Placement.TOP;
            case "BOTTOM" -> Placement.BOTTOM;
            default ->
                    throw new GrammarException(
                            "Expected TOP or BOTTOM but found '" + token.text() + "'");
        };
    }

    static int integer(Token token) {
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new GrammarException("Expected an integer but found '" + token.text() + "'");
        }
    }
}
