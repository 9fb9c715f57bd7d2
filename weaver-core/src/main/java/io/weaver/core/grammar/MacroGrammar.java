package io.weaver.core.grammar;

import io.weaver.core.model.PortRef;

/// Shorthand lines that the workflow builder expands into instances and edges: `@map` and
/// `@coerce`.
final class MacroGrammar {

    static final String MAP_FORM =
            "@map instanceId childNode[(inputPort -> outputPort)] over sourceNode.port";
    static final String COERCE_FORM =
            "@coerce instanceId sourceNode.port -> targetNode.port as "
                    + "string|number|boolean|json|object";

    private MacroGrammar() {}

    static TagDeclaration.MapTag map(TokenCursor cursor) {
        String id = cursor.expect(TokenType.IDENTIFIER, "instance id").text();
        String child = cursor.expect(TokenType.IDENTIFIER, "child node id").text();
        String inputPort = null;
        String outputPort = null;
        if (cursor.accept(TokenType.LPAREN) != null) {
            inputPort = cursor.expectName("input port").text();
            cursor.expect(TokenType.ARROW, "'->'");
            outputPort = cursor.expectName("output port").text();
            cursor.expect(TokenType.RPAREN, "')'");
        }
        keyword(cursor, "over");
        PortRef source = ConnectionGrammar.portRef(cursor);
        cursor.expectEnd();
        return new TagDeclaration.MapTag(id, child, inputPort, outputPort, source);
    }

    static TagDeclaration.CoerceTag coerce(TokenCursor cursor) {
        String id = cursor.expect(TokenType.IDENTIFIER, "instance id").text();
        PortRef from = ConnectionGrammar.portRef(cursor);
        cursor.expect(TokenType.ARROW, "'->'");
        PortRef to = ConnectionGrammar.portRef(cursor);
        keyword(cursor, "as");
        String target = cursor.expect(TokenType.IDENTIFIER, "target type").text();
        cursor.expectEnd();
        return new TagDeclaration.CoerceTag(id, from, to, target);
    }

    private static void keyword(TokenCursor cursor, String word) {
        if (cursor.accept(TokenType.IDENTIFIER, word) == null) {
            throw new GrammarException("Expected '" + word + "'");
        }
    }
}
