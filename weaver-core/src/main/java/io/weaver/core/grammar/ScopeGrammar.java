package io.weaver.core.grammar;

import java.util.ArrayList;
import java.util.List;

/// `@scope` and `@position` lines.
final class ScopeGrammar {

    static final String SCOPE_FORM = "@scope [owner.]scopeName [child1, child2]";
    static final String POSITION_FORM = "@position nodeId x y";

    private ScopeGrammar() {}

    static TagDeclaration.ScopeTag scope(TokenCursor cursor) {
        String first = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
        String owner = null;
        String name = first;
        if (cursor.accept(TokenType.DOT) != null) {
            owner = first;
            name = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
        }

        List<String> children = new ArrayList<>();
        if (cursor.accept(TokenType.LBRACKET) != null) {
            if (cursor.accept(TokenType.RBRACKET) == null) {
                do {
                    children.add(cursor.expect(TokenType.IDENTIFIER, "child instance id").text());
                } while (cursor.accept(TokenType.COMMA) != null);
                cursor.expect(TokenType.RBRACKET, "']'");
            }
        }
        // node types may describe the scope after the name
        cursor.description();
        cursor.expectEnd();
        return new TagDeclaration.ScopeTag(owner, name, children);
    }

    static TagDeclaration.PositionTag position(TokenCursor cursor) {
        String node = cursor.expect(TokenType.IDENTIFIER, "node id").text();
        double x = Double.parseDouble(cursor.expect(TokenType.NUMBER, "x coordinate").text());
        double y = Double.parseDouble(cursor.expect(TokenType.NUMBER, "y coordinate").text());
        cursor.expectEnd();
        return new TagDeclaration.PositionTag(node, x, y);
    }
}
