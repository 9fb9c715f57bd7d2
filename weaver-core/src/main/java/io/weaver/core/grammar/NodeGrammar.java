package io.weaver.core.grammar;

import io.weaver.core.model.InstanceConfig;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.Position;
import java.util.ArrayList;
import java.util.List;

/// `@node` lines placing an instance in a workflow.
///
/// {@snippet :
/// @node fetch HttpGet loop.item [label: "Fetch page", expr: retries="3", minimized]
/// }
final class NodeGrammar {

    static final String FORM = "@node instanceId NodeType [parent.scope] [label: \"...\", ...]";

    private NodeGrammar() {}

    static TagDeclaration.NodeTag parse(TokenCursor cursor) {
        String id = cursor.expect(TokenType.IDENTIFIER, "instance id").text();
        String type = cursor.expect(TokenType.IDENTIFIER, "node type").text();

        InstanceParent parent = null;
        if (cursor.check(TokenType.IDENTIFIER)) {
            String owner = cursor.next().text();
            cursor.expect(TokenType.DOT, "'.' between parent and scope");
            String scope = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
            parent = new InstanceParent(owner, scope);
        }

        InstanceConfig.Builder config = InstanceConfig.builder();
        while (cursor.accept(TokenType.LBRACKET) != null) {
            do {
                attribute(cursor, config);
            } while (cursor.accept(TokenType.COMMA) != null);
            cursor.expect(TokenType.RBRACKET, "']'");
        }
        cursor.expectEnd();

        return new TagDeclaration.NodeTag(id, type, parent, config.build());
    }

    private static void attribute(TokenCursor cursor, InstanceConfig.Builder config) {
        if (cursor.accept(TokenType.KEYWORD, "minimized") != null) {
            config.minimized(true);
            return;
        }
        Token prefix = cursor.expect(TokenType.PREFIX, "node attribute");
        switch (prefix.text()) {
            case "label" -> config.label(cursor.expect(TokenType.STRING, "label").text());
            case "expr" -> {
                do {
                    String port = cursor.expectAssignment("port name");
                    config.portExpression(
                            port, cursor.expect(TokenType.STRING, "expression").text());
                } while (continuesAssignments(cursor));
            }
            case "portOrder" -> {
                do {
                    String port = cursor.expectAssignment("port name");
                    config.portOrder(
                            port, PortGrammar.integer(cursor.expect(TokenType.NUMBER, "order")));
                } while (continuesAssignments(cursor));
            }
            case "portLabel" -> {
                do {
                    String port = cursor.expectAssignment("port name");
                    config.portLabel(port, cursor.expect(TokenType.STRING, "label").text());
                } while (continuesAssignments(cursor));
            }
            case "pullExecution" ->
                    config.pullExecution(cursor.expect(TokenType.IDENTIFIER, "trigger port").text());
            case "size" -> {
                int width = PortGrammar.integer(cursor.expect(TokenType.NUMBER, "width"));
                int height = PortGrammar.integer(cursor.expect(TokenType.NUMBER, "height"));
                config.size(width, height);
            }
            case "position" -> {
                double x = Double.parseDouble(cursor.expect(TokenType.NUMBER, "x").text());
                double y = Double.parseDouble(cursor.expect(TokenType.NUMBER, "y").text());
                config.position(new Position(x, y));
            }
            case "color" -> config.color(cursor.expect(TokenType.STRING, "color").text());
            case "icon" -> config.icon(cursor.expect(TokenType.STRING, "icon").text());
            case "tags" -> config.tags(tags(cursor));
            default ->
                    throw new GrammarException("Unknown node attribute '" + prefix.text() + ":'");
        }
    }

    /// Consumes the comma before another `port=value` pair of the same attribute.
    private static boolean continuesAssignments(TokenCursor cursor) {
        Token comma = cursor.peek();
        if (comma != null && comma.is(TokenType.COMMA) && cursor.checkAssignment(1)) {
            cursor.next();
            return true;
        }
        return false;
    }

    private static List<InstanceConfig.Tag> tags(TokenCursor cursor) {
        List<InstanceConfig.Tag> tags = new ArrayList<>();
        while (true) {
            String label = cursor.expect(TokenType.STRING, "tag label").text();
            Token tooltip = cursor.accept(TokenType.STRING);
            tags.add(new InstanceConfig.Tag(label, tooltip != null ? tooltip.text() : null));

            Token comma = cursor.peek();
            Token next = cursor.peek(1);
            if (comma != null && comma.is(TokenType.COMMA) && next != null && next.is(TokenType.STRING)) {
                cursor.next();
                continue;
            }
            return tags;
        }
    }
}
