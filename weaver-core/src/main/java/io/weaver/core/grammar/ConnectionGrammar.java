package io.weaver.core.grammar;

import io.weaver.core.model.PortRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Edge lines: `@connect`, `@path`, `@fanOut` and `@fanIn`.
final class ConnectionGrammar {

    static final String CONNECT_FORM = "@connect sourceNode.port[:scope] -> targetNode.port[:scope]";
    static final String PATH_FORM = "@path Start -> nodeA:ok -> nodeB:fail -> Exit";
    static final String FAN_OUT_FORM = "@fanOut source.port -> target1, target2.port";
    static final String FAN_IN_FORM = "@fanIn source1, source2.port -> target.port";

    private static final Set<String> ROUTES = Set.of("ok", "success", "fail");

    private ConnectionGrammar() {}

    static TagDeclaration.ConnectTag connect(TokenCursor cursor) {
        PortRef from = portRef(cursor);
        cursor.expect(TokenType.ARROW, "'->'");
        PortRef to = portRef(cursor);
        cursor.expectEnd();
        return new TagDeclaration.ConnectTag(from, to);
    }

    static TagDeclaration.PathTag path(TokenCursor cursor) {
        List<TagDeclaration.PathStep> steps = new ArrayList<>();
        do {
            Token node = cursor.expectName("node id");
            String route = null;
            if (cursor.consumedColon() || cursor.accept(TokenType.COLON) != null) {
                route = cursor.expect(TokenType.IDENTIFIER, "route (ok, success or fail)").text();
                if (!ROUTES.contains(route)) {
                    throw new GrammarException(
                            "Unknown route '" + route + "', expected ok, success or fail");
                }
            }
            steps.add(new TagDeclaration.PathStep(node.text(), route));
        } while (cursor.accept(TokenType.ARROW) != null);
        cursor.expectEnd();

        if (steps.size() < 2) {
            throw new GrammarException("A path needs at least two nodes");
        }
        return new TagDeclaration.PathTag(steps);
    }

    static TagDeclaration.FanOutTag fanOut(TokenCursor cursor) {
        TagDeclaration.Endpoint source = endpoint(cursor);
        if (source.port() == null) {
            throw new GrammarException("Fan-out source needs a port");
        }
        cursor.expect(TokenType.ARROW, "'->'");
        List<TagDeclaration.Endpoint> targets = new ArrayList<>();
        do {
            targets.add(endpoint(cursor));
        } while (cursor.accept(TokenType.COMMA) != null);
        cursor.expectEnd();
        return new TagDeclaration.FanOutTag(source, targets);
    }

    static TagDeclaration.FanInTag fanIn(TokenCursor cursor) {
        List<TagDeclaration.Endpoint> sources = new ArrayList<>();
        do {
            sources.add(endpoint(cursor));
        } while (cursor.accept(TokenType.COMMA) != null);
        cursor.expect(TokenType.ARROW, "'->'");
        TagDeclaration.Endpoint target = endpoint(cursor);
        if (target.port() == null) {
            throw new GrammarException("Fan-in target needs a port");
        }
        cursor.expectEnd();
        return new TagDeclaration.FanInTag(sources, target);
    }

    /// `node.port[:scope]`
    static PortRef portRef(TokenCursor cursor) {
        TagDeclaration.Endpoint endpoint = endpoint(cursor);
        if (endpoint.port() == null) {
            throw new GrammarException("Expected '.' and a port after '" + endpoint.node() + "'");
        }
        return new PortRef(endpoint.node(), endpoint.port(), endpoint.scope());
    }

    private static TagDeclaration.Endpoint endpoint(TokenCursor cursor) {
        String node = cursor.expect(TokenType.IDENTIFIER, "node id").text();
        if (cursor.accept(TokenType.DOT) == null) {
            return new TagDeclaration.Endpoint(node, null, null);
        }
        String port = cursor.expectName("port name").text();
        String scope = null;
        if (cursor.consumedColon() || cursor.accept(TokenType.COLON) != null) {
            scope = cursor.expect(TokenType.IDENTIFIER, "scope name").text();
        }
        return new TagDeclaration.Endpoint(node, port, scope);
    }
}
