package io.weaver.core.grammar;

import io.weaver.core.util.Durations;
import java.time.Duration;
import java.util.Set;
import java.util.regex.Pattern;

/// Workflow directive and node type metadata lines.
final class DirectiveGrammar {

    static final String TRIGGER_FORM = "@trigger event=\"name\" cron=\"m h dom mon dow\"";
    static final String CANCEL_ON_FORM = "@cancelOn event=\"name\" [match=\"field\"] [timeout=\"1h\"]";
    static final String RETRIES_FORM = "@retries N";
    static final String TIMEOUT_FORM = "@timeout \"30m\"";
    static final String THROTTLE_FORM = "@throttle limit=N [period=\"1m\"]";
    static final String IMPORT_FORM = "@fwImport name exportName from \"package.Class\"";
    static final String MARKER_FORM = "@flowWeaver nodeType|workflow|pattern";
    static final String STRICT_TYPES_FORM = "@strictTypes [true|false]";
    static final String IDENTIFIER_FORM = "@tag identifier";

    static final Set<String> MARKER_KINDS = Set.of("nodeType", "workflow", "pattern");

    private static final Pattern CRON_FIELD =
            Pattern.compile("\\*(/\\d+)?|\\d+(-\\d+)?(/\\d+)?(,\\d+(-\\d+)?(/\\d+)?)*");

    private DirectiveGrammar() {}

    static TagDeclaration.Marker marker(TokenCursor cursor) {
        String kind = cursor.expect(TokenType.IDENTIFIER, "nodeType, workflow or pattern").text();
        if (!MARKER_KINDS.contains(kind)) {
            throw new GrammarException(
                    "Unknown declaration kind '" + kind + "', expected nodeType, workflow or pattern");
        }
        cursor.expectEnd();
        return new TagDeclaration.Marker(kind);
    }

    static TagDeclaration.TriggerTag trigger(TokenCursor cursor) {
        String event = null;
        String cron = null;
        while (!cursor.atEnd()) {
            Token key = cursor.expect(TokenType.KEY, "event= or cron=");
            String value = cursor.expect(TokenType.STRING, "quoted value").text();
            switch (key.text()) {
                case "event" -> event = value;
                case "cron" -> cron = cron(value);
                default -> throw new GrammarException("Unknown trigger key '" + key.text() + "='");
            }
        }
        if (event == null && cron == null) {
            throw new GrammarException("A trigger needs event= or cron=");
        }
        return new TagDeclaration.TriggerTag(event, cron);
    }

    static TagDeclaration.CancelOnTag cancelOn(TokenCursor cursor) {
        String event = null;
        String match = null;
        Duration timeout = null;
        while (!cursor.atEnd()) {
            Token key = cursor.expect(TokenType.KEY, "event=, match= or timeout=");
            String value = cursor.expect(TokenType.STRING, "quoted value").text();
            switch (key.text()) {
                case "event" -> event = value;
                case "match" -> match = value;
                case "timeout" -> timeout = duration(value);
                default -> throw new GrammarException("Unknown cancelOn key '" + key.text() + "='");
            }
        }
        if (event == null) {
            throw new GrammarException("cancelOn needs event=");
        }
        return new TagDeclaration.CancelOnTag(event, match, timeout);
    }

    static TagDeclaration.RetriesTag retries(TokenCursor cursor) {
        int retries = PortGrammar.integer(cursor.expect(TokenType.NUMBER, "retry count"));
        if (retries < 0) {
            throw new GrammarException("Retry count must not be negative");
        }
        cursor.expectEnd();
        return new TagDeclaration.RetriesTag(retries);
    }

    static TagDeclaration.TimeoutTag timeout(TokenCursor cursor) {
        Duration timeout = duration(cursor.expect(TokenType.STRING, "quoted duration").text());
        cursor.expectEnd();
        return new TagDeclaration.TimeoutTag(timeout);
    }

    static TagDeclaration.ThrottleTag throttle(TokenCursor cursor) {
        Integer limit = null;
        Duration period = null;
        while (!cursor.atEnd()) {
            Token key = cursor.expect(TokenType.KEY, "limit= or period=");
            switch (key.text()) {
                case "limit" ->
                        limit = PortGrammar.integer(cursor.expect(TokenType.NUMBER, "limit"));
                case "period" ->
                        period = duration(cursor.expect(TokenType.STRING, "quoted period").text());
                default -> throw new GrammarException("Unknown throttle key '" + key.text() + "='");
            }
        }
        if (limit == null || limit <= 0) {
            throw new GrammarException("A throttle needs a positive limit=");
        }
        return new TagDeclaration.ThrottleTag(limit, period);
    }

    static TagDeclaration.ImportTag fwImport(TokenCursor cursor) {
        String name = cursor.expect(TokenType.IDENTIFIER, "local name").text();
        String exportName = cursor.expect(TokenType.IDENTIFIER, "export name").text();
        Token from = cursor.expect(TokenType.IDENTIFIER, "'from'");
        if (!from.text().equals("from")) {
            throw new GrammarException("Expected 'from' but found '" + from.text() + "'");
        }
        String source = cursor.expect(TokenType.STRING, "quoted class name").text();
        cursor.expectEnd();
        return new TagDeclaration.ImportTag(name, exportName, source);
    }

    static TagDeclaration.StrictTypesTag strictTypes(TokenCursor cursor) {
        Token value = cursor.accept(TokenType.KEYWORD);
        cursor.expectEnd();
        if (value == null) {
            return new TagDeclaration.StrictTypesTag(true);
        }
        return switch (value.text()) {
            case "true" -> new TagDeclaration.StrictTypesTag(true);
            case "false" -> new TagDeclaration.StrictTypesTag(false);
            default -> throw new GrammarException("Expected true or false but found '" + value.text() + "'");
        };
    }

    /// A single identifier argument, as in `@executeWhen DISJUNCTION` or `@name fetch`.
    static String identifier(TokenCursor cursor, String what) {
        Token token = cursor.accept(TokenType.STRING);
        if (token == null) {
            token = cursor.expectName(what);
        }
        cursor.expectEnd();
        return token.text();
    }

    /// Quoted or bare text after the tag.
    static String text(String line, Token tag) {
        String rest = line.substring(tag.end()).trim();
        if (rest.length() >= 2 && rest.startsWith("\"") && rest.endsWith("\"")) {
            return rest.substring(1, rest.length() - 1);
        }
        return rest;
    }

    private static String cron(String expression) {
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new GrammarException(
                    "Invalid cron expression '" + expression + "': expected 5 fields");
        }
        for (String field : fields) {
            if (!CRON_FIELD.matcher(field).matches()) {
                throw new GrammarException(
                        "Invalid cron expression '" + expression + "': bad field '" + field + "'");
            }
        }
        return expression.trim();
    }

    private static Duration duration(String text) {
        try {
            return Durations.parse(text);
        } catch (IllegalArgumentException e) {
            throw new GrammarException(e.getMessage());
        }
    }
}
