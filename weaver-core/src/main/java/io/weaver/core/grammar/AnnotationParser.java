package io.weaver.core.grammar;

import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses the annotation language inside one documentation comment.
///
/// Each line is parsed on its own. Lines that do not start with a known tag are prose (before
/// the first tag) or ignored (standard Javadoc tags such as `@see`). A line that starts with a
/// known tag but does not match its form becomes a `PARSE_WARNING` and parsing continues with
/// the next line.
///
/// `@param` and `@returns` also accept plain Javadoc prose after the port name, so ordinary
/// method documentation doubles as workflow boundary declarations.
///
/// ### Usage
/// {@snippet :
/// AnnotationBlock block = new AnnotationParser().parse(commentLines, firstLine);
/// block.all(TagDeclaration.NodeTag.class).forEach(this::placeInstance);
/// }
///
/// @implNote Stateless and thread-safe.
public final class AnnotationParser {

    private static final Logger logger = Logger.getLogger(AnnotationParser.class.getName());

    private static final int MAX_QUOTED_LENGTH = 60;

    private static final Pattern JAVADOC_PORT =
            Pattern.compile("^(@(?:param|returns))\\s+(\\[[^\\]]*\\]|[A-Za-z_$][A-Za-z0-9_$]*)(.*)$");

    @FunctionalInterface
    private interface Rule {
        TagDeclaration parse(String line, Token tag, TokenCursor cursor);
    }

    /// `raw` rules read the text after the tag themselves and are never tokenized.
    private record TagRule(String form, Rule rule, boolean raw) {

        TagRule(String form, Rule rule) {
            this(form, rule, false);
        }
    }

    private static final Map<String, TagRule> RULES =
            Map.ofEntries(
                    Map.entry("@flowWeaver", new TagRule(DirectiveGrammar.MARKER_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.marker(cursor))),
                    Map.entry("@input", portRule("input")),
                    Map.entry("@output", portRule("output")),
                    Map.entry("@step", portRule("step")),
                    Map.entry("@param", portRule("param")),
                    Map.entry("@returns", portRule("returns")),
                    Map.entry("@port", new TagRule("@port IN.name - description",
                            AnnotationParser::patternPort)),
                    Map.entry("@node", new TagRule(NodeGrammar.FORM,
                            (line, tag, cursor) -> NodeGrammar.parse(cursor))),
                    Map.entry("@connect", new TagRule(ConnectionGrammar.CONNECT_FORM,
                            (line, tag, cursor) -> ConnectionGrammar.connect(cursor))),
                    Map.entry("@path", new TagRule(ConnectionGrammar.PATH_FORM,
                            (line, tag, cursor) -> ConnectionGrammar.path(cursor))),
                    Map.entry("@fanOut", new TagRule(ConnectionGrammar.FAN_OUT_FORM,
                            (line, tag, cursor) -> ConnectionGrammar.fanOut(cursor))),
                    Map.entry("@fanIn", new TagRule(ConnectionGrammar.FAN_IN_FORM,
                            (line, tag, cursor) -> ConnectionGrammar.fanIn(cursor))),
                    Map.entry("@map", new TagRule(MacroGrammar.MAP_FORM,
                            (line, tag, cursor) -> MacroGrammar.map(cursor))),
                    Map.entry("@coerce", new TagRule(MacroGrammar.COERCE_FORM,
                            (line, tag, cursor) -> MacroGrammar.coerce(cursor))),
                    Map.entry("@scope", new TagRule(ScopeGrammar.SCOPE_FORM,
                            (line, tag, cursor) -> ScopeGrammar.scope(cursor))),
                    Map.entry("@position", new TagRule(ScopeGrammar.POSITION_FORM,
                            (line, tag, cursor) -> ScopeGrammar.position(cursor))),
                    Map.entry("@trigger", new TagRule(DirectiveGrammar.TRIGGER_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.trigger(cursor))),
                    Map.entry("@cancelOn", new TagRule(DirectiveGrammar.CANCEL_ON_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.cancelOn(cursor))),
                    Map.entry("@retries", new TagRule(DirectiveGrammar.RETRIES_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.retries(cursor))),
                    Map.entry("@timeout", new TagRule(DirectiveGrammar.TIMEOUT_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.timeout(cursor))),
                    Map.entry("@throttle", new TagRule(DirectiveGrammar.THROTTLE_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.throttle(cursor))),
                    Map.entry("@fwImport", new TagRule(DirectiveGrammar.IMPORT_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.fwImport(cursor))),
                    Map.entry("@strictTypes", new TagRule(DirectiveGrammar.STRICT_TYPES_FORM,
                            (line, tag, cursor) -> DirectiveGrammar.strictTypes(cursor))),
                    Map.entry("@autoConnect", new TagRule("@autoConnect",
                            (line, tag, cursor) -> {
                                cursor.expectEnd();
                                return new TagDeclaration.AutoConnectTag();
                            })),
                    Map.entry("@expression", new TagRule("@expression",
                            (line, tag, cursor) -> {
                                cursor.expectEnd();
                                return new TagDeclaration.ExpressionTag();
                            })),
                    Map.entry("@executeWhen", new TagRule("@executeWhen CONJUNCTION|DISJUNCTION",
                            (line, tag, cursor) -> new TagDeclaration.ExecuteWhenTag(
                                    DirectiveGrammar.identifier(cursor, "execution strategy")))),
                    Map.entry("@pullExecution", new TagRule("@pullExecution triggerPort",
                            (line, tag, cursor) -> new TagDeclaration.PullExecutionTag(
                                    DirectiveGrammar.identifier(cursor, "trigger port")))),
                    Map.entry("@name", new TagRule("@name identifier",
                            (line, tag, cursor) -> new TagDeclaration.NameTag(
                                    DirectiveGrammar.identifier(cursor, "name")))),
                    Map.entry("@label", textRule("@label text", TagDeclaration.LabelTag::new)),
                    Map.entry("@description",
                            textRule("@description text", TagDeclaration.DescriptionTag::new)),
                    Map.entry("@color", textRule("@color \"#rrggbb\"", TagDeclaration.ColorTag::new)),
                    Map.entry("@icon", textRule("@icon \"name\"", TagDeclaration.IconTag::new)));

    /// Parses the lines of one comment.
    ///
    /// @param lines comment lines with comment delimiters and leading `*` removed, not null
    /// @param firstLine 1-based source line of the first element of `lines`
    /// @return parsed tags, prose summary and warnings, never null
    public AnnotationBlock parse(List<String> lines, int firstLine) {
        List<AnnotationBlock.Entry> entries = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        StringBuilder summary = new StringBuilder();
        boolean seenTag = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            int lineNumber = firstLine + i;

            if (!line.startsWith("@")) {
                if (!seenTag && !line.isEmpty()) {
                    if (summary.length() > 0) {
                        summary.append(' ');
                    }
                    summary.append(line);
                }
                continue;
            }
            seenTag = true;

            String tagName = tagName(line);
            TagRule rule = RULES.get(tagName);
            if (rule == null) {
                continue;
            }

            try {
                entries.add(new AnnotationBlock.Entry(parseLine(line, rule), lineNumber));
            } catch (GrammarException e) {
                TagDeclaration lenient = lenientPort(line, rule);
                if (lenient != null) {
                    entries.add(new AnnotationBlock.Entry(lenient, lineNumber));
                    continue;
                }
                warnings.add(warning(tagName, line, e.getMessage(), rule, lineNumber));
            } catch (RuntimeException e) {
                // a rule failing outside its grammar still costs only this line
                String error = e.getMessage() != null ? e.getMessage() : e.toString();
                warnings.add(warning(tagName, line, error, rule, lineNumber));
            }
        }

        return new AnnotationBlock(
                summary.length() > 0 ? summary.toString() : null, entries, warnings);
    }

    /// Parses a single tag line, throwing on malformed input.
    ///
    /// @param line the line, starting at its tag, not null
    /// @return the declaration, or null when the line's tag is not part of the language
    /// @throws IllegalArgumentException if the line is malformed
    public TagDeclaration parseLine(String line) {
        TagRule rule = RULES.get(tagName(line.trim()));
        if (rule == null) {
            return null;
        }
        try {
            return parseLine(line.trim(), rule);
        } catch (GrammarException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static TagDeclaration parseLine(String line, TagRule rule) {
        if (rule.raw()) {
            String name = tagName(line);
            Token tag = new Token(TokenType.TAG, name, 0, name.length());
            return rule.rule().parse(line, tag, new TokenCursor(List.of()));
        }
        TokenCursor cursor = new TokenCursor(Tokenizer.tokenize(line));
        Token tag = cursor.expect(TokenType.TAG, "tag");
        return rule.rule().parse(line, tag, cursor);
    }

    /// Re-reads `@param`/`@returns` lines as `name` followed by free Javadoc prose.
    private static TagDeclaration lenientPort(String line, TagRule rule) {
        Matcher matcher = JAVADOC_PORT.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String prose = matcher.group(3).trim();
        if (prose.startsWith("-")) {
            prose = prose.substring(1).trim();
        }
        try {
            TagDeclaration.PortTag head =
                    (TagDeclaration.PortTag) parseLine(matcher.group(1) + " " + matcher.group(2), rule);
            PortDeclaration port = head.port();
            return new TagDeclaration.PortTag(
                    head.tag(),
                    new PortDeclaration(
                            port.name(),
                            port.optional(),
                            port.defaultText(),
                            port.scope(),
                            port.order(),
                            port.placement(),
                            port.type(),
                            port.mergeStrategy(),
                            prose.isEmpty() ? null : prose,
                            port.expression()));
        } catch (GrammarException e) {
            return null;
        }
    }

    private static String tagName(String line) {
        int end = 1;
        while (end < line.length() && Character.isLetterOrDigit(line.charAt(end))) {
            end++;
        }
        return line.substring(0, end);
    }

    private static Diagnostic warning(
            String tagName, String line, String error, TagRule rule, int lineNumber) {
        String message = warningMessage(tagName.substring(1), line, error, rule.form());
        logger.fine(message);
        return Diagnostic.warning(DiagnosticCode.PARSE_WARNING, message).atLine(lineNumber);
    }

    static String warningMessage(String tag, String line, String error, String form) {
        String quoted =
                line.length() > MAX_QUOTED_LENGTH
                        ? line.substring(0, MAX_QUOTED_LENGTH) + "..."
                        : line;
        return "Failed to parse "
                + tag
                + " line: \""
                + quoted
                + "\"\n  Error: "
                + error
                + "\n  Expected format: "
                + form;
    }

    private static TagRule portRule(String tag) {
        return new TagRule(
                PortGrammar.FORM.replace("@input", "@" + tag),
                (line, tagToken, cursor) ->
                        new TagDeclaration.PortTag(tag, PortGrammar.parse(line, cursor)));
    }

    private static TagRule textRule(
            String form, java.util.function.Function<String, TagDeclaration> factory) {
        return new TagRule(
                form,
                (line, tag, cursor) -> {
                    String text = DirectiveGrammar.text(line, tag);
                    if (text.isEmpty()) {
                        throw new GrammarException("Expected text after " + tag.text());
                    }
                    return factory.apply(text);
                },
                true);
    }

    private static TagDeclaration patternPort(String line, Token tag, TokenCursor cursor) {
        Token boundary = cursor.expect(TokenType.IDENTIFIER, "IN or OUT");
        boolean input;
        if (boundary.text().equals("IN")) {
            input = true;
        } else if (boundary.text().equals("OUT")) {
            input = false;
        } else {
            throw new GrammarException("Expected IN or OUT but found '" + boundary.text() + "'");
        }
        cursor.expect(TokenType.DOT, "'.'");
        return new TagDeclaration.PatternPortTag(input, PortGrammar.parse(line, cursor));
    }
}
