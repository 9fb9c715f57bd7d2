package io.weaver.core.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.JavadocComment;
import io.weaver.core.exception.SourceParseException;
import io.weaver.core.grammar.AnnotationBlock;
import io.weaver.core.grammar.AnnotationParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Reads a Java compilation unit and extracts the methods documented with `@flowWeaver`.
///
/// Only the shape of the code is read: package, imports, record declarations and each
/// annotated method's signature and comment. Nothing is resolved or compiled.
///
/// @implNote Each call creates its own {@link JavaParser}; instances of this class are
/// stateless and thread-safe.
public class SourceUnitParser {

    private static final Logger logger = Logger.getLogger(SourceUnitParser.class.getName());

    private static final String MARKER = "@flowWeaver";

    private final AnnotationParser annotationParser;

    public SourceUnitParser() {
        this(new AnnotationParser());
    }

    public SourceUnitParser(AnnotationParser annotationParser) {
        this.annotationParser = annotationParser;
    }

    /// Parses a source file.
    ///
    /// @param file path to a `.java` file, not null
    /// @return the extracted content, never null
    /// @throws SourceParseException if the file cannot be read or is not valid Java
    public ParsedSource parse(Path file) throws SourceParseException {
        String fileName = file.getFileName().toString();
        try {
            return parse(fileName, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SourceParseException(fileName, "Cannot read file: " + e.getMessage(), e);
        }
    }

    /// Parses source text.
    ///
    /// @param fileName file name used for diagnostics and the class name fallback, not null
    /// @param source Java source text, not null
    /// @return the extracted content, never null
    /// @throws SourceParseException if the text is not valid Java
    public ParsedSource parse(String fileName, String source) throws SourceParseException {
        ParserConfiguration config = new ParserConfiguration();
        config.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        JavaParser parser = new JavaParser(config);

        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems =
                    result.getProblems().stream()
                            .map(Problem::getVerboseMessage)
                            .collect(Collectors.joining("; "));
            throw new SourceParseException(fileName, "Not valid Java: " + problems);
        }
        CompilationUnit unit = result.getResult().get();

        String packageName =
                unit.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        List<String> imports =
                unit.getImports().stream()
                        .map(
                                i ->
                                        (i.isStatic() ? "static " : "")
                                                + i.getNameAsString()
                                                + (i.isAsterisk() ? ".*" : ""))
                        .toList();

        String className = primaryClassName(unit, fileName);

        Map<String, RecordShape> records = new LinkedHashMap<>();
        unit.findAll(RecordDeclaration.class)
                .forEach(
                        record ->
                                records.put(
                                        record.getNameAsString(),
                                        new RecordShape(
                                                record.getNameAsString(),
                                                record.getParameters().stream()
                                                        .map(SourceUnitParser::parameter)
                                                        .toList())));

        List<AnnotatedFunction> functions = new ArrayList<>();
        for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
            Optional<JavadocComment> comment = method.getJavadocComment();
            if (comment.isEmpty() || !comment.get().getContent().contains(MARKER)) {
                continue;
            }
            AnnotationBlock block = annotate(comment.get());
            if (block.kind().isEmpty()) {
                logger.fine(() -> fileName + ": malformed marker on " + method.getNameAsString());
            }
            functions.add(function(method, block));
        }

        logger.fine(() -> fileName + ": found " + functions.size() + " annotated method(s)");
        return new ParsedSource(fileName, packageName, className, imports, functions, records);
    }

    private AnnotationBlock annotate(JavadocComment comment) {
        int firstLine = comment.getBegin().map(position -> position.line).orElse(1);
        List<String> lines = new ArrayList<>();
        for (String raw : comment.getContent().split("\r?\n", -1)) {
            String line = raw.strip();
            if (line.startsWith("*")) {
                line = line.substring(1);
            }
            lines.add(line.strip());
        }
        return annotationParser.parse(lines, firstLine);
    }

    private static AnnotatedFunction function(MethodDeclaration method, AnnotationBlock block) {
        List<MethodParameter> parameters =
                method.getParameters().stream().map(SourceUnitParser::parameter).toList();
        return new AnnotatedFunction(
                method.getNameAsString(),
                declaringClass(method),
                parameters,
                method.getTypeAsString(),
                method.getBody().isPresent(),
                block,
                method.getBegin().map(position -> position.line).orElse(0));
    }

    private static MethodParameter parameter(Parameter p) {
        return new MethodParameter(
                p.getNameAsString(), p.getTypeAsString() + (p.isVarArgs() ? "..." : ""));
    }

    /// Dotted path of the enclosing types, relative to the package.
    private static String declaringClass(MethodDeclaration method) {
        List<String> names = new ArrayList<>();
        Optional<Node> current = method.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof TypeDeclaration<?> type) {
                names.add(0, type.getNameAsString());
            }
            current = node.getParentNode();
        }
        return String.join(".", names);
    }

    private static String primaryClassName(CompilationUnit unit, String fileName) {
        String stem =
                fileName.endsWith(".java")
                        ? fileName.substring(0, fileName.length() - ".java".length())
                        : fileName;
        if (unit.getTypes().isEmpty()
                || unit.getTypes().stream().anyMatch(t -> t.getNameAsString().equals(stem))) {
            return stem;
        }
        return unit.getType(0).getNameAsString();
    }
}
