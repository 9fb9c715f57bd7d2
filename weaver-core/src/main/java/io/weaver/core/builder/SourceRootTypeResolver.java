package io.weaver.core.builder;

import io.weaver.core.exception.SourceParseException;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeType;
import io.weaver.core.parser.AnnotatedFunction;
import io.weaver.core.parser.ParsedSource;
import io.weaver.core.parser.SourceUnitParser;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Resolves imports by reading `package/Class.java` under a list of source roots.
///
/// The exported method must carry a `@flowWeaver nodeType` comment; its shape is built the
/// same way as a local node type. Methods without annotations have no discoverable shape.
///
/// @implNote Parsed files are cached per instance; safe for concurrent use.
public class SourceRootTypeResolver implements ExternalTypeResolver {

    private static final Logger logger = Logger.getLogger(SourceRootTypeResolver.class.getName());

    private final List<Path> sourceRoots;
    private final SourceUnitParser parser;
    private final NodeTypeBuilder nodeTypeBuilder = new NodeTypeBuilder();
    private final Map<Path, Optional<ParsedSource>> cache = new ConcurrentHashMap<>();

    public SourceRootTypeResolver(List<Path> sourceRoots) {
        this(sourceRoots, new SourceUnitParser());
    }

    public SourceRootTypeResolver(List<Path> sourceRoots, SourceUnitParser parser) {
        this.sourceRoots = List.copyOf(sourceRoots);
        this.parser = parser;
    }

    @Override
    public Optional<NodeType> resolve(String source, String exportName) {
        String relative = source.replace('.', '/') + ".java";
        for (Path root : sourceRoots) {
            Path file = root.resolve(relative);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            Optional<ParsedSource> parsed = cache.computeIfAbsent(file, this::read);
            if (parsed.isEmpty()) {
                continue;
            }
            Optional<NodeType> found = find(parsed.get(), exportName);
            if (found.isPresent()) {
                return found;
            }
        }
        logger.fine(() -> "No annotated export '" + exportName + "' in " + source);
        return Optional.empty();
    }

    private Optional<NodeType> find(ParsedSource parsed, String exportName) {
        for (AnnotatedFunction function : parsed.functionsOfKind("nodeType")) {
            if (!function.name().equals(exportName)) {
                continue;
            }
            String className =
                    parsed.packageName().isEmpty()
                            ? function.declaringClass()
                            : parsed.packageName() + "." + function.declaringClass();
            return Optional.of(
                    nodeTypeBuilder.build(
                            function,
                            parsed,
                            new ImplementationRef.External(className, exportName),
                            new BuildDiagnostics()));
        }
        return Optional.empty();
    }

    private Optional<ParsedSource> read(Path file) {
        try {
            return Optional.of(parser.parse(file));
        } catch (SourceParseException e) {
            logger.warning("Skipping unreadable import source " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
