package io.weaver.core;

import io.weaver.core.builder.ExternalTypeResolver;
import io.weaver.core.builder.SourceRootTypeResolver;
import io.weaver.core.builder.SourceUnitBuilder;
import io.weaver.core.generator.CodeGenerator;
import io.weaver.core.parser.SourceUnitParser;
import io.weaver.core.plan.ExecutionPlanner;
import io.weaver.core.validation.GraphValidator;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link Weaver} pipelines.
///
/// ### Usage
/// {@snippet :
/// Weaver weaver = WeaverFactory.create();
///
/// Weaver strict = WeaverFactory.create(
///     WeaverConfig.builder()
///         .strictTypes(true)
///         .sourceRoot(Path.of("src/main/java"))
///         .build());
/// }
///
/// @implNote This is a utility class with only static methods. All collaborators are wired
/// explicitly via constructor injection.
///
/// @see Weaver
/// @see WeaverConfig
public final class WeaverFactory {

    private static final Logger logger = Logger.getLogger(WeaverFactory.class.getName());

    private WeaverFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates a pipeline with default configuration.
    ///
    /// @return a fully-wired pipeline, never null
    public static Weaver create() {
        return create(new WeaverConfig());
    }

    /// Creates a pipeline with custom configuration.
    ///
    /// @apiNote **Side effects**: none until the pipeline is used; source roots are read
    /// lazily when an import is resolved.
    ///
    /// @param config pipeline options, not null
    /// @return a fully-wired pipeline, never null
    public static Weaver create(WeaverConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        SourceUnitParser parser = new SourceUnitParser();
        ExternalTypeResolver resolver = createResolver(config, parser);
        GraphValidator validator = new GraphValidator();

        logger.fine(
                () ->
                        "Creating Weaver (strictTypes="
                                + config.isStrictTypes()
                                + ", draftMode="
                                + config.isDraftMode()
                                + ", production="
                                + config.isProduction()
                                + ", sourceRoots="
                                + config.getSourceRoots()
                                + ")");
        return new Weaver(
                config,
                parser,
                new SourceUnitBuilder(resolver, config.isStrictExternalResolution()),
                validator,
                new ExecutionPlanner(),
                new CodeGenerator(validator));
    }

    private static ExternalTypeResolver createResolver(
            WeaverConfig config, SourceUnitParser parser) {
        if (config.getSourceRoots().isEmpty()) {
            return ExternalTypeResolver.NONE;
        }
        return new SourceRootTypeResolver(config.getSourceRoots(), parser);
    }
}
