package io.weaver.core;

import io.weaver.core.builder.SourceUnit;
import io.weaver.core.builder.SourceUnitBuilder;
import io.weaver.core.exception.GraphBuildException;
import io.weaver.core.exception.SourceParseException;
import io.weaver.core.exception.ValidationFailedException;
import io.weaver.core.generator.CodeGenerator;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.parser.SourceUnitParser;
import io.weaver.core.plan.ExecutionPlan;
import io.weaver.core.plan.ExecutionPlanner;
import io.weaver.core.plan.PlanCreationException;
import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.GraphValidator;
import io.weaver.core.validation.ValidationResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point of the pipeline: source text to graph, graph to diagnostics, unit to program.
///
/// Instances are created by {@link WeaverFactory}; every collaborator is injected through the
/// constructor.
///
/// ### Usage
/// {@snippet :
/// Weaver weaver = WeaverFactory.create(WeaverConfig.builder().strictTypes(true).build());
/// CompilationResult result = weaver.compile(Path.of("src/flows/Orders.java"));
/// Files.writeString(target, result.generatedSource());
/// }
///
/// ### Contracts
/// - {@link #compile} never returns partial output: any error aborts the whole unit
/// - Diagnostics of a successful compilation are warnings only
///
/// @implNote Thread-safe as long as the injected collaborators are; the default ones are.
///
/// @see WeaverFactory
/// @see WeaverConfig
public class Weaver {

    private static final Logger logger = Logger.getLogger(Weaver.class.getName());

    private final WeaverConfig config;
    private final SourceUnitParser parser;
    private final SourceUnitBuilder builder;
    private final GraphValidator validator;
    private final ExecutionPlanner planner;
    private final CodeGenerator generator;

    public Weaver(
            WeaverConfig config,
            SourceUnitParser parser,
            SourceUnitBuilder builder,
            GraphValidator validator,
            ExecutionPlanner planner,
            CodeGenerator generator) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    public WeaverConfig getConfig() {
        return config;
    }

    // ---------------- Parse ----------------

    /// Parses and builds a source file.
    ///
    /// @param file path to a `.java` file, not null
    /// @return the built unit, never null
    /// @throws SourceParseException if the file cannot be read or is not valid Java
    /// @throws GraphBuildException if the unit declares something that cannot be built
    public SourceUnit parse(Path file) throws SourceParseException, GraphBuildException {
        Objects.requireNonNull(file, "file must not be null");
        return builder.build(parser.parse(file));
    }

    /// Parses and builds source text.
    ///
    /// @param fileName name used in diagnostics and the generated header, not null
    /// @param source Java source text, not null
    /// @return the built unit, never null
    /// @throws SourceParseException if the text is not valid Java
    /// @throws GraphBuildException if the unit declares something that cannot be built
    public SourceUnit parse(String fileName, String source)
            throws SourceParseException, GraphBuildException {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(source, "source must not be null");
        return builder.build(parser.parse(fileName, source));
    }

    // ---------------- Validate ----------------

    /// Validates one graph with the configured strictness.
    ///
    /// @param graph graph to check, not null
    /// @return errors and warnings, never null
    public ValidationResult validate(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return validator.validate(graph, config.validationOptions());
    }

    // ---------------- Compile ----------------

    /// Compiles a source file into the Java source of its companion class.
    ///
    /// @param file path to a `.java` file, not null
    /// @return generated source and collected warnings, never null
    /// @throws SourceParseException if the file cannot be read or is not valid Java
    /// @throws GraphBuildException if the unit cannot be built
    /// @throws ValidationFailedException if the unit or one of its graphs has errors
    /// @throws PlanCreationException if a workflow contains an ordering cycle
    public CompilationResult compile(Path file)
            throws SourceParseException,
                    GraphBuildException,
                    ValidationFailedException,
                    PlanCreationException {
        return compile(parse(file));
    }

    /// Compiles source text into the Java source of its companion class.
    ///
    /// @see #compile(Path)
    public CompilationResult compile(String fileName, String source)
            throws SourceParseException,
                    GraphBuildException,
                    ValidationFailedException,
                    PlanCreationException {
        return compile(parse(fileName, source));
    }

    /// Compiles a built unit.
    ///
    /// @param unit unit returned by {@link #parse}, not null
    /// @return generated source and collected warnings, never null
    /// @throws ValidationFailedException if the unit or one of its graphs has errors
    /// @throws PlanCreationException if a workflow contains an ordering cycle
    public CompilationResult compile(SourceUnit unit)
            throws ValidationFailedException, PlanCreationException {
        Objects.requireNonNull(unit, "unit must not be null");
        logger.info("Compiling " + unit.fileName());

        List<Diagnostic> warnings = new ArrayList<>();
        List<Diagnostic> unitErrors = new ArrayList<>();
        for (Diagnostic diagnostic : unit.diagnostics()) {
            (diagnostic.isError() ? unitErrors : warnings).add(diagnostic);
        }
        if (!unitErrors.isEmpty()) {
            throw new ValidationFailedException(
                    unit.fileName(), new ValidationResult(unitErrors, warnings));
        }

        for (Pattern pattern : unit.patterns()) {
            ValidationResult result = validator.validatePattern(pattern);
            if (!result.isValid()) {
                throw new ValidationFailedException(pattern.name(), result);
            }
            warnings.addAll(result.warnings());
        }
        for (WorkflowGraph graph : unit.workflows()) {
            ValidationResult result = validate(graph);
            if (!result.isValid()) {
                throw new ValidationFailedException(graph.getName(), result);
            }
            warnings.addAll(result.warnings());
        }

        Map<String, ExecutionPlan> plans = planner.planUnit(unit);
        plans.values().forEach(plan -> warnings.addAll(plan.warnings()));

        String source = generator.generate(unit, plans, config.generateOptions());
        logger.info(
                "Compiled "
                        + unit.fileName()
                        + " into "
                        + unit.companionClassName()
                        + " with "
                        + warnings.size()
                        + " warning(s)");
        return new CompilationResult(source, warnings);
    }
}
