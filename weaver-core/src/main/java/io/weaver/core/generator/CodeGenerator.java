package io.weaver.core.generator;

import io.weaver.core.builder.SourceUnit;
import io.weaver.core.exception.ValidationFailedException;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.plan.ExecutionPlan;
import io.weaver.core.validation.GraphValidator;
import io.weaver.core.validation.ValidationResult;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Generates the Java companion class of a source unit from its execution plans.
///
/// The companion class `<UnitName>Workflows` lives in the unit's package and exposes, per
/// workflow, a `WorkflowDirectives` constant and two entry points:
///
/// {@snippet :
/// public static WorkflowResult calculate(boolean execute, Map<String, Object> params)
/// public static WorkflowResult calculate(
///         boolean execute, Map<String, Object> params, WorkflowContext context)
/// }
///
/// Asynchronous workflows return `CompletableFuture<WorkflowResult>` instead. The generated
/// code depends only on `io.weaver.runtime` and on the unit's own classes and imports.
///
/// ### Contracts
/// - **Precondition**: every workflow of the unit has a plan
/// - **Postcondition**: identical input yields byte-identical output
/// - Graphs with validation errors are rejected with {@link ValidationFailedException}
///
/// @implNote Stateless and thread-safe. Each call uses its own writer.
/// @see io.weaver.core.plan.ExecutionPlanner for the plans consumed here
public class CodeGenerator {

    private static final Logger logger = Logger.getLogger(CodeGenerator.class.getName());

    private static final List<String> RUNTIME_IMPORTS =
            List.of(
                    "io.weaver.runtime.Async",
                    "io.weaver.runtime.Coercions",
                    "io.weaver.runtime.ConjunctionJoin",
                    "io.weaver.runtime.ExecutionContext",
                    "io.weaver.runtime.Iteration",
                    "io.weaver.runtime.JsonValues",
                    "io.weaver.runtime.NodeExecutionException",
                    "io.weaver.runtime.NodeStatus",
                    "io.weaver.runtime.Ports",
                    "io.weaver.runtime.RecursionDepthExceededException",
                    "io.weaver.runtime.ScopeFunction",
                    "io.weaver.runtime.ScopeResult",
                    "io.weaver.runtime.WorkflowContext",
                    "io.weaver.runtime.WorkflowDirectives",
                    "io.weaver.runtime.WorkflowResult",
                    "java.time.Duration",
                    "java.util.List",
                    "java.util.Map",
                    "java.util.concurrent.CompletableFuture");

    private final GraphValidator validator;

    public CodeGenerator() {
        this(new GraphValidator());
    }

    /// @param validator validator run on every graph before generation, not null
    public CodeGenerator(GraphValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /// Generates the companion class of a unit.
    ///
    /// @param unit built source unit, not null
    /// @param plans execution plans by workflow name, not null
    /// @param options generation options, not null
    /// @return Java source of the companion class, never null
    /// @throws ValidationFailedException if a workflow has validation errors
    /// @throws IllegalArgumentException if a workflow of the unit has no plan
    public String generate(
            SourceUnit unit, Map<String, ExecutionPlan> plans, GenerateOptions options)
            throws ValidationFailedException {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(plans, "plans must not be null");
        Objects.requireNonNull(options, "options must not be null");

        for (WorkflowGraph graph : unit.workflows()) {
            if (!plans.containsKey(graph.getName())) {
                throw new IllegalArgumentException(
                        "No execution plan for workflow '" + graph.getName() + "'");
            }
            ValidationResult result = validator.validate(graph, options.validation());
            if (!result.isValid()) {
                throw new ValidationFailedException(graph.getName(), result);
            }
        }

        JavaSourceWriter out = new JavaSourceWriter();
        header(unit, out);
        out.open("public final class " + unit.companionClassName());
        out.blank();
        out.line("private " + unit.companionClassName() + "() {}");
        for (WorkflowGraph graph : unit.workflows()) {
            out.blank();
            new WorkflowEmitter(unit, plans.get(graph.getName()), options.production(), out).emit();
        }
        out.close();

        String source = out.toString();
        logger.info(
                "Generated "
                        + unit.companionClassName()
                        + " with "
                        + unit.workflows().size()
                        + " workflow(s)"
                        + (options.production() ? " (production)" : ""));
        return source;
    }

    private static void header(SourceUnit unit, JavaSourceWriter out) {
        out.line("// Generated by Weaver from " + unit.fileName() + ". Do not edit.");
        if (!unit.packageName().isEmpty()) {
            out.line("package " + unit.packageName() + ";");
        }
        out.blank();

        TreeSet<String> imports = new TreeSet<>(RUNTIME_IMPORTS);
        TreeSet<String> staticImports = new TreeSet<>();
        for (String declared : unit.imports()) {
            if (declared.startsWith("static ")) {
                staticImports.add(declared.substring("static ".length()));
            } else {
                imports.add(declared);
            }
        }
        imports.forEach(i -> out.line("import " + i + ";"));
        staticImports.forEach(i -> out.line("import static " + i + ";"));
        out.blank();

        out.line(
                "/** Workflows of {@code "
                        + unit.className()
                        + "}, generated from their annotations. */");
        out.line("@SuppressWarnings({\"unchecked\", \"unused\"})");
    }
}
