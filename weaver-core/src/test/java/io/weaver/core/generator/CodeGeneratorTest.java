package io.weaver.core.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weaver.core.Fixtures;
import io.weaver.core.builder.ExternalTypeResolver;
import io.weaver.core.builder.SourceUnit;
import io.weaver.core.builder.SourceUnitBuilder;
import io.weaver.core.exception.ValidationFailedException;
import io.weaver.core.parser.SourceUnitParser;
import io.weaver.core.plan.ExecutionPlan;
import io.weaver.core.plan.ExecutionPlanner;
import io.weaver.core.validation.DiagnosticCode;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CodeGeneratorTest {

    private final SourceUnitParser parser = new SourceUnitParser();
    private final ExecutionPlanner planner = new ExecutionPlanner();
    private final CodeGenerator generator = new CodeGenerator();

    private SourceUnit adder;
    private Map<String, ExecutionPlan> plans;

    @BeforeEach
    void setUp() throws Exception {
        adder = build("Adder.java", Fixtures.ADDER);
        plans = planner.planUnit(adder);
    }

    private SourceUnit build(String fileName, String source) throws Exception {
        return new SourceUnitBuilder(ExternalTypeResolver.NONE, false)
                .build(parser.parse(fileName, source));
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInput() throws Exception {
        String first = generator.generate(adder, plans, GenerateOptions.DEFAULTS);
        String second =
                generator.generate(
                        build("Adder.java", Fixtures.ADDER),
                        planner.planUnit(build("Adder.java", Fixtures.ADDER)),
                        GenerateOptions.DEFAULTS);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldRejectUnitWithValidationErrors() throws Exception {
        SourceUnit broken = build("Broken.java", Fixtures.BROKEN);
        Map<String, ExecutionPlan> brokenPlans = planner.planUnit(broken);

        assertThatThrownBy(() -> generator.generate(broken, brokenPlans, GenerateOptions.DEFAULTS))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(
                        e -> {
                            ValidationFailedException failure = (ValidationFailedException) e;
                            assertThat(failure.getWorkflow()).isEqualTo("calculate");
                            assertThat(failure.getResult().hasCode(
                                            DiagnosticCode.MISSING_REQUIRED_INPUT))
                                    .isTrue();
                        });
    }

    @Test
    void shouldRequirePlanForEveryWorkflow() {
        Map<String, ExecutionPlan> partial = new HashMap<>(plans);
        partial.remove("fork");

        assertThatThrownBy(() -> generator.generate(adder, partial, GenerateOptions.DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No execution plan for workflow 'fork'");
    }

    @Nested
    class Layout {

        private String source;

        @BeforeEach
        void generate() throws Exception {
            source = generator.generate(adder, plans, GenerateOptions.DEFAULTS);
        }

        @Test
        void shouldStartWithHeaderAndPackage() {
            assertThat(source)
                    .startsWith(
                            "// Generated by Weaver from Adder.java. Do not edit.\n"
                                    + "package flows;\n");
            assertThat(source)
                    .contains("import io.weaver.runtime.WorkflowResult;\n")
                    .contains("import java.util.concurrent.atomic.AtomicInteger;\n");
        }

        @Test
        void shouldDeclareCompanionClass() {
            assertThat(source)
                    .contains("public final class AdderWorkflows {\n")
                    .contains("    private AdderWorkflows() {}\n")
                    .endsWith("}\n");
        }

        @Test
        void shouldEmitBothEntryPointsPerWorkflow() {
            assertThat(source)
                    .contains(
                            "public static WorkflowResult calculate("
                                    + "boolean execute, Map<String, Object> params) {")
                    .contains(
                            "public static WorkflowResult calculate(boolean execute,"
                                    + " Map<String, Object> params, WorkflowContext context) {")
                    .contains("return calculate(execute, params, WorkflowContext.create());")
                    .contains(
                            "public static final WorkflowDirectives CALCULATE_DIRECTIVES"
                                    + " = WorkflowDirectives.NONE;");
        }

        @Test
        void shouldBufferMultipleTriggersInJoin() {
            assertThat(source)
                    .contains("ConjunctionJoin bothJoin = new ConjunctionJoin(\"both\", "
                            + "List.of(\"execute\"));")
                    .contains("bothJoin.report(\"execute\", \"left.onSuccess\", "
                            + "ctx.get(\"left\", \"onSuccess\"));")
                    .contains("if (bothJoin.tryFire()) {");
        }

        @Test
        void shouldRegisterPullNodeLazily() {
            assertThat(source).contains("ctx.registerPullExecutor(\"lazy\", () -> {");
        }

        @Test
        void shouldGuardNestedWorkflowCallsWithDepth() {
            assertThat(source)
                    .contains("ctx.workflowContext().descend(\"pong\")")
                    .contains("ctx.workflowContext().descend(\"ping\")")
                    .contains("catch (RecursionDepthExceededException e) {");
        }

        @Test
        void shouldReportToListenerOutsideProduction() {
            assertThat(source)
                    .contains(
                            "context.listener().onWorkflowComplete("
                                    + "\"calculate\", workflowResult);")
                    .contains("NodeStatus.RUNNING");
        }
    }

    @Test
    void shouldOmitTraceEventsInProduction() throws Exception {
        String source =
                generator.generate(adder, plans, GenerateOptions.DEFAULTS.withProduction(true));

        assertThat(source)
                .doesNotContain("listener()")
                .doesNotContain("NodeStatus.")
                .doesNotContain("nodeFailed(")
                .contains("new ExecutionContext(context, false);");
    }
}
