package io.weaver.core.validation;

import static io.weaver.core.TestGraphs.edge;
import static io.weaver.core.TestGraphs.unary;
import static io.weaver.core.TestGraphs.workflow;
import static org.assertj.core.api.Assertions.assertThat;

import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Pattern;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.Scope;
import io.weaver.core.model.WorkflowGraph;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    /// Start -> a -> b -> Exit, with a.result feeding b.value.
    private static WorkflowGraph.Builder chain(DataType produced, DataType consumed) {
        return workflow("chain")
                .nodeType(unary("Source", DataType.ANY, produced).build())
                .nodeType(unary("Target", consumed, DataType.ANY).build())
                .instance(NodeInstance.of("a", "Source"))
                .instance(NodeInstance.of("b", "Target"))
                .connection(edge("Start.execute", "a.execute"))
                .connection(edge("Start.x", "a.value"))
                .connection(edge("a.onSuccess", "b.execute"))
                .connection(edge("a.result", "b.value"))
                .connection(edge("b.onSuccess", "Exit.onSuccess"))
                .connection(edge("b.result", "Exit.result"));
    }

    private static List<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::code).toList();
    }

    @Test
    void shouldAcceptWellFormedGraph() {
        ValidationResult result =
                validator.validate(
                        chain(DataType.NUMBER, DataType.NUMBER).build(),
                        ValidationOptions.DEFAULTS);

        assertThat(result.isValid()).isTrue();
        assertThat(result.all()).isEmpty();
    }

    @Test
    void shouldReturnEqualResultsForRepeatedRuns() {
        WorkflowGraph graph =
                chain(DataType.STRING, DataType.NUMBER)
                        .instance(NodeInstance.of("idle", "Source"))
                        .build();

        assertThat(validator.validate(graph, ValidationOptions.DEFAULTS))
                .isEqualTo(validator.validate(graph, ValidationOptions.DEFAULTS));
    }

    @Nested
    class Coercions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "NUMBER, STRING,",
            "BOOLEAN, STRING,",
            "ANY, NUMBER,",
            "OBJECT, ANY,",
            "STRING, NUMBER, LOSSY_TYPE_COERCION",
            "STRING, BOOLEAN, LOSSY_TYPE_COERCION",
            "ARRAY, STRING, LOSSY_TYPE_COERCION",
            "NUMBER, BOOLEAN, UNUSUAL_TYPE_COERCION",
            "STRING, ARRAY, UNUSUAL_TYPE_COERCION",
            "OBJECT, NUMBER, TYPE_MISMATCH",
            "FUNCTION, STRING, TYPE_MISMATCH"
        })
        void shouldClassifyDataConnection(
                DataType produced, DataType consumed, DiagnosticCode expected) {
            ValidationResult result =
                    validator.validate(
                            chain(produced, consumed).build(), ValidationOptions.DEFAULTS);

            if (expected == null) {
                assertThat(result.all()).isEmpty();
            } else {
                assertThat(result.errors()).isEmpty();
                assertThat(codes(result.warnings())).containsExactly(expected);
                assertThat(result.warnings().get(0).connection())
                        .isEqualTo(edge("a.result", "b.value"));
            }
        }

        @Test
        void shouldReportCoercionAsErrorInStrictMode() {
            ValidationResult result =
                    validator.validate(
                            chain(DataType.STRING, DataType.NUMBER).build(),
                            ValidationOptions.strictMode());

            assertThat(codes(result.errors())).containsExactly(DiagnosticCode.LOSSY_TYPE_COERCION);
        }

        @Test
        void shouldHonourStrictTypesOfWorkflow() {
            WorkflowGraph graph = chain(DataType.STRING, DataType.NUMBER).build();
            WorkflowGraph strict =
                    graph.toBuilder().options(graph.getOptions().withStrictTypes(true)).build();

            assertThat(validator.validate(strict, ValidationOptions.DEFAULTS).isValid()).isFalse();
        }

        @Test
        void shouldRejectStepToDataConnection() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .connection(edge("a.onFailure", "b.value"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors())).contains(DiagnosticCode.STEP_PORT_TYPE_MISMATCH);
        }
    }

    @Nested
    class Bindings {

        @Test
        void shouldReportUnknownTypeOnceWithSuggestion() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .instance(NodeInstance.of("c", "Sourc"))
                            .connection(edge("b.onSuccess", "c.execute"))
                            .connection(edge("c.result", "Exit.result"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors())).containsExactly(DiagnosticCode.UNKNOWN_NODE_TYPE);
            assertThat(result.errors().get(0).message())
                    .isEqualTo(
                            "Node \"c\" references unknown node type \"Sourc\"."
                                    + " Did you mean \"Source\"?");
            assertThat(result.errors().get(0).nodeId()).isEqualTo("c");
        }

        @Test
        void shouldReportStubAsErrorUnlessDraft() {
            NodeType stub = unary("Source", DataType.ANY, DataType.NUMBER)
                    .variant(NodeVariant.STUB)
                    .build();
            WorkflowGraph graph = chain(DataType.NUMBER, DataType.NUMBER).nodeType(stub).build();

            ValidationResult strict = validator.validate(graph, ValidationOptions.DEFAULTS);
            ValidationResult draft = validator.validate(graph, ValidationOptions.draftMode());

            assertThat(codes(strict.errors())).containsExactly(DiagnosticCode.STUB_NODE);
            assertThat(draft.isValid()).isTrue();
            assertThat(codes(draft.warnings())).containsExactly(DiagnosticCode.STUB_NODE);
        }

        @Test
        void shouldRejectReservedInstanceAndTypeNames() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .nodeType(unary("Exit", DataType.ANY, DataType.ANY).build())
                            .instance(NodeInstance.of("Start", "Source"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors()))
                    .contains(
                            DiagnosticCode.RESERVED_NODE_NAME, DiagnosticCode.RESERVED_INSTANCE_ID);
        }
    }

    @Nested
    class Connections {

        @Test
        void shouldSuggestClosestPortName() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .connection(edge("a.reslt", "Exit.result"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            Diagnostic unknown = result.errors().get(0);
            assertThat(unknown.code()).isEqualTo(DiagnosticCode.UNKNOWN_SOURCE_PORT);
            assertThat(unknown.message()).endsWith("Did you mean \"result\"?");
        }

        @Test
        void shouldReportMissingRequiredInput() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .connections(
                                    List.of(
                                            edge("Start.execute", "a.execute"),
                                            edge("a.onSuccess", "b.execute"),
                                            edge("a.result", "b.value"),
                                            edge("b.onSuccess", "Exit.onSuccess"),
                                            edge("b.result", "Exit.result")))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors()))
                    .containsExactly(DiagnosticCode.MISSING_REQUIRED_INPUT);
            assertThat(result.errors().get(0).port()).isEqualTo("value");
        }

        @Test
        void shouldAcceptUnconnectedInputWithDefault() {
            NodeType withDefault =
                    NodeType.builder("Source")
                            .inputs(
                                    List.of(
                                            Port.input("execute").dataType(DataType.STEP).build(),
                                            Port.input("value").defaultValue(3).build()))
                            .outputs(
                                    unary("Source", DataType.ANY, DataType.NUMBER)
                                            .build()
                                            .getOutputs())
                            .build();
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .nodeType(withDefault)
                            .connections(
                                    List.of(
                                            edge("Start.execute", "a.execute"),
                                            edge("a.onSuccess", "b.execute"),
                                            edge("a.result", "b.value"),
                                            edge("b.onSuccess", "Exit.onSuccess"),
                                            edge("b.result", "Exit.result")))
                            .build();

            assertThat(validator.validate(graph, ValidationOptions.DEFAULTS).isValid()).isTrue();
        }

        @Test
        void shouldRejectTwoSourcesOnOneInput() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .connection(edge("Start.x", "b.value"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors()))
                    .containsExactly(DiagnosticCode.MULTIPLE_CONNECTIONS_TO_INPUT);
        }

        @Test
        void shouldDetectLoop() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .connection(edge("b.onFailure", "a.execute"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors())).containsExactly(DiagnosticCode.CYCLE_DETECTED);
            assertThat(result.errors().get(0).message()).isEqualTo("Loop detected: a -> b -> a");
        }

        @Test
        void shouldWarnAboutUnusedNodeAndOutput() {
            WorkflowGraph graph =
                    chain(DataType.NUMBER, DataType.NUMBER)
                            .instance(NodeInstance.of("idle", "Target"))
                            .build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.warnings()))
                    .containsExactly(DiagnosticCode.UNUSED_NODE, DiagnosticCode.UNUSED_OUTPUT_PORT);
        }
    }

    @Nested
    class Scopes {

        private NodeType forEach() {
            return NodeType.builder("ForEach")
                    .input(Port.input("execute").dataType(DataType.STEP).build())
                    .input(Port.input("success").dataType(DataType.STEP).scope("each").build())
                    .input(
                            Port.input("failure")
                                    .dataType(DataType.STEP)
                                    .scope("each")
                                    .failure(true)
                                    .build())
                    .output(
                            Port.output("onSuccess")
                                    .dataType(DataType.STEP)
                                    .controlFlow(true)
                                    .build())
                    .output(
                            Port.output("onFailure")
                                    .dataType(DataType.STEP)
                                    .controlFlow(true)
                                    .failure(true)
                                    .build())
                    .output(Port.output("start").dataType(DataType.STEP).scope("each").build())
                    .output(Port.output("item").dataType(DataType.NUMBER).scope("each").build())
                    .scope("each")
                    .build();
        }

        private WorkflowGraph.Builder loop() {
            return chain(DataType.NUMBER, DataType.NUMBER)
                    .nodeType(forEach())
                    .instance(NodeInstance.of("loop", "ForEach"))
                    .connection(edge("b.onSuccess", "loop.execute"));
        }

        @Test
        void shouldWarnAboutEmptyScope() {
            ValidationResult result =
                    validator.validate(loop().build(), ValidationOptions.DEFAULTS);

            assertThat(codes(result.warnings())).containsExactly(DiagnosticCode.SCOPE_EMPTY);
        }

        @Test
        void shouldRejectUnknownScopeQualifier() {
            Connection unknownScope =
                    new Connection(
                            new PortRef("loop", "start", "every"), PortRef.of("a", "execute"));
            WorkflowGraph graph = loop().connection(unknownScope).build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(codes(result.errors())).contains(DiagnosticCode.SCOPE_WRONG_SCOPE_NAME);
        }

        @Test
        void shouldRejectScopeOwnedByWrongName() {
            WorkflowGraph graph =
                    loop().scope(new Scope("loop", "items", List.of("b"))).build();

            ValidationResult result = validator.validate(graph, ValidationOptions.DEFAULTS);

            assertThat(result.errors())
                    .filteredOn(d -> d.code() == DiagnosticCode.SCOPE_WRONG_SCOPE_NAME)
                    .extracting(Diagnostic::message)
                    .containsExactly(
                            "Instance \"loop\" has no scope \"items\". Available scopes: each.");
        }
    }

    @Test
    void shouldRequirePortsOnPattern() {
        Pattern pattern =
                new Pattern(
                        "retry",
                        null,
                        Map.of(),
                        List.of(NodeInstance.of("a", "Missing")),
                        List.of(),
                        List.of(),
                        List.of());

        ValidationResult result = validator.validatePattern(pattern);

        assertThat(codes(result.errors()))
                .containsExactly(DiagnosticCode.PATTERN_NO_PORTS, DiagnosticCode.UNKNOWN_NODE_TYPE);
    }
}
