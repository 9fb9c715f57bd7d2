package io.weaver.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.weaver.core.builder.ExternalTypeResolver;
import io.weaver.core.builder.SourceUnit;
import io.weaver.core.builder.SourceUnitBuilder;
import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.Port;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.parser.SourceUnitParser;
import io.weaver.core.validation.GraphValidator;
import io.weaver.core.validation.ValidationOptions;
import io.weaver.core.validation.ValidationResult;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GraphSerializerTest {

    private static final String SHIPPING =
            """
            package flows;

            public class Shipping {

                public record Label(String code) {}

                /**
                 * Prints a shipping label.
                 *
                 * @flowWeaver nodeType
                 * @input [copies=1] - Number of copies
                 */
                public static String print(String address, int copies) {
                    return address;
                }

                /**
                 * Ships an order.
                 *
                 * @flowWeaver workflow
                 * @node p print [label: "Print label"]
                 * @path Start -> p -> Exit
                 * @connect p.result -> Exit.code
                 * @trigger event="order.paid"
                 * @retries 2
                 * @timeout "30m"
                 * @throttle limit=5 period="1m"
                 * @position Start 0 0
                 */
                public static Label ship(boolean execute, String address) {
                    return null;
                }
            }
            """;

    private final ObjectMapper mapper = GraphSerializer.createMapper();

    private WorkflowGraph shipping;

    @BeforeEach
    void setUp() throws Exception {
        SourceUnit unit =
                new SourceUnitBuilder(ExternalTypeResolver.NONE, false)
                        .build(new SourceUnitParser().parse("Shipping.java", SHIPPING));
        shipping = unit.findWorkflow("ship").orElseThrow();
    }

    @Nested
    class RoundTrip {

        @Test
        void shouldRestoreBuiltGraph() {
            WorkflowGraph restored = GraphSerializer.fromJson(GraphSerializer.toJson(shipping));

            assertThat(restored).isEqualTo(shipping);
            assertThat(restored.getOptions().timeout()).isEqualTo(Duration.ofMinutes(30));
            assertThat(restored.getInstances().get(0).config().getLabel())
                    .isEqualTo("Print label");
        }

        @Test
        void shouldDistinguishNullDefaultFromNoDefault() {
            WorkflowGraph graph =
                    WorkflowGraph.builder()
                            .name("flow")
                            .functionName("flow")
                            .startPort(Port.output("execute").dataType(DataType.STEP).build())
                            .startPort(Port.output("note").defaultValue(null).build())
                            .startPort(
                                    Port.output("tags")
                                            .dataType(DataType.ARRAY)
                                            .defaultValue(List.of("a", "b"))
                                            .build())
                            .startPort(Port.output("plain").build())
                            .build();

            WorkflowGraph restored = GraphSerializer.fromJson(GraphSerializer.toJson(graph));

            assertThat(restored).isEqualTo(graph);
            assertThat(restored.getStartPorts())
                    .extracting(Port::getName, Port::hasDefault, Port::getDefaultValue)
                    .containsExactly(
                            tuple("execute", false, null),
                            tuple("note", true, null),
                            tuple("tags", true, List.of("a", "b")),
                            tuple("plain", false, null));
        }

        @Test
        void shouldRestoreEveryImplementationKind() {
            WorkflowGraph graph =
                    WorkflowGraph.builder()
                            .name("flow")
                            .functionName("flow")
                            .nodeType(type("local", new ImplementationRef.Local("Flows", "local")))
                            .nodeType(type("nested", new ImplementationRef.SameFile("other")))
                            .nodeType(
                                    type(
                                            "mail",
                                            new ImplementationRef.External(
                                                    "com.acme.Mail", "send")))
                            .instance(NodeInstance.of("a", "local"))
                            .connection(Connection.of("Start", "execute", "a", "execute"))
                            .build();

            WorkflowGraph restored = GraphSerializer.fromJson(GraphSerializer.toJson(graph));

            assertThat(restored.getNodeTypes().values())
                    .extracting(NodeType::getImplementation)
                    .containsExactly(
                            new ImplementationRef.Local("Flows", "local"),
                            new ImplementationRef.SameFile("other"),
                            new ImplementationRef.External("com.acme.Mail", "send"));
        }

        private NodeType type(String name, ImplementationRef implementation) {
            return NodeType.builder(name).functionName(name).implementation(implementation).build();
        }
    }

    @Nested
    class Format {

        @Test
        void shouldTagImplementationWithKind() throws Exception {
            JsonNode json = mapper.readTree(GraphSerializer.toJson(shipping));
            JsonNode implementation = json.at("/nodeTypes/print/implementation");

            assertThat(implementation.get("kind").asText()).isEqualTo("LOCAL");
            assertThat(implementation.get("className").asText()).isEqualTo("Shipping");
            assertThat(implementation.get("methodName").asText()).isEqualTo("print");
        }

        @Test
        void shouldWriteDurationsAsIsoStrings() throws Exception {
            JsonNode options = mapper.readTree(GraphSerializer.toJson(shipping)).get("options");

            assertThat(options.get("timeout").asText()).isEqualTo("PT30M");
            assertThat(options.at("/throttle/period").asText()).isEqualTo("PT1M");
            assertThat(options.get("retries").asInt()).isEqualTo(2);
        }

        @Test
        void shouldOmitDerivedScopedFlag() throws Exception {
            JsonNode json = mapper.readTree(GraphSerializer.toJson(shipping));

            assertThat(json.at("/instances/0").has("scoped")).isFalse();
            assertThat(json.at("/connections/0/from").has("scoped")).isFalse();
        }
    }

    @Nested
    class Diagnostics {

        @Test
        void shouldReportValidGraph() throws Exception {
            ValidationResult result =
                    new GraphValidator().validate(shipping, new ValidationOptions(false, false));

            JsonNode json = mapper.readTree(GraphSerializer.diagnosticsToJson(result));

            assertThat(json.get("valid").asBoolean()).isTrue();
            assertThat(json.get("errors")).isEmpty();
        }

        @Test
        void shouldListErrorsWithCodes() throws Exception {
            WorkflowGraph missing =
                    shipping.toBuilder()
                            .instance(NodeInstance.of("ghost", "Missing"))
                            .connection(Connection.of("Start", "execute", "ghost", "execute"))
                            .build();
            ValidationResult result =
                    new GraphValidator().validate(missing, new ValidationOptions(false, false));

            JsonNode json = mapper.readTree(GraphSerializer.diagnosticsToJson(result));

            assertThat(json.get("valid").asBoolean()).isFalse();
            assertThat(json.get("errors"))
                    .anySatisfy(
                            error -> {
                                assertThat(error.get("code").asText())
                                        .isEqualTo("UNKNOWN_NODE_TYPE");
                                assertThat(error.get("nodeId").asText()).isEqualTo("ghost");
                            });
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> GraphSerializer.fromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow graph");
        }

        @Test
        void shouldRejectUnknownImplementationKind() {
            String json =
                    """
                    {
                      "name": "flow",
                      "functionName": "flow",
                      "nodeTypes": {
                        "a": {
                          "name": "a",
                          "functionName": "a",
                          "implementation": { "kind": "REMOTE" }
                        }
                      }
                    }
                    """;

            assertThatThrownBy(() -> GraphSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown implementation kind: REMOTE");
        }
    }
}
