package io.weaver.core.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.weaver.core.model.InstanceConfig;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.Placement;
import io.weaver.core.model.Position;
import io.weaver.core.model.PortRef;
import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AnnotationParserTest {

    private final AnnotationParser parser = new AnnotationParser();

    @Nested
    class Ports {

        @Test
        void shouldParseFullPortLine() {
            TagDeclaration.PortTag tag =
                    (TagDeclaration.PortTag)
                            parser.parseLine(
                                    "@input [limit=10] scope:item [order:1, type:NUMBER]"
                                            + " - Maximum number of results");

            PortDeclaration port = tag.port();
            assertThat(tag.tag()).isEqualTo("input");
            assertThat(port.name()).isEqualTo("limit");
            assertThat(port.optional()).isTrue();
            assertThat(port.defaultText()).isEqualTo("10");
            assertThat(port.scope()).isEqualTo("item");
            assertThat(port.order()).isEqualTo(1);
            assertThat(port.type()).isEqualTo("NUMBER");
            assertThat(port.description()).isEqualTo("Maximum number of results");
        }

        @ParameterizedTest
        @ValueSource(strings = {"event", "cron", "match", "timeout", "limit", "period"})
        void shouldAcceptDirectiveKeyWordAsDefaultedPortName(String name) {
            AnnotationBlock block =
                    parser.parse(
                            List.of(
                                    "@flowWeaver nodeType",
                                    "@input [" + name + "=5] - ms to wait",
                                    "@input event - incoming"),
                            1);

            assertThat(block.warnings()).isEmpty();
            assertThat(block.all(TagDeclaration.PortTag.class))
                    .extracting(tag -> tag.port().name(), tag -> tag.port().defaultText())
                    .containsExactly(tuple(name, "5"), tuple("event", null));
        }

        @Test
        void shouldKeepStructuredDefaultText() {
            TagDeclaration.PortTag tag =
                    (TagDeclaration.PortTag) parser.parseLine("@input [tags=[\"a\", \"b\"]]");

            assertThat(tag.port().defaultText()).isEqualTo("[\"a\", \"b\"]");
        }

        @Test
        void shouldReadExpressionDescriptionAsConstant() {
            TagDeclaration.PortTag tag =
                    (TagDeclaration.PortTag) parser.parseLine("@input rate - Expression: 0.5 * 2");

            assertThat(tag.port().expression()).isEqualTo("0.5 * 2");
            assertThat(tag.port().description()).isNull();
        }

        @Test
        void shouldParsePlacementAndMergeStrategy() {
            TagDeclaration.PortTag tag =
                    (TagDeclaration.PortTag)
                            parser.parseLine(
                                    "@output total [placement:BOTTOM, mergeStrategy:COLLECT]");

            assertThat(tag.port().placement()).isEqualTo(Placement.BOTTOM);
            assertThat(tag.port().mergeStrategy()).isEqualTo("COLLECT");
        }

        @Test
        void shouldAcceptJavadocProseAfterParam() {
            AnnotationBlock block =
                    parser.parse(List.of("@param amount the amount to charge, in cents"), 1);

            TagDeclaration.PortTag tag = block.all(TagDeclaration.PortTag.class).get(0);
            assertThat(tag.port().name()).isEqualTo("amount");
            assertThat(tag.port().description()).isEqualTo("the amount to charge, in cents");
            assertThat(block.warnings()).isEmpty();
        }
    }

    @Nested
    class Nodes {

        @Test
        void shouldParseNodeWithParentAndAttributes() {
            TagDeclaration.NodeTag tag =
                    (TagDeclaration.NodeTag)
                            parser.parseLine(
                                    "@node fetch HttpGet loop.item [label: \"Fetch page\","
                                            + " expr: retries=\"3\", minimized,"
                                            + " position: 10 -20]");

            InstanceConfig config = tag.config();
            assertThat(tag.id()).isEqualTo("fetch");
            assertThat(tag.type()).isEqualTo("HttpGet");
            assertThat(tag.parent()).isEqualTo(new InstanceParent("loop", "item"));
            assertThat(config.getLabel()).isEqualTo("Fetch page");
            assertThat(config.getPortExpressions()).containsEntry("retries", "3");
            assertThat(config.isMinimized()).isTrue();
            assertThat(config.getPosition()).isEqualTo(new Position(10, -20));
        }

        @Test
        void shouldAcceptDirectiveKeyWordsInPortAssignments() {
            TagDeclaration.NodeTag tag =
                    (TagDeclaration.NodeTag)
                            parser.parseLine(
                                    "@node wait Sleep [expr: timeout=\"5\", limit=\"2\","
                                            + " portOrder: period=1]");

            assertThat(tag.config().getPortExpressions())
                    .containsEntry("timeout", "5")
                    .containsEntry("limit", "2");
            assertThat(tag.config().getPortOrder()).containsEntry("period", 1);
        }

        @Test
        void shouldParsePullExecutionAndTags() {
            TagDeclaration.NodeTag tag =
                    (TagDeclaration.NodeTag)
                            parser.parseLine(
                                    "@node lazy Compute [pullExecution: execute,"
                                            + " tags: \"beta\" \"not stable yet\", size: 200 80]");

            assertThat(tag.config().getPullExecution()).isEqualTo("execute");
            assertThat(tag.config().getTags())
                    .containsExactly(new InstanceConfig.Tag("beta", "not stable yet"));
            assertThat(tag.config().getWidth()).isEqualTo(200);
            assertThat(tag.config().getHeight()).isEqualTo(80);
        }
    }

    @Nested
    class Connections {

        @Test
        void shouldParseScopedConnection() {
            TagDeclaration.ConnectTag tag =
                    (TagDeclaration.ConnectTag)
                            parser.parseLine("@connect loop.start:item -> body.execute");

            assertThat(tag.from()).isEqualTo(new PortRef("loop", "start", "item"));
            assertThat(tag.to()).isEqualTo(PortRef.of("body", "execute"));
        }

        @Test
        void shouldParsePathWithRoutes() {
            TagDeclaration.PathTag tag =
                    (TagDeclaration.PathTag)
                            parser.parseLine("@path Start -> validate:ok -> charge:fail -> Exit");

            assertThat(tag.steps())
                    .containsExactly(
                            new TagDeclaration.PathStep("Start", null),
                            new TagDeclaration.PathStep("validate", "ok"),
                            new TagDeclaration.PathStep("charge", "fail"),
                            new TagDeclaration.PathStep("Exit", null));
        }

        @Test
        void shouldParseFanOutTargetsWithAndWithoutPorts() {
            TagDeclaration.FanOutTag tag =
                    (TagDeclaration.FanOutTag) parser.parseLine("@fanOut a.value -> b, c.input");

            assertThat(tag.source()).isEqualTo(new TagDeclaration.Endpoint("a", "value", null));
            assertThat(tag.targets())
                    .containsExactly(
                            new TagDeclaration.Endpoint("b", null, null),
                            new TagDeclaration.Endpoint("c", "input", null));
        }

        @Test
        void shouldRejectUnknownRoute() {
            assertThatThrownBy(() -> parser.parseLine("@path Start -> a:maybe -> Exit"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maybe");
        }
    }

    @Nested
    class Macros {

        @Test
        void shouldParseMapWithInferredPorts() {
            TagDeclaration.MapTag tag =
                    (TagDeclaration.MapTag) parser.parseLine("@map loop double over Start.items");

            assertThat(tag)
                    .isEqualTo(
                            new TagDeclaration.MapTag(
                                    "loop", "double", null, null, PortRef.of("Start", "items")));
        }

        @Test
        void shouldParseMapWithExplicitPorts() {
            TagDeclaration.MapTag tag =
                    (TagDeclaration.MapTag)
                            parser.parseLine("@map pages fetch(url -> body) over list.urls");

            assertThat(tag.inputPort()).isEqualTo("url");
            assertThat(tag.outputPort()).isEqualTo("body");
            assertThat(tag.source()).isEqualTo(PortRef.of("list", "urls"));
        }

        @Test
        void shouldParseCoerceWithRawTargetType() {
            TagDeclaration.CoerceTag tag =
                    (TagDeclaration.CoerceTag)
                            parser.parseLine("@coerce asText calc.total -> notify.message as text");

            assertThat(tag)
                    .isEqualTo(
                            new TagDeclaration.CoerceTag(
                                    "asText",
                                    PortRef.of("calc", "total"),
                                    PortRef.of("notify", "message"),
                                    "text"));
        }
    }

    @Nested
    class Directives {

        @Test
        void shouldParseTriggerWithCron() {
            TagDeclaration.TriggerTag tag =
                    (TagDeclaration.TriggerTag)
                            parser.parseLine("@trigger event=\"order.created\" cron=\"0 9 * * 1\"");

            assertThat(tag.event()).isEqualTo("order.created");
            assertThat(tag.cron()).isEqualTo("0 9 * * 1");
        }

        @Test
        void shouldParseCancelOnAndThrottleDurations() {
            TagDeclaration.CancelOnTag cancel =
                    (TagDeclaration.CancelOnTag)
                            parser.parseLine(
                                    "@cancelOn event=\"order.cancelled\" match=\"orderId\""
                                            + " timeout=\"1h\"");
            TagDeclaration.ThrottleTag throttle =
                    (TagDeclaration.ThrottleTag)
                            parser.parseLine("@throttle limit=5 period=\"1m\"");

            assertThat(cancel.timeout()).isEqualTo(Duration.ofHours(1));
            assertThat(cancel.match()).isEqualTo("orderId");
            assertThat(throttle.limit()).isEqualTo(5);
            assertThat(throttle.period()).isEqualTo(Duration.ofMinutes(1));
        }

        @Test
        void shouldParseImport() {
            TagDeclaration.ImportTag tag =
                    (TagDeclaration.ImportTag)
                            parser.parseLine("@fwImport Mailer send from \"com.acme.mail.Mail\"");

            assertThat(tag)
                    .isEqualTo(
                            new TagDeclaration.ImportTag("Mailer", "send", "com.acme.mail.Mail"));
        }

        @Test
        void shouldReadTextTagsRaw() {
            TagDeclaration.LabelTag tag =
                    (TagDeclaration.LabelTag) parser.parseLine("@label Charge card (retry: 3x)");

            assertThat(tag.label()).isEqualTo("Charge card (retry: 3x)");
        }

        @Test
        void shouldIgnoreStandardJavadocTags() {
            assertThat(parser.parseLine("@see Something")).isNull();
        }
    }

    @Nested
    class Warnings {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "@retries -1",
                    "@trigger cron=\"every day\"",
                    "@connect a -> b.execute",
                    "@node onlyId",
                    "@input [unclosed",
                    "@map loop double Start.items",
                    "@coerce c a.x -> b.y"
                })
        void shouldWarnAndContinueOnMalformedLine(String line) {
            AnnotationBlock block = parser.parse(List.of(line, "@retries 2"), 10);

            assertThat(block.warnings()).hasSize(1);
            Diagnostic warning = block.warnings().get(0);
            assertThat(warning.code()).isEqualTo(DiagnosticCode.PARSE_WARNING);
            assertThat(warning.line()).isEqualTo(10);
            assertThat(warning.message()).startsWith("Failed to parse ");
            assertThat(warning.message()).contains("Expected format: ");
            assertThat(block.all(TagDeclaration.RetriesTag.class))
                    .containsExactly(new TagDeclaration.RetriesTag(2));
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "@timeout \"9999999999999999d\"",
                    "@cancelOn event=\"order.void\" timeout=\"9999999999999999d\"",
                    "@throttle limit=1 period=\"99999999999999999999d\""
                })
        void shouldWarnAndContinueOnOutOfRangeDuration(String line) {
            AnnotationBlock block =
                    parser.parse(List.of("@flowWeaver workflow", line, "@node a add"), 1);

            assertThat(block.warnings())
                    .singleElement()
                    .satisfies(
                            warning -> {
                                assertThat(warning.line()).isEqualTo(2);
                                assertThat(warning.message()).contains("Duration out of range");
                            });
            assertThat(block.kind()).contains("workflow");
            assertThat(block.all(TagDeclaration.NodeTag.class))
                    .extracting(TagDeclaration.NodeTag::id)
                    .containsExactly("a");
        }

        @Test
        void shouldTruncateQuotedLine() {
            String line = "@connect " + "a".repeat(80);

            AnnotationBlock block = parser.parse(List.of(line), 1);

            assertThat(block.warnings().get(0).message())
                    .contains("\"" + line.substring(0, 60) + "...\"");
        }
    }

    @Test
    void shouldCollectProseBeforeFirstTagAsSummary() {
        AnnotationBlock block =
                parser.parse(
                        List.of(
                                "Adds two numbers.",
                                "Both are required.",
                                "",
                                "@flowWeaver nodeType"),
                        1);

        assertThat(block.summary()).isEqualTo("Adds two numbers. Both are required.");
        assertThat(block.kind()).contains("nodeType");
    }
}
