package io.weaver.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weaver.core.exception.SourceParseException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceUnitParserTest {

    private static final String ORDERS =
            """
            package flows;

            import java.util.List;
            import static java.lang.Math.max;

            public class Orders {

                public record Totals(double net, double tax) {}

                /** Not part of any workflow. */
                public static int plain() {
                    return 0;
                }

                /**
                 * Sums order lines.
                 *
                 * @flowWeaver nodeType
                 */
                public static Totals sum(double amount, String... tags) {
                    return new Totals(amount, 0);
                }

                static class Remote {

                    /**
                     * @flowWeaver nodeType
                     */
                    public static java.util.concurrent.CompletableFuture<String> fetch(String url) {
                        return null;
                    }
                }
            }
            """;

    private SourceUnitParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceUnitParser();
    }

    @Test
    void shouldReadPackageImportsAndRecords() throws Exception {
        ParsedSource source = parser.parse("Orders.java", ORDERS);

        assertThat(source.packageName()).isEqualTo("flows");
        assertThat(source.className()).isEqualTo("Orders");
        assertThat(source.qualifiedClassName()).isEqualTo("flows.Orders");
        assertThat(source.imports()).containsExactly("java.util.List", "static java.lang.Math.max");
        assertThat(source.record("Totals"))
                .hasValueSatisfying(
                        shape ->
                                assertThat(shape.components())
                                        .extracting(MethodParameter::name)
                                        .containsExactly("net", "tax"));
    }

    @Test
    void shouldKeepOnlyMarkedMethodsInSourceOrder() throws Exception {
        ParsedSource source = parser.parse("Orders.java", ORDERS);

        assertThat(source.functions())
                .extracting(AnnotatedFunction::name)
                .containsExactly("sum", "fetch");
        assertThat(source.functionsOfKind("nodeType")).hasSize(2);
    }

    @Test
    void shouldReadSignatureDetails() throws Exception {
        ParsedSource source = parser.parse("Orders.java", ORDERS);
        AnnotatedFunction sum = source.functions().get(0);
        AnnotatedFunction fetch = source.functions().get(1);

        assertThat(sum.parameters())
                .containsExactly(
                        new MethodParameter("amount", "double"),
                        new MethodParameter("tags", "String..."));
        assertThat(sum.returnType()).isEqualTo("Totals");
        assertThat(sum.annotations().summary()).isEqualTo("Sums order lines.");
        assertThat(sum.hasBody()).isTrue();
        assertThat(fetch.declaringClass()).isEqualTo("Orders.Remote");
        assertThat(fetch.isAsync()).isTrue();
    }

    @Test
    void shouldFallBackToFirstTypeWhenFileNameDiffers() throws Exception {
        ParsedSource source = parser.parse("Renamed.java", ORDERS);

        assertThat(source.className()).isEqualTo("Orders");
    }

    @Test
    void shouldRejectInvalidJava() {
        assertThatThrownBy(() -> parser.parse("Broken.java", "public class Broken {"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageStartingWith("Broken.java: Not valid Java");
    }

    @Test
    void shouldReportUnreadableFile(@TempDir Path dir) {
        assertThatThrownBy(() -> parser.parse(dir.resolve("Missing.java")))
                .isInstanceOf(SourceParseException.class)
                .hasMessageStartingWith("Missing.java: Cannot read file")
                .extracting(e -> ((SourceParseException) e).getFileName())
                .isEqualTo("Missing.java");
    }
}
