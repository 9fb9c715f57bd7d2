package io.weaver.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.weaver.core.builder.ExternalTypeResolver;
import io.weaver.core.builder.SourceUnit;
import io.weaver.core.builder.SourceUnitBuilder;
import io.weaver.core.exception.ValidationFailedException;
import io.weaver.core.generator.CodeGenerator;
import io.weaver.core.parser.SourceUnitParser;
import io.weaver.core.plan.ExecutionPlanner;
import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import io.weaver.core.validation.GraphValidator;
import io.weaver.core.validation.Severity;
import io.weaver.core.validation.ValidationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WeaverTest {

    private static final String COERCING =
            """
            package flows;

            public class Labels {

                /**
                 * @flowWeaver nodeType
                 */
                public static String describe(double amount) {
                    return "amount " + amount;
                }

                /**
                 * @flowWeaver nodeType
                 */
                public static double parse(double value) {
                    return value;
                }

                /**
                 * @flowWeaver workflow
                 * @node d describe
                 * @node p parse
                 * @path Start -> d -> p -> Exit
                 * @connect d.result -> p.value
                 */
                public static void label(boolean execute, double amount) {}
            }
            """;

    @Nested
    class Compile {

        @Test
        void shouldGenerateCompanionSource() throws Exception {
            CompilationResult result = WeaverFactory.create().compile("Adder.java", Fixtures.ADDER);

            assertThat(result.generatedSource())
                    .startsWith("// Generated by Weaver from Adder.java. Do not edit.")
                    .contains("public final class AdderWorkflows");
            assertThat(result.diagnostics()).noneMatch(Diagnostic::isError);
            assertThat(result.diagnostics())
                    .extracting(Diagnostic::code)
                    .contains(DiagnosticCode.UNUSED_NODE, DiagnosticCode.UNUSED_OUTPUT_PORT);
        }

        @Test
        void shouldCompileFileFromDisk(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("Adder.java"), Fixtures.ADDER);

            CompilationResult result = WeaverFactory.create().compile(file);

            assertThat(result.generatedSource()).contains("package flows;");
        }

        @Test
        void shouldAbortOnValidationErrors() {
            Weaver weaver = WeaverFactory.create();

            assertThatThrownBy(() -> weaver.compile("Broken.java", Fixtures.BROKEN))
                    .isInstanceOf(ValidationFailedException.class)
                    .hasMessageStartingWith("Workflow 'calculate' has ")
                    .hasMessageContaining("MISSING_REQUIRED_INPUT");
        }

        @Test
        void shouldWarnOnLossyCoercionByDefault() throws Exception {
            CompilationResult result = WeaverFactory.create().compile("Labels.java", COERCING);

            assertThat(result.diagnostics())
                    .anySatisfy(
                            d -> {
                                assertThat(d.code())
                                        .isEqualTo(DiagnosticCode.LOSSY_TYPE_COERCION);
                                assertThat(d.severity()).isEqualTo(Severity.WARNING);
                            });
        }

        @Test
        void shouldRejectLossyCoercionWithStrictTypes() {
            Weaver weaver = WeaverFactory.create(WeaverConfig.builder().strictTypes(true).build());

            ValidationFailedException failure =
                    catchThrowableOfType(
                            () -> weaver.compile("Labels.java", COERCING),
                            ValidationFailedException.class);

            assertThat(failure.getResult().hasCode(DiagnosticCode.LOSSY_TYPE_COERCION)).isTrue();
        }
    }

    @Nested
    class Collaborators {

        @Test
        void shouldValidateWithConfiguredOptions() throws Exception {
            GraphValidator validator = mock(GraphValidator.class);
            when(validator.validate(any(), any()))
                    .thenReturn(new ValidationResult(List.of(), List.of()));
            WeaverConfig config = WeaverConfig.builder().draftMode(true).build();
            Weaver weaver = wire(config, validator, mock(CodeGenerator.class));
            SourceUnit unit = weaver.parse("Adder.java", Fixtures.ADDER);

            weaver.validate(unit.workflows().get(0));

            verify(validator).validate(unit.workflows().get(0), config.validationOptions());
        }

        @Test
        void shouldNotGenerateWhenValidationFails() throws Exception {
            GraphValidator validator = new GraphValidator();
            CodeGenerator generator = mock(CodeGenerator.class);
            Weaver weaver = wire(new WeaverConfig(), validator, generator);

            assertThatThrownBy(() -> weaver.compile("Broken.java", Fixtures.BROKEN))
                    .isInstanceOf(ValidationFailedException.class);
            verify(generator, never()).generate(any(), any(), any());
        }

        private Weaver wire(
                WeaverConfig config, GraphValidator validator, CodeGenerator generator) {
            return new Weaver(
                    config,
                    new SourceUnitParser(),
                    new SourceUnitBuilder(ExternalTypeResolver.NONE, false),
                    validator,
                    new ExecutionPlanner(),
                    generator);
        }
    }

    @Test
    void shouldDeriveOptionsFromConfig() {
        WeaverConfig config =
                WeaverConfig.builder().strictTypes(true).draftMode(true).production(true).build();

        assertThat(config.validationOptions().strict()).isTrue();
        assertThat(config.validationOptions().draft()).isTrue();
        assertThat(config.generateOptions().production()).isTrue();
        assertThat(new WeaverConfig().getSourceRoots()).isEmpty();
    }
}
