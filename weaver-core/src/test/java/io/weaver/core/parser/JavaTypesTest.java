package io.weaver.core.parser;

import static org.assertj.core.api.Assertions.assertThat;

import io.weaver.core.model.DataType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JavaTypesTest {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "double | NUMBER",
                "java.math.BigDecimal | NUMBER",
                "String | STRING",
                "Boolean | BOOLEAN",
                "List<String> | ARRAY",
                "int[] | ARRAY",
                "String... | ARRAY",
                "ScopeFunction | FUNCTION",
                "Object | ANY",
                "T | ANY",
                "CompletableFuture<Integer> | NUMBER",
                "Map<String, Object> | OBJECT"
            })
    void shouldInferDataType(String type, DataType expected) {
        assertThat(JavaTypes.infer(type)).isEqualTo(expected);
    }

    @Test
    void shouldUnwrapAsyncTypes() {
        assertThat(JavaTypes.isAsync("CompletionStage<String>")).isTrue();
        assertThat(JavaTypes.unwrapAsync("CompletableFuture<Map<String, Object>>"))
                .isEqualTo("Map<String, Object>");
        assertThat(JavaTypes.unwrapAsync("CompletableFuture")).isEqualTo("Object");
    }

    @Test
    void shouldStripGenericsAndPackages() {
        assertThat(JavaTypes.rawType("Map<String, Object>")).isEqualTo("Map");
        assertThat(JavaTypes.simpleName("io.weaver.runtime.WorkflowContext"))
                .isEqualTo("WorkflowContext");
        assertThat(JavaTypes.isWorkflowContext("io.weaver.runtime.WorkflowContext")).isTrue();
        assertThat(JavaTypes.isVoid("Void")).isTrue();
        assertThat(JavaTypes.isPrimitive("int")).isTrue();
        assertThat(JavaTypes.isPrimitive("Integer")).isFalse();
    }
}
