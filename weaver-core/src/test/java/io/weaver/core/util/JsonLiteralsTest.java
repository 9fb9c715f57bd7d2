package io.weaver.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonLiteralsTest {

    @Nested
    class Parse {

        @Test
        void shouldReadScalars() {
            assertThat(JsonLiterals.parse("42")).isEqualTo(42);
            assertThat(JsonLiterals.parse("10000000000")).isEqualTo(10_000_000_000L);
            assertThat(JsonLiterals.parse("-1.5")).isEqualTo(-1.5);
            assertThat(JsonLiterals.parse("true")).isEqualTo(Boolean.TRUE);
            assertThat(JsonLiterals.parse("null")).isNull();
            assertThat(JsonLiterals.parse("\"a\\nb\\u0041\"")).isEqualTo("a\nbA");
        }

        @Test
        void shouldReadNestedStructuresInOrder() {
            Object value = JsonLiterals.parse("{\"b\": [1, 2], \"a\": {}}");

            assertThat(value).isInstanceOf(Map.class);
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) value;
            assertThat(new ArrayList<>(map.keySet())).containsExactly("b", "a");
            assertThat(map.get("b")).isEqualTo(List.of(1, 2));
        }

        @Test
        void shouldRejectTrailingContent() {
            assertThatThrownBy(() -> JsonLiterals.parse("1 2"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unexpected trailing content");
        }
    }

    @Test
    void shouldFallBackToRawText() {
        assertThat(JsonLiterals.parseOrRaw("hello")).isEqualTo("hello");
        assertThat(JsonLiterals.parseOrRaw("\"hello\"")).isEqualTo("hello");
        assertThat(JsonLiterals.parseOrRaw("nope")).isEqualTo("nope");
        assertThat(JsonLiterals.parseOrRaw("[1,")).isEqualTo("[1,");
    }
}
