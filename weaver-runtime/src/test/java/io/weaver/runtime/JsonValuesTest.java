package io.weaver.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {

    @Test
    void shouldRenderMapsListsAndScalars() {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("id", 7);
        order.put("tags", List.of("a", "b"));
        order.put("paid", true);

        assertThat(JsonValues.stringify(order))
                .isEqualTo("{\"id\":7,\"tags\":[\"a\",\"b\"],\"paid\":true}");
        assertThat(JsonValues.stringify("x")).isEqualTo("\"x\"");
        assertThat(JsonValues.stringify(null)).isEqualTo("null");
    }

    @Test
    void shouldParseTextIntoMapsAndLists() {
        Object parsed = JsonValues.parse("{\"id\":7,\"tags\":[\"a\"]}");

        assertThat(parsed).isInstanceOf(Map.class);
        assertThat((Map<String, Object>) parsed).containsEntry("id", 7).containsEntry("tags", List.of("a"));
    }

    @Test
    void shouldPassNonTextThrough() {
        List<Integer> list = List.of(1, 2);

        assertThat(JsonValues.parse(list)).isSameAs(list);
        assertThat(JsonValues.parse(null)).isNull();
    }

    @Test
    void shouldRejectMalformedText() {
        assertThatThrownBy(() -> JsonValues.parse("{oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid JSON: ");
    }
}
