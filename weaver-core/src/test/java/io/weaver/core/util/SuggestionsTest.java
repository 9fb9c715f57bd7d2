package io.weaver.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SuggestionsTest {

    private static final List<String> PORTS = List.of("execute", "amount", "currency");

    @Test
    void shouldSuggestClosestName() {
        assertThat(Suggestions.closest("amuont", PORTS)).contains("amount");
        assertThat(Suggestions.closest("Currency", PORTS)).contains("currency");
    }

    @Test
    void shouldNotSuggestDistantName() {
        assertThat(Suggestions.closest("total", PORTS)).isEmpty();
    }

    @Test
    void shouldFormatHintSuffix() {
        assertThat(Suggestions.hint("excute", PORTS)).isEqualTo(" Did you mean \"execute\"?");
        assertThat(Suggestions.hint("total", PORTS)).isEmpty();
    }

    @Test
    void shouldCountEdits() {
        assertThat(Suggestions.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(Suggestions.distance("", "abc")).isEqualTo(3);
    }
}
