package io.weaver.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CoercionsTest {

    @Nested
    class Truthiness {

        @Test
        void shouldTreatNullFalseZeroAndEmptyAsFalse() {
            assertThat(Coercions.isTruthy(null)).isFalse();
            assertThat(Coercions.isTruthy(false)).isFalse();
            assertThat(Coercions.isTruthy(0)).isFalse();
            assertThat(Coercions.isTruthy(0.0)).isFalse();
            assertThat(Coercions.isTruthy(Double.NaN)).isFalse();
            assertThat(Coercions.isTruthy("")).isFalse();
        }

        @Test
        void shouldTreatOtherValuesAsTrue() {
            assertThat(Coercions.isTruthy(true)).isTrue();
            assertThat(Coercions.isTruthy(-1)).isTrue();
            assertThat(Coercions.isTruthy("false")).isTrue();
            assertThat(Coercions.isTruthy(List.of())).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"true", " TRUE ", "True"})
        void shouldParseBooleanText(String text) {
            assertThat(Coercions.toBoolean(text)).isTrue();
        }
    }

    @Nested
    class Numbers {

        @Test
        void shouldParseNumericStrings() {
            assertThat(Coercions.toDouble(" 2.5 ")).isEqualTo(2.5);
            assertThat(Coercions.toInt("7")).isEqualTo(7);
        }

        @Test
        void shouldTruncateWhenNarrowing() {
            assertThat(Coercions.toInt(3.9)).isEqualTo(3);
            assertThat(Coercions.toLong(5_000_000_000.0)).isEqualTo(5_000_000_000L);
        }

        @Test
        void shouldMapNullToZero() {
            assertThat(Coercions.toDouble(null)).isZero();
            assertThat(Coercions.toInt(null)).isZero();
            assertThat(Coercions.toChar(null)).isEqualTo('\0');
        }

        @Test
        void shouldRejectNonNumericText() {
            assertThatThrownBy(() -> Coercions.toDouble("abc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'abc'");
        }
    }

    @Nested
    class Boxed {

        @Test
        void shouldKeepNull() {
            assertThat(Coercions.toBoxed(null, Integer.class)).isNull();
        }

        @Test
        void shouldConvertBetweenWrappers() {
            assertThat(Coercions.toBoxed(2.0, Integer.class)).isEqualTo(2);
            assertThat(Coercions.toBoxed("1.5", Double.class)).isEqualTo(1.5);
            assertThat(Coercions.toBoxed(1, Boolean.class)).isTrue();
            assertThat(Coercions.toBoxed(2.0, String.class)).isEqualTo("2");
        }

        @Test
        void shouldRejectUnsupportedTarget() {
            assertThatThrownBy(() -> Coercions.toBoxed(1, List.class))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldRenderWholeDoublesWithoutFraction() {
        assertThat(Coercions.toStringValue(2.0)).isEqualTo("2");
        assertThat(Coercions.toStringValue(2.5)).isEqualTo("2.5");
        assertThat(Coercions.toStringValue(null)).isNull();
    }

    @Test
    void shouldPickFirstNonNullOrDefault() {
        assertThat(Coercions.firstNonNull(null, "a", "b")).isEqualTo("a");
        assertThat(Coercions.firstNonNull((Object) null)).isNull();
        assertThat(Coercions.orDefault(null, 3)).isEqualTo(3);
        assertThat(Coercions.orDefault(1, 3)).isEqualTo(1);
    }
}
