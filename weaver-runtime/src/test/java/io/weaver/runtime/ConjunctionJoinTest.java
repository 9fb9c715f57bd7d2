package io.weaver.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConjunctionJoinTest {

    @Test
    void shouldFireOnceWhenEveryPortReported() {
        ConjunctionJoin join = new ConjunctionJoin("merge", List.of("left", "right"));

        join.report("left", "a.onSuccess", true);
        assertThat(join.tryFire()).isFalse();

        join.report("right", "b.onSuccess", true);
        assertThat(join.tryFire()).isTrue();
        assertThat(join.tryFire()).isFalse();
    }

    @Test
    void shouldSatisfyPortWithAnyOfItsSources() {
        ConjunctionJoin join = new ConjunctionJoin("merge", List.of("execute"));

        join.report("execute", "a.onSuccess", false);
        join.report("execute", "b.onSuccess", true);

        assertThat(join.isReady()).isTrue();
        assertThat(join.lastValue("a.onSuccess")).isEqualTo(false);
    }

    @Test
    void shouldNotCountFalseSignals() {
        ConjunctionJoin join = new ConjunctionJoin("merge", List.of("x", "y"));

        join.report("x", "Start.x", true);
        join.report("y", "Start.y", null);

        assertThat(join.tryFire()).isFalse();
    }

    @Test
    void shouldRejectUnknownPort() {
        ConjunctionJoin join = new ConjunctionJoin("merge", List.of("x"));

        assertThatThrownBy(() -> join.report("z", "a.onSuccess", true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'z'");
    }

    @Test
    void shouldRequireAtLeastOnePort() {
        assertThatThrownBy(() -> new ConjunctionJoin("merge", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
