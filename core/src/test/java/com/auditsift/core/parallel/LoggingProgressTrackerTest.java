package com.auditsift.core.parallel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LoggingProgressTrackerTest {

    @Test
    void tracks_and_clamps_progress() {
        List<Double> seen = new ArrayList<>();
        LoggingProgressTracker t = new LoggingProgressTracker((p, phase, done, total) -> seen.add(p));

        int id = t.track(4, "Searching");
        t.update(id, 1);
        t.update(id, 0);
        t.update(id, 10);
        assertThat(t.completed(id)).isEqualTo(4);

        t.complete(id);
        assertThat(t.completed(id)).isEqualTo(-1);
        assertThat(seen).first().isEqualTo(0.0);
        assertThat(seen).last().isEqualTo(1.0);
    }

    @Test
    void ids_are_distinct_and_unknown_ids_are_ignored() {
        LoggingProgressTracker t = new LoggingProgressTracker();
        int a = t.track(1, "a");
        int b = t.track(1, "b");
        assertThat(a).isNotEqualTo(b);

        t.update(999, 1);
        t.complete(999);
        assertThat(t.completed(999)).isEqualTo(-1);
    }

    @Test
    void invalid_arguments_are_rejected() {
        LoggingProgressTracker t = new LoggingProgressTracker();
        assertThatThrownBy(() -> t.track(0, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> t.track(1, " ")).isInstanceOf(IllegalArgumentException.class);
        int id = t.track(2, "x");
        assertThatThrownBy(() -> t.update(id, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
