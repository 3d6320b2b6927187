package com.auditsift.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StructuredLogTest {

    private static final ObjectMapper OM = new ObjectMapper();

    @Test
    void line_is_single_json_object_with_event_and_pairs() throws Exception {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

        String line = slog.line("INFO", "run-done", null,
                "systems", 4, "partial", false, "file", Path.of("a.txt"), "names", List.of("x", "y"));

        assertThat(line).doesNotContain("\n");
        JsonNode n = OM.readTree(line);
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("event").asText()).isEqualTo("run-done");
        assertThat(n.get("systems").asInt()).isEqualTo(4);
        assertThat(n.get("partial").asBoolean()).isFalse();
        assertThat(n.get("ts").asText()).isNotBlank();
    }

    @Test
    void error_line_carries_exception_class_and_message() throws Exception {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

        String line = slog.line("ERROR", "task-failed", new IOException("disk \"gone\""), "index", 3);

        JsonNode n = OM.readTree(line);
        assertThat(n.get("error").asText()).isEqualTo("IOException");
        assertThat(n.get("message").asText()).isEqualTo("disk \"gone\"");
    }

    @Test
    void odd_trailing_key_is_flagged() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class).line("WARN", "e", null, "a", 1, "dangling");
        JsonNode n = OM.readTree(line);
        assertThat(n.get("a").asInt()).isEqualTo(1);
        assertThat(n.has("dangling")).isFalse();
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
    }
}
