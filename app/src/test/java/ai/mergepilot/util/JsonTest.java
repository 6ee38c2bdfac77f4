package ai.mergepilot.util;

import static org.junit.jupiter.api.Assertions.*;

import ai.mergepilot.rebase.LogEntry;
import ai.mergepilot.rebase.RunStage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonTest {

    @Test
    void testLogEntryIsSingleLineWithLabelsAndIsoTimestamp() throws Exception {
        var entry = new LogEntry(
                Instant.parse("2024-05-01T10:15:30Z"),
                RunStage.RESOLVING_CONFLICTS,
                "Analyzing conflict in file: a.txt",
                50,
                List.of("a.txt"),
                List.of());

        var json = Json.toJson(entry);

        assertFalse(json.contains("\n"));
        var node = Json.readTree(json);
        assertEquals("2024-05-01T10:15:30Z", node.get("timestamp").asText());
        assertEquals("resolving_conflicts", node.get("stage").asText());
        assertEquals(50, node.get("progressPercent").asInt());
        assertEquals("a.txt", node.get("files").get(0).asText());
    }

    @Test
    void testPathRoundTrip() throws Exception {
        var json = Json.toJson(Path.of("src", "..", "src", "Main.java"));
        assertEquals(Path.of("src", "Main.java"), Json.getMapper().readValue(json, Path.class));
    }
}
