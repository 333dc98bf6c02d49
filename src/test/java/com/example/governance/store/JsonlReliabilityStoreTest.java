package com.example.governance.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonlReliabilityStoreTest {

    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path dir;

    @Test
    void appendsOneLinePerRowPerTable() throws Exception {
        JsonlReliabilityStore store = new JsonlReliabilityStore(om, props(dir, 512));

        store.appendDegradationEvent(new DegradationEventRow("e1", "escalation", 2, "Moderate Degradation",
                new DegradationEventRow.TriggerData("cpu_usage", "gt", 90d, 97d, 30_000L, null),
                Instant.parse("2024-05-01T10:00:00Z")));
        store.appendDegradationEvent(new DegradationEventRow("e2", "recovery", 1, "Minor Degradation", null,
                Instant.parse("2024-05-01T10:05:00Z")));

        List<String> lines = Files.readAllLines(store.pathFor(JsonlReliabilityStore.DEGRADATION_EVENTS), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode first = om.readTree(lines.get(0));
        assertThat(first.get("eventId").asText()).isEqualTo("e1");
        assertThat(first.get("triggerData").get("observedValue").asDouble()).isEqualTo(97d);
        assertThat(Files.exists(store.pathFor(JsonlReliabilityStore.RECOVERY_ATTEMPTS))).isFalse();
    }

    @Test
    void clipsFreeTextInAttemptResults() throws Exception {
        JsonlReliabilityStore store = new JsonlReliabilityStore(om, props(dir, 40));
        String longError = "x".repeat(200);

        store.appendRecoveryAttempt(new RecoveryAttemptRow("a1", "err", "agent", "cache_clear",
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:00:01Z"), "failed",
                new RecoveryAttemptRow.ResultData(false, false, true, 1000L, List.of(), List.of(longError), longError)));

        JsonNode row = om.readTree(Files.readAllLines(store.pathFor(JsonlReliabilityStore.RECOVERY_ATTEMPTS)).get(0));
        assertThat(row.get("resultData").get("error").asText()).hasSize(40);
        assertThat(row.get("resultData").get("sideEffects").get(0).asText()).hasSize(40);
    }

    @Test
    void unwritableDirectorySurfacesStoreException() throws Exception {
        Path file = Files.writeString(dir.resolve("not-a-dir"), "x");
        JsonlReliabilityStore store = new JsonlReliabilityStore(om, props(file, 512));

        assertThatThrownBy(() -> store.appendCoordinationEvent(new CoordinationEventRow("c1", "s1",
                Instant.parse("2024-05-01T10:00:00Z"), "agent-a", "phase_started", "assessment", null, null, "in_progress")))
                .isInstanceOf(ReliabilityStoreException.class);
    }

    private static StoreProperties props(Path dir, int maxText) {
        StoreProperties p = new StoreProperties();
        p.setJsonlEnabled(true);
        p.setDirectory(dir.toString());
        p.setMaxTextChars(maxText);
        return p;
    }
}
