package com.activelearn.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLinesLabeledExampleStoreTest {
    private static final Instant NOW = Instant.parse("2026-03-10T00:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendAndReloadExamples() throws Exception {
        Path file = tempDir.resolve("labeled.jsonl");
        JsonLinesLabeledExampleStore store = new JsonLinesLabeledExampleStore(file);
        store.append(example("1", "inbox_triage", "k1", LabelSource.APPROVALS, "req-1", NOW));
        store.append(example("2", "insights_writer", "k2", LabelSource.FEEDBACK, "fb-1", NOW.minus(Duration.ofDays(10))));

        JsonLinesLabeledExampleStore reloaded = new JsonLinesLabeledExampleStore(file);

        assertTrue(reloaded.containsSource(LabelSource.APPROVALS, "req-1"));
        assertFalse(reloaded.containsSource(LabelSource.GOLD, "req-1"));
        assertTrue(reloaded.containsKey("insights_writer", LabelSource.FEEDBACK, "k2"));
        assertEquals(List.of("inbox_triage", "insights_writer"), reloaded.agents());
        assertEquals(Set.of("k1"), reloaded.labeledKeys("inbox_triage"));
        assertEquals("quarantine", reloaded.findByAgent("inbox_triage").get(0).label());
        assertEquals(70, reloaded.findByAgent("inbox_triage").get(0).payload().get("risk_score").asInt());
    }

    @Test
    void shouldRejectDuplicateSourceIds() throws Exception {
        JsonLinesLabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        store.append(example("1", "inbox_triage", "k1", LabelSource.APPROVALS, "req-1", NOW));

        assertThrows(IllegalArgumentException.class,
                () -> store.append(example("2", "inbox_triage", "k9", LabelSource.APPROVALS, "req-1", NOW)));
        store.append(example("3", "inbox_triage", "k1", LabelSource.GOLD, "req-1", NOW));

        assertEquals(2, store.findByAgent("inbox_triage").size());
    }

    @Test
    void shouldReportStats() throws Exception {
        JsonLinesLabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        store.append(example("1", "inbox_triage", "k1", LabelSource.APPROVALS, "req-1", NOW));
        store.append(example("2", "inbox_triage", "k2", LabelSource.GOLD, "g-1", NOW.minus(Duration.ofDays(1))));
        store.append(example("3", "knowledge_update", "k3", LabelSource.FEEDBACK, "fb-1", NOW.minus(Duration.ofDays(9))));

        LabeledStats stats = store.stats(NOW.minus(Duration.ofDays(7)));

        assertEquals(3, stats.total());
        assertEquals(1L, stats.bySource().get(LabelSource.GOLD));
        assertEquals(0L, stats.bySource().get(LabelSource.SYNTHETIC));
        assertEquals(2L, stats.byAgent().get("inbox_triage"));
        assertEquals(2, stats.recent7d());
    }

    @Test
    void shouldKeepFailingOnCorruptLineInsteadOfServingPartialIndex() throws Exception {
        Path first = tempDir.resolve("first.jsonl");
        Path second = tempDir.resolve("second.jsonl");
        new JsonLinesLabeledExampleStore(first).append(example("1", "inbox_triage", "k1", LabelSource.APPROVALS, "req-1", NOW));
        new JsonLinesLabeledExampleStore(second).append(example("2", "inbox_triage", "k2", LabelSource.APPROVALS, "req-2", NOW));
        Path file = tempDir.resolve("labeled.jsonl");
        Files.writeString(file, Files.readString(first) + "{\"id\": \"3\", broken" + System.lineSeparator() + Files.readString(second));
        JsonLinesLabeledExampleStore store = new JsonLinesLabeledExampleStore(file);

        IOException error = assertThrows(IOException.class, () -> store.containsSource(LabelSource.APPROVALS, "req-2"));
        assertTrue(error.getMessage().contains("line 2"));
        assertThrows(IOException.class, () -> store.containsSource(LabelSource.APPROVALS, "req-2"));
        assertThrows(IOException.class, () -> store.append(example("4", "inbox_triage", "k4", LabelSource.APPROVALS, "req-2", NOW)));

        Files.writeString(file, Files.readString(first) + Files.readString(second));
        assertTrue(store.containsSource(LabelSource.APPROVALS, "req-2"));
        assertEquals(2, store.findByAgent("inbox_triage").size());
    }

    private static LabeledExample example(String id, String agent, String key, LabelSource source, String sourceId, Instant at) {
        return new LabeledExample(id, agent, key, JsonNodeFactory.instance.objectNode().put("risk_score", 70), "quarantine",
                source, sourceId, 100, null, at);
    }
}
