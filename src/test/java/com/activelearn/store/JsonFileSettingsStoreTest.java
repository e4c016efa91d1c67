package com.activelearn.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSettingsStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldBumpVersionOnEveryWriteAndSurviveReload() throws Exception {
        Path file = tempDir.resolve("state/settings.json");
        JsonFileSettingsStore store = new JsonFileSettingsStore(file, CLOCK);

        assertEquals(1L, store.put("bundle_seq.inbox_triage", IntNode.valueOf(1), "alice"));
        assertEquals(2L, store.put("bundle_seq.inbox_triage", IntNode.valueOf(2), "bob"));
        assertTrue(Files.exists(file));

        JsonFileSettingsStore reloaded = new JsonFileSettingsStore(file, CLOCK);
        SettingEntry entry = reloaded.get("bundle_seq.inbox_triage").orElseThrow();
        assertEquals(2L, entry.version());
        assertEquals(2, entry.value().asInt());
        assertEquals("bob", entry.updatedBy());
        assertEquals(CLOCK.instant(), entry.updatedAt());
    }

    @Test
    void shouldListKeysByPrefixInLexicalOrder() throws Exception {
        JsonFileSettingsStore store = new JsonFileSettingsStore(tempDir.resolve("settings.json"), CLOCK);
        store.apply(new SettingsBatch("test")
                .put("bundle.inbox_triage.canary", TextNode.valueOf("c"))
                .put("bundle.inbox_triage.active", TextNode.valueOf("a"))
                .put("bundle_state.inbox_triage.b1", TextNode.valueOf("s"))
                .put("judge_weights.inbox_triage", TextNode.valueOf("w")));

        assertEquals(List.of("bundle.inbox_triage.active", "bundle.inbox_triage.canary"), store.keys("bundle."));
        assertTrue(store.delete("bundle.inbox_triage.canary"));
        assertFalse(store.delete("bundle.inbox_triage.canary"));
        assertEquals(List.of("bundle.inbox_triage.active"), store.keys("bundle."));
    }

    @Test
    void shouldApplyBatchWithDeletes() throws Exception {
        JsonFileSettingsStore store = new JsonFileSettingsStore(tempDir.resolve("settings.json"), CLOCK);
        store.put("bundle.a.canary", TextNode.valueOf("c"), "test");

        store.apply(new SettingsBatch("test")
                .delete("bundle.a.canary")
                .put("bundle.a.active", TextNode.valueOf("c")));

        assertTrue(store.get("bundle.a.canary").isEmpty());
        assertEquals("c", store.value("bundle.a.active").orElseThrow().asText());
    }

    @Test
    void shouldKeepWritesFromAnotherStoreOnTheSameFile() throws Exception {
        Path file = tempDir.resolve("settings.json");
        JsonFileSettingsStore weights = new JsonFileSettingsStore(file, CLOCK);
        JsonFileSettingsStore guard = new JsonFileSettingsStore(file, CLOCK);
        assertTrue(weights.get("bundle.inbox_triage.canary").isEmpty());

        guard.put("bundle.inbox_triage.canary", TextNode.valueOf("canary"), "canary-guard");
        weights.put("judge_weights.inbox_triage", TextNode.valueOf("weights"), "judge-weights");

        JsonFileSettingsStore reader = new JsonFileSettingsStore(file, CLOCK);
        assertEquals(List.of("bundle.inbox_triage.canary", "judge_weights.inbox_triage"), reader.keys(""));
        assertEquals("canary", weights.value("bundle.inbox_triage.canary").orElseThrow().asText());
        assertTrue(Files.exists(tempDir.resolve("settings.json.lock")));
    }

    @Test
    void shouldNotLoseConcurrentWritesFromSeparateStores() throws Exception {
        Path file = tempDir.resolve("settings.json");
        List<JsonFileSettingsStore> stores = List.of(
                new JsonFileSettingsStore(file, CLOCK),
                new JsonFileSettingsStore(file, CLOCK));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int writer = 0; writer < 4; writer++) {
                JsonFileSettingsStore store = stores.get(writer % 2);
                String prefix = "writer" + writer + ".";
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        store.put(prefix + i, IntNode.valueOf(i), "test");
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(40, new JsonFileSettingsStore(file, CLOCK).keys("writer").size());
    }

    @Test
    void shouldLeaveStateUntouchedWhenPersistFails() throws Exception {
        FailingStore store = new FailingStore();
        store.put("bundle.a.active", TextNode.valueOf("old"), "test");
        store.failNext = true;

        assertThrows(IOException.class, () -> store.apply(new SettingsBatch("test")
                .put("bundle.a.active", TextNode.valueOf("new"))
                .put("bundle.a.backup", TextNode.valueOf("old"))));

        assertEquals("old", store.value("bundle.a.active").orElseThrow().asText());
        assertEquals(1L, store.get("bundle.a.active").orElseThrow().version());
        assertTrue(store.get("bundle.a.backup").isEmpty());
    }

    private static final class FailingStore extends InMemorySettingsStore {
        boolean failNext;

        FailingStore() {
            super(CLOCK);
        }

        @Override
        protected void persist(Map<String, SettingEntry> snapshot) throws IOException {
            if (failNext) {
                failNext = false;
                throw new IOException("disk full");
            }
        }
    }
}
