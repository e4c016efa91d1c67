package com.activelearn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.activelearn.feedback.JsonLinesLabeledExampleStore;
import com.activelearn.runtime.ActiveLearningControl;
import com.activelearn.store.JsonFileSettingsStore;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;

    @BeforeEach
    void writeConfig() throws IOException {
        configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                storage:
                  settingsPath: %1$s/settings.json
                  labeledExamplesPath: %1$s/labeled.jsonl
                  predictionsPath: %1$s/predictions.jsonl
                  runMetricsPath: %1$s/run-metrics.jsonl
                feeds:
                  approvalsPath: %1$s/feeds/approvals.json
                  feedbackPath: %1$s/feeds/feedback.json
                  goldPath: %1$s/feeds/gold.json
                training:
                  minExamples: 50
                """.formatted(tempDir.toString().replace('\\', '/')));
    }

    @Test
    void shouldReportStatusWithEmptyStores() {
        assertEquals(0, execute("--mode", "status"));
        assertEquals(0, execute("--mode", "pending"));
        assertEquals(0, execute("--mode", "canaries"));
    }

    @Test
    void shouldRequireAgentForAgentScopedModes() {
        assertEquals(2, execute("--mode", "create_bundle"));
        assertEquals(2, execute("--mode", "rollback"));
        assertEquals(2, execute("--mode", "propose", "--agent", "inbox_triage"));
        assertEquals(2, execute("--mode", "promote", "--agent", "inbox_triage"));
    }

    @Test
    void shouldRejectUnknownApprovalAndMissingBackup() {
        assertEquals(1, execute("--mode", "approve", "--approval-id", "does-not-exist"));
        assertEquals(1, execute("--mode", "rollback", "--agent", "inbox_triage"));
    }

    @Test
    void shouldFailCreateBundleWithoutEnoughLabels() {
        assertEquals(0, execute("--mode", "record_label",
                "--agent", "inbox_triage", "--key", "msg-1", "--label", "archive", "--payload", "{\"word_count\":12}"));

        assertEquals(1, execute("--mode", "create_bundle", "--agent", "inbox_triage"));
    }

    @Test
    void shouldRecordReviewLabel() throws IOException {
        assertEquals(0, execute("--mode", "record_label",
                "--agent", "inbox_triage", "--key", "msg-7", "--label", "escalate", "--actor", "alice"));

        JsonLinesLabeledExampleStore labels = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        assertEquals("escalate", labels.findByAgent("inbox_triage").get(0).label());
    }

    @Test
    void shouldSkipNightlyJobsWhilePaused() throws IOException {
        assertEquals(0, execute("--mode", "pause", "--rationale", "quarterly audit", "--actor", "alice"));

        ActiveLearningControl control = new ActiveLearningControl(new JsonFileSettingsStore(tempDir.resolve("settings.json")));
        assertTrue(control.isPaused());
        assertEquals(0, execute("--mode", "nightly"));

        assertEquals(0, execute("--mode", "resume", "--actor", "alice"));
        ActiveLearningControl reloaded = new ActiveLearningControl(new JsonFileSettingsStore(tempDir.resolve("settings.json")));
        assertEquals("alice", reloaded.status().actor());
    }

    private int execute(String... args) {
        String[] withConfig = new String[args.length + 2];
        System.arraycopy(args, 0, withConfig, 0, args.length);
        withConfig[args.length] = "--config";
        withConfig[args.length + 1] = configPath.toString();
        return new CommandLine(new Main()).execute(withConfig);
    }
}
