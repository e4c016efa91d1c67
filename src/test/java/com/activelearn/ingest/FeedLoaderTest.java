package com.activelearn.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.activelearn.feedback.JsonLinesLabeledExampleStore;
import com.activelearn.feedback.LabelSource;
import com.activelearn.feedback.LabeledExample;
import com.activelearn.feedback.LabeledExampleStore;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedLoaderTest {
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadResolvedApprovalsOnce() throws Exception {
        LabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        ObjectNode context = JsonNodeFactory.instance.objectNode().put("risk_score", 82);
        ApprovalFeed approvals = (since, limit) -> List.of(
                new ApprovalEvent("req-1", "inbox_triage", "quarantine", "approved", context, "phishing", NOW),
                new ApprovalEvent("req-2", "inbox_triage", "quarantine", "pending", context, null, NOW),
                new ApprovalEvent("req-3", "inbox_triage", null, "rejected", context, null, NOW));
        FeedLoader loader = new FeedLoader(store, approvals, null, null, CLOCK);

        assertEquals(2, loader.loadFromApprovals(null, 100));
        assertEquals(0, loader.loadFromApprovals(null, 100));

        List<LabeledExample> examples = store.findByAgent("inbox_triage");
        assertEquals("quarantine_approved", examples.get(0).label());
        assertEquals("req-1", examples.get(0).key());
        assertEquals(LabelSource.APPROVALS, examples.get(0).source());
        assertEquals(100, examples.get(0).confidence());
        assertEquals("unknown_rejected", examples.get(1).label());
    }

    @Test
    void shouldFillLimitWithResolvedApprovalsWhenNewerOnesArePending() throws Exception {
        Path export = tempDir.resolve("approvals.json");
        Files.writeString(export, """
                [
                  {"requestId": "req-1", "agent": "inbox_triage", "action": "quarantine", "status": "approved",
                   "createdAt": "2026-03-08T10:00:00Z"},
                  {"requestId": "req-2", "agent": "inbox_triage", "action": "allow", "status": "rejected",
                   "createdAt": "2026-03-08T11:00:00Z"},
                  {"requestId": "req-3", "agent": "inbox_triage", "action": "allow", "status": "pending",
                   "createdAt": "2026-03-09T10:00:00Z"},
                  {"requestId": "req-4", "agent": "inbox_triage", "action": "quarantine", "status": "pending",
                   "createdAt": "2026-03-09T11:00:00Z"}
                ]
                """);
        LabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        FeedLoader loader = new FeedLoader(store, new JsonFileFeeds(export, null, null), null, null, CLOCK);

        assertEquals(2, loader.loadFromApprovals(null, 2));
        assertTrue(store.containsSource(LabelSource.APPROVALS, "req-1"));
        assertTrue(store.containsSource(LabelSource.APPROVALS, "req-2"));
    }

    @Test
    void shouldLabelFeedbackByThumbsUpRatio() throws Exception {
        LabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        LocalDate day = LocalDate.of(2026, 3, 9);
        FeedbackFeed feedback = (since, limit) -> List.of(
                new FeedbackAggregate("fb-1", "insights_writer", day, 10, 9, 1, 4.5, 0.9),
                new FeedbackAggregate("fb-2", "knowledge_update", day, 10, 6, 4, 3.1, 0.6),
                new FeedbackAggregate("fb-3", "inbox_triage", day, 4, 1, 3, 2.0, 0.3),
                new FeedbackAggregate("fb-4", "inbox_triage", day.minusDays(1), 0, 0, 0, 0.0, 0.0),
                new FeedbackAggregate("fb-5", "insights_writer", day, 12, 12, 0, 5.0, 1.0));
        FeedLoader loader = new FeedLoader(store, null, feedback, null, CLOCK);

        assertEquals(3, loader.loadFromFeedback(null, 100));

        LabeledExample insights = store.findByAgent("insights_writer").get(0);
        assertEquals("high_quality", insights.label());
        assertEquals("insights_writer_2026-03-09", insights.key());
        assertEquals(90, insights.confidence());
        assertEquals(10, insights.payload().get("feedback_count").asInt());
        assertEquals("medium_quality", store.findByAgent("knowledge_update").get(0).label());
        assertEquals("low_quality", store.findByAgent("inbox_triage").get(0).label());
    }

    @Test
    void shouldKeepLoadingWhenOneSourceIsDown() throws Exception {
        LabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        ApprovalFeed approvals = (since, limit) -> {
            throw new UpstreamUnavailableException("approvals", "connection refused");
        };
        GoldSetFeed gold = (agent, limit) -> List.of(
                new GoldTask("gold-1", "inbox_triage", JsonNodeFactory.instance.objectNode(), "quarantine", "known phish"),
                new GoldTask("gold-2", "inbox_triage", null, null, null));
        FeedLoader loader = new FeedLoader(store, approvals, null, gold, CLOCK);

        Map<String, Integer> counts = loader.loadAll();

        assertEquals(Map.of("approvals", 0, "feedback", 0, "gold", 2), counts);
        assertEquals(List.of("quarantine", "unknown"),
                store.findByAgent("inbox_triage").stream().map(LabeledExample::label).toList());
        assertEquals(0, loader.loadFromGoldsets(null, 100));
    }

    @Test
    void shouldRecordReviewLabelsIdempotently() throws Exception {
        LabeledExampleStore store = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        FeedLoader loader = new FeedLoader(store, null, null, null, CLOCK);

        assertTrue(loader.recordReviewLabel("inbox_triage", "task-7", null, "safe", "carol"));
        assertFalse(loader.recordReviewLabel("inbox_triage", "task-7", null, "quarantine", "dave"));

        LabeledExample example = store.findByAgent("inbox_triage").get(0);
        assertEquals(LabelSource.GOLD, example.source());
        assertEquals("review:inbox_triage:task-7", example.sourceId());
        assertEquals(1, loader.stats().total());
        assertEquals(1, loader.stats().recent7d());
    }

    @Test
    void shouldBucketQualityRatios() {
        assertEquals("high_quality", FeedLoader.qualityLabel(0.8));
        assertEquals("medium_quality", FeedLoader.qualityLabel(0.5));
        assertEquals("medium_quality", FeedLoader.qualityLabel(0.79));
        assertEquals("low_quality", FeedLoader.qualityLabel(0.49));
    }
}
