package com.activelearn.ingest;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.feedback.LabelSource;
import com.activelearn.feedback.LabeledExample;
import com.activelearn.feedback.LabeledExampleStore;
import com.activelearn.feedback.LabeledStats;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Idempotent ETL from the approvals, feedback and gold-set exports into the labeled example store.
 *
 * <p>Every row is keyed by {@code (source, source_id)}; an existence check before each insert makes reloading an
 * overlapping window a no-op. Sources are independent: one unreachable export only zeroes its own count.
 */
public class FeedLoader {
    private static final Logger log = LoggerFactory.getLogger(FeedLoader.class);

    public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(7);
    public static final int DEFAULT_LIMIT = 1000;
    static final double HIGH_QUALITY_RATIO = 0.8;
    static final double MEDIUM_QUALITY_RATIO = 0.5;

    private final LabeledExampleStore store;
    private final ApprovalFeed approvalFeed;
    private final FeedbackFeed feedbackFeed;
    private final GoldSetFeed goldSetFeed;
    private final Clock clock;

    public FeedLoader(LabeledExampleStore store, ApprovalFeed approvalFeed, FeedbackFeed feedbackFeed, GoldSetFeed goldSetFeed) {
        this(store, approvalFeed, feedbackFeed, goldSetFeed, Clock.systemUTC());
    }

    public FeedLoader(
            LabeledExampleStore store,
            ApprovalFeed approvalFeed,
            FeedbackFeed feedbackFeed,
            GoldSetFeed goldSetFeed,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.approvalFeed = approvalFeed;
        this.feedbackFeed = feedbackFeed;
        this.goldSetFeed = goldSetFeed;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int loadFromApprovals(Instant since, int limit) throws IOException {
        Instant cutoff = since == null ? clock.instant().minus(DEFAULT_LOOKBACK) : since;
        List<ApprovalEvent> events;
        try {
            events = requireFeed("approvals", approvalFeed).fetchApprovals(cutoff, limit);
        } catch (UpstreamUnavailableException e) {
            log.warn("feeds.skip source={} reason={}", e.source(), e.getMessage());
            return 0;
        }

        int count = 0;
        for (ApprovalEvent event : events) {
            if (!event.isResolved() || event.requestId() == null) {
                continue;
            }
            if (store.containsSource(LabelSource.APPROVALS, event.requestId())) {
                continue;
            }
            String action = event.action() == null || event.action().isBlank() ? "unknown" : event.action();
            store.append(new LabeledExample(
                    UUID.randomUUID().toString(),
                    event.agent(),
                    event.requestId(),
                    event.context(),
                    action + "_" + event.status(),
                    LabelSource.APPROVALS,
                    event.requestId(),
                    100,
                    event.rationale(),
                    clock.instant()));
            count++;
        }
        if (count > 0) {
            log.info("Loaded {} labeled examples from approvals", count);
        }
        return count;
    }

    public int loadFromFeedback(Instant since, int limit) throws IOException {
        Instant cutoff = since == null ? clock.instant().minus(DEFAULT_LOOKBACK) : since;
        List<FeedbackAggregate> aggregates;
        try {
            aggregates = requireFeed("feedback", feedbackFeed).fetchFeedback(LocalDate.ofInstant(cutoff, ZoneOffset.UTC), limit);
        } catch (UpstreamUnavailableException e) {
            log.warn("feeds.skip source={} reason={}", e.source(), e.getMessage());
            return 0;
        }

        int count = 0;
        for (FeedbackAggregate aggregate : aggregates) {
            if (aggregate.feedbackCount() <= 0 || aggregate.id() == null) {
                continue;
            }
            String key = aggregate.agent() + "_" + aggregate.date();
            if (store.containsSource(LabelSource.FEEDBACK, aggregate.id())
                    || store.containsKey(aggregate.agent(), LabelSource.FEEDBACK, key)) {
                continue;
            }
            double ratio = aggregate.thumbsUpRatio();
            store.append(new LabeledExample(
                    UUID.randomUUID().toString(),
                    aggregate.agent(),
                    key,
                    feedbackPayload(aggregate),
                    qualityLabel(ratio),
                    LabelSource.FEEDBACK,
                    aggregate.id(),
                    (int) Math.round(ratio * 100),
                    null,
                    clock.instant()));
            count++;
        }
        if (count > 0) {
            log.info("Loaded {} labeled examples from feedback", count);
        }
        return count;
    }

    public int loadFromGoldsets(String agent, int limit) throws IOException {
        List<GoldTask> tasks;
        try {
            tasks = requireFeed("gold", goldSetFeed).fetchGoldTasks(agent, limit);
        } catch (UpstreamUnavailableException e) {
            log.warn("feeds.skip source={} reason={}", e.source(), e.getMessage());
            return 0;
        }

        int count = 0;
        for (GoldTask task : tasks) {
            if (task.id() == null || store.containsSource(LabelSource.GOLD, task.id())) {
                continue;
            }
            store.append(new LabeledExample(
                    UUID.randomUUID().toString(),
                    task.agent(),
                    task.id(),
                    task.inputData(),
                    task.expectedAction() == null || task.expectedAction().isBlank() ? "unknown" : task.expectedAction(),
                    LabelSource.GOLD,
                    task.id(),
                    100,
                    task.description(),
                    clock.instant()));
            count++;
        }
        if (count > 0) {
            log.info("Loaded {} labeled examples from gold sets", count);
        }
        return count;
    }

    public Map<String, Integer> loadAll() throws IOException {
        return loadAll(null, DEFAULT_LIMIT);
    }

    public Map<String, Integer> loadAll(Instant since, int limit) throws IOException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(LabelSource.APPROVALS.wireName(), loadFromApprovals(since, limit));
        counts.put(LabelSource.FEEDBACK.wireName(), loadFromFeedback(since, limit));
        counts.put(LabelSource.GOLD.wireName(), loadFromGoldsets(null, limit));
        log.info("feeds.load.complete counts={}", counts);
        return counts;
    }

    public boolean recordReviewLabel(String agent, String key, JsonNode payload, String label, String reviewer) throws IOException {
        Objects.requireNonNull(label, "label");
        String sourceId = "review:" + agent + ":" + key;
        if (store.containsSource(LabelSource.GOLD, sourceId)) {
            return false;
        }
        store.append(new LabeledExample(
                UUID.randomUUID().toString(),
                agent,
                key,
                payload,
                label,
                LabelSource.GOLD,
                sourceId,
                100,
                reviewer == null ? "" : "reviewed by " + reviewer,
                clock.instant()));
        log.info("Recorded review label agent={} key={} label={}", agent, key, label);
        return true;
    }

    public LabeledStats stats() throws IOException {
        return store.stats(clock.instant().minus(DEFAULT_LOOKBACK));
    }

    static String qualityLabel(double thumbsUpRatio) {
        if (thumbsUpRatio >= HIGH_QUALITY_RATIO) {
            return "high_quality";
        }
        if (thumbsUpRatio >= MEDIUM_QUALITY_RATIO) {
            return "medium_quality";
        }
        return "low_quality";
    }

    private static ObjectNode feedbackPayload(FeedbackAggregate aggregate) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("feedback_count", aggregate.feedbackCount());
        payload.put("thumbs_up", aggregate.thumbsUp());
        payload.put("thumbs_down", aggregate.thumbsDown());
        payload.put("avg_quality_score", aggregate.avgQualityScore());
        payload.put("success_rate", aggregate.successRate());
        return payload;
    }

    private static <T> T requireFeed(String source, T feed) throws UpstreamUnavailableException {
        if (feed == null) {
            throw new UpstreamUnavailableException(source, "No " + source + " feed configured");
        }
        return feed;
    }
}
