package com.activelearn.review;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.feedback.LabeledExampleStore;
import com.activelearn.judging.JudgePrediction;
import com.activelearn.judging.JudgeWeightCalculator;
import com.activelearn.judging.PredictionSource;
import com.activelearn.runtime.AppConfig;
import com.activelearn.store.SettingsStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class UncertaintySampler {
    private static final Logger log = LoggerFactory.getLogger(UncertaintySampler.class);

    public static final String QUEUE_PREFIX = "review_queue.";

    private final SettingsStore settings;
    private final LabeledExampleStore labels;
    private final PredictionSource predictions;
    private final JudgeWeightCalculator judgeWeights;
    private final AppConfig.ReviewConfig config;
    private final UncertaintyScorer scorer;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public UncertaintySampler(
            SettingsStore settings,
            LabeledExampleStore labels,
            PredictionSource predictions,
            JudgeWeightCalculator judgeWeights,
            AppConfig.ReviewConfig config) {
        this(settings, labels, predictions, judgeWeights, config, Clock.systemUTC());
    }

    UncertaintySampler(
            SettingsStore settings,
            LabeledExampleStore labels,
            PredictionSource predictions,
            JudgeWeightCalculator judgeWeights,
            AppConfig.ReviewConfig config,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.labels = Objects.requireNonNull(labels, "labels");
        this.predictions = Objects.requireNonNull(predictions, "predictions");
        this.judgeWeights = Objects.requireNonNull(judgeWeights, "judgeWeights");
        this.config = Objects.requireNonNull(config, "config");
        this.scorer = new UncertaintyScorer(config.getLowConfidenceThreshold());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<ReviewCandidate> sampleForReview(String agent) throws IOException {
        return sampleForReview(agent, config.getTopN(), 0.0);
    }

    /**
     * Scores every unlabeled prediction from the lookback window and returns the most uncertain ones, highest first.
     * Equal scores keep the order the predictions were fetched in.
     */
    public List<ReviewCandidate> sampleForReview(String agent, int topN, double minUncertainty) throws IOException {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be > 0");
        }
        Instant since = clock.instant().minus(Duration.ofDays(config.getLookbackDays()));
        List<JudgePrediction> recent = predictions.findSince(agent, since);
        if (recent.isEmpty()) {
            log.info("No predictions for {} in the last {} days", agent, config.getLookbackDays());
            return List.of();
        }

        Set<String> labeled = labels.labeledKeys(agent);
        ToDoubleFunction<String> weightOf = weightLookup(agent);

        List<ReviewCandidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (JudgePrediction prediction : recent) {
            if (prediction.taskKey() == null || labeled.contains(prediction.taskKey())) {
                continue;
            }
            Optional<UncertaintyScorer.Result> result = scorer.score(prediction.scores(), weightOf);
            if (result.isEmpty()) {
                skipped++;
                continue;
            }
            if (result.get().uncertainty() < minUncertainty) {
                continue;
            }
            candidates.add(new ReviewCandidate(
                    prediction.taskKey(),
                    agent,
                    result.get().uncertainty(),
                    result.get().method(),
                    prediction.scores(),
                    prediction.payload(),
                    prediction.createdAt(),
                    prediction.id()));
        }

        // List.sort is stable
        candidates.sort(Comparator.comparingDouble(ReviewCandidate::uncertainty).reversed());
        List<ReviewCandidate> top = candidates.size() > topN ? List.copyOf(candidates.subList(0, topN)) : List.copyOf(candidates);
        log.info("review.sample agent={} predictions={} labeled={} skipped={} selected={}",
                agent, recent.size(), labeled.size(), skipped, top.size());
        return top;
    }

    public ReviewQueue refreshQueue(String agent, int topN, double minUncertainty) throws IOException {
        ReviewQueue queue = new ReviewQueue(
                agent,
                UUID.randomUUID().toString(),
                clock.instant(),
                sampleForReview(agent, topN, minUncertainty));
        settings.put(QUEUE_PREFIX + agent, mapper.valueToTree(queue), "review-sampler");
        return queue;
    }

    public Map<String, List<ReviewCandidate>> dailySampleReviewQueue() throws IOException {
        Map<String, List<ReviewCandidate>> results = new LinkedHashMap<>();
        for (String agent : predictions.agents()) {
            try {
                ReviewQueue queue = refreshQueue(agent, config.getTopNPerAgent(), config.getMinUncertainty());
                if (!queue.candidates().isEmpty()) {
                    results.put(agent, queue.candidates());
                }
            } catch (IOException | RuntimeException e) {
                log.error("review.sample.failed agent={} reason={}", agent, e.getMessage(), e);
            }
        }
        int total = results.values().stream().mapToInt(List::size).sum();
        log.info("review.sample.complete agents={} candidates={}", results.size(), total);
        return results;
    }

    public Optional<ReviewQueue> storedQueue(String agent) throws IOException {
        Optional<JsonNode> value = settings.value(QUEUE_PREFIX + agent);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.treeToValue(value.get(), ReviewQueue.class));
    }

    public ReviewStats stats() throws IOException {
        Instant since = clock.instant().minus(Duration.ofDays(config.getLookbackDays()));
        Map<String, Long> unlabeledByAgent = new TreeMap<>();
        Map<String, Integer> queuedByAgent = new TreeMap<>();
        long recentTotal = 0;
        for (String agent : predictions.agents()) {
            Set<String> labeled = labels.labeledKeys(agent);
            List<JudgePrediction> recent = predictions.findSince(agent, since);
            recentTotal += recent.size();
            long unlabeled = recent.stream()
                    .filter(prediction -> prediction.taskKey() != null && !labeled.contains(prediction.taskKey()))
                    .count();
            unlabeledByAgent.put(agent, unlabeled);
            storedQueue(agent).ifPresent(queue -> queuedByAgent.put(agent, queue.candidates().size()));
        }
        long totalUnlabeled = unlabeledByAgent.values().stream().mapToLong(Long::longValue).sum();
        long totalLabeled = labels.stats(since).total();
        return new ReviewStats(recentTotal, totalLabeled, totalUnlabeled, unlabeledByAgent, queuedByAgent);
    }

    private ToDoubleFunction<String> weightLookup(String agent) throws IOException {
        Optional<Map<String, Double>> stored = judgeWeights.storedWeights(agent);
        if (stored.isEmpty()) {
            return judgeId -> 1.0;
        }
        Map<String, Double> weights = stored.get();
        return judgeId -> {
            Double weight = weights.get(judgeId);
            return weight == null ? judgeWeights.defaultWeight(judgeId) : weight;
        };
    }
}
