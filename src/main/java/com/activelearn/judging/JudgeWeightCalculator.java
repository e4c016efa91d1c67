package com.activelearn.judging;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.feedback.LabeledExample;
import com.activelearn.feedback.LabeledExampleStore;
import com.activelearn.runtime.AppConfig;
import com.activelearn.store.SettingEntry;
import com.activelearn.store.SettingsStore;
import com.activelearn.versioning.AgentLocks;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JudgeWeightCalculator {
    private static final Logger log = LoggerFactory.getLogger(JudgeWeightCalculator.class);

    public static final String KEY_PREFIX = "judge_weights.";
    public static final double MIN_WEIGHT = 0.10;
    public static final double MAX_WEIGHT = 1.00;

    private final SettingsStore settings;
    private final LabeledExampleStore labels;
    private final PredictionSource predictions;
    private final AgentLocks locks;
    private final AppConfig.JudgesConfig config;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JudgeWeightCalculator(
            SettingsStore settings,
            LabeledExampleStore labels,
            PredictionSource predictions,
            AgentLocks locks,
            AppConfig.JudgesConfig config) {
        this(settings, labels, predictions, locks, config, Clock.systemUTC());
    }

    JudgeWeightCalculator(
            SettingsStore settings,
            LabeledExampleStore labels,
            PredictionSource predictions,
            AgentLocks locks,
            AppConfig.JudgesConfig config,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.labels = Objects.requireNonNull(labels, "labels");
        this.predictions = Objects.requireNonNull(predictions, "predictions");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public double computeWeight(String agent, String judgeId, List<JudgeEvidence> evidence) throws IOException {
        return locks.withLock(agent, () -> {
            Map<String, Double> stored = new TreeMap<>(storedWeights(agent).orElse(Map.of()));
            double weight = resolveWeight(judgeId, evidence, stored);
            stored.put(judgeId, weight);
            save(agent, stored);
            return weight;
        });
    }

    public Map<String, Double> updateWeightsForAgent(String agent) throws IOException {
        Instant now = clock.instant();
        List<JudgePrediction> recent = predictions.findSince(agent, now.minus(Duration.ofDays(config.getLookbackDays())));
        if (recent.isEmpty()) {
            log.info("No judge predictions for {} in the last {} days, keeping current weights", agent, config.getLookbackDays());
            return currentWeights(agent);
        }

        Map<String, List<JudgeEvidence>> evidenceByJudge = gatherEvidence(agent, recent);
        return locks.withLock(agent, () -> {
            Map<String, Double> weights = new TreeMap<>(storedWeights(agent).orElse(Map.of()));
            for (Map.Entry<String, List<JudgeEvidence>> entry : evidenceByJudge.entrySet()) {
                double weight = resolveWeight(entry.getKey(), entry.getValue(), weights);
                weights.put(entry.getKey(), weight);
                log.info("judges.weight agent={} judge={} evidence={} weight={}",
                        agent, entry.getKey(), entry.getValue().size(), weight);
            }
            if (weights.isEmpty()) {
                return defaultWeights();
            }
            save(agent, weights);
            return Collections.unmodifiableMap(weights);
        });
    }

    public Map<String, Map<String, Double>> nightlyUpdateWeights() throws IOException {
        TreeSet<String> agents = new TreeSet<>(predictions.agents());
        agents.addAll(labels.agents());
        Map<String, Map<String, Double>> results = new LinkedHashMap<>();
        for (String agent : agents) {
            try {
                results.put(agent, updateWeightsForAgent(agent));
            } catch (IOException | RuntimeException e) {
                log.error("judges.update.failed agent={} reason={}", agent, e.getMessage(), e);
                results.put(agent, defaultWeights());
            }
        }
        log.info("judges.update.complete agents={}", results.size());
        return results;
    }

    public Map<String, Double> currentWeights(String agent) throws IOException {
        return storedWeights(agent).map(Collections::unmodifiableMap).orElseGet(this::defaultWeights);
    }

    public Optional<Map<String, Double>> storedWeights(String agent) throws IOException {
        Optional<JsonNode> value = settings.value(KEY_PREFIX + agent);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.convertValue(value.get(), new TypeReference<TreeMap<String, Double>>() {
        }));
    }

    public List<JudgeWeight> judgeWeights(String agent) throws IOException {
        Optional<SettingEntry> entry = settings.get(KEY_PREFIX + agent);
        Instant updatedAt = entry.map(SettingEntry::updatedAt).orElse(null);
        List<JudgeWeight> rows = new ArrayList<>();
        for (Map.Entry<String, Double> weight : new TreeMap<>(currentWeights(agent)).entrySet()) {
            rows.add(new JudgeWeight(agent, weight.getKey(), weight.getValue(), updatedAt));
        }
        return rows;
    }

    /**
     * Decay-weighted agreement minus half the mean calibration error, clamped to [0.10, 1.00] and rounded to three
     * decimals.
     */
    public static double weightFrom(List<JudgeEvidence> evidence, Instant now, double halfLifeDays) {
        if (evidence.isEmpty()) {
            throw new IllegalArgumentException("evidence must not be empty");
        }
        double decaySum = 0.0;
        double agreementSum = 0.0;
        double calibrationSum = 0.0;
        for (JudgeEvidence item : evidence) {
            double ageDays = Math.max(0.0, Duration.between(item.timestamp(), now).toMillis() / 86_400_000.0);
            double decay = Math.exp(-ageDays * Math.log(2) / halfLifeDays);
            decaySum += decay;
            agreementSum += item.agreement() * decay;
            calibrationSum += Math.abs(item.predictedConfidence() - item.agreement());
        }
        double weightedAgreement = decaySum > 0.0 ? agreementSum / decaySum : 0.0;
        double calibrationError = calibrationSum / evidence.size();
        double weight = clamp(weightedAgreement - 0.5 * calibrationError);
        return Math.round(weight * 1000.0) / 1000.0;
    }

    public double defaultWeight(String judgeId) {
        Double configured = config.getDefaultWeights().get(judgeId);
        return clamp(configured == null ? config.getUnknownJudgeWeight() : configured);
    }

    Map<String, List<JudgeEvidence>> gatherEvidence(String agent, List<JudgePrediction> recent) throws IOException {
        Map<String, String> groundTruth = new HashMap<>();
        for (LabeledExample example : labels.findByAgent(agent)) {
            if (example.source().isHighConfidence()) {
                groundTruth.put(example.key(), example.label());
            }
        }

        Map<String, List<JudgeEvidence>> evidence = new TreeMap<>();
        for (JudgePrediction prediction : recent) {
            String actual = groundTruth.get(prediction.taskKey());
            if (actual == null || prediction.createdAt() == null) {
                continue;
            }
            for (JudgeScore score : prediction.scores()) {
                if (score.judgeId() == null || !score.hasVerdict()) {
                    continue;
                }
                evidence.computeIfAbsent(score.judgeId(), ignored -> new ArrayList<>())
                        .add(new JudgeEvidence(
                                prediction.createdAt(),
                                score.verdict().equals(actual) ? 1 : 0,
                                score.normalizedConfidence()));
            }
        }
        return evidence;
    }

    private double resolveWeight(String judgeId, List<JudgeEvidence> evidence, Map<String, Double> stored) {
        if (evidence == null || evidence.isEmpty()) {
            return defaultWeight(judgeId);
        }
        if (evidence.size() < config.getMinEvidence()) {
            Double prior = stored.get(judgeId);
            return prior == null ? defaultWeight(judgeId) : prior;
        }
        return weightFrom(evidence, clock.instant(), config.getHalfLifeDays());
    }

    private void save(String agent, Map<String, Double> weights) throws IOException {
        settings.put(KEY_PREFIX + agent, mapper.valueToTree(new TreeMap<>(weights)), "judge-weights");
    }

    private Map<String, Double> defaultWeights() {
        Map<String, Double> defaults = new TreeMap<>();
        config.getDefaultWeights().forEach((judge, weight) -> defaults.put(judge, clamp(weight)));
        return Collections.unmodifiableMap(defaults);
    }

    private static double clamp(double weight) {
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, weight));
    }
}
