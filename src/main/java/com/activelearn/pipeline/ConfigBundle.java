package com.activelearn.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.activelearn.feedback.LabelSource;

public record ConfigBundle(
        String agent,
        String bundleId,
        int version,
        Instant createdAt,
        int trainingCount,
        double accuracy,
        Map<String, Integer> labelDistribution,
        List<Double> featureImportances,
        Map<String, Double> thresholds,
        ModelType modelType,
        Set<LabelSource> sourcesUsed) {

    public ConfigBundle {
        Objects.requireNonNull(agent, "agent");
        labelDistribution = labelDistribution == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(labelDistribution));
        featureImportances = featureImportances == null ? List.of() : List.copyOf(featureImportances);
        thresholds = thresholds == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        sourcesUsed = sourcesUsed == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(sourcesUsed));
    }

    public static ConfigBundle empty(String agent) {
        return new ConfigBundle(agent, null, 0, null, 0, 0.0, Map.of(), List.of(), Map.of(), null, Set.of());
    }

    public ConfigBundle withIdentity(String newBundleId, int newVersion) {
        return new ConfigBundle(agent, newBundleId, newVersion, createdAt, trainingCount, accuracy,
                labelDistribution, featureImportances, thresholds, modelType, sourcesUsed);
    }
}
