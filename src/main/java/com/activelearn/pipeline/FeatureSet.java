package com.activelearn.pipeline;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

import com.fasterxml.jackson.databind.JsonNode;

public final class FeatureSet {
    private final String agent;
    private final List<Feature> features;
    private final ThresholdRule thresholdRule;

    public FeatureSet(String agent, List<Feature> features, ThresholdRule thresholdRule) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.features = List.copyOf(features);
        this.thresholdRule = Objects.requireNonNull(thresholdRule, "thresholdRule");
        if (this.features.isEmpty()) {
            throw new IllegalArgumentException("Feature set for " + agent + " has no features");
        }
    }

    public String agent() {
        return agent;
    }

    public List<String> featureNames() {
        return features.stream().map(Feature::name).toList();
    }

    public int size() {
        return features.size();
    }

    public double[] extract(JsonNode payload) {
        double[] row = new double[features.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = features.get(i).extractor().applyAsDouble(payload);
        }
        return row;
    }

    public Map<String, Double> thresholds(FittedModel model, FeatureScaler scaler) {
        return thresholdRule.derive(model, scaler);
    }

    public record Feature(String name, ToDoubleFunction<JsonNode> extractor) {
    }

    @FunctionalInterface
    public interface ThresholdRule {
        Map<String, Double> derive(FittedModel model, FeatureScaler scaler);
    }
}
