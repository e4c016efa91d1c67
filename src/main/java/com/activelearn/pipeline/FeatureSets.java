package com.activelearn.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;

public final class FeatureSets {
    public static final String INBOX_TRIAGE = "inbox_triage";
    public static final String INSIGHTS_WRITER = "insights_writer";
    public static final String KNOWLEDGE_UPDATE = "knowledge_update";

    private final Map<String, FeatureSet> byAgent = new TreeMap<>();

    public static FeatureSets defaults() {
        FeatureSets sets = new FeatureSets();
        sets.register(inboxTriage());
        sets.register(insightsWriter());
        sets.register(knowledgeUpdate());
        return sets;
    }

    public FeatureSets register(FeatureSet featureSet) {
        byAgent.put(featureSet.agent(), featureSet);
        return this;
    }

    public Optional<FeatureSet> forAgent(String agent) {
        return Optional.ofNullable(byAgent.get(agent));
    }

    public List<String> agents() {
        return List.copyOf(byAgent.keySet());
    }

    static FeatureSet inboxTriage() {
        return new FeatureSet(INBOX_TRIAGE, List.of(
                new FeatureSet.Feature("risk_score", payload -> number(payload, "risk_score", 0.0)),
                new FeatureSet.Feature("spf_fail", payload -> number(payload, "spf_fail", 0.0)),
                new FeatureSet.Feature("dkim_fail", payload -> number(payload, "dkim_fail", 0.0)),
                new FeatureSet.Feature("suspicious_keywords", payload -> size(payload, "suspicious_keywords")),
                new FeatureSet.Feature("attachments", payload -> size(payload, "attachments")),
                new FeatureSet.Feature("sender_domain_age_days", payload -> number(payload, "sender_domain_age_days", 0.0)),
                new FeatureSet.Feature("recipient_count", payload -> number(payload, "recipient_count", 1.0))),
                (model, scaler) -> {
                    Map<String, Double> thresholds = new LinkedHashMap<>();
                    thresholds.put("risk_score_threshold", boundary(model, scaler, 0, 50.0));
                    double spfDkim = model.modelType() == ModelType.LOGISTIC
                            ? round(Math.abs(model.featureWeight(1) + model.featureWeight(2)), 2)
                            : 1.0;
                    thresholds.put("spf_dkim_weight", spfDkim);
                    return thresholds;
                });
    }

    static FeatureSet insightsWriter() {
        return new FeatureSet(INSIGHTS_WRITER, List.of(
                new FeatureSet.Feature("pattern_strength", payload -> number(payload, "pattern_strength", 0.0)),
                new FeatureSet.Feature("data_points_count", payload -> number(payload, "data_points_count", 0.0)),
                new FeatureSet.Feature("confidence_score", payload -> number(payload, "confidence_score", 0.0)),
                new FeatureSet.Feature("statistical_significance", payload -> number(payload, "statistical_significance", 0.0)),
                new FeatureSet.Feature("novelty_score", payload -> number(payload, "novelty_score", 0.0))),
                (model, scaler) -> {
                    Map<String, Double> thresholds = new LinkedHashMap<>();
                    thresholds.put("pattern_strength_threshold", boundary(model, scaler, 0, 70.0));
                    thresholds.put("min_data_points", 10.0);
                    return thresholds;
                });
    }

    static FeatureSet knowledgeUpdate() {
        return new FeatureSet(KNOWLEDGE_UPDATE, List.of(
                new FeatureSet.Feature("similarity_score", payload -> number(payload, "similarity_score", 0.0)),
                new FeatureSet.Feature("frequency_delta", payload -> number(payload, "frequency_delta", 0.0)),
                new FeatureSet.Feature("co_occurrence_count", payload -> number(payload, "co_occurrence_count", 0.0)),
                new FeatureSet.Feature("context_overlap_ratio", payload -> number(payload, "context_overlap_ratio", 0.0))),
                (model, scaler) -> {
                    Map<String, Double> thresholds = new LinkedHashMap<>();
                    thresholds.put("similarity_threshold", boundary(model, scaler, 0, 80.0));
                    thresholds.put("min_co_occurrence", 3.0);
                    return thresholds;
                });
    }

    static double boundary(FittedModel model, FeatureScaler scaler, int featureIndex, double fallback) {
        OptionalDouble scaled = model.decisionBoundary(featureIndex);
        if (scaled.isEmpty() || !Double.isFinite(scaled.getAsDouble())) {
            return fallback;
        }
        double raw = scaler.inverse(featureIndex, scaled.getAsDouble());
        return round(Math.max(0.0, Math.min(100.0, raw)), 1);
    }

    static double number(JsonNode payload, String field, double fallback) {
        JsonNode value = payload == null ? null : payload.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1.0 : 0.0;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static double size(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        if (value == null || value.isNull()) {
            return 0.0;
        }
        return value.isContainerNode() ? value.size() : number(payload, field, 0.0);
    }

    static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
