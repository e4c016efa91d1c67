package com.activelearn.pipeline;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FeatureSetsTest {

    @Test
    void shouldExtractInboxTriageFeaturesWithDefaults() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("risk_score", 72.5);
        payload.put("spf_fail", true);
        payload.put("dkim_fail", "1");
        payload.putArray("suspicious_keywords").add("urgent").add("wire");
        payload.putArray("attachments").add("a.pdf");
        payload.put("sender_domain_age_days", 3);

        double[] row = FeatureSets.inboxTriage().extract(payload);

        assertArrayEquals(new double[] {72.5, 1.0, 1.0, 2.0, 1.0, 3.0, 1.0}, row, 1e-12);
    }

    @Test
    void shouldMapBoundaryBackToRawUnitsAndClamp() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][] {{40.0, 0}, {60.0, 0}});

        assertEquals(55.0, FeatureSets.boundary(model(OptionalDouble.of(0.5)), scaler, 0, 50.0), 1e-12);
        assertEquals(100.0, FeatureSets.boundary(model(OptionalDouble.of(20.0)), scaler, 0, 50.0), 1e-12);
        assertEquals(0.0, FeatureSets.boundary(model(OptionalDouble.of(-20.0)), scaler, 0, 50.0), 1e-12);
        assertEquals(70.0, FeatureSets.boundary(model(OptionalDouble.empty()), scaler, 0, 70.0), 1e-12);
    }

    @Test
    void shouldEmitFixedThresholdsForInsightsAndKnowledgeAgents() {
        FeatureScaler scaler = FeatureScaler.fit(new double[][] {{0, 0, 0, 0, 0}, {1, 1, 1, 1, 1}});
        FittedModel noBoundary = model(OptionalDouble.empty());

        Map<String, Double> insights = FeatureSets.insightsWriter().thresholds(noBoundary, scaler);
        Map<String, Double> knowledge = FeatureSets.knowledgeUpdate().thresholds(noBoundary, scaler);

        assertEquals(Map.of("pattern_strength_threshold", 70.0, "min_data_points", 10.0), insights);
        assertEquals(Map.of("similarity_threshold", 80.0, "min_co_occurrence", 3.0), knowledge);
    }

    private static FittedModel model(OptionalDouble boundary) {
        return new FittedModel() {
            @Override
            public String predict(double[] row) {
                return "x";
            }

            @Override
            public List<Double> featureImportances() {
                return List.of();
            }

            @Override
            public double featureWeight(int featureIndex) {
                return 0.0;
            }

            @Override
            public OptionalDouble decisionBoundary(int featureIndex) {
                return boundary;
            }

            @Override
            public List<String> classes() {
                return List.of("x", "y");
            }

            @Override
            public ModelType modelType() {
                return ModelType.TREE;
            }
        };
    }
}
