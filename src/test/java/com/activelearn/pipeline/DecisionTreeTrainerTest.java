package com.activelearn.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionTreeTrainerTest {

    @Test
    void shouldSplitOnTheInformativeFeatureAtTheMidpoint() {
        double[][] rows = {
                {0.0, 5.0},
                {1.0, 5.0},
                {2.0, 5.0},
                {3.0, 5.0},
                {4.0, 5.0},
                {5.0, 5.0}
        };
        List<String> labels = List.of("safe", "safe", "safe", "spam", "spam", "spam");

        DecisionTreeTrainer.TreeModel model = (DecisionTreeTrainer.TreeModel) new DecisionTreeTrainer().fit(rows, labels);

        assertEquals(2.5, model.decisionBoundary(0).orElseThrow(), 1e-12);
        assertTrue(model.decisionBoundary(1).isEmpty());
        assertEquals(1.0, model.featureImportances().get(0), 1e-12);
        assertEquals(0.0, model.featureImportances().get(1), 1e-12);
        assertEquals("safe", model.predict(new double[] {1.2, 5.0}));
        assertEquals("spam", model.predict(new double[] {4.2, 5.0}));
        assertEquals(1, model.depth());
    }

    @Test
    void shouldRespectMaxDepth() {
        double[][] rows = new double[16][];
        String[] labels = new String[16];
        for (int i = 0; i < 16; i++) {
            rows[i] = new double[] {i};
            labels[i] = i % 2 == 0 ? "even" : "odd";
        }

        DecisionTreeTrainer.TreeModel model = (DecisionTreeTrainer.TreeModel) new DecisionTreeTrainer(2, 2).fit(rows, List.of(labels));

        assertTrue(model.depth() <= 2);
        assertEquals(ModelType.TREE, model.modelType());
    }

    @Test
    void shouldReturnLeafWithLowestLabelOnTie() {
        double[][] rows = {{1.0}, {1.0}};

        FittedModel model = new DecisionTreeTrainer().fit(rows, List.of("b", "a"));

        assertEquals("a", model.predict(new double[] {1.0}));
        assertEquals(0.0, model.featureImportances().get(0), 1e-12);
    }
}
