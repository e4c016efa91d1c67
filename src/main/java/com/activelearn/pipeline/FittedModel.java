package com.activelearn.pipeline;

import java.util.List;
import java.util.OptionalDouble;

public interface FittedModel {

    String predict(double[] row);

    List<Double> featureImportances();

    double featureWeight(int featureIndex);

    /**
     * Value of the feature (in standardized units) where the model's decision flips, if the model has one.
     */
    OptionalDouble decisionBoundary(int featureIndex);

    List<String> classes();

    ModelType modelType();
}
