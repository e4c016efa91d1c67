package com.activelearn.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * L2-regularized logistic regression fitted by full-batch gradient descent.
 *
 * <p>Two classes give one model whose coefficients score the second class (in sorted order); more classes give
 * one-vs-rest models, one per class. Row 0 of the coefficients drives importances and decision boundaries.
 */
public class LogisticRegressionTrainer implements Trainer {
    private final int maxIterations;
    private final double learningRate;
    private final double inverseRegularization;

    public LogisticRegressionTrainer() {
        this(1000, 0.5, 1.0);
    }

    public LogisticRegressionTrainer(int maxIterations, double learningRate, double inverseRegularization) {
        if (maxIterations <= 0 || learningRate <= 0 || inverseRegularization <= 0) {
            throw new IllegalArgumentException("maxIterations, learningRate and inverseRegularization must be > 0");
        }
        this.maxIterations = maxIterations;
        this.learningRate = learningRate;
        this.inverseRegularization = inverseRegularization;
    }

    @Override
    public ModelType modelType() {
        return ModelType.LOGISTIC;
    }

    @Override
    public FittedModel fit(double[][] features, List<String> labels) {
        if (features.length == 0 || features.length != labels.size()) {
            throw new IllegalArgumentException("features and labels must be non-empty and aligned");
        }
        List<String> classes = List.copyOf(new TreeSet<>(labels));
        if (classes.size() < 2) {
            throw new IllegalArgumentException("Logistic regression needs at least two classes, got " + classes);
        }

        List<String> positives = classes.size() == 2 ? List.of(classes.get(1)) : classes;
        double[][] coefficients = new double[positives.size()][];
        double[] intercepts = new double[positives.size()];
        for (int k = 0; k < positives.size(); k++) {
            String positive = positives.get(k);
            double[] target = new double[labels.size()];
            for (int i = 0; i < target.length; i++) {
                target[i] = positive.equals(labels.get(i)) ? 1.0 : 0.0;
            }
            double[] fitted = fitBinary(features, target);
            coefficients[k] = Arrays.copyOf(fitted, fitted.length - 1);
            intercepts[k] = fitted[fitted.length - 1];
        }
        return new LogisticModel(classes, coefficients, intercepts);
    }

    private double[] fitBinary(double[][] x, double[] y) {
        int n = x.length;
        int width = x[0].length;
        double lambda = 1.0 / (inverseRegularization * n);
        double[] w = new double[width];
        double b = 0.0;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double[] gradient = new double[width];
            double gradientB = 0.0;
            for (int i = 0; i < n; i++) {
                double error = sigmoid(dot(w, x[i]) + b) - y[i];
                for (int j = 0; j < width; j++) {
                    gradient[j] += error * x[i][j];
                }
                gradientB += error;
            }
            double largest = Math.abs(gradientB / n);
            for (int j = 0; j < width; j++) {
                gradient[j] = gradient[j] / n + lambda * w[j];
                largest = Math.max(largest, Math.abs(gradient[j]));
                w[j] -= learningRate * gradient[j];
            }
            b -= learningRate * gradientB / n;
            if (largest < 1e-6) {
                break;
            }
        }
        double[] out = Arrays.copyOf(w, width + 1);
        out[width] = b;
        return out;
    }

    static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static final class LogisticModel implements FittedModel {
        private final List<String> classes;
        private final double[][] coefficients;
        private final double[] intercepts;

        LogisticModel(List<String> classes, double[][] coefficients, double[] intercepts) {
            this.classes = classes;
            this.coefficients = coefficients;
            this.intercepts = intercepts;
        }

        @Override
        public String predict(double[] row) {
            if (coefficients.length == 1) {
                return sigmoid(dot(coefficients[0], row) + intercepts[0]) >= 0.5 ? classes.get(1) : classes.get(0);
            }
            int best = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < coefficients.length; k++) {
                double score = dot(coefficients[k], row) + intercepts[k];
                if (score > bestScore) {
                    bestScore = score;
                    best = k;
                }
            }
            return classes.get(best);
        }

        @Override
        public List<Double> featureImportances() {
            List<Double> importances = new ArrayList<>();
            for (double coefficient : coefficients[0]) {
                importances.add(Math.abs(coefficient));
            }
            return Collections.unmodifiableList(importances);
        }

        @Override
        public double featureWeight(int featureIndex) {
            return coefficients[0][featureIndex];
        }

        @Override
        public OptionalDouble decisionBoundary(int featureIndex) {
            double coefficient = coefficients[0][featureIndex];
            if (coefficient == 0.0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(-intercepts[0] / coefficient);
        }

        @Override
        public List<String> classes() {
            return classes;
        }

        @Override
        public ModelType modelType() {
            return ModelType.LOGISTIC;
        }
    }
}
