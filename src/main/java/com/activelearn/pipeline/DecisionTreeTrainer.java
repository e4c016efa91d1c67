package com.activelearn.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * Depth-bounded CART classifier using Gini impurity.
 *
 * <p>Candidate thresholds are midpoints between consecutive distinct values. Among equally good splits the first
 * one found wins (lowest feature index, then lowest threshold), so training is deterministic.
 */
public class DecisionTreeTrainer implements Trainer {
    private final int maxDepth;
    private final int minSamplesSplit;

    public DecisionTreeTrainer() {
        this(5, 2);
    }

    public DecisionTreeTrainer(int maxDepth, int minSamplesSplit) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
        this.maxDepth = maxDepth;
        this.minSamplesSplit = Math.max(2, minSamplesSplit);
    }

    @Override
    public ModelType modelType() {
        return ModelType.TREE;
    }

    @Override
    public FittedModel fit(double[][] features, List<String> labels) {
        if (features.length == 0 || features.length != labels.size()) {
            throw new IllegalArgumentException("features and labels must be non-empty and aligned");
        }
        List<String> classes = List.copyOf(new TreeSet<>(labels));
        int[] y = new int[labels.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = Collections.binarySearch(classes, labels.get(i));
        }
        int width = features[0].length;
        double[] impurityDecrease = new double[width];
        int[] all = new int[features.length];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        Node root = grow(features, y, classes.size(), all, 0, impurityDecrease);

        double total = Arrays.stream(impurityDecrease).sum();
        List<Double> importances = new ArrayList<>(width);
        for (double decrease : impurityDecrease) {
            importances.add(total > 0 ? decrease / total : 0.0);
        }
        return new TreeModel(classes, root, Collections.unmodifiableList(importances));
    }

    private Node grow(double[][] x, int[] y, int classCount, int[] rows, int depth, double[] impurityDecrease) {
        int[] counts = classCounts(y, classCount, rows);
        double impurity = gini(counts, rows.length);
        int majority = majority(counts);
        if (depth >= maxDepth || rows.length < minSamplesSplit || impurity == 0.0) {
            return Node.leaf(majority);
        }

        int bestFeature = -1;
        double bestThreshold = 0.0;
        double bestImpurity = impurity;
        for (int feature = 0; feature < x[0].length; feature++) {
            double[] values = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                values[i] = x[rows[i]][feature];
            }
            double[] distinct = Arrays.stream(values).distinct().sorted().toArray();
            for (int t = 0; t + 1 < distinct.length; t++) {
                double threshold = (distinct[t] + distinct[t + 1]) / 2.0;
                double weighted = splitImpurity(x, y, classCount, rows, feature, threshold);
                if (weighted < bestImpurity - 1e-12) {
                    bestImpurity = weighted;
                    bestFeature = feature;
                    bestThreshold = threshold;
                }
            }
        }
        if (bestFeature < 0) {
            return Node.leaf(majority);
        }

        int[] left = partition(x, rows, bestFeature, bestThreshold, true);
        int[] right = partition(x, rows, bestFeature, bestThreshold, false);
        impurityDecrease[bestFeature] += rows.length * impurity - rows.length * bestImpurity;
        return Node.split(
                bestFeature,
                bestThreshold,
                majority,
                grow(x, y, classCount, left, depth + 1, impurityDecrease),
                grow(x, y, classCount, right, depth + 1, impurityDecrease));
    }

    private static double splitImpurity(double[][] x, int[] y, int classCount, int[] rows, int feature, double threshold) {
        int[] leftCounts = new int[classCount];
        int[] rightCounts = new int[classCount];
        int leftSize = 0;
        for (int row : rows) {
            if (x[row][feature] <= threshold) {
                leftCounts[y[row]]++;
                leftSize++;
            } else {
                rightCounts[y[row]]++;
            }
        }
        int rightSize = rows.length - leftSize;
        return (leftSize * gini(leftCounts, leftSize) + rightSize * gini(rightCounts, rightSize)) / rows.length;
    }

    private static int[] partition(double[][] x, int[] rows, int feature, double threshold, boolean left) {
        return Arrays.stream(rows)
                .filter(row -> (x[row][feature] <= threshold) == left)
                .toArray();
    }

    private static int[] classCounts(int[] y, int classCount, int[] rows) {
        int[] counts = new int[classCount];
        for (int row : rows) {
            counts[y[row]]++;
        }
        return counts;
    }

    private static double gini(int[] counts, int size) {
        if (size == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int count : counts) {
            double p = (double) count / size;
            sum += p * p;
        }
        return 1.0 - sum;
    }

    // ties resolve to the lowest class index
    private static int majority(int[] counts) {
        int best = 0;
        for (int k = 1; k < counts.length; k++) {
            if (counts[k] > counts[best]) {
                best = k;
            }
        }
        return best;
    }

    private record Node(int feature, double threshold, int classIndex, Node left, Node right) {
        static Node leaf(int classIndex) {
            return new Node(-1, 0.0, classIndex, null, null);
        }

        static Node split(int feature, double threshold, int classIndex, Node left, Node right) {
            return new Node(feature, threshold, classIndex, left, right);
        }

        boolean isLeaf() {
            return feature < 0;
        }
    }

    static final class TreeModel implements FittedModel {
        private final List<String> classes;
        private final Node root;
        private final List<Double> importances;

        private TreeModel(List<String> classes, Node root, List<Double> importances) {
            this.classes = classes;
            this.root = root;
            this.importances = importances;
        }

        @Override
        public String predict(double[] row) {
            Node node = root;
            while (!node.isLeaf()) {
                node = row[node.feature()] <= node.threshold() ? node.left() : node.right();
            }
            return classes.get(node.classIndex());
        }

        @Override
        public List<Double> featureImportances() {
            return importances;
        }

        @Override
        public double featureWeight(int featureIndex) {
            return importances.get(featureIndex);
        }

        @Override
        public OptionalDouble decisionBoundary(int featureIndex) {
            Deque<Node> queue = new ArrayDeque<>();
            queue.add(root);
            while (!queue.isEmpty()) {
                Node node = queue.poll();
                if (node.isLeaf()) {
                    continue;
                }
                if (node.feature() == featureIndex) {
                    return OptionalDouble.of(node.threshold());
                }
                queue.add(node.left());
                queue.add(node.right());
            }
            return OptionalDouble.empty();
        }

        @Override
        public List<String> classes() {
            return classes;
        }

        @Override
        public ModelType modelType() {
            return ModelType.TREE;
        }

        int depth() {
            return depth(root);
        }

        private static int depth(Node node) {
            return node.isLeaf() ? 0 : 1 + Math.max(depth(node.left()), depth(node.right()));
        }
    }
}
