package com.activelearn.review;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

import com.activelearn.judging.JudgeScore;

/**
 * Turns a judge ensemble's scores into one uncertainty value in [0, 1].
 *
 * <p>Methods are tried in priority order: verdict disagreement (normalized Shannon entropy), then a low weighted
 * confidence, then the weighted variance of confidences rescaled by the maximum variance possible on [0, 1].
 */
public final class UncertaintyScorer {
    // variance of a [0, 1] variable never exceeds 1/4
    static final double MAX_VARIANCE = 0.25;

    private final double lowConfidenceThreshold;

    public UncertaintyScorer(double lowConfidenceThreshold) {
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public Optional<Result> score(List<JudgeScore> scores, ToDoubleFunction<String> weightOf) {
        List<JudgeScore> usable = new ArrayList<>();
        for (JudgeScore score : scores) {
            if (score.judgeId() != null && score.hasVerdict()) {
                usable.add(score);
            }
        }
        if (usable.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Integer> verdictCounts = new LinkedHashMap<>();
        for (JudgeScore score : usable) {
            verdictCounts.merge(score.verdict(), 1, Integer::sum);
        }
        if (verdictCounts.size() > 1) {
            double entropy = 0.0;
            for (int count : verdictCounts.values()) {
                double p = (double) count / usable.size();
                entropy -= p * log2(p);
            }
            return Optional.of(new Result(bounded(entropy / log2(verdictCounts.size())), UncertaintyMethod.DISAGREEMENT));
        }

        double[] weights = new double[usable.size()];
        double weightSum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.max(0.0, weightOf.applyAsDouble(usable.get(i).judgeId()));
            weightSum += weights[i];
        }
        if (weightSum <= 0.0) {
            Arrays.fill(weights, 1.0);
            weightSum = weights.length;
        }

        double weightedConfidence = 0.0;
        for (int i = 0; i < weights.length; i++) {
            weightedConfidence += weights[i] * usable.get(i).normalizedConfidence();
        }
        weightedConfidence /= weightSum;
        if (weightedConfidence < lowConfidenceThreshold) {
            return Optional.of(new Result(bounded(1.0 - weightedConfidence), UncertaintyMethod.LOW_CONFIDENCE));
        }

        double variance = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double centered = usable.get(i).normalizedConfidence() - weightedConfidence;
            variance += weights[i] * centered * centered;
        }
        variance /= weightSum;
        return Optional.of(new Result(bounded(variance / MAX_VARIANCE), UncertaintyMethod.WEIGHTED_VARIANCE));
    }

    private static double bounded(double value) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        return Math.round(clamped * 1000.0) / 1000.0;
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    public record Result(double uncertainty, UncertaintyMethod method) {
    }
}
