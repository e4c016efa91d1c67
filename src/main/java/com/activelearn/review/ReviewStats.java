package com.activelearn.review;

import java.util.Map;

public record ReviewStats(
        long recentPredictions,
        long totalLabeled,
        long totalUnlabeled,
        Map<String, Long> unlabeledByAgent,
        Map<String, Integer> queuedByAgent) {
}
