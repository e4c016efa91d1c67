package com.activelearn.governance;

public record CanaryCheck(
        String agent,
        boolean hasRegression,
        Double qualityDelta,
        Double latencyDelta,
        Recommendation recommendation,
        String reason) {

    static CanaryCheck inconclusive(String agent, String reason) {
        return new CanaryCheck(agent, false, null, null, Recommendation.MONITOR, reason);
    }
}
