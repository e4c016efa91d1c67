package com.activelearn.governance;

import com.activelearn.runtime.AppConfig;

public record CanaryPolicy(
        double qualityRollbackDelta,
        double latencyRollbackDelta,
        double qualityPromoteDelta,
        double latencyPromoteDelta) {

    public static CanaryPolicy defaults() {
        return new CanaryPolicy(-0.05, 0.10, 0.02, -0.10);
    }

    public static CanaryPolicy fromConfig(AppConfig.CanaryConfig config) {
        return new CanaryPolicy(
                config.getQualityRollbackDelta(),
                config.getLatencyRollbackDelta(),
                config.getQualityPromoteDelta(),
                config.getLatencyPromoteDelta());
    }

    public CanaryCheck evaluate(String agent, RegressionComparison comparison) {
        double quality = comparison.qualityDelta();
        double latency = comparison.latencyDelta();
        if (quality < qualityRollbackDelta || latency > latencyRollbackDelta) {
            return new CanaryCheck(agent, true, quality, latency, Recommendation.ROLLBACK,
                    String.format("quality %+.3f, latency %+.3f breach rollback limits", quality, latency));
        }
        if (quality > qualityPromoteDelta || latency < latencyPromoteDelta) {
            return new CanaryCheck(agent, false, quality, latency, Recommendation.PROMOTE,
                    String.format("quality %+.3f, latency %+.3f clear promotion limits", quality, latency));
        }
        return new CanaryCheck(agent, false, quality, latency, Recommendation.MONITOR,
                String.format("quality %+.3f, latency %+.3f within monitoring band", quality, latency));
    }
}
