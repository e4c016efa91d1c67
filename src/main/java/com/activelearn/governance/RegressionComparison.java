package com.activelearn.governance;

/**
 * Relative change of the canary against the active bundle: {@code (canary - active) / active}.
 */
public record RegressionComparison(double qualityDelta, double latencyDelta) {
}
