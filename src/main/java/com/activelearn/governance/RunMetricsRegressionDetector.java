package com.activelearn.governance;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class RunMetricsRegressionDetector implements RegressionDetector {
    private final RunMetricsSource source;
    private final int minSamples;
    private final Clock clock;

    public RunMetricsRegressionDetector(RunMetricsSource source, int minSamples) {
        this(source, minSamples, Clock.systemUTC());
    }

    public RunMetricsRegressionDetector(RunMetricsSource source, int minSamples, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.minSamples = minSamples;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public RegressionComparison compare(String agent, int lookbackHours) throws RegressionDetectionException {
        Instant since = clock.instant().minus(Duration.ofHours(lookbackHours));
        List<RunSample> samples;
        try {
            samples = source.findSince(agent, since);
        } catch (IOException e) {
            throw new RegressionDetectionException("Could not read run metrics for " + agent, e);
        }

        List<RunSample> canary = new ArrayList<>();
        List<RunSample> active = new ArrayList<>();
        for (RunSample sample : samples) {
            (sample.canary() ? canary : active).add(sample);
        }
        if (canary.size() < minSamples) {
            throw new RegressionDetectionException(
                    "Only " + canary.size() + " canary runs for " + agent + " in the last " + lookbackHours + "h, need " + minSamples);
        }
        if (active.isEmpty()) {
            throw new RegressionDetectionException("No active runs for " + agent + " in the last " + lookbackHours + "h");
        }

        double qualityDelta = relativeDelta(meanQuality(canary), meanQuality(active));
        double latencyDelta = relativeDelta(p95Latency(canary), p95Latency(active));
        return new RegressionComparison(qualityDelta, latencyDelta);
    }

    static double meanQuality(List<RunSample> samples) {
        return samples.stream().mapToDouble(RunSample::quality).average().orElse(0.0);
    }

    /**
     * Nearest-rank 95th percentile.
     */
    static double p95Latency(List<RunSample> samples) {
        double[] latencies = samples.stream().mapToDouble(RunSample::latencyMs).toArray();
        Arrays.sort(latencies);
        int rank = (int) Math.ceil(0.95 * latencies.length);
        return latencies[Math.max(0, rank - 1)];
    }

    private static double relativeDelta(double canary, double active) {
        if (active == 0.0) {
            return canary == 0.0 ? 0.0 : Math.signum(canary);
        }
        return (canary - active) / Math.abs(active);
    }
}
