package com.activelearn.versioning;

import java.time.Duration;
import java.time.Instant;

import com.activelearn.pipeline.ConfigBundle;

/**
 * The in-flight canary for one agent.
 *
 * @param stageStartedAt when the current percent took effect
 * @param stalledChecks consecutive guard checks that ended in "monitor" at this stage
 * @param lastCheckedAt last guard check that left the canary where it was, null before the first one at this stage
 */
public record CanarySlot(
        String agent,
        ConfigBundle bundle,
        int percent,
        String approvalId,
        Instant deployedAt,
        Instant stageStartedAt,
        int stalledChecks,
        Instant lastCheckedAt) {

    public String bundleId() {
        return bundle.bundleId();
    }

    public Instant nextCheckAfter(Duration interval) {
        Instant base = lastCheckedAt == null || lastCheckedAt.isBefore(stageStartedAt) ? stageStartedAt : lastCheckedAt;
        return base.plus(interval);
    }

    public CanarySlot atPercent(int newPercent, Instant at) {
        return new CanarySlot(agent, bundle, newPercent, approvalId, deployedAt, at, 0, null);
    }

    public CanarySlot withStalledCheck(Instant at) {
        return new CanarySlot(agent, bundle, percent, approvalId, deployedAt, stageStartedAt, stalledChecks + 1, at);
    }
}
