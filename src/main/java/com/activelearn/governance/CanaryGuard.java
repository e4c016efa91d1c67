package com.activelearn.governance;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.runtime.AppConfig;
import com.activelearn.versioning.AgentLocks;
import com.activelearn.versioning.ApprovalRequest;
import com.activelearn.versioning.BundleManager;
import com.activelearn.versioning.BundleState;
import com.activelearn.versioning.CanarySlot;
import com.activelearn.versioning.InvalidStateTransitionException;

/**
 * Watches deployed canaries and moves them forward or back based on regression checks.
 *
 * <p>Detector failures never escalate: an evaluation that cannot be completed yields {@link Recommendation#MONITOR}.
 * Promotion and rollback run under the agent's lock and go through {@link BundleManager}.
 */
public class CanaryGuard {
    private static final Logger log = LoggerFactory.getLogger(CanaryGuard.class);

    private final BundleManager bundles;
    private final RegressionDetector detector;
    private final CanaryPolicy policy;
    private final AgentLocks locks;
    private final AppConfig.CanaryConfig config;
    private final Clock clock;

    public CanaryGuard(BundleManager bundles, RegressionDetector detector, AgentLocks locks, AppConfig.CanaryConfig config) {
        this(bundles, detector, locks, config, Clock.systemUTC());
    }

    public CanaryGuard(
            BundleManager bundles,
            RegressionDetector detector,
            AgentLocks locks,
            AppConfig.CanaryConfig config,
            Clock clock) {
        this.bundles = Objects.requireNonNull(bundles, "bundles");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.config = Objects.requireNonNull(config, "config");
        this.policy = CanaryPolicy.fromConfig(config);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CanaryCheck checkCanaryPerformance(String agent) {
        return checkCanaryPerformance(agent, config.getLookbackHours());
    }

    public CanaryCheck checkCanaryPerformance(String agent, int lookbackHours) {
        CanaryCheck check;
        try {
            check = policy.evaluate(agent, detector.compare(agent, lookbackHours));
        } catch (RegressionDetectionException | RuntimeException e) {
            log.warn("guard.check.inconclusive agent={} reason={}", agent, e.getMessage());
            check = CanaryCheck.inconclusive(agent, "regression detector unavailable: " + e.getMessage());
        }
        log.info("guard.check agent={} quality_delta={} latency_delta={} recommendation={}",
                agent, check.qualityDelta(), check.latencyDelta(), check.recommendation().wireName());
        return check;
    }

    public int promoteCanary(String agent, int targetPercent) throws IOException {
        return locks.withLock(agent, () -> {
            CanarySlot slot = bundles.canary(agent)
                    .orElseThrow(() -> new InvalidStateTransitionException("promote canary for " + agent, "no canary", "a deployed canary"));
            if (targetPercent <= slot.percent() || targetPercent > 100) {
                throw new IllegalArgumentException(
                        "Target percent must be above the current " + slot.percent() + "% and at most 100, got " + targetPercent);
            }
            if (targetPercent == 100) {
                bundles.finalizeCanary(agent);
                return 100;
            }
            return bundles.setCanaryPercent(agent, targetPercent).percent();
        });
    }

    public void rollbackCanary(String agent) throws IOException {
        locks.withLock(agent, () -> bundles.clearCanary(agent));
    }

    public BundleState startRollout(String approvalId) throws IOException {
        return bundles.applyApprovedBundle(approvalId, firstStage(config.getStages()));
    }

    public RolloutResult gradualRollout(String agent) throws IOException {
        return gradualRollout(agent, config.getStages(), config.getCheckIntervalHours());
    }

    /**
     * Runs one cycle of the staged rollout: wait out the check interval, then roll back, advance to the next stage, or
     * keep monitoring. The interval counts from the stage change or from the last check that did not move the canary. After {@code maxStalledChecks} monitoring cycles in a row the canary is reported stuck until an
     * operator acts; a regression still rolls it back.
     */
    public RolloutResult gradualRollout(String agent, List<Integer> stages, int checkIntervalHours) throws IOException {
        return locks.withLock(agent, () -> {
            Optional<CanarySlot> current = bundles.canary(agent);
            if (current.isEmpty()) {
                return new RolloutResult(agent, RolloutStatus.NO_CANARY, 0, null, "no canary deployed");
            }
            CanarySlot slot = current.get();
            Instant due = slot.nextCheckAfter(Duration.ofHours(checkIntervalHours));
            if (clock.instant().isBefore(due)) {
                return new RolloutResult(agent, RolloutStatus.WAITING, slot.percent(), null, "next check after " + due);
            }

            CanaryCheck check = checkCanaryPerformance(agent);
            if (check.recommendation() == Recommendation.ROLLBACK) {
                bundles.clearCanary(agent);
                log.warn("guard.rollback agent={} bundle={} reason={}", agent, slot.bundleId(), check.reason());
                return new RolloutResult(agent, RolloutStatus.ROLLED_BACK, 0, check, check.reason());
            }
            if (slot.stalledChecks() >= config.getMaxStalledChecks()) {
                CanarySlot stuck = bundles.recordStalledCheck(agent);
                log.warn("guard.stuck agent={} bundle={} percent={} stalled_checks={}",
                        agent, slot.bundleId(), slot.percent(), stuck.stalledChecks());
                return new RolloutResult(agent, RolloutStatus.STUCK, slot.percent(), check,
                        "stalled after " + stuck.stalledChecks() + " checks, needs an operator");
            }
            if (check.recommendation() == Recommendation.PROMOTE) {
                int next = nextStage(stages, slot.percent());
                if (next >= 100) {
                    bundles.finalizeCanary(agent);
                    log.info("guard.complete agent={} bundle={}", agent, slot.bundleId());
                    return new RolloutResult(agent, RolloutStatus.COMPLETE, 0, check, "canary promoted to active");
                }
                bundles.setCanaryPercent(agent, next);
                log.info("guard.promote agent={} bundle={} from={} to={}", agent, slot.bundleId(), slot.percent(), next);
                return new RolloutResult(agent, RolloutStatus.PROMOTED, next, check, "advanced to " + next + "%");
            }

            CanarySlot stalled = bundles.recordStalledCheck(agent);
            if (stalled.stalledChecks() >= config.getMaxStalledChecks()) {
                log.warn("guard.stuck agent={} bundle={} percent={} stalled_checks={}",
                        agent, slot.bundleId(), slot.percent(), stalled.stalledChecks());
                return new RolloutResult(agent, RolloutStatus.STUCK, slot.percent(), check,
                        "stalled after " + stalled.stalledChecks() + " checks, needs an operator");
            }
            return new RolloutResult(agent, RolloutStatus.MONITORING, slot.percent(), check, check.reason());
        });
    }

    public List<RolloutResult> nightlyGuardCheck() throws IOException {
        List<RolloutResult> results = new ArrayList<>();
        for (CanarySlot canary : bundles.activeCanaries()) {
            String agent = canary.agent();
            try {
                results.add(gradualRollout(agent));
            } catch (IOException | RuntimeException e) {
                log.error("guard.failed agent={} reason={}", agent, e.getMessage(), e);
                results.add(new RolloutResult(agent, RolloutStatus.ERROR, canary.percent(), null, e.getMessage()));
            }
        }
        log.info("guard.complete agents={}", results.size());
        return results;
    }

    public List<BundleState> autoApplyApprovedBundles() throws IOException {
        return autoApplyApprovedBundles(config.getAutoApplyPercent());
    }

    public List<BundleState> autoApplyApprovedBundles(int initialPercent) throws IOException {
        List<BundleState> applied = new ArrayList<>();
        for (ApprovalRequest approval : bundles.approvedUndeployed()) {
            try {
                applied.add(bundles.applyApprovedBundle(approval.id(), initialPercent));
            } catch (IOException | RuntimeException e) {
                log.error("guard.auto_apply.failed agent={} approval={} reason={}", approval.agent(), approval.id(), e.getMessage(), e);
            }
        }
        log.info("guard.auto_apply applied={}", applied.size());
        return applied;
    }

    static int nextStage(List<Integer> stages, int currentPercent) {
        for (int stage : stages) {
            if (stage > currentPercent) {
                return stage;
            }
        }
        return 100;
    }

    private static int firstStage(List<Integer> stages) {
        if (stages.isEmpty()) {
            throw new IllegalStateException("canary.stages must not be empty");
        }
        return stages.get(0);
    }
}
