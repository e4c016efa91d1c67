package com.activelearn.governance;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.activelearn.feedback.JsonLinesLabeledExampleStore;
import com.activelearn.feedback.LabelSource;
import com.activelearn.feedback.LabeledExample;
import com.activelearn.feedback.LabeledExampleStore;
import com.activelearn.pipeline.ConfigBundle;
import com.activelearn.pipeline.FeatureSets;
import com.activelearn.pipeline.HeuristicTrainer;
import com.activelearn.pipeline.ModelType;
import com.activelearn.runtime.AppConfig;
import com.activelearn.store.InMemorySettingsStore;
import com.activelearn.testing.MutableClock;
import com.activelearn.versioning.AgentLocks;
import com.activelearn.versioning.BundleManager;
import com.activelearn.versioning.BundleState;
import com.activelearn.versioning.BundleStatus;
import com.activelearn.versioning.InvalidStateTransitionException;
import com.activelearn.versioning.SettingsApprovalRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanaryGuardTest {
    private static final String AGENT = "inbox_triage";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private BundleManager bundles;
    private StubDetector detector;
    private CanaryGuard guard;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-03-01T02:00:00Z"));
        InMemorySettingsStore settings = new InMemorySettingsStore(clock);
        LabeledExampleStore labels = new JsonLinesLabeledExampleStore(tempDir.resolve("labeled.jsonl"));
        seed(labels);
        AgentLocks locks = new AgentLocks();
        HeuristicTrainer trainer = new HeuristicTrainer(labels, FeatureSets.defaults(), HeuristicTrainer.defaultTrainers(5), clock);
        bundles = new BundleManager(settings, trainer, new SettingsApprovalRepository(settings, clock), locks,
                new AppConfig.BundlesConfig(), clock);
        detector = new StubDetector();
        guard = new CanaryGuard(bundles, detector, locks, new AppConfig.CanaryConfig(), clock);
    }

    @Test
    void shouldRecommendRollbackOnQualityDrop() throws Exception {
        ConfigBundle active = approveAndApply(null);
        clock.advance(Duration.ofMinutes(1));
        approveAndApply(10);
        detector.next = new RegressionComparison(-0.08, 0.0);

        CanaryCheck check = guard.checkCanaryPerformance(AGENT, 24);

        assertEquals(Recommendation.ROLLBACK, check.recommendation());
        assertTrue(check.hasRegression());
        assertEquals(-0.08, check.qualityDelta());
        assertEquals(24, detector.lastLookbackHours);

        guard.rollbackCanary(AGENT);

        assertEquals(0, bundles.canaryPercent(AGENT));
        assertEquals(active, bundles.activeBundle(AGENT).orElseThrow());
        assertEquals(active, bundles.backup(AGENT).orElseThrow());
    }

    @Test
    void shouldApplyAsymmetricThresholds() {
        CanaryPolicy policy = CanaryPolicy.defaults();

        assertEquals(Recommendation.MONITOR, policy.evaluate(AGENT, new RegressionComparison(-0.05, 0.0)).recommendation());
        assertEquals(Recommendation.ROLLBACK, policy.evaluate(AGENT, new RegressionComparison(0.0, 0.11)).recommendation());
        assertEquals(Recommendation.PROMOTE, policy.evaluate(AGENT, new RegressionComparison(0.03, 0.0)).recommendation());
        assertEquals(Recommendation.PROMOTE, policy.evaluate(AGENT, new RegressionComparison(0.0, -0.11)).recommendation());
        assertEquals(Recommendation.MONITOR, policy.evaluate(AGENT, new RegressionComparison(0.02, 0.10)).recommendation());
        assertEquals(Recommendation.ROLLBACK, policy.evaluate(AGENT, new RegressionComparison(0.05, 0.2)).recommendation());
    }

    @Test
    void shouldTreatDetectorFailureAsMonitor() {
        detector.failure = new RegressionDetectionException("only 3 canary runs");

        CanaryCheck check = guard.checkCanaryPerformance(AGENT);

        assertEquals(Recommendation.MONITOR, check.recommendation());
        assertFalse(check.hasRegression());
        assertNull(check.qualityDelta());
        assertTrue(check.reason().contains("only 3 canary runs"));
    }

    @Test
    void shouldWalkThroughStagesUntilActive() throws Exception {
        ConfigBundle canary = approveAndApply(10);
        detector.next = new RegressionComparison(0.04, -0.02);

        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());

        clock.advance(Duration.ofHours(24));
        RolloutResult promoted = guard.gradualRollout(AGENT);
        assertEquals(RolloutStatus.PROMOTED, promoted.status());
        assertEquals(50, promoted.percent());
        assertEquals(50, bundles.canaryPercent(AGENT));

        clock.advance(Duration.ofHours(12));
        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());

        clock.advance(Duration.ofHours(12));
        RolloutResult complete = guard.gradualRollout(AGENT);
        assertEquals(RolloutStatus.COMPLETE, complete.status());
        assertEquals(canary, bundles.activeBundle(AGENT).orElseThrow());
        assertTrue(bundles.canary(AGENT).isEmpty());
        assertEquals(BundleStatus.ACTIVE, bundles.state(AGENT, canary.bundleId()).orElseThrow().status());
        assertEquals(RolloutStatus.NO_CANARY, guard.gradualRollout(AGENT).status());
    }

    @Test
    void shouldReportStuckAfterRepeatedMonitoring() throws Exception {
        approveAndApply(10);
        detector.next = new RegressionComparison(0.0, 0.0);

        clock.advance(Duration.ofHours(24));
        assertEquals(RolloutStatus.MONITORING, guard.gradualRollout(AGENT).status());
        clock.advance(Duration.ofHours(24));
        assertEquals(RolloutStatus.MONITORING, guard.gradualRollout(AGENT).status());
        clock.advance(Duration.ofHours(24));
        assertEquals(RolloutStatus.STUCK, guard.gradualRollout(AGENT).status());

        detector.next = new RegressionComparison(0.05, 0.0);
        clock.advance(Duration.ofHours(24));
        RolloutResult stillStuck = guard.gradualRollout(AGENT);
        assertEquals(RolloutStatus.STUCK, stillStuck.status());
        assertEquals(10, bundles.canaryPercent(AGENT));

        detector.next = new RegressionComparison(-0.2, 0.0);
        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());
        clock.advance(Duration.ofHours(24));
        RolloutResult rolledBack = guard.gradualRollout(AGENT);
        assertEquals(RolloutStatus.ROLLED_BACK, rolledBack.status());
        assertEquals(0, bundles.canaryPercent(AGENT));
    }

    @Test
    void shouldWaitAFullIntervalAfterEachMonitorResult() throws Exception {
        approveAndApply(10);
        detector.next = new RegressionComparison(0.0, 0.0);
        clock.advance(Duration.ofHours(25));

        assertEquals(RolloutStatus.MONITORING, guard.gradualRollout(AGENT).status());
        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());
        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());
        assertEquals(1, bundles.canary(AGENT).orElseThrow().stalledChecks());

        clock.advance(Duration.ofHours(23));
        assertEquals(RolloutStatus.WAITING, guard.gradualRollout(AGENT).status());

        clock.advance(Duration.ofHours(2));
        assertEquals(RolloutStatus.MONITORING, guard.gradualRollout(AGENT).status());
        assertEquals(2, bundles.canary(AGENT).orElseThrow().stalledChecks());
    }

    @Test
    void shouldResetStalledCountWhenOperatorPromotes() throws Exception {
        ConfigBundle canary = approveAndApply(10);
        detector.next = new RegressionComparison(0.0, 0.0);
        clock.advance(Duration.ofHours(24));
        guard.gradualRollout(AGENT);

        assertEquals(50, guard.promoteCanary(AGENT, 50));
        assertEquals(0, bundles.canary(AGENT).orElseThrow().stalledChecks());
        assertThrows(IllegalArgumentException.class, () -> guard.promoteCanary(AGENT, 50));
        assertThrows(IllegalArgumentException.class, () -> guard.promoteCanary(AGENT, 101));

        assertEquals(100, guard.promoteCanary(AGENT, 100));
        assertEquals(canary, bundles.activeBundle(AGENT).orElseThrow());
        assertThrows(InvalidStateTransitionException.class, () -> guard.promoteCanary(AGENT, 100));
    }

    @Test
    void shouldRunNightlyCheckAndAutoApply() throws Exception {
        assertTrue(guard.nightlyGuardCheck().isEmpty());

        ConfigBundle bundle = bundles.createBundle(AGENT, 50, ModelType.LOGISTIC);
        String approvalId = bundles.proposeBundle(AGENT, bundle.bundleId(), "alice");
        bundles.approveBundle(approvalId, "bob", null);

        List<BundleState> applied = guard.autoApplyApprovedBundles();
        assertEquals(1, applied.size());
        assertEquals(10, applied.get(0).canaryPercent());
        assertTrue(guard.autoApplyApprovedBundles().isEmpty());

        detector.next = new RegressionComparison(0.0, 0.3);
        clock.advance(Duration.ofHours(25));
        List<RolloutResult> results = guard.nightlyGuardCheck();

        assertEquals(1, results.size());
        assertEquals(RolloutStatus.ROLLED_BACK, results.get(0).status());
        assertEquals(BundleStatus.ROLLED_BACK, bundles.state(AGENT, bundle.bundleId()).orElseThrow().status());
    }

    @Test
    void shouldPickNextStage() {
        assertEquals(50, CanaryGuard.nextStage(List.of(10, 50, 100), 10));
        assertEquals(50, CanaryGuard.nextStage(List.of(10, 50, 100), 25));
        assertEquals(100, CanaryGuard.nextStage(List.of(10, 50, 100), 50));
        assertEquals(100, CanaryGuard.nextStage(List.of(10, 50), 50));
    }

    private ConfigBundle approveAndApply(Integer percent) throws Exception {
        ConfigBundle bundle = bundles.createBundle(AGENT, 50, ModelType.LOGISTIC);
        String approvalId = bundles.proposeBundle(AGENT, bundle.bundleId(), "alice");
        bundles.approveBundle(approvalId, "bob", null);
        if (percent == null) {
            bundles.applyApprovedBundle(approvalId, null);
        } else {
            guard.startRollout(approvalId);
            assertEquals(percent, bundles.canaryPercent(AGENT));
        }
        return bundle;
    }

    private void seed(LabeledExampleStore labels) throws Exception {
        for (int i = 0; i < 60; i++) {
            boolean risky = i % 3 != 0;
            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("risk_score", risky ? 70 + (i % 20) : 10 + (i % 20));
            labels.append(new LabeledExample("id-" + i, AGENT, "k-" + i, payload, risky ? "quarantine" : "safe",
                    LabelSource.APPROVALS, "req-" + i, 100, null, clock.instant()));
        }
    }

    private static final class StubDetector implements RegressionDetector {
        RegressionComparison next = new RegressionComparison(0.0, 0.0);
        RegressionDetectionException failure;
        int lastLookbackHours;

        @Override
        public RegressionComparison compare(String agent, int lookbackHours) throws RegressionDetectionException {
            lastLookbackHours = lookbackHours;
            if (failure != null) {
                throw failure;
            }
            return next;
        }
    }
}
