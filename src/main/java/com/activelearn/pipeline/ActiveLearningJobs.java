package com.activelearn.pipeline;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.governance.CanaryGuard;
import com.activelearn.governance.RolloutResult;
import com.activelearn.ingest.FeedLoader;
import com.activelearn.judging.JudgeWeightCalculator;
import com.activelearn.review.ReviewCandidate;
import com.activelearn.review.UncertaintySampler;
import com.activelearn.runtime.ActiveLearningControl;
import com.activelearn.runtime.AppConfig;

public class ActiveLearningJobs {
    private static final Logger log = LoggerFactory.getLogger(ActiveLearningJobs.class);

    private final ActiveLearningControl control;
    private final FeedLoader feedLoader;
    private final JudgeWeightCalculator judgeWeights;
    private final UncertaintySampler sampler;
    private final CanaryGuard guard;
    private final AppConfig.FeedsConfig feedsConfig;
    private final Clock clock;

    public ActiveLearningJobs(
            ActiveLearningControl control,
            FeedLoader feedLoader,
            JudgeWeightCalculator judgeWeights,
            UncertaintySampler sampler,
            CanaryGuard guard,
            AppConfig.FeedsConfig feedsConfig) {
        this(control, feedLoader, judgeWeights, sampler, guard, feedsConfig, Clock.systemUTC());
    }

    public ActiveLearningJobs(
            ActiveLearningControl control,
            FeedLoader feedLoader,
            JudgeWeightCalculator judgeWeights,
            UncertaintySampler sampler,
            CanaryGuard guard,
            AppConfig.FeedsConfig feedsConfig,
            Clock clock) {
        this.control = Objects.requireNonNull(control, "control");
        this.feedLoader = Objects.requireNonNull(feedLoader, "feedLoader");
        this.judgeWeights = Objects.requireNonNull(judgeWeights, "judgeWeights");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.feedsConfig = Objects.requireNonNull(feedsConfig, "feedsConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public JobReport loadFeeds() throws IOException {
        if (control.isPaused()) {
            return JobReport.paused("load_feeds");
        }
        Instant since = clock.instant().minus(Duration.ofDays(feedsConfig.getLookbackDays()));
        Map<String, Integer> counts = feedLoader.loadAll(since, feedsConfig.getLimit());
        return JobReport.ok("load_feeds", "loaded " + counts);
    }

    public JobReport nightlyUpdateWeights() throws IOException {
        if (control.isPaused()) {
            return JobReport.paused("update_weights");
        }
        Map<String, Map<String, Double>> weights = judgeWeights.nightlyUpdateWeights();
        return JobReport.ok("update_weights", "updated " + weights.size() + " agents");
    }

    public JobReport dailySampleReviewQueue() throws IOException {
        if (control.isPaused()) {
            return JobReport.paused("sample_review");
        }
        Map<String, List<ReviewCandidate>> queues = sampler.dailySampleReviewQueue();
        int total = queues.values().stream().mapToInt(List::size).sum();
        return JobReport.ok("sample_review", "queued " + total + " candidates for " + queues.size() + " agents");
    }

    public JobReport nightlyGuardCheck() throws IOException {
        if (control.isPaused()) {
            return JobReport.paused("guard");
        }
        List<RolloutResult> results = guard.nightlyGuardCheck();
        List<String> outcomes = new ArrayList<>();
        for (RolloutResult result : results) {
            outcomes.add(result.agent() + "=" + result.status().wireName());
        }
        return JobReport.ok("guard", "checked " + outcomes);
    }

    public List<JobReport> runAll() {
        List<JobReport> reports = new ArrayList<>();
        reports.add(run("load_feeds", this::loadFeeds));
        reports.add(run("update_weights", this::nightlyUpdateWeights));
        reports.add(run("sample_review", this::dailySampleReviewQueue));
        reports.add(run("guard", this::nightlyGuardCheck));
        return reports;
    }

    private JobReport run(String job, Job action) {
        try {
            JobReport report = action.run();
            log.info("jobs.run job={} status={} summary=\"{}\"", job, report.status().wireName(), report.summary());
            return report;
        } catch (IOException | RuntimeException e) {
            log.error("jobs.failed job={} reason={}", job, e.getMessage(), e);
            return new JobReport(job, JobStatus.FAILED, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Job {
        JobReport run() throws IOException;
    }

    public enum JobStatus {
        OK,
        PAUSED,
        FAILED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record JobReport(String job, JobStatus status, String summary) {

        static JobReport ok(String job, String summary) {
            return new JobReport(job, JobStatus.OK, summary);
        }

        static JobReport paused(String job) {
            return new JobReport(job, JobStatus.PAUSED, "active learning is paused");
        }
    }
}
