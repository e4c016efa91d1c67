package com.activelearn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.feedback.JsonLinesLabeledExampleStore;
import com.activelearn.feedback.LabeledExampleStore;
import com.activelearn.governance.CanaryCheck;
import com.activelearn.governance.CanaryGuard;
import com.activelearn.governance.RegressionDetectors;
import com.activelearn.governance.RolloutResult;
import com.activelearn.ingest.FeedLoader;
import com.activelearn.ingest.JsonFileFeeds;
import com.activelearn.judging.JsonLinesPredictionSource;
import com.activelearn.judging.JudgeWeight;
import com.activelearn.judging.JudgeWeightCalculator;
import com.activelearn.pipeline.ActiveLearningJobs;
import com.activelearn.pipeline.ConfigBundle;
import com.activelearn.pipeline.FeatureSets;
import com.activelearn.pipeline.HeuristicTrainer;
import com.activelearn.pipeline.InsufficientDataException;
import com.activelearn.pipeline.LogisticRegressionTrainer;
import com.activelearn.pipeline.ModelType;
import com.activelearn.pipeline.Trainer;
import com.activelearn.review.ReviewCandidate;
import com.activelearn.review.UncertaintySampler;
import com.activelearn.runtime.ActiveLearningControl;
import com.activelearn.runtime.AppConfig;
import com.activelearn.store.JsonFileSettingsStore;
import com.activelearn.store.SettingsStore;
import com.activelearn.versioning.AgentLocks;
import com.activelearn.versioning.ApprovalRequest;
import com.activelearn.versioning.BundleManager;
import com.activelearn.versioning.BundleState;
import com.activelearn.versioning.CanarySlot;
import com.activelearn.versioning.InvalidStateTransitionException;
import com.activelearn.versioning.MissingBackupException;
import com.activelearn.versioning.SettingsApprovalRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "active-learning",
        mixinStandardHelpOptions = true,
        version = "active-learning 0.1.0",
        description = "Operator CLI for the active-learning and canary rollout loop.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--agent", description = "Agent the operation applies to")
    String agent;

    @Option(names = "--bundle-id", description = "Bundle id for propose mode")
    String bundleId;

    @Option(names = "--approval-id", description = "Approval request id for approve, reject and apply modes")
    String approvalId;

    @Option(names = "--actor", description = "Who performs the operation", defaultValue = "cli")
    String actor;

    @Option(names = "--rationale", description = "Reason recorded with an approval decision or pause")
    String rationale;

    @Option(names = "--percent", description = "Canary percent for apply mode (1-99) or target percent for promote mode (up to 100)")
    Integer percent;

    @Option(names = "--min-examples", description = "Minimum labeled examples required to train")
    Integer minExamples;

    @Option(names = "--model-type", description = "Classifier to train: logistic or tree")
    String modelType;

    @Option(names = "--top-n", description = "Candidates to keep per agent in sample-review mode")
    Integer topN;

    @Option(names = "--min-uncertainty", description = "Lowest uncertainty kept in sample-review mode")
    Double minUncertainty;

    @Option(names = "--lookback-hours", description = "Window for check-canary mode")
    Integer lookbackHours;

    @Option(names = "--key", description = "Task key for record-label mode")
    String key;

    @Option(names = "--label", description = "Label for record-label mode")
    String label;

    @Option(names = "--payload", description = "Task payload as JSON for record-label mode")
    String payload;

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    enum Mode {
        status,
        stats,
        load_feeds,
        record_label,
        update_weights,
        weights,
        sample_review,
        review_stats,
        create_bundle,
        propose,
        approve,
        reject,
        apply,
        rollback,
        pending,
        canaries,
        check_canary,
        promote,
        rollback_canary,
        guard,
        auto_apply,
        nightly,
        pause,
        resume
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting active-learning in {} mode", mode);
        log.info("Using config file: {}", configPath);

        Services services = new Services(config);
        try {
            return run(config, services);
        } catch (InvalidStateTransitionException | MissingBackupException | IllegalArgumentException e) {
            log.error("Rejected: {}", e.getMessage());
            return 1;
        } catch (InsufficientDataException e) {
            log.error("Not enough training data: {}", e.getMessage());
            return 1;
        }
    }

    private int run(AppConfig config, Services services) throws IOException, InsufficientDataException {
        switch (mode) {
            case status -> {
                ActiveLearningControl.Status status = services.control.status();
                log.info("Active learning paused={} reason={} actor={} since={}",
                        status.paused(), status.reason(), status.actor(), status.since());
            }
            case stats -> log.info("Labeled examples: {}", json(services.feedLoader.stats()));
            case load_feeds -> log.info("Loaded feeds: {}", services.feedLoader.loadAll());
            case record_label -> {
                if (agent == null || key == null || label == null) {
                    log.error("--agent, --key, and --label are required in record_label mode");
                    return 2;
                }
                JsonNode payloadNode = payload == null ? null : mapper.readTree(payload);
                boolean created = services.feedLoader.recordReviewLabel(agent, key, payloadNode, label, actor);
                log.info("Review label agent={} key={} created={}", agent, key, created);
            }
            case update_weights -> {
                if (agent == null) {
                    log.info("Judge weights: {}", json(services.judgeWeights.nightlyUpdateWeights()));
                } else {
                    log.info("Judge weights for {}: {}", agent, json(services.judgeWeights.updateWeightsForAgent(agent)));
                }
            }
            case weights -> {
                if (agent == null) {
                    log.error("--agent is required in weights mode");
                    return 2;
                }
                for (JudgeWeight weight : services.judgeWeights.judgeWeights(agent)) {
                    log.info("judge={} weight={} updatedAt={}", weight.judgeId(), weight.weight(), weight.updatedAt());
                }
            }
            case sample_review -> {
                if (agent == null) {
                    log.info("Review queues: {}", json(services.sampler.dailySampleReviewQueue()));
                } else {
                    int n = topN == null ? config.getReview().getTopN() : topN;
                    double min = minUncertainty == null ? 0.0 : minUncertainty;
                    List<ReviewCandidate> candidates = services.sampler.refreshQueue(agent, n, min).candidates();
                    for (ReviewCandidate candidate : candidates) {
                        log.info("key={} uncertainty={} method={}",
                                candidate.taskKey(), candidate.uncertainty(), candidate.method().wireName());
                    }
                }
            }
            case review_stats -> log.info("Review stats: {}", json(services.sampler.stats()));
            case create_bundle -> {
                if (agent == null) {
                    log.error("--agent is required in create_bundle mode");
                    return 2;
                }
                int min = minExamples == null ? config.getTraining().getMinExamples() : minExamples;
                ModelType type = ModelType.fromWireName(modelType == null ? config.getTraining().getModelType() : modelType);
                ConfigBundle bundle = services.bundles.createBundle(agent, min, type);
                log.info("Created bundle {} version={} accuracy={} thresholds={}",
                        bundle.bundleId(), bundle.version(), String.format("%.3f", bundle.accuracy()), bundle.thresholds());
            }
            case propose -> {
                if (agent == null || bundleId == null) {
                    log.error("--agent and --bundle-id are required in propose mode");
                    return 2;
                }
                String id = services.bundles.proposeBundle(agent, bundleId, actor);
                log.info("Approval request {}: {}", id, json(services.bundles.approval(id).orElseThrow().diff()));
            }
            case approve, reject -> {
                if (approvalId == null) {
                    log.error("--approval-id is required in {} mode", mode);
                    return 2;
                }
                ApprovalRequest request = mode == Mode.approve
                        ? services.bundles.approveBundle(approvalId, actor, rationale)
                        : services.bundles.rejectBundle(approvalId, actor, rationale);
                log.info("Approval {} is now {}", request.id(), request.status().wireName());
            }
            case apply -> {
                if (approvalId == null) {
                    log.error("--approval-id is required in apply mode");
                    return 2;
                }
                BundleState state = services.bundles.applyApprovedBundle(approvalId, percent);
                log.info("Bundle {} for {} is {} canaryPercent={}",
                        state.bundleId(), state.agent(), state.status().wireName(), state.canaryPercent());
            }
            case rollback -> {
                if (agent == null) {
                    log.error("--agent is required in rollback mode");
                    return 2;
                }
                ConfigBundle restored = services.bundles.rollbackBundle(agent);
                log.info("Restored bundle {} for {}", restored.bundleId(), agent);
            }
            case pending -> {
                for (ApprovalRequest request : services.bundles.listPendingApprovals()) {
                    log.info("approval={} agent={} bundle={} proposer={} diff=\"{}\"",
                            request.id(), request.agent(), request.bundleId(), request.proposer(), request.diff().summary());
                }
            }
            case canaries -> {
                for (CanarySlot canary : services.bundles.activeCanaries()) {
                    log.info("agent={} bundle={} percent={} stageStartedAt={} stalledChecks={}",
                            canary.agent(), canary.bundleId(), canary.percent(), canary.stageStartedAt(), canary.stalledChecks());
                }
            }
            case check_canary -> {
                if (agent == null) {
                    log.error("--agent is required in check_canary mode");
                    return 2;
                }
                int hours = lookbackHours == null ? config.getCanary().getLookbackHours() : lookbackHours;
                CanaryCheck check = services.guard.checkCanaryPerformance(agent, hours);
                log.info("Canary check: {}", json(check));
            }
            case promote -> {
                if (agent == null || percent == null) {
                    log.error("--agent and --percent are required in promote mode");
                    return 2;
                }
                log.info("Canary for {} now at {}%", agent, services.guard.promoteCanary(agent, percent));
            }
            case rollback_canary -> {
                if (agent == null) {
                    log.error("--agent is required in rollback_canary mode");
                    return 2;
                }
                services.guard.rollbackCanary(agent);
                log.info("Canary for {} rolled back", agent);
            }
            case guard -> {
                for (RolloutResult result : services.guard.nightlyGuardCheck()) {
                    log.info("agent={} status={} percent={} message={}",
                            result.agent(), result.status().wireName(), result.percent(), result.message());
                }
            }
            case auto_apply -> {
                int initial = percent == null ? config.getCanary().getAutoApplyPercent() : percent;
                log.info("Auto-applied {} bundles", services.guard.autoApplyApprovedBundles(initial).size());
            }
            case nightly -> {
                boolean failed = false;
                for (ActiveLearningJobs.JobReport report : services.jobs.runAll()) {
                    failed |= report.status() == ActiveLearningJobs.JobStatus.FAILED;
                }
                return failed ? 1 : 0;
            }
            case pause -> services.control.pause(rationale, actor);
            case resume -> services.control.resume(actor);
            default -> throw new IllegalStateException("Unhandled mode " + mode);
        }
        return 0;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        return yamlMapper.readValue(config.toFile(), AppConfig.class);
    }

    private String json(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }

    private static final class Services {
        final ActiveLearningControl control;
        final FeedLoader feedLoader;
        final JudgeWeightCalculator judgeWeights;
        final UncertaintySampler sampler;
        final BundleManager bundles;
        final CanaryGuard guard;
        final ActiveLearningJobs jobs;

        Services(AppConfig config) {
            AppConfig.StorageConfig storage = config.getStorage();
            Path settingsPath = Path.of(storage.getSettingsPath()).toAbsolutePath();
            SettingsStore settings = new JsonFileSettingsStore(settingsPath);
            LabeledExampleStore labels = new JsonLinesLabeledExampleStore(Path.of(storage.getLabeledExamplesPath()));
            JsonLinesPredictionSource predictions = new JsonLinesPredictionSource(Path.of(storage.getPredictionsPath()));
            // one lock file per agent beside the settings document
            AgentLocks locks = new AgentLocks(settingsPath.resolveSibling("locks"));

            AppConfig.FeedsConfig feeds = config.getFeeds();
            JsonFileFeeds files = new JsonFileFeeds(
                    Path.of(feeds.getApprovalsPath()), Path.of(feeds.getFeedbackPath()), Path.of(feeds.getGoldPath()));
            this.control = new ActiveLearningControl(settings);
            this.feedLoader = new FeedLoader(labels, files, files, files);
            this.judgeWeights = new JudgeWeightCalculator(settings, labels, predictions, locks, config.getJudges());
            this.sampler = new UncertaintySampler(settings, labels, predictions, judgeWeights, config.getReview());

            AppConfig.TrainingConfig training = config.getTraining();
            Map<ModelType, Trainer> trainers = HeuristicTrainer.defaultTrainers(training.getTreeMaxDepth());
            trainers.put(ModelType.LOGISTIC, new LogisticRegressionTrainer(training.getLogisticMaxIterations(), 0.5, 1.0));
            HeuristicTrainer trainer = new HeuristicTrainer(labels, FeatureSets.defaults(), trainers, Clock.systemUTC());
            this.bundles = new BundleManager(settings, trainer, new SettingsApprovalRepository(settings), locks, config.getBundles());
            this.guard = new CanaryGuard(bundles, RegressionDetectors.fromEnvironment(config), locks, config.getCanary());
            this.jobs = new ActiveLearningJobs(control, feedLoader, judgeWeights, sampler, guard, feeds);
        }
    }
}
