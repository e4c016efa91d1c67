package com.activelearn.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private FeedsConfig feeds = new FeedsConfig();
    private TrainingConfig training = new TrainingConfig();
    private JudgesConfig judges = new JudgesConfig();
    private ReviewConfig review = new ReviewConfig();
    private BundlesConfig bundles = new BundlesConfig();
    private CanaryConfig canary = new CanaryConfig();
    private RegressionConfig regression = new RegressionConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public FeedsConfig getFeeds() {
        return feeds;
    }

    public void setFeeds(FeedsConfig feeds) {
        this.feeds = feeds == null ? new FeedsConfig() : feeds;
    }

    public TrainingConfig getTraining() {
        return training;
    }

    public void setTraining(TrainingConfig training) {
        this.training = training == null ? new TrainingConfig() : training;
    }

    public JudgesConfig getJudges() {
        return judges;
    }

    public void setJudges(JudgesConfig judges) {
        this.judges = judges == null ? new JudgesConfig() : judges;
    }

    public ReviewConfig getReview() {
        return review;
    }

    public void setReview(ReviewConfig review) {
        this.review = review == null ? new ReviewConfig() : review;
    }

    public BundlesConfig getBundles() {
        return bundles;
    }

    public void setBundles(BundlesConfig bundles) {
        this.bundles = bundles == null ? new BundlesConfig() : bundles;
    }

    public CanaryConfig getCanary() {
        return canary;
    }

    public void setCanary(CanaryConfig canary) {
        this.canary = canary == null ? new CanaryConfig() : canary;
    }

    public RegressionConfig getRegression() {
        return regression;
    }

    public void setRegression(RegressionConfig regression) {
        this.regression = regression == null ? new RegressionConfig() : regression;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String settingsPath = ".activelearn/settings.json";
        private String labeledExamplesPath = ".activelearn/labeled-examples.jsonl";
        private String predictionsPath = ".activelearn/predictions.jsonl";
        private String runMetricsPath = ".activelearn/run-metrics.jsonl";

        public String getSettingsPath() {
            return settingsPath;
        }

        public void setSettingsPath(String settingsPath) {
            this.settingsPath = settingsPath;
        }

        public String getLabeledExamplesPath() {
            return labeledExamplesPath;
        }

        public void setLabeledExamplesPath(String labeledExamplesPath) {
            this.labeledExamplesPath = labeledExamplesPath;
        }

        public String getPredictionsPath() {
            return predictionsPath;
        }

        public void setPredictionsPath(String predictionsPath) {
            this.predictionsPath = predictionsPath;
        }

        public String getRunMetricsPath() {
            return runMetricsPath;
        }

        public void setRunMetricsPath(String runMetricsPath) {
            this.runMetricsPath = runMetricsPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeedsConfig {
        private String approvalsPath = ".activelearn/feeds/approvals.json";
        private String feedbackPath = ".activelearn/feeds/feedback.json";
        private String goldPath = ".activelearn/feeds/gold.json";
        private int lookbackDays = 7;
        private int limit = 1000;

        public String getApprovalsPath() {
            return approvalsPath;
        }

        public void setApprovalsPath(String approvalsPath) {
            this.approvalsPath = approvalsPath;
        }

        public String getFeedbackPath() {
            return feedbackPath;
        }

        public void setFeedbackPath(String feedbackPath) {
            this.feedbackPath = feedbackPath;
        }

        public String getGoldPath() {
            return goldPath;
        }

        public void setGoldPath(String goldPath) {
            this.goldPath = goldPath;
        }

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrainingConfig {
        private int minExamples = 50;
        private String modelType = "logistic";
        private int treeMaxDepth = 5;
        private int logisticMaxIterations = 1000;

        public int getMinExamples() {
            return minExamples;
        }

        public void setMinExamples(int minExamples) {
            this.minExamples = minExamples;
        }

        public String getModelType() {
            return modelType;
        }

        public void setModelType(String modelType) {
            this.modelType = modelType;
        }

        public int getTreeMaxDepth() {
            return treeMaxDepth;
        }

        public void setTreeMaxDepth(int treeMaxDepth) {
            this.treeMaxDepth = treeMaxDepth;
        }

        public int getLogisticMaxIterations() {
            return logisticMaxIterations;
        }

        public void setLogisticMaxIterations(int logisticMaxIterations) {
            this.logisticMaxIterations = logisticMaxIterations;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JudgesConfig {
        private int lookbackDays = 30;
        private double halfLifeDays = 7.0;
        private int minEvidence = 5;
        private double unknownJudgeWeight = 0.5;
        private Map<String, Double> defaultWeights = defaultJudgeWeights();

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public double getHalfLifeDays() {
            return halfLifeDays;
        }

        public void setHalfLifeDays(double halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
        }

        public int getMinEvidence() {
            return minEvidence;
        }

        public void setMinEvidence(int minEvidence) {
            this.minEvidence = minEvidence;
        }

        public double getUnknownJudgeWeight() {
            return unknownJudgeWeight;
        }

        public void setUnknownJudgeWeight(double unknownJudgeWeight) {
            this.unknownJudgeWeight = unknownJudgeWeight;
        }

        public Map<String, Double> getDefaultWeights() {
            return defaultWeights;
        }

        public void setDefaultWeights(Map<String, Double> defaultWeights) {
            this.defaultWeights = defaultWeights == null ? defaultJudgeWeights() : defaultWeights;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReviewConfig {
        private int lookbackDays = 7;
        private int topN = 50;
        private int topNPerAgent = 20;
        private double minUncertainty = 0.5;
        private double lowConfidenceThreshold = 0.6;

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        public int getTopNPerAgent() {
            return topNPerAgent;
        }

        public void setTopNPerAgent(int topNPerAgent) {
            this.topNPerAgent = topNPerAgent;
        }

        public double getMinUncertainty() {
            return minUncertainty;
        }

        public void setMinUncertainty(double minUncertainty) {
            this.minUncertainty = minUncertainty;
        }

        public double getLowConfidenceThreshold() {
            return lowConfidenceThreshold;
        }

        public void setLowConfidenceThreshold(double lowConfidenceThreshold) {
            this.lowConfidenceThreshold = lowConfidenceThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BundlesConfig {
        private int backupHistorySize = 3;

        public int getBackupHistorySize() {
            return backupHistorySize;
        }

        public void setBackupHistorySize(int backupHistorySize) {
            this.backupHistorySize = backupHistorySize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CanaryConfig {
        private double qualityRollbackDelta = -0.05;
        private double latencyRollbackDelta = 0.10;
        private double qualityPromoteDelta = 0.02;
        private double latencyPromoteDelta = -0.10;
        private int lookbackHours = 24;
        private int checkIntervalHours = 24;
        private List<Integer> stages = new ArrayList<>(List.of(10, 50, 100));
        private int maxStalledChecks = 3;
        private int autoApplyPercent = 10;

        public double getQualityRollbackDelta() {
            return qualityRollbackDelta;
        }

        public void setQualityRollbackDelta(double qualityRollbackDelta) {
            this.qualityRollbackDelta = qualityRollbackDelta;
        }

        public double getLatencyRollbackDelta() {
            return latencyRollbackDelta;
        }

        public void setLatencyRollbackDelta(double latencyRollbackDelta) {
            this.latencyRollbackDelta = latencyRollbackDelta;
        }

        public double getQualityPromoteDelta() {
            return qualityPromoteDelta;
        }

        public void setQualityPromoteDelta(double qualityPromoteDelta) {
            this.qualityPromoteDelta = qualityPromoteDelta;
        }

        public double getLatencyPromoteDelta() {
            return latencyPromoteDelta;
        }

        public void setLatencyPromoteDelta(double latencyPromoteDelta) {
            this.latencyPromoteDelta = latencyPromoteDelta;
        }

        public int getLookbackHours() {
            return lookbackHours;
        }

        public void setLookbackHours(int lookbackHours) {
            this.lookbackHours = lookbackHours;
        }

        public int getCheckIntervalHours() {
            return checkIntervalHours;
        }

        public void setCheckIntervalHours(int checkIntervalHours) {
            this.checkIntervalHours = checkIntervalHours;
        }

        public List<Integer> getStages() {
            return stages;
        }

        public void setStages(List<Integer> stages) {
            this.stages = stages == null ? new ArrayList<>(List.of(10, 50, 100)) : stages;
        }

        public int getMaxStalledChecks() {
            return maxStalledChecks;
        }

        public void setMaxStalledChecks(int maxStalledChecks) {
            this.maxStalledChecks = maxStalledChecks;
        }

        public int getAutoApplyPercent() {
            return autoApplyPercent;
        }

        public void setAutoApplyPercent(int autoApplyPercent) {
            this.autoApplyPercent = autoApplyPercent;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegressionConfig {
        private String provider = "run-metrics";
        private String url = "";
        private String apiKey = "";
        private int timeoutMs = 10000;
        private int minSamples = 30;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }
    }

    static Map<String, Double> defaultJudgeWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("gpt-4", 0.8);
        weights.put("gpt-3.5-turbo", 0.6);
        weights.put("claude-3-opus", 0.8);
        weights.put("claude-3-sonnet", 0.7);
        return weights;
    }
}
