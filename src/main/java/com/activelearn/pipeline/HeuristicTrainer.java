package com.activelearn.pipeline;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.feedback.LabelSource;
import com.activelearn.feedback.LabeledExample;
import com.activelearn.feedback.LabeledExampleStore;

public class HeuristicTrainer {
    private static final Logger log = LoggerFactory.getLogger(HeuristicTrainer.class);

    public static final int DEFAULT_MIN_EXAMPLES = 50;

    private final LabeledExampleStore store;
    private final FeatureSets featureSets;
    private final Map<ModelType, Trainer> trainers;
    private final Clock clock;

    public HeuristicTrainer(LabeledExampleStore store) {
        this(store, FeatureSets.defaults(), defaultTrainers(5), Clock.systemUTC());
    }

    public HeuristicTrainer(LabeledExampleStore store, FeatureSets featureSets, Map<ModelType, Trainer> trainers, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.featureSets = Objects.requireNonNull(featureSets, "featureSets");
        this.trainers = new EnumMap<>(ModelType.class);
        this.trainers.putAll(trainers);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static Map<ModelType, Trainer> defaultTrainers(int treeMaxDepth) {
        Map<ModelType, Trainer> trainers = new EnumMap<>(ModelType.class);
        trainers.put(ModelType.LOGISTIC, new LogisticRegressionTrainer());
        trainers.put(ModelType.TREE, new DecisionTreeTrainer(treeMaxDepth, 2));
        return trainers;
    }

    public ConfigBundle train(String agent) throws IOException, InsufficientDataException {
        return train(agent, DEFAULT_MIN_EXAMPLES, ModelType.LOGISTIC);
    }

    public ConfigBundle train(String agent, int minExamples, ModelType modelType) throws IOException, InsufficientDataException {
        FeatureSet featureSet = featureSets.forAgent(agent)
                .orElseThrow(() -> new IllegalArgumentException("No feature set registered for agent " + agent));
        Trainer trainer = trainers.get(Objects.requireNonNull(modelType, "modelType"));
        if (trainer == null) {
            throw new IllegalArgumentException("No trainer registered for model_type " + modelType.wireName());
        }

        List<LabeledExample> examples = store.findByAgent(agent);
        if (examples.size() < minExamples) {
            throw new InsufficientDataException(agent, examples.size(), minExamples);
        }

        double[][] raw = new double[examples.size()][];
        List<String> labels = new ArrayList<>(examples.size());
        Map<String, Integer> distribution = new TreeMap<>();
        Set<LabelSource> sources = new TreeSet<>();
        for (int i = 0; i < examples.size(); i++) {
            LabeledExample example = examples.get(i);
            raw[i] = featureSet.extract(example.payload());
            labels.add(example.label());
            distribution.merge(example.label(), 1, Integer::sum);
            sources.add(example.source());
        }
        if (distribution.size() < 2) {
            throw new InsufficientDataException(agent, examples.size(), minExamples,
                    "Training " + agent + " needs at least two distinct labels, got " + distribution.keySet());
        }

        FeatureScaler scaler = FeatureScaler.fit(raw);
        double[][] scaled = scaler.transform(raw);
        FittedModel model = trainer.fit(scaled, labels);

        int correct = 0;
        for (int i = 0; i < scaled.length; i++) {
            if (model.predict(scaled[i]).equals(labels.get(i))) {
                correct++;
            }
        }
        double accuracy = (double) correct / scaled.length;

        ConfigBundle bundle = new ConfigBundle(
                agent,
                null,
                0,
                clock.instant(),
                examples.size(),
                accuracy,
                distribution,
                model.featureImportances(),
                featureSet.thresholds(model, scaler),
                model.modelType(),
                sources);
        log.info("training.complete agent={} model={} examples={} accuracy={}",
                agent, model.modelType().wireName(), examples.size(), String.format("%.3f", accuracy));
        return bundle;
    }
}
