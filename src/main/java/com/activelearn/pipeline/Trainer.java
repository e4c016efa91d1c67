package com.activelearn.pipeline;

import java.util.List;

public interface Trainer {
    FittedModel fit(double[][] features, List<String> labels);

    ModelType modelType();
}
