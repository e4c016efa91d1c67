package com.activelearn.judging;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface PredictionSource {

    List<JudgePrediction> findSince(String agent, Instant since) throws IOException;

    List<String> agents() throws IOException;
}
