package com.activelearn.judging;

import java.time.Instant;

public record JudgeEvidence(Instant timestamp, int agreement, double predictedConfidence) {

    public JudgeEvidence {
        if (agreement != 0 && agreement != 1) {
            throw new IllegalArgumentException("agreement must be 0 or 1, got " + agreement);
        }
        if (predictedConfidence < 0.0 || predictedConfidence > 1.0) {
            throw new IllegalArgumentException("predictedConfidence must be within [0, 1], got " + predictedConfidence);
        }
    }
}
