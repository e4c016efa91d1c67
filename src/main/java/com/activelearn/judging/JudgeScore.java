package com.activelearn.judging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One judge's opinion on one task. Confidence is on a 0..100 scale; a missing confidence reads as 50.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JudgeScore(String judgeId, String verdict, Double confidence) {

    public boolean hasVerdict() {
        return verdict != null && !verdict.isBlank();
    }

    public double normalizedConfidence() {
        double raw = confidence == null ? 50.0 : confidence;
        return Math.max(0.0, Math.min(1.0, raw / 100.0));
    }
}
