package com.activelearn.review;

import java.time.Instant;
import java.util.List;

import com.activelearn.judging.JudgeScore;
import com.fasterxml.jackson.databind.JsonNode;

public record ReviewCandidate(
        String taskKey,
        String agent,
        double uncertainty,
        UncertaintyMethod method,
        List<JudgeScore> judgeScores,
        JsonNode payload,
        Instant createdAt,
        String predictionId) {
}
