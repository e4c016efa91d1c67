package com.activelearn.judging;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JudgePrediction(
        String id,
        String agent,
        String taskKey,
        List<JudgeScore> scores,
        JsonNode payload,
        Instant createdAt) {

    public JudgePrediction {
        scores = scores == null ? List.of() : List.copyOf(scores);
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
    }
}
