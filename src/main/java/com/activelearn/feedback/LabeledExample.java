package com.activelearn.feedback;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public record LabeledExample(
        String id,
        String agent,
        String key,
        JsonNode payload,
        String label,
        LabelSource source,
        String sourceId,
        int confidence,
        String notes,
        Instant createdAt) {

    public LabeledExample {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceId, "sourceId");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within 0..100, got " + confidence);
        }
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
        notes = notes == null ? "" : notes;
    }
}
