package com.activelearn.review;

import java.time.Instant;
import java.util.List;

public record ReviewQueue(String agent, String runId, Instant generatedAt, List<ReviewCandidate> candidates) {

    public ReviewQueue {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
