package com.activelearn.ingest;

import java.time.LocalDate;

public record FeedbackAggregate(
        String id,
        String agent,
        LocalDate date,
        int feedbackCount,
        int thumbsUp,
        int thumbsDown,
        double avgQualityScore,
        double successRate) {

    public double thumbsUpRatio() {
        return feedbackCount == 0 ? 0.0 : (double) thumbsUp / feedbackCount;
    }
}
