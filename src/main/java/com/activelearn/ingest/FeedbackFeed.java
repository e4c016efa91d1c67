package com.activelearn.ingest;

import java.time.LocalDate;
import java.util.List;

@FunctionalInterface
public interface FeedbackFeed {
    List<FeedbackAggregate> fetchFeedback(LocalDate since, int limit) throws UpstreamUnavailableException;
}
