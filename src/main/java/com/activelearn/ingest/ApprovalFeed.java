package com.activelearn.ingest;

import java.time.Instant;
import java.util.List;

@FunctionalInterface
public interface ApprovalFeed {
    List<ApprovalEvent> fetchApprovals(Instant since, int limit) throws UpstreamUnavailableException;
}
