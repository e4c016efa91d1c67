package com.activelearn.ingest;

import java.util.List;

@FunctionalInterface
public interface GoldSetFeed {
    List<GoldTask> fetchGoldTasks(String agent, int limit) throws UpstreamUnavailableException;
}
