package com.activelearn.governance;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface RunMetricsSource {

    List<RunSample> findSince(String agent, Instant since) throws IOException;
}
