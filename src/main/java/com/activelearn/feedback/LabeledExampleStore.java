package com.activelearn.feedback;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface LabeledExampleStore {

    boolean containsSource(LabelSource source, String sourceId) throws IOException;

    boolean containsKey(String agent, LabelSource source, String key) throws IOException;

    void append(LabeledExample example) throws IOException;

    List<LabeledExample> findByAgent(String agent) throws IOException;

    Set<String> labeledKeys(String agent) throws IOException;

    List<String> agents() throws IOException;

    LabeledStats stats(Instant recentCutoff) throws IOException;
}
