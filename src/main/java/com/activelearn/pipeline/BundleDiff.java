package com.activelearn.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record BundleDiff(
        String agent,
        String baseline,
        List<ThresholdChange> changed,
        Map<String, Double> added,
        Map<String, Double> removed,
        double accuracyDelta,
        String summary) {

    public static final String INITIAL_BASELINE = "initial";

    public BundleDiff {
        changed = changed == null ? List.of() : List.copyOf(changed);
        added = added == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(added));
        removed = removed == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(removed));
    }

    public boolean hasChanges() {
        return !changed.isEmpty() || !added.isEmpty() || !removed.isEmpty();
    }

    public record ThresholdChange(String key, double oldValue, double newValue, double delta) {
    }
}
