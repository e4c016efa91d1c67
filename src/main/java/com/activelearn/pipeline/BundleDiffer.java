package com.activelearn.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

public final class BundleDiffer {

    private BundleDiffer() {
    }

    public static BundleDiff diff(ConfigBundle oldBundle, ConfigBundle newBundle) {
        Objects.requireNonNull(oldBundle, "oldBundle");
        Objects.requireNonNull(newBundle, "newBundle");
        Map<String, Double> before = oldBundle.thresholds();
        Map<String, Double> after = newBundle.thresholds();

        List<BundleDiff.ThresholdChange> changed = new ArrayList<>();
        Map<String, Double> added = new TreeMap<>();
        Map<String, Double> removed = new TreeMap<>();
        TreeSet<String> keys = new TreeSet<>(before.keySet());
        keys.addAll(after.keySet());
        for (String key : keys) {
            Double oldValue = before.get(key);
            Double newValue = after.get(key);
            if (oldValue == null) {
                added.put(key, newValue);
            } else if (newValue == null) {
                removed.put(key, oldValue);
            } else if (Double.compare(oldValue, newValue) != 0) {
                changed.add(new BundleDiff.ThresholdChange(key, oldValue, newValue, newValue - oldValue));
            }
        }

        String baseline = oldBundle.bundleId() == null ? BundleDiff.INITIAL_BASELINE : oldBundle.bundleId();
        String summary = changed.size() + " changes, " + added.size() + " additions, " + removed.size() + " removals";
        return new BundleDiff(
                newBundle.agent(),
                baseline,
                changed,
                added,
                removed,
                newBundle.accuracy() - oldBundle.accuracy(),
                summary);
    }
}
