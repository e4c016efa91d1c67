package com.activelearn.feedback;

import java.util.Map;

public record LabeledStats(
        long total,
        Map<LabelSource, Long> bySource,
        Map<String, Long> byAgent,
        long recent7d) {
}
