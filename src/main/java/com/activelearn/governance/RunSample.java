package com.activelearn.governance;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunSample(
        String agent,
        String bundleId,
        boolean canary,
        double quality,
        double latencyMs,
        Instant recordedAt) {
}
