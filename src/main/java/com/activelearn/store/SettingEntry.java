package com.activelearn.store;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

public record SettingEntry(
        String key,
        JsonNode value,
        long version,
        Instant updatedAt,
        String updatedBy) {
}
