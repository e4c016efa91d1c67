package com.activelearn.ingest;

import com.fasterxml.jackson.databind.JsonNode;

public record GoldTask(
        String id,
        String agent,
        JsonNode inputData,
        String expectedAction,
        String description) {
}
