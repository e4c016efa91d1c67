package com.activelearn.ingest;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

public record ApprovalEvent(
        String requestId,
        String agent,
        String action,
        String status,
        JsonNode context,
        String rationale,
        Instant createdAt) {

    public boolean isResolved() {
        return "approved".equals(status) || "rejected".equals(status);
    }
}
