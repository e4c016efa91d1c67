package com.activelearn.versioning;

import java.time.Instant;
import java.util.Objects;

import com.activelearn.pipeline.BundleDiff;

public record ApprovalRequest(
        String id,
        String agent,
        String bundleId,
        String proposer,
        ApprovalStatus status,
        BundleDiff diff,
        String approver,
        String rationale,
        Instant createdAt,
        Instant resolvedAt) {

    public ApprovalRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }

    public static ApprovalRequest pending(String id, String agent, String bundleId, String proposer, BundleDiff diff, Instant at) {
        return new ApprovalRequest(id, agent, bundleId, proposer, ApprovalStatus.PENDING, diff, null, null, at, null);
    }

    public ApprovalRequest resolve(ApprovalStatus decision, String decidedBy, String reason, Instant at) {
        if (status != ApprovalStatus.PENDING) {
            throw new InvalidStateTransitionException("resolve approval " + id, status.wireName(), ApprovalStatus.PENDING.wireName());
        }
        if (decision == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("An approval can only be resolved to approved or rejected");
        }
        return new ApprovalRequest(id, agent, bundleId, proposer, decision, diff, decidedBy, reason, createdAt, at);
    }
}
