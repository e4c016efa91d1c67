package com.activelearn.versioning;

import java.time.Instant;

public record BundleState(
        String agent,
        String bundleId,
        BundleStatus status,
        Integer canaryPercent,
        String approvalId,
        Instant updatedAt) {

    public BundleState transition(BundleStatus next, Integer percent, Instant at) {
        return new BundleState(agent, bundleId, next, percent, approvalId, at);
    }

    public BundleState withApproval(String newApprovalId, BundleStatus next, Instant at) {
        return new BundleState(agent, bundleId, next, canaryPercent, newApprovalId, at);
    }
}
