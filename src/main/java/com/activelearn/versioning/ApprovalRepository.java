package com.activelearn.versioning;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.activelearn.store.SettingsBatch;

public interface ApprovalRepository extends ApprovalSink {

    Optional<ApprovalRequest> find(String approvalId) throws IOException;

    List<ApprovalRequest> findByStatus(ApprovalStatus status) throws IOException;

    /**
     * Adds a write of the request to a batch so it commits together with bundle slot changes.
     */
    void stage(SettingsBatch batch, ApprovalRequest request);
}
