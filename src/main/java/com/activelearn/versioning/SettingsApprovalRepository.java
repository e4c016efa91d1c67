package com.activelearn.versioning;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.activelearn.pipeline.BundleDiff;
import com.activelearn.store.SettingsBatch;
import com.activelearn.store.SettingsStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class SettingsApprovalRepository implements ApprovalRepository {
    private final SettingsStore settings;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public SettingsApprovalRepository(SettingsStore settings) {
        this(settings, Clock.systemUTC());
    }

    public SettingsApprovalRepository(SettingsStore settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String create(String agent, String bundleId, BundleDiff diff, String proposer) throws IOException {
        ApprovalRequest request = ApprovalRequest.pending(
                UUID.randomUUID().toString(), agent, bundleId, proposer, diff, clock.instant());
        SettingsBatch batch = new SettingsBatch(proposer);
        stage(batch, request);
        settings.apply(batch);
        return request.id();
    }

    @Override
    public Optional<ApprovalRequest> find(String approvalId) throws IOException {
        Optional<JsonNode> value = settings.value(BundleKeys.approval(approvalId));
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.treeToValue(value.get(), ApprovalRequest.class));
    }

    @Override
    public List<ApprovalRequest> findByStatus(ApprovalStatus status) throws IOException {
        List<ApprovalRequest> matches = new ArrayList<>();
        for (String key : settings.keys(BundleKeys.APPROVAL_PREFIX)) {
            Optional<JsonNode> value = settings.value(key);
            if (value.isEmpty()) {
                continue;
            }
            ApprovalRequest request = mapper.treeToValue(value.get(), ApprovalRequest.class);
            if (request.status() == status) {
                matches.add(request);
            }
        }
        matches.sort(Comparator.comparing(ApprovalRequest::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return matches;
    }

    @Override
    public void stage(SettingsBatch batch, ApprovalRequest request) {
        batch.put(BundleKeys.approval(request.id()), mapper.valueToTree(request));
    }
}
