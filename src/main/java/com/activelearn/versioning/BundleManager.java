package com.activelearn.versioning;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.pipeline.BundleDiff;
import com.activelearn.pipeline.BundleDiffer;
import com.activelearn.pipeline.ConfigBundle;
import com.activelearn.pipeline.HeuristicTrainer;
import com.activelearn.pipeline.InsufficientDataException;
import com.activelearn.pipeline.ModelType;
import com.activelearn.runtime.AppConfig;
import com.activelearn.store.SettingsBatch;
import com.activelearn.store.SettingsStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.IntNode;

public class BundleManager {
    private static final Logger log = LoggerFactory.getLogger(BundleManager.class);
    private static final DateTimeFormatter BUNDLE_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private final SettingsStore settings;
    private final HeuristicTrainer trainer;
    private final ApprovalRepository approvals;
    private final AgentLocks locks;
    private final AppConfig.BundlesConfig config;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public BundleManager(
            SettingsStore settings,
            HeuristicTrainer trainer,
            ApprovalRepository approvals,
            AgentLocks locks,
            AppConfig.BundlesConfig config) {
        this(settings, trainer, approvals, locks, config, Clock.systemUTC());
    }

    public BundleManager(
            SettingsStore settings,
            HeuristicTrainer trainer,
            ApprovalRepository approvals,
            AgentLocks locks,
            AppConfig.BundlesConfig config,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.trainer = Objects.requireNonNull(trainer, "trainer");
        this.approvals = Objects.requireNonNull(approvals, "approvals");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ConfigBundle createBundle(String agent, int minExamples, ModelType modelType)
            throws IOException, InsufficientDataException {
        ConfigBundle trained = trainer.train(agent, minExamples, modelType);
        return locks.withLock(agent, () -> {
            int version = settings.value(BundleKeys.sequence(agent)).map(JsonNode::asInt).orElse(0) + 1;
            String bundleId = nextBundleId(agent);
            ConfigBundle bundle = trained.withIdentity(bundleId, version);
            Instant now = clock.instant();
            SettingsBatch batch = new SettingsBatch("bundle-manager")
                    .put(BundleKeys.bundle(agent, bundleId), mapper.valueToTree(bundle))
                    .put(BundleKeys.sequence(agent), IntNode.valueOf(version));
            putState(batch, new BundleState(agent, bundleId, BundleStatus.PENDING, null, null, now));
            settings.apply(batch);
            log.info("Created bundle {} for {} version={} examples={}", bundleId, agent, version, bundle.trainingCount());
            return bundle;
        });
    }

    public String proposeBundle(String agent, String bundleId, String proposer) throws IOException {
        return locks.withLock(agent, () -> {
            ConfigBundle bundle = requireBundle(agent, bundleId);
            BundleState state = requireState(agent, bundleId);
            requireStatus(state, "propose bundle " + bundleId, BundleStatus.PENDING);

            ConfigBundle baseline = activeBundle(agent).orElseGet(() -> ConfigBundle.empty(agent));
            BundleDiff diff = BundleDiffer.diff(baseline, bundle);
            Instant now = clock.instant();
            String who = proposer == null || proposer.isBlank() ? "system" : proposer;
            String approvalId = approvals.create(agent, bundleId, diff, who);
            try {
                SettingsBatch batch = new SettingsBatch(who);
                putState(batch, state.withApproval(approvalId, BundleStatus.PROPOSED, now));
                settings.apply(batch);
            } catch (IOException | RuntimeException e) {
                log.error("Approval {} for bundle {} was created but the bundle is still pending", approvalId, bundleId);
                throw e;
            }
            log.info("Proposed bundle {} for {} approval={} diff=\"{}\"", bundleId, agent, approvalId, diff.summary());
            return approvalId;
        });
    }

    public ApprovalRequest approveBundle(String approvalId, String approver, String rationale) throws IOException {
        return resolve(approvalId, "approve", ApprovalStatus.APPROVED, BundleStatus.APPROVED, approver, rationale);
    }

    public ApprovalRequest rejectBundle(String approvalId, String approver, String rationale) throws IOException {
        return resolve(approvalId, "reject", ApprovalStatus.REJECTED, BundleStatus.REJECTED, approver, rationale);
    }

    /**
     * Deploys an approved bundle, as a canary when {@code canaryPercent} is given, otherwise straight to active.
     *
     * <p>Re-applying a canary with a new percent re-targets it without taking another backup. Applying an already
     * active bundle without a percent is a no-op.
     */
    public BundleState applyApprovedBundle(String approvalId, Integer canaryPercent) throws IOException {
        ApprovalRequest approval = requireApproval(approvalId);
        if (canaryPercent != null && (canaryPercent < 1 || canaryPercent > 99)) {
            throw new IllegalArgumentException("canary_percent must be within 1..99, got " + canaryPercent);
        }
        String agent = approval.agent();
        return locks.withLock(agent, () -> {
            ApprovalRequest current = requireApproval(approvalId);
            if (current.status() != ApprovalStatus.APPROVED) {
                throw new InvalidStateTransitionException(
                        "apply approval " + approvalId, current.status().wireName(), ApprovalStatus.APPROVED.wireName());
            }
            String bundleId = current.bundleId();
            ConfigBundle bundle = requireBundle(agent, bundleId);
            BundleState state = requireState(agent, bundleId);
            Instant now = clock.instant();

            switch (state.status()) {
                case APPROVED -> {
                    SettingsBatch batch = new SettingsBatch("bundle-manager");
                    stageBackup(batch, agent);
                    BundleState next;
                    if (canaryPercent != null) {
                        supersedeCanary(batch, agent, bundleId, now);
                        CanarySlot slot = new CanarySlot(agent, bundle, canaryPercent, approvalId, now, now, 0, null);
                        batch.put(BundleKeys.canary(agent), mapper.valueToTree(slot));
                        next = state.transition(BundleStatus.DEPLOYED_CANARY, canaryPercent, now);
                    } else {
                        next = stageActivation(batch, agent, bundle, state, now);
                    }
                    putState(batch, next);
                    settings.apply(batch);
                    log.info("Applied bundle {} for {} canary={}", bundleId, agent, canaryPercent == null ? "none" : canaryPercent + "%");
                    return next;
                }
                case DEPLOYED_CANARY -> {
                    if (canaryPercent != null) {
                        setCanaryPercent(agent, canaryPercent);
                        return requireState(agent, bundleId);
                    }
                    finalizeCanary(agent);
                    return requireState(agent, bundleId);
                }
                case ACTIVE -> {
                    if (canaryPercent != null) {
                        throw new InvalidStateTransitionException(
                                "deploy active bundle " + bundleId + " as canary", state.status().wireName(),
                                BundleStatus.APPROVED.wireName());
                    }
                    return state;
                }
                default -> throw new InvalidStateTransitionException(
                        "apply bundle " + bundleId, state.status().wireName(),
                        BundleStatus.APPROVED.wireName() + " or " + BundleStatus.DEPLOYED_CANARY.wireName());
            }
        });
    }

    /**
     * Restores the most recent backup as the active bundle and clears any canary. Repeated calls walk back through the
     * retained history. Without a canary to drop, backups identical to the active bundle are skipped.
     */
    public ConfigBundle rollbackBundle(String agent) throws IOException {
        return locks.withLock(agent, () -> {
            Optional<ConfigBundle> backup = backup(agent);
            if (backup.isEmpty()) {
                throw new MissingBackupException(agent);
            }
            List<ConfigBundle> candidates = new ArrayList<>(history(agent));
            if (candidates.isEmpty() || !candidates.get(0).bundleId().equals(backup.get().bundleId())) {
                candidates.add(0, backup.get());
            }
            Optional<ConfigBundle> replaced = activeBundle(agent);
            Optional<CanarySlot> canary = canary(agent);
            if (canary.isEmpty() && replaced.isPresent()) {
                String activeId = replaced.get().bundleId();
                while (!candidates.isEmpty() && candidates.get(0).bundleId().equals(activeId)) {
                    log.info("Skipping backup {} for {}: already the active bundle", activeId, agent);
                    candidates.remove(0);
                }
                if (candidates.isEmpty()) {
                    throw new MissingBackupException(agent);
                }
            }
            ConfigBundle restored = candidates.remove(0);
            Instant now = clock.instant();
            SettingsBatch batch = new SettingsBatch("bundle-manager");

            if (replaced.isPresent() && !replaced.get().bundleId().equals(restored.bundleId())) {
                markStatus(batch, agent, replaced.get().bundleId(), BundleStatus.ROLLED_BACK, null, now);
            } else if (canary.isPresent()) {
                log.info("Rollback for {} keeps active bundle {} and drops canary {}", agent, restored.bundleId(),
                        canary.get().bundleId());
            }
            if (canary.isPresent()) {
                batch.delete(BundleKeys.canary(agent));
                markStatus(batch, agent, canary.get().bundleId(), BundleStatus.ROLLED_BACK, null, now);
            }
            batch.put(BundleKeys.active(agent), mapper.valueToTree(restored));
            markStatus(batch, agent, restored.bundleId(), BundleStatus.ACTIVE, null, now);

            writeHistory(batch, agent, candidates);
            settings.apply(batch);
            log.warn("Rolled back {} to bundle {} ({} older backups left)", agent, restored.bundleId(), candidates.size());
            return restored;
        });
    }

    public CanarySlot setCanaryPercent(String agent, int percent) throws IOException {
        if (percent < 1 || percent > 99) {
            throw new IllegalArgumentException("canary percent must be within 1..99, got " + percent);
        }
        return locks.withLock(agent, () -> {
            CanarySlot slot = requireCanary(agent, "set canary percent");
            CanarySlot updated = slot.atPercent(percent, clock.instant());
            SettingsBatch batch = new SettingsBatch("bundle-manager")
                    .put(BundleKeys.canary(agent), mapper.valueToTree(updated));
            markStatus(batch, agent, slot.bundleId(), BundleStatus.DEPLOYED_CANARY, percent, updated.stageStartedAt());
            settings.apply(batch);
            log.info("Canary {} for {} now at {}%", slot.bundleId(), agent, percent);
            return updated;
        });
    }

    public ConfigBundle finalizeCanary(String agent) throws IOException {
        return locks.withLock(agent, () -> {
            CanarySlot slot = requireCanary(agent, "finalize canary");
            Instant now = clock.instant();
            SettingsBatch batch = new SettingsBatch("bundle-manager");
            stageBackup(batch, agent);
            batch.delete(BundleKeys.canary(agent));
            BundleState state = requireState(agent, slot.bundleId());
            putState(batch, stageActivation(batch, agent, slot.bundle(), state, now));
            settings.apply(batch);
            log.info("Canary {} for {} promoted to active", slot.bundleId(), agent);
            return slot.bundle();
        });
    }

    public ConfigBundle clearCanary(String agent) throws IOException {
        return locks.withLock(agent, () -> {
            CanarySlot slot = requireCanary(agent, "roll back canary");
            SettingsBatch batch = new SettingsBatch("bundle-manager").delete(BundleKeys.canary(agent));
            markStatus(batch, agent, slot.bundleId(), BundleStatus.ROLLED_BACK, null, clock.instant());
            settings.apply(batch);
            log.warn("Canary {} for {} rolled back", slot.bundleId(), agent);
            return slot.bundle();
        });
    }

    public CanarySlot recordStalledCheck(String agent) throws IOException {
        return locks.withLock(agent, () -> {
            CanarySlot updated = requireCanary(agent, "record canary check").withStalledCheck(clock.instant());
            settings.put(BundleKeys.canary(agent), mapper.valueToTree(updated), "canary-guard");
            return updated;
        });
    }

    public Optional<ConfigBundle> activeBundle(String agent) throws IOException {
        return read(BundleKeys.active(agent), ConfigBundle.class);
    }

    public Optional<ConfigBundle> backup(String agent) throws IOException {
        return read(BundleKeys.backup(agent), ConfigBundle.class);
    }

    public Optional<CanarySlot> canary(String agent) throws IOException {
        return read(BundleKeys.canary(agent), CanarySlot.class);
    }

    public int canaryPercent(String agent) throws IOException {
        return canary(agent).map(CanarySlot::percent).orElse(0);
    }

    public List<CanarySlot> activeCanaries() throws IOException {
        List<CanarySlot> canaries = new ArrayList<>();
        for (String key : settings.keys(BundleKeys.BUNDLE_PREFIX)) {
            String agent = BundleKeys.agentOfCanaryKey(key);
            if (agent != null) {
                canary(agent).ifPresent(canaries::add);
            }
        }
        return canaries;
    }

    public List<ConfigBundle> history(String agent) throws IOException {
        Optional<JsonNode> value = settings.value(BundleKeys.history(agent));
        if (value.isEmpty()) {
            return List.of();
        }
        return mapper.convertValue(value.get(), new TypeReference<List<ConfigBundle>>() {
        });
    }

    public Optional<ConfigBundle> bundle(String agent, String bundleId) throws IOException {
        return read(BundleKeys.bundle(agent, bundleId), ConfigBundle.class);
    }

    public Optional<BundleState> state(String agent, String bundleId) throws IOException {
        return read(BundleKeys.state(agent, bundleId), BundleState.class);
    }

    public Optional<ApprovalRequest> approval(String approvalId) throws IOException {
        return approvals.find(approvalId);
    }

    public List<ApprovalRequest> listPendingApprovals() throws IOException {
        return approvals.findByStatus(ApprovalStatus.PENDING);
    }

    public List<ApprovalRequest> approvedUndeployed() throws IOException {
        List<ApprovalRequest> ready = new ArrayList<>();
        for (ApprovalRequest request : approvals.findByStatus(ApprovalStatus.APPROVED)) {
            Optional<BundleState> state = state(request.agent(), request.bundleId());
            if (state.isPresent() && state.get().status() == BundleStatus.APPROVED) {
                ready.add(request);
            }
        }
        return ready;
    }

    private ApprovalRequest resolve(
            String approvalId,
            String verb,
            ApprovalStatus decision,
            BundleStatus next,
            String approver,
            String rationale) throws IOException {
        ApprovalRequest approval = requireApproval(approvalId);
        String agent = approval.agent();
        return locks.withLock(agent, () -> {
            ApprovalRequest current = requireApproval(approvalId);
            BundleState state = requireState(agent, current.bundleId());
            requireStatus(state, verb + " bundle " + current.bundleId(), BundleStatus.PROPOSED);
            if (!approvalId.equals(state.approvalId())) {
                throw new InvalidStateTransitionException(
                        verb + " bundle " + current.bundleId(), "proposed under approval " + state.approvalId(),
                        "approval " + approvalId);
            }
            Instant now = clock.instant();
            ApprovalRequest resolved = current.resolve(decision, approver, rationale, now);

            SettingsBatch batch = new SettingsBatch(approver);
            approvals.stage(batch, resolved);
            putState(batch, state.transition(next, null, now));
            settings.apply(batch);
            log.info("Bundle {} for {} {} by {}", current.bundleId(), agent, decision.wireName(), approver);
            return resolved;
        });
    }

    private BundleState stageActivation(SettingsBatch batch, String agent, ConfigBundle bundle, BundleState state, Instant now)
            throws IOException {
        Optional<ConfigBundle> previous = activeBundle(agent);
        if (previous.isPresent() && !previous.get().bundleId().equals(bundle.bundleId())) {
            markStatus(batch, agent, previous.get().bundleId(), BundleStatus.SUPERSEDED, null, now);
        }
        batch.put(BundleKeys.active(agent), mapper.valueToTree(bundle));
        return state.transition(BundleStatus.ACTIVE, null, now);
    }

    private void stageBackup(SettingsBatch batch, String agent) throws IOException {
        Optional<ConfigBundle> active = activeBundle(agent);
        if (active.isEmpty()) {
            log.info("No active bundle to back up for {}", agent);
            return;
        }
        List<ConfigBundle> history = new ArrayList<>(history(agent));
        if (history.isEmpty() || !history.get(0).bundleId().equals(active.get().bundleId())) {
            history.add(0, active.get());
        }
        writeHistory(batch, agent, history);
    }

    private void writeHistory(SettingsBatch batch, String agent, List<ConfigBundle> history) {
        int keep = Math.max(1, config.getBackupHistorySize());
        List<ConfigBundle> bounded = history.size() > keep ? history.subList(0, keep) : history;
        if (bounded.isEmpty()) {
            batch.delete(BundleKeys.history(agent));
            batch.delete(BundleKeys.backup(agent));
            return;
        }
        batch.put(BundleKeys.history(agent), mapper.valueToTree(bounded));
        batch.put(BundleKeys.backup(agent), mapper.valueToTree(bounded.get(0)));
    }

    private void supersedeCanary(SettingsBatch batch, String agent, String incomingBundleId, Instant now) throws IOException {
        Optional<CanarySlot> existing = canary(agent);
        if (existing.isPresent() && !existing.get().bundleId().equals(incomingBundleId)) {
            markStatus(batch, agent, existing.get().bundleId(), BundleStatus.SUPERSEDED, null, now);
            log.info("Canary {} for {} superseded by {}", existing.get().bundleId(), agent, incomingBundleId);
        }
    }

    private void markStatus(SettingsBatch batch, String agent, String bundleId, BundleStatus status, Integer percent, Instant now)
            throws IOException {
        BundleState state = state(agent, bundleId)
                .orElseGet(() -> new BundleState(agent, bundleId, status, percent, null, now));
        putState(batch, state.transition(status, percent, now));
    }

    private void putState(SettingsBatch batch, BundleState state) {
        batch.put(BundleKeys.state(state.agent(), state.bundleId()), mapper.valueToTree(state));
    }

    private String nextBundleId(String agent) throws IOException {
        String base = agent + "_" + BUNDLE_ID_TIME.format(clock.instant());
        String candidate = base;
        int suffix = 2;
        while (settings.get(BundleKeys.bundle(agent, candidate)).isPresent()) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private ApprovalRequest requireApproval(String approvalId) throws IOException {
        return approvals.find(approvalId)
                .orElseThrow(() -> new IllegalArgumentException("Approval " + approvalId + " not found"));
    }

    private ConfigBundle requireBundle(String agent, String bundleId) throws IOException {
        return bundle(agent, bundleId)
                .orElseThrow(() -> new IllegalArgumentException("Bundle " + bundleId + " not found for " + agent));
    }

    private BundleState requireState(String agent, String bundleId) throws IOException {
        return state(agent, bundleId)
                .orElseThrow(() -> new IllegalArgumentException("Bundle " + bundleId + " not found for " + agent));
    }

    private CanarySlot requireCanary(String agent, String action) throws IOException {
        return canary(agent)
                .orElseThrow(() -> new InvalidStateTransitionException(action + " for " + agent, "no canary", "a deployed canary"));
    }

    private static void requireStatus(BundleState state, String action, BundleStatus required) {
        if (state.status() != required) {
            throw new InvalidStateTransitionException(action, state.status().wireName(), required.wireName());
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) throws IOException {
        Optional<JsonNode> value = settings.value(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.treeToValue(value.get(), type));
    }
}
