package com.activelearn.versioning;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.activelearn.pipeline.BundleDiff;
import com.activelearn.store.InMemorySettingsStore;
import com.activelearn.store.SettingsBatch;
import com.activelearn.testing.MutableClock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsApprovalRepositoryTest {

    @Test
    void shouldCreateAndListPendingNewestFirst() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        InMemorySettingsStore settings = new InMemorySettingsStore(clock);
        SettingsApprovalRepository repository = new SettingsApprovalRepository(settings, clock);

        String older = repository.create("inbox_triage", "b1", diff(), "alice");
        clock.advance(Duration.ofMinutes(1));
        String newer = repository.create("knowledge_update", "b2", diff(), "alice");

        List<ApprovalRequest> pending = repository.findByStatus(ApprovalStatus.PENDING);
        assertEquals(List.of(newer, older), pending.stream().map(ApprovalRequest::id).toList());
        assertEquals("initial", pending.get(1).diff().baseline());
        assertTrue(repository.findByStatus(ApprovalStatus.APPROVED).isEmpty());
    }

    @Test
    void shouldResolveOnlyOnce() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        InMemorySettingsStore settings = new InMemorySettingsStore(clock);
        SettingsApprovalRepository repository = new SettingsApprovalRepository(settings, clock);
        String id = repository.create("inbox_triage", "b1", diff(), "alice");

        ApprovalRequest approved = repository.find(id).orElseThrow()
                .resolve(ApprovalStatus.APPROVED, "bob", "ok", clock.instant());
        SettingsBatch batch = new SettingsBatch("bob");
        repository.stage(batch, approved);
        settings.apply(batch);

        ApprovalRequest stored = repository.find(id).orElseThrow();
        assertEquals(ApprovalStatus.APPROVED, stored.status());
        assertEquals("bob", stored.approver());
        assertThrows(InvalidStateTransitionException.class,
                () -> stored.resolve(ApprovalStatus.REJECTED, "carol", null, clock.instant()));
        assertTrue(repository.find("missing").isEmpty());
    }

    private static BundleDiff diff() {
        return new BundleDiff("inbox_triage", BundleDiff.INITIAL_BASELINE, List.of(), Map.of("risk_score_threshold", 55.0),
                Map.of(), 0.9, "0 changes, 1 additions, 0 removals");
    }
}
