package com.activelearn.store;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;

public class InMemorySettingsStore implements SettingsStore {
    private final Clock clock;
    private NavigableMap<String, SettingEntry> entries = new TreeMap<>();

    public InMemorySettingsStore() {
        this(Clock.systemUTC());
    }

    public InMemorySettingsStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Optional<SettingEntry> get(String key) throws IOException {
        return Optional.ofNullable(entries().get(key));
    }

    @Override
    public synchronized long put(String key, JsonNode value, String updatedBy) throws IOException {
        apply(new SettingsBatch(updatedBy).put(key, value));
        return entries().get(key).version();
    }

    @Override
    public synchronized boolean delete(String key) throws IOException {
        if (!entries().containsKey(key)) {
            return false;
        }
        apply(new SettingsBatch("system").delete(key));
        return true;
    }

    @Override
    public synchronized List<String> keys(String prefix) throws IOException {
        List<String> matches = new ArrayList<>();
        for (String key : entries().tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            matches.add(key);
        }
        return matches;
    }

    @Override
    public synchronized void apply(SettingsBatch batch) throws IOException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return;
        }
        NavigableMap<String, SettingEntry> next = new TreeMap<>(entries());
        Instant now = clock.instant();
        for (SettingsBatch.Operation operation : batch.operations()) {
            if (operation.isDelete()) {
                next.remove(operation.key());
                continue;
            }
            SettingEntry previous = next.get(operation.key());
            long version = previous == null ? 1L : previous.version() + 1L;
            next.put(operation.key(), new SettingEntry(operation.key(), operation.value().deepCopy(), version, now, batch.updatedBy()));
        }
        persist(next);
        entries = next;
    }

    /**
     * Hook for durable subclasses. Throwing leaves the current state untouched.
     */
    protected void persist(Map<String, SettingEntry> snapshot) throws IOException {
    }

    protected NavigableMap<String, SettingEntry> entries() throws IOException {
        return entries;
    }

    protected void replaceEntries(NavigableMap<String, SettingEntry> loaded) {
        this.entries = loaded;
    }
}
