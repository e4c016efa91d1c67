package com.activelearn.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

public interface SettingsStore {

    Optional<SettingEntry> get(String key) throws IOException;

    long put(String key, JsonNode value, String updatedBy) throws IOException;

    boolean delete(String key) throws IOException;

    List<String> keys(String prefix) throws IOException;

    /**
     * Commits every operation of the batch, or none of them.
     */
    void apply(SettingsBatch batch) throws IOException;

    default Optional<JsonNode> value(String key) throws IOException {
        return get(key).map(SettingEntry::value);
    }
}
