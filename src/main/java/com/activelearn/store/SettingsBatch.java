package com.activelearn.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

public final class SettingsBatch {
    private final String updatedBy;
    private final List<Operation> operations = new ArrayList<>();

    public SettingsBatch(String updatedBy) {
        this.updatedBy = updatedBy == null || updatedBy.isBlank() ? "system" : updatedBy;
    }

    public SettingsBatch put(String key, JsonNode value) {
        operations.add(new Operation(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value")));
        return this;
    }

    public SettingsBatch delete(String key) {
        operations.add(new Operation(Objects.requireNonNull(key, "key"), null));
        return this;
    }

    public String updatedBy() {
        return updatedBy;
    }

    public List<Operation> operations() {
        return List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public record Operation(String key, JsonNode value) {
        public boolean isDelete() {
            return value == null;
        }
    }
}
