package com.activelearn.versioning;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BundleStatus {
    PENDING,
    PROPOSED,
    APPROVED,
    REJECTED,
    DEPLOYED_CANARY,
    ACTIVE,
    ROLLED_BACK,
    SUPERSEDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BundleStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
