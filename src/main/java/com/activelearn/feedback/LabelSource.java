package com.activelearn.feedback;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LabelSource {
    APPROVALS,
    FEEDBACK,
    GOLD,
    SYNTHETIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LabelSource fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isHighConfidence() {
        return this == APPROVALS || this == GOLD;
    }
}
