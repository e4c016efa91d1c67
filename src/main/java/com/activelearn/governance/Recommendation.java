package com.activelearn.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Recommendation {
    ROLLBACK,
    PROMOTE,
    MONITOR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
