package com.activelearn.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RolloutStatus {
    NO_CANARY,
    WAITING,
    MONITORING,
    STUCK,
    PROMOTED,
    COMPLETE,
    ROLLED_BACK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
