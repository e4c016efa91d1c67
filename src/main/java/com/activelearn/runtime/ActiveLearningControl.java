package com.activelearn.runtime;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.activelearn.store.SettingsStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ActiveLearningControl {
    private static final Logger log = LoggerFactory.getLogger(ActiveLearningControl.class);

    public static final String PAUSED_KEY = "active_learning.paused";

    private final SettingsStore settings;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public ActiveLearningControl(SettingsStore settings) {
        this(settings, Clock.systemUTC());
    }

    public ActiveLearningControl(SettingsStore settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Status pause(String reason, String actor) throws IOException {
        Status status = new Status(true, reason, actorOrSystem(actor), clock.instant());
        settings.put(PAUSED_KEY, mapper.valueToTree(status), status.actor());
        log.warn("Active learning paused by {}: {}", status.actor(), reason);
        return status;
    }

    public Status resume(String actor) throws IOException {
        Status status = new Status(false, null, actorOrSystem(actor), clock.instant());
        settings.put(PAUSED_KEY, mapper.valueToTree(status), status.actor());
        log.info("Active learning resumed by {}", status.actor());
        return status;
    }

    public boolean isPaused() throws IOException {
        return status().paused();
    }

    public Status status() throws IOException {
        Optional<JsonNode> value = settings.value(PAUSED_KEY);
        if (value.isEmpty()) {
            return new Status(false, null, null, null);
        }
        return mapper.treeToValue(value.get(), Status.class);
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? "system" : actor;
    }

    public record Status(boolean paused, String reason, String actor, Instant since) {
    }
}
