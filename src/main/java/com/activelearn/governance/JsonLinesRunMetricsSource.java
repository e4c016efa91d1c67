package com.activelearn.governance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonLinesRunMetricsSource implements RunMetricsSource {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonLinesRunMetricsSource(Path path) {
        this.path = path;
    }

    public synchronized void append(RunSample sample) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String line = mapper.writeValueAsString(sample) + System.lineSeparator();
        Files.writeString(path, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized List<RunSample> findSince(String agent, Instant since) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<RunSample> matches = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            RunSample sample = mapper.readValue(line, RunSample.class);
            if (!agent.equals(sample.agent()) || sample.recordedAt() == null || sample.recordedAt().isBefore(since)) {
                continue;
            }
            matches.add(sample);
        }
        return matches;
    }
}
