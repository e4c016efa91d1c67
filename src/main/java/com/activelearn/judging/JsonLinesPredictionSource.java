package com.activelearn.judging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonLinesPredictionSource implements PredictionSource {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonLinesPredictionSource(Path path) {
        this.path = path;
    }

    public synchronized void append(JudgePrediction prediction) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String line = mapper.writeValueAsString(prediction) + System.lineSeparator();
        Files.writeString(path, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized List<JudgePrediction> findSince(String agent, Instant since) throws IOException {
        List<JudgePrediction> matches = new ArrayList<>();
        for (JudgePrediction prediction : readAll()) {
            if (agent != null && !agent.equals(prediction.agent())) {
                continue;
            }
            if (prediction.createdAt() == null || prediction.createdAt().isBefore(since)) {
                continue;
            }
            matches.add(prediction);
        }
        matches.sort(Comparator.comparing(JudgePrediction::createdAt));
        return matches;
    }

    @Override
    public synchronized List<String> agents() throws IOException {
        TreeSet<String> agents = new TreeSet<>();
        for (JudgePrediction prediction : readAll()) {
            if (prediction.agent() != null) {
                agents.add(prediction.agent());
            }
        }
        return List.copyOf(agents);
    }

    private List<JudgePrediction> readAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<JudgePrediction> predictions = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            predictions.add(mapper.readValue(line, JudgePrediction.class));
        }
        return predictions;
    }
}
