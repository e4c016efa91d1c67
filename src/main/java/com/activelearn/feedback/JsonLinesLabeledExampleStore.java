package com.activelearn.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonLinesLabeledExampleStore implements LabeledExampleStore {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    private List<LabeledExample> rows;
    private final Set<String> sourceIndex = new HashSet<>();
    private final Set<String> keyIndex = new HashSet<>();

    public JsonLinesLabeledExampleStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized boolean containsSource(LabelSource source, String sourceId) throws IOException {
        ensureLoaded();
        return sourceIndex.contains(sourceKey(source, sourceId));
    }

    @Override
    public synchronized boolean containsKey(String agent, LabelSource source, String key) throws IOException {
        ensureLoaded();
        return keyIndex.contains(agentKey(agent, source, key));
    }

    @Override
    public synchronized void append(LabeledExample example) throws IOException {
        ensureLoaded();
        if (sourceIndex.contains(sourceKey(example.source(), example.sourceId()))) {
            throw new IllegalArgumentException("Labeled example already exists for source="
                    + example.source().wireName() + " sourceId=" + example.sourceId());
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String line = mapper.writeValueAsString(example) + System.lineSeparator();
        Files.writeString(path, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        index(example);
    }

    @Override
    public synchronized List<LabeledExample> findByAgent(String agent) throws IOException {
        ensureLoaded();
        return rows.stream()
                .filter(example -> example.agent().equals(agent))
                .toList();
    }

    @Override
    public synchronized Set<String> labeledKeys(String agent) throws IOException {
        ensureLoaded();
        Set<String> keys = new LinkedHashSet<>();
        for (LabeledExample example : rows) {
            if (example.agent().equals(agent)) {
                keys.add(example.key());
            }
        }
        return keys;
    }

    @Override
    public synchronized List<String> agents() throws IOException {
        ensureLoaded();
        Set<String> agents = new TreeSet<>();
        rows.forEach(example -> agents.add(example.agent()));
        return List.copyOf(agents);
    }

    @Override
    public synchronized LabeledStats stats(Instant recentCutoff) throws IOException {
        ensureLoaded();
        Map<LabelSource, Long> bySource = new EnumMap<>(LabelSource.class);
        for (LabelSource source : LabelSource.values()) {
            bySource.put(source, 0L);
        }
        Map<String, Long> byAgent = new TreeMap<>();
        long recent = 0;
        for (LabeledExample example : rows) {
            bySource.merge(example.source(), 1L, Long::sum);
            byAgent.merge(example.agent(), 1L, Long::sum);
            if (example.createdAt() != null && !example.createdAt().isBefore(recentCutoff)) {
                recent++;
            }
        }
        return new LabeledStats(rows.size(), bySource, byAgent, recent);
    }

    private void ensureLoaded() throws IOException {
        if (rows != null) {
            return;
        }
        List<LabeledExample> loaded = new ArrayList<>();
        if (Files.exists(path)) {
            List<String> lines = Files.readAllLines(path);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                try {
                    loaded.add(mapper.readValue(line, LabeledExample.class));
                } catch (JsonProcessingException e) {
                    throw new IOException("Unreadable labeled example at " + path + " line " + (i + 1), e);
                }
            }
        }
        rows = new ArrayList<>();
        sourceIndex.clear();
        keyIndex.clear();
        loaded.forEach(this::index);
    }

    private void index(LabeledExample example) {
        rows.add(example);
        sourceIndex.add(sourceKey(example.source(), example.sourceId()));
        keyIndex.add(agentKey(example.agent(), example.source(), example.key()));
    }

    private static String sourceKey(LabelSource source, String sourceId) {
        return source.wireName() + "\u0000" + sourceId;
    }

    private static String agentKey(String agent, LabelSource source, String key) {
        return agent + "\u0000" + source.wireName() + "\u0000" + key;
    }
}
