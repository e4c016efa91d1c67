package com.activelearn.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Settings store persisted as a single JSON document, shared safely between processes.
 *
 * <p>Every read reloads the document, and every batch reloads, applies and persists while holding an exclusive lock
 * on the sibling {@code .lock} file. Commits write a temp file and move it over the previous document, so a failed
 * write leaves the last committed state readable.
 */
public class JsonFileSettingsStore extends InMemorySettingsStore {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private final ProcessFileLock fileLock;

    public JsonFileSettingsStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public JsonFileSettingsStore(Path path, Clock clock) {
        super(clock);
        this.path = path;
        this.fileLock = new ProcessFileLock(path.resolveSibling(path.getFileName() + ".lock"));
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void apply(SettingsBatch batch) throws IOException {
        fileLock.withLock(() -> {
            super.apply(batch);
            return null;
        });
    }

    @Override
    public synchronized long put(String key, JsonNode value, String updatedBy) throws IOException {
        return fileLock.withLock(() -> super.put(key, value, updatedBy));
    }

    @Override
    protected NavigableMap<String, SettingEntry> entries() throws IOException {
        replaceEntries(fileLock.withLock(this::load));
        return super.entries();
    }

    @Override
    protected void persist(Map<String, SettingEntry> snapshot) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private NavigableMap<String, SettingEntry> load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new TreeMap<>();
        }
        return mapper.readValue(path.toFile(), new TypeReference<TreeMap<String, SettingEntry>>() {
        });
    }
}
