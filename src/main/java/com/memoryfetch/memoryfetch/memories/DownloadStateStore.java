package com.memoryfetch.memoryfetch.memories;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable {@code dedupKey -> local path} mapping shared by all workers of a run and across runs.
 * Every {@link #record} rewrites the whole mapping while holding the store lock; the file is replaced
 * by an atomic move so a reader never observes a partially written document.
 */
public class DownloadStateStore {

    private static final Logger log = LoggerFactory.getLogger(DownloadStateStore.class);
    private static final TypeReference<LinkedHashMap<String, String>> MAPPING_TYPE = new TypeReference<>() {
    };

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private final Map<String, String> entries;

    private DownloadStateStore(Path stateFile, ObjectMapper objectMapper, Map<String, String> entries) {
        this.stateFile = stateFile;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.entries = entries;
    }

    /**
     * Loads previously recorded downloads. Absent or unreadable state starts empty.
     */
    public static DownloadStateStore load(Path stateFile, ObjectMapper objectMapper) {
        return new DownloadStateStore(stateFile, objectMapper, readEntries(stateFile, objectMapper));
    }

    private static Map<String, String> readEntries(Path stateFile, ObjectMapper objectMapper) {
        if (!Files.exists(stateFile)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, String> loaded = objectMapper.readValue(stateFile.toFile(), MAPPING_TYPE);
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException ex) {
            log.warn("Could not load state file {}: {}", stateFile, ex.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Records a written file and flushes the full mapping.
     *
     * @return {@code false} when the mapping could not be persisted; the entry stays in memory
     */
    public synchronized boolean record(String key, Path localPath) {
        entries.put(key, localPath.toString());
        try {
            persist();
            return true;
        } catch (IOException ex) {
            log.warn("Could not save state file {}: {}", stateFile, ex.getMessage());
            return false;
        }
    }

    private void persist() throws IOException {
        Path parent = stateFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, stateFile.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), entries);
            try {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
