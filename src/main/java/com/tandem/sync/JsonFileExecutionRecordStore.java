package com.tandem.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores execution records as a single JSON object keyed by execution id.
 * Writes go to a temporary sibling file that is then moved over the original.
 */
public class JsonFileExecutionRecordStore implements ExecutionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileExecutionRecordStore.class);

    private static final TypeReference<LinkedHashMap<String, ExecutionRecord>> RECORDS =
            new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileExecutionRecordStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<ExecutionRecord> find(String executionId) {
        return Optional.ofNullable(load().get(executionId));
    }

    @Override
    public synchronized void save(ExecutionRecord record) {
        Map<String, ExecutionRecord> records = load();
        records.put(record.id(), record);
        write(records);
        log.debug("Saved execution record {}", record.id());
    }

    @Override
    public synchronized List<ExecutionRecord> findAll() {
        return new ArrayList<>(load().values());
    }

    private LinkedHashMap<String, ExecutionRecord> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, ExecutionRecord> records = objectMapper.readValue(file.toFile(), RECORDS);
            return records != null ? records : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read execution records from " + file, e);
        }
    }

    private void write(Map<String, ExecutionRecord> records) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write execution records to " + file, e);
        }
    }
}
