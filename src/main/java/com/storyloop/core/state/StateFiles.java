package com.storyloop.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON persistence for the files the dashboard layer reads: whole-record files written
 * atomically, and append-only JSON Lines logs.
 *
 * <p>Records use snake_case field names and ISO-8601 timestamps. Fields a record type does not
 * declare are ignored on read, since agents and dashboards may add their own.
 */
public class StateFiles {

    private static final Logger log = LoggerFactory.getLogger(StateFiles.class);

    private final ObjectMapper mapper;

    public StateFiles() {
        this(defaultMapper());
    }

    public StateFiles(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Writes {@code value} to a temp file in the target directory, then renames it over the
     * target so readers see either the old or the new record, never a partial one.
     */
    public void writeAtomically(Path target, Object value) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.write(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, using plain replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    /**
     * Reads a whole-record file.
     *
     * @return empty if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public <T> Optional<T> read(Path file, Class<T> type) throws IOException {
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /** Appends one record as a single JSON line. */
    public synchronized void appendLine(Path logFile, Object record) {
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            String line = mapper.writeValueAsString(record) + "\n";
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + logFile, e);
        }
    }

    /**
     * Reads every parseable record from a JSON Lines log, skipping malformed lines.
     *
     * @return records in file order; empty if the log does not exist
     */
    public <T> List<T> readLines(Path logFile, Class<T> type) {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + logFile, e);
        }
        List<T> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(mapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed line in {}: {}", logFile, e.getOriginalMessage());
            }
        }
        return records;
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
