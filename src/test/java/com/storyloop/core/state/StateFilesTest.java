package com.storyloop.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StateFilesTest {

    public record Sample(@JsonProperty("task_id") String taskId, @JsonProperty("at") Instant at, int count) {}

    @TempDir
    Path tempDir;

    private final StateFiles stateFiles = new StateFiles();

    @Test
    void writeAtomicallyReplacesWholeRecord() throws IOException {
        Path file = tempDir.resolve("nested/dir/record.json");

        stateFiles.writeAtomically(file, new Sample("US-001", Instant.parse("2026-01-15T10:00:00Z"), 1));
        stateFiles.writeAtomically(file, new Sample("US-002", Instant.parse("2026-01-15T10:00:05Z"), 2));

        Sample read = stateFiles.read(file, Sample.class).orElseThrow();
        assertEquals("US-002", read.taskId());
        assertEquals(2, read.count());
        try (var listing = Files.list(file.getParent())) {
            assertEquals(1, listing.count(), "no temp files left behind");
        }
    }

    @Test
    void timestampsAreIsoStrings() throws IOException {
        Path file = tempDir.resolve("record.json");

        stateFiles.writeAtomically(file, new Sample("US-001", Instant.parse("2026-01-15T10:00:00Z"), 1));

        assertTrue(Files.readString(file).contains("\"2026-01-15T10:00:00Z\""));
    }

    @Test
    void readMissingFileIsEmpty() throws IOException {
        assertEquals(Optional.empty(), stateFiles.read(tempDir.resolve("absent.json"), Sample.class));
    }

    @Test
    void readCorruptFileThrows() throws IOException {
        Path file = tempDir.resolve("corrupt.json");
        Files.writeString(file, "{ \"task_id\": ");

        assertThrows(IOException.class, () -> stateFiles.read(file, Sample.class));
    }

    @Test
    void appendLineWritesOneRecordPerLine() throws IOException {
        Path log = tempDir.resolve("logs/events.jsonl");

        stateFiles.appendLine(log, new Sample("US-001", null, 1));
        stateFiles.appendLine(log, new Sample("US-002", null, 2));

        assertEquals(2, Files.readAllLines(log).size());
        List<Sample> records = stateFiles.readLines(log, Sample.class);
        assertEquals(List.of("US-001", "US-002"), records.stream().map(Sample::taskId).toList());
    }

    @Test
    void readLinesSkipsMalformedLines() throws IOException {
        Path log = tempDir.resolve("events.jsonl");
        Files.writeString(log, "{\"task_id\":\"US-001\",\"count\":1}\nnot json\n\n{\"task_id\":\"US-002\",\"count\":2}\n");

        assertEquals(2, stateFiles.readLines(log, Sample.class).size());
    }

    @Test
    void readLinesOfMissingLogIsEmpty() {
        assertTrue(stateFiles.readLines(tempDir.resolve("none.jsonl"), Sample.class).isEmpty());
    }
}
