package com.storyloop.prd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads the task list from a {@code prd.json} requirements document:
 *
 * <pre>{@code
 * { "userStories": [ { "id": "US-001", "title": "...", "dependencies": [], "fileScope": [],
 *                      "priority": 1, "passes": false } ] }
 * }</pre>
 *
 * Only the fields the engine needs are read; anything else in the document is ignored.
 */
public class PrdTaskSource {

    private static final Logger log = LoggerFactory.getLogger(PrdTaskSource.class);

    private final ObjectMapper mapper;

    public PrdTaskSource(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Task> load(Path prdFile) {
        String json;
        try {
            json = Files.readString(prdFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read requirements document " + prdFile, e);
        }
        List<Task> tasks = parse(json);
        log.info("Loaded {} stories from {}", tasks.size(), prdFile);
        return tasks;
    }

    /**
     * @throws IllegalArgumentException if the document is not JSON or a story has no id
     */
    public List<Task> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed requirements document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Requirements document must be a JSON object");
        }

        JsonNode stories = root.path("userStories");
        List<Task> tasks = new ArrayList<>();
        if (!stories.isArray()) {
            log.warn("Requirements document has no userStories array");
            return tasks;
        }
        int index = 0;
        for (JsonNode story : stories) {
            String id = story.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Story at index " + index + " has no id");
            }
            tasks.add(new Task(
                    id,
                    story.path("title").asText(id),
                    strings(story.path("dependencies")),
                    new LinkedHashSet<>(strings(story.path("fileScope"))),
                    story.path("priority").isNumber() ? story.get("priority").asInt() : Task.DEFAULT_PRIORITY,
                    story.path("passes").asBoolean(false)));
            index++;
        }
        return tasks;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }
}
