package com.planlens.dispatch.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planlens.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a task snapshot from JSON. Accepts either a bare array of tasks or an
 * object of the form {@code {"planId": "...", "tasks": [...]}}.
 */
@Component
public class TaskFileReader {

    private static final Logger log = LoggerFactory.getLogger(TaskFileReader.class);

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public TaskFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A parsed snapshot.
     *
     * @param planId plan id from the file, or null for a bare array
     * @param tasks  validated tasks
     */
    public record TaskSnapshot(String planId, List<Task> tasks) {}

    public TaskSnapshot read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new InvalidTaskSetException("Task file not found: " + file);
        }
        try {
            var snapshot = parse(Files.readString(file));
            log.debug("Loaded {} tasks from {}", snapshot.tasks().size(), file);
            return snapshot;
        } catch (IOException e) {
            throw new InvalidTaskSetException("Cannot read task file " + file + ": " + e.getMessage(), e);
        }
    }

    public TaskSnapshot parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidTaskSetException("Task file is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            String planId = null;
            JsonNode taskNode = root;
            if (root.isObject()) {
                planId = root.hasNonNull("planId") ? root.get("planId").asText() : null;
                taskNode = root.get("tasks");
            }
            if (taskNode == null || !taskNode.isArray()) {
                throw new InvalidTaskSetException("Expected a JSON array of tasks or an object with a \"tasks\" array");
            }
            List<Task> tasks = objectMapper.readerFor(TASK_LIST)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(taskNode);
            return new TaskSnapshot(planId, TaskSetValidator.validate(tasks));
        } catch (JsonProcessingException e) {
            throw new InvalidTaskSetException("Malformed task JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidTaskSetException("Cannot parse tasks: " + e.getMessage(), e);
        }
    }
}
