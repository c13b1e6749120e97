package com.planlens.dispatch.io;

import com.planlens.core.model.Task;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Checks the caller-side preconditions of the analysis engine: every task has an id
 * and ids are unique. Dangling dependencies are left alone; the engine drops them.
 */
public final class TaskSetValidator {

    private TaskSetValidator() {} // utility class

    public static List<Task> validate(List<Task> tasks) {
        if (tasks == null) {
            throw new InvalidTaskSetException("Task list is required");
        }
        var seen = new HashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        for (int i = 0; i < tasks.size(); i++) {
            var task = tasks.get(i);
            if (task == null) {
                throw new InvalidTaskSetException("Task at index " + i + " is null");
            }
            if (task.id() == null || task.id().isBlank()) {
                throw new InvalidTaskSetException("Task at index " + i + " has no id");
            }
            if (!seen.add(task.id())) {
                duplicates.add(task.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidTaskSetException("Duplicate task ids: " + String.join(", ", duplicates));
        }
        return tasks;
    }
}
