package com.planlens.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.io.Serializable;
import java.util.List;

/**
 * A single unit of work within a plan snapshot. Read-only to the analysis engine.
 *
 * @param id                 unique identifier (e.g., "TASK-001")
 * @param title              short human-readable title; drives keyword-based decomposition
 * @param description        what this task should accomplish; nullable
 * @param status             current workflow status
 * @param priority           priority tier (P1 highest)
 * @param dependencies       IDs of tasks that must complete first; unknown IDs are ignored
 * @param acceptanceCriteria how to determine the task is done; nullable
 * @param estimatedMinutes   estimated effort in minutes; nullable, treated as 0
 * @param planId             owning plan, if any
 * @param parentTaskId       parent task when this task came from a decomposition
 * @param sortOrder          position of the task within its plan
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    List<String> dependencies,
    @JsonAlias("acceptance_criteria") String acceptanceCriteria,
    @JsonAlias("estimated_minutes") Integer estimatedMinutes,
    @JsonAlias("plan_id") String planId,
    @JsonAlias("parent_task_id") String parentTaskId,
    @JsonAlias("sort_order") int sortOrder
) implements Serializable {

    /** Convenience constructor for tasks outside any plan. */
    public Task(String id, String title, String description, TaskStatus status, TaskPriority priority,
                List<String> dependencies, String acceptanceCriteria, Integer estimatedMinutes) {
        this(id, title, description, status, priority, dependencies, acceptanceCriteria,
                estimatedMinutes, null, null, 0);
    }

    /** Estimated minutes, 0 when absent. */
    public int minutes() {
        return estimatedMinutes != null ? estimatedMinutes : 0;
    }

    public List<String> dependencyIds() {
        return dependencies != null ? dependencies : List.of();
    }

    public String titleText() {
        return title != null ? title : "";
    }

    public String descriptionText() {
        return description != null ? description : "";
    }

    public String acceptanceCriteriaText() {
        return acceptanceCriteria != null ? acceptanceCriteria : "";
    }
}
