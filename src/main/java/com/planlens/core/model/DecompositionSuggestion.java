package com.planlens.core.model;

import java.util.List;

/**
 * Proposed split of a task that violates sizing or quality rules.
 *
 * @param taskId            task to decompose
 * @param reason            violated rules joined with "; "
 * @param suggestedSubtasks ordered subtasks, each at most 45 minutes
 */
public record DecompositionSuggestion(
    String taskId,
    String reason,
    List<SuggestedSubtask> suggestedSubtasks
) {

    public DecompositionSuggestion {
        suggestedSubtasks = List.copyOf(suggestedSubtasks);
    }

    public record SuggestedSubtask(String title, int estimatedMinutes, TaskPriority priority) {

        public SuggestedSubtask withMaxMinutes(int max) {
            return estimatedMinutes <= max ? this : new SuggestedSubtask(title, max, priority);
        }
    }
}
