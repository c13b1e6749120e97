package com.planlens.core.decomposition;

import com.planlens.core.model.DecompositionSuggestion;
import com.planlens.core.model.DecompositionSuggestion.SuggestedSubtask;
import com.planlens.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags tasks that break sizing or quality rules and proposes subtasks for them.
 * Each task is judged on its own; the dependency graph is not consulted.
 */
@Service
public class DecompositionAdvisor {

    private static final Logger log = LoggerFactory.getLogger(DecompositionAdvisor.class);

    static final int MAX_SUBTASK_MINUTES = 45;
    static final int MIN_DESCRIPTION_LENGTH = 20;
    static final int DEFAULT_ESTIMATE_MINUTES = 30;
    static final int MINUTES_PER_SUBTASK = 30;
    static final int MIN_SUBTASKS = 2;

    public List<DecompositionSuggestion> suggest(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        var suggestions = new ArrayList<DecompositionSuggestion>();
        for (var task : tasks) {
            List<String> reasons = violations(task);
            if (reasons.isEmpty()) continue;

            log.debug("  {} needs decomposition: {}", task.id(), reasons);
            suggestions.add(new DecompositionSuggestion(task.id(), String.join("; ", reasons), subtasksFor(task)));
        }
        log.debug("Decomposition: {} of {} tasks flagged", suggestions.size(), tasks.size());
        return suggestions;
    }

    private List<String> violations(Task task) {
        var reasons = new ArrayList<String>();
        if (task.minutes() > MAX_SUBTASK_MINUTES) {
            reasons.add("Estimated " + task.minutes() + " minutes exceeds " + MAX_SUBTASK_MINUTES + "-minute limit");
        }
        if (task.descriptionText().trim().length() < MIN_DESCRIPTION_LENGTH) {
            reasons.add("Description is too vague (less than " + MIN_DESCRIPTION_LENGTH + " characters)");
        }
        if (task.acceptanceCriteriaText().trim().isEmpty()) {
            reasons.add("Missing acceptance criteria");
        }
        return reasons;
    }

    private List<SuggestedSubtask> subtasksFor(Task task) {
        // An absent estimate sizes the split as a 30-minute task.
        int estimate = task.estimatedMinutes() != null ? task.estimatedMinutes() : DEFAULT_ESTIMATE_MINUTES;
        int target = Math.max(MIN_SUBTASKS, SubtaskTemplates.ceilDiv(estimate, MINUTES_PER_SUBTASK));
        return SubtaskTemplates.generate(task.titleText(), task.priority(), estimate, target).stream()
                .map(s -> s.withMaxMinutes(MAX_SUBTASK_MINUTES))
                .toList();
    }
}
