package com.planlens.core.decomposition;

import com.planlens.core.model.DecompositionSuggestion.SuggestedSubtask;
import com.planlens.core.model.TaskPriority;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword-driven subtask templates. The first category whose keyword appears in the
 * task title (case-insensitive substring) wins; titles matching nothing get an even
 * "Step N" split.
 */
final class SubtaskTemplates {

    enum Category {
        CREATION(List.of("create", "implement", "add", "build")),
        FIX(List.of("fix", "debug", "resolve")),
        REFACTOR(List.of("refactor", "update", "migrate")),
        TEST(List.of("test", "verify")),
        GENERIC(List.of());

        private final List<String> keywords;

        Category(List<String> keywords) {
            this.keywords = keywords;
        }

        List<String> keywords() {
            return keywords;
        }
    }

    private SubtaskTemplates() {} // utility class

    static Category categorize(String title) {
        if (title == null || title.isBlank()) {
            return Category.GENERIC;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (var category : Category.values()) {
            for (String keyword : category.keywords()) {
                if (lower.contains(keyword)) {
                    return category;
                }
            }
        }
        return Category.GENERIC;
    }

    /**
     * @param title     parent task title
     * @param priority  parent priority, inherited by most subtasks
     * @param estimate  parent estimate in minutes
     * @param target    target subtask count, at least 2
     */
    static List<SuggestedSubtask> generate(String title, TaskPriority priority, int estimate, int target) {
        var subtasks = new ArrayList<SuggestedSubtask>();
        switch (categorize(title)) {
            case CREATION -> {
                subtasks.add(new SuggestedSubtask("Design interface/API for: " + title, 20, priority));
                subtasks.add(new SuggestedSubtask("Implement core logic for: " + title, 30, priority));
                subtasks.add(new SuggestedSubtask("Write unit tests for: " + title, 25, priority));
                if (target > 3) {
                    subtasks.add(new SuggestedSubtask("Add error handling for: " + title, 20, priority));
                }
                if (target > 4) {
                    subtasks.add(new SuggestedSubtask("Document: " + title, 15, TaskPriority.lowest()));
                }
            }
            case FIX -> {
                subtasks.add(new SuggestedSubtask("Investigate root cause for: " + title, 20, priority));
                subtasks.add(new SuggestedSubtask("Implement fix for: " + title, 25, priority));
                subtasks.add(new SuggestedSubtask("Write regression test for: " + title, 20, priority));
            }
            case REFACTOR -> {
                subtasks.add(new SuggestedSubtask("Analyze current code for: " + title, 20, priority));
                subtasks.add(new SuggestedSubtask("Apply changes for: " + title, 30, priority));
                subtasks.add(new SuggestedSubtask("Update tests for: " + title, 20, priority));
                if (target > 3) {
                    subtasks.add(new SuggestedSubtask("Verify backwards compatibility for: " + title, 15, priority));
                }
            }
            case TEST -> {
                subtasks.add(new SuggestedSubtask("Write happy-path tests for: " + title, 25, priority));
                subtasks.add(new SuggestedSubtask("Write edge-case tests for: " + title, 25, priority));
                subtasks.add(new SuggestedSubtask("Write error-handling tests for: " + title, 20, priority));
            }
            case GENERIC -> {
                int perStep = ceilDiv(estimate, target);
                for (int i = 0; i < target; i++) {
                    subtasks.add(new SuggestedSubtask("Step " + (i + 1) + " of: " + title, perStep, priority));
                }
            }
        }
        return subtasks;
    }

    static int ceilDiv(int value, int divisor) {
        return (int) Math.ceil((double) value / divisor);
    }
}
