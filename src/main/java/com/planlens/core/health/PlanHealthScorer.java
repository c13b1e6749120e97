package com.planlens.core.health;

import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.DependencyNode;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.PlanHealth.Factor;
import com.planlens.core.model.PlanHealth.Grade;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Grades a plan on six weighted quality dimensions: granularity, acceptance-criteria
 * coverage, priority balance, dependency health, description quality and
 * decomposition readiness.
 */
@Service
public class PlanHealthScorer {

    private static final Logger log = LoggerFactory.getLogger(PlanHealthScorer.class);

    static final String GRANULARITY = "Task Granularity";
    static final String CRITERIA_COVERAGE = "Acceptance Criteria Coverage";
    static final String PRIORITY_BALANCE = "Priority Balance";
    static final String DEPENDENCY_HEALTH = "Dependency Health";
    static final String DESCRIPTION_QUALITY = "Description Quality";
    static final String DECOMPOSITION_READINESS = "Decomposition Readiness";
    static final String NO_TASKS = "No tasks";

    /** Ideal P1/P2/P3 split. */
    private static final Map<TaskPriority, Double> IDEAL_SHARE = new EnumMap<>(Map.of(
            TaskPriority.P1, 0.3,
            TaskPriority.P2, 0.4,
            TaskPriority.P3, 0.3));

    private final DependencyGraphBuilder graphBuilder;

    public PlanHealthScorer(DependencyGraphBuilder graphBuilder) {
        this.graphBuilder = graphBuilder;
    }

    public PlanHealth score(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return new PlanHealth(0, Grade.F, List.of(new Factor(NO_TASKS, 0, 1, "Plan has no tasks.")));
        }
        return score(tasks, graphBuilder.build(tasks));
    }

    /**
     * Scores {@code tasks} against a graph already built from the same snapshot.
     */
    public PlanHealth score(List<Task> tasks, DependencyGraph graph) {
        if (tasks == null || tasks.isEmpty()) {
            return score(tasks);
        }
        var factors = new ArrayList<Factor>();
        factors.add(granularity(tasks));
        factors.add(criteriaCoverage(tasks));
        factors.add(priorityBalance(tasks));
        factors.add(dependencyHealth(graph));
        factors.add(descriptionQuality(tasks));
        factors.add(decompositionReadiness(tasks));

        int totalWeight = factors.stream().mapToInt(Factor::weight).sum();
        double weighted = factors.stream().mapToDouble(f -> (double) f.score() * f.weight()).sum() / totalWeight;
        int score = clamp(Math.round(weighted));
        var grade = Grade.forScore(score);

        log.debug("Plan health: score={}, grade={}, factors={}", score, grade, factors);
        return new PlanHealth(score, grade, factors);
    }

    private Factor granularity(List<Task> tasks) {
        int total = tasks.size();
        long inRange = tasks.stream().filter(t -> t.minutes() >= 15 && t.minutes() <= 45).count();
        long over45 = tasks.stream().filter(t -> t.minutes() > 45).count();
        long over120 = tasks.stream().filter(t -> t.minutes() > 120).count();
        double raw = (double) inRange / total * 100 - over120 * 10;
        return new Factor(GRANULARITY, clamp(Math.round(raw)), 25,
                inRange + "/" + total + " in 15-45 min. " + over45 + " oversized. " + over120 + " exceed 2h.");
    }

    private Factor criteriaCoverage(List<Task> tasks) {
        int total = tasks.size();
        long covered = tasks.stream().filter(t -> !t.acceptanceCriteriaText().trim().isEmpty()).count();
        return new Factor(CRITERIA_COVERAGE, clamp(Math.round((double) covered / total * 100)), 20,
                covered + "/" + total + " have criteria.");
    }

    private Factor priorityBalance(List<Task> tasks) {
        int total = tasks.size();
        var counts = new EnumMap<TaskPriority, Long>(TaskPriority.class);
        for (var priority : TaskPriority.values()) {
            counts.put(priority, 0L);
        }
        long distinct = tasks.stream().map(Task::priority).distinct().count();
        for (var task : tasks) {
            if (task.priority() != null) {
                counts.merge(task.priority(), 1L, Long::sum);
            }
        }

        double deviation = 0;
        for (var priority : TaskPriority.values()) {
            deviation += Math.abs((double) counts.get(priority) / total - IDEAL_SHARE.get(priority));
        }
        deviation /= TaskPriority.values().length;

        double raw = Math.max(0, (1 - deviation * 3) * 100);
        if (distinct == 1) {
            raw = Math.max(0, raw - 30);
        }
        return new Factor(PRIORITY_BALANCE, clamp(Math.round(raw)), 15,
                "P1:" + counts.get(TaskPriority.P1) + " P2:" + counts.get(TaskPriority.P2)
                        + " P3:" + counts.get(TaskPriority.P3) + ". " + distinct + " distinct.");
    }

    private Factor dependencyHealth(DependencyGraph graph) {
        double raw = 100;
        if (graph.hasCycles()) raw -= 50;
        if (graph.maxDepth() > 5) {
            raw -= 30;
        } else if (graph.maxDepth() > 3) {
            raw -= 15;
        }
        double avgIn = graph.nodes().stream().mapToInt(DependencyNode::inDegree).sum()
                / (double) Math.max(graph.nodes().size(), 1);
        if (avgIn > 2) {
            raw -= Math.min(20, (avgIn - 2) * 10);
        }
        return new Factor(DEPENDENCY_HEALTH, clamp(Math.round(Math.max(0, raw))), 20,
                String.format(Locale.ROOT, "Depth:%d. Cycles:%s. AvgIn:%.1f.",
                        graph.maxDepth(), graph.hasCycles() ? "YES" : "No", avgIn));
    }

    private Factor descriptionQuality(List<Task> tasks) {
        int total = tasks.size();
        List<Integer> lengths = tasks.stream().map(t -> t.descriptionText().trim().length()).toList();
        double avgLength = lengths.stream().mapToInt(Integer::intValue).sum() / (double) total;
        long detailed = lengths.stream().filter(l -> l >= 50).count();
        double raw = Math.min(100, (avgLength / 50) * 100 * 0.5 + (double) detailed / total * 100 * 0.5);
        return new Factor(DESCRIPTION_QUALITY, clamp(Math.round(raw)), 10,
                "Avg:" + Math.round(avgLength) + " chars. " + detailed + "/" + total + ">=50.");
    }

    private Factor decompositionReadiness(List<Task> tasks) {
        long over2h = tasks.stream().filter(t -> t.minutes() > 120).count();
        long over1h = tasks.stream().filter(t -> t.minutes() > 60).count();
        long raw = Math.max(0, 100 - over2h * 25 - over1h * 10);
        return new Factor(DECOMPOSITION_READINESS, clamp(raw), 10,
                over2h + " exceed 2h. " + over1h + " exceed 1h.");
    }

    private static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }
}
