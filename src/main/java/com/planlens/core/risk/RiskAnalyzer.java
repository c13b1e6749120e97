package com.planlens.core.risk;

import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.DependencyNode;
import com.planlens.core.model.RiskAnalysis;
import com.planlens.core.model.RiskAnalysis.Bottleneck;
import com.planlens.core.model.RiskCategory;
import com.planlens.core.model.RiskFactor;
import com.planlens.core.model.RiskSeverity;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scans a task snapshot and its dependency graph for known risk patterns.
 * <p>
 * Each rule fires independently. The aggregate score is the sum of factor scores
 * normalized against the all-critical ceiling of {@code 4 x factorCount}.
 */
@Service
public class RiskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalyzer.class);

    static final String EMPTY_PLAN_RECOMMENDATION = "No tasks to analyze. Create tasks first.";
    static final String HEALTHY_RECOMMENDATION = "Plan looks healthy. Proceed with execution.";

    private static final int MODERATE_PLAN_SIZE = 30;
    private static final int LARGE_PLAN_SIZE = 50;
    private static final int MIN_DESCRIPTION_LENGTH = 20;
    private static final int MAX_TASK_MINUTES = 45;
    private static final int VERY_LARGE_TASK_MINUTES = 120;
    private static final int DEEP_CHAIN_DEPTH = 3;
    private static final int VERY_DEEP_CHAIN_DEPTH = 5;
    private static final int BOTTLENECK_DEPENDENTS = 3;
    private static final int SEVERE_BOTTLENECK_DEPENDENTS = 5;
    private static final double HIGH_EFFORT_HOURS = 80;
    private static final double EXTREME_EFFORT_HOURS = 160;
    private static final int MAX_BOTTLENECKS = 5;

    private final DependencyGraphBuilder graphBuilder;
    private final RiskFactorIdGenerator idGenerator;

    public RiskAnalyzer(DependencyGraphBuilder graphBuilder, RiskFactorIdGenerator idGenerator) {
        this.graphBuilder = graphBuilder;
        this.idGenerator = idGenerator;
    }

    public RiskAnalysis analyze(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return new RiskAnalysis(RiskSeverity.LOW, 0, List.of(),
                    List.of(EMPTY_PLAN_RECOMMENDATION), List.of(), List.of());
        }
        return analyze(tasks, graphBuilder.build(tasks));
    }

    /**
     * Analyzes {@code tasks} against a graph already built from the same snapshot.
     */
    public RiskAnalysis analyze(List<Task> tasks, DependencyGraph graph) {
        if (tasks == null || tasks.isEmpty()) {
            return analyze(tasks);
        }
        int total = tasks.size();
        List<String> allIds = tasks.stream().map(Task::id).filter(Objects::nonNull).toList();
        var factors = new ArrayList<RiskFactor>();

        // Plan size
        if (total > LARGE_PLAN_SIZE) {
            factors.add(factor(RiskCategory.SCOPE, RiskSeverity.HIGH, 0.7, 0.6, "Large plan scope",
                    "Plan has " + total + " tasks, which increases coordination overhead.",
                    "Consider breaking the plan into phases of 20-30 tasks each.", allIds));
        } else if (total > MODERATE_PLAN_SIZE) {
            factors.add(factor(RiskCategory.SCOPE, RiskSeverity.MEDIUM, 0.4, 0.4, "Moderate plan scope",
                    "Plan has " + total + " tasks. Monitor for scope growth.",
                    "Review and prune low-priority tasks regularly.", allIds));
        }

        // Top-priority concentration
        TaskPriority top = TaskPriority.highest();
        List<String> topIds = tasks.stream().filter(t -> t.priority() == top).map(Task::id).filter(Objects::nonNull).toList();
        double topRatio = (double) topIds.size() / total;
        long topPercent = Math.round(topRatio * 100);
        if (topRatio > 0.7) {
            factors.add(factor(RiskCategory.RESOURCE, RiskSeverity.HIGH, 0.8, 0.7, "Excessive " + top + " concentration",
                    topPercent + "% of tasks are " + top + ". When everything is critical, nothing is.",
                    "Re-prioritize: only truly blocking tasks should be " + top + ".", topIds));
        } else if (topRatio > 0.5) {
            factors.add(factor(RiskCategory.RESOURCE, RiskSeverity.MEDIUM, 0.5, 0.5, "High " + top + " concentration",
                    topPercent + "% of tasks are " + top + ".",
                    "Review " + top + " tasks and downgrade those that are not truly blocking.", topIds));
        }

        // Acceptance criteria
        List<String> missingCriteria = tasks.stream()
                .filter(t -> t.acceptanceCriteriaText().trim().isEmpty())
                .map(Task::id).filter(Objects::nonNull)
                .toList();
        if (!missingCriteria.isEmpty()) {
            double ratio = (double) missingCriteria.size() / total;
            factors.add(factor(RiskCategory.SCOPE, RiskSeverity.forRatio(ratio), 0.6 + ratio * 0.3, 0.5 + ratio * 0.3,
                    "Missing acceptance criteria",
                    missingCriteria.size() + " of " + total + " tasks have no acceptance criteria.",
                    "Add clear, binary acceptance criteria to every task.", missingCriteria));
        }

        // Descriptions
        List<String> vague = tasks.stream()
                .filter(t -> t.descriptionText().trim().length() < MIN_DESCRIPTION_LENGTH)
                .map(Task::id).filter(Objects::nonNull)
                .toList();
        if (!vague.isEmpty()) {
            double ratio = (double) vague.size() / total;
            factors.add(factor(RiskCategory.SCOPE, RiskSeverity.forRatio(ratio), 0.5 + ratio * 0.3, 0.4 + ratio * 0.3,
                    "Vague task descriptions",
                    vague.size() + " of " + total + " tasks have descriptions shorter than "
                            + MIN_DESCRIPTION_LENGTH + " characters.",
                    "Expand descriptions to include what, why, and context.", vague));
        }

        // Task size
        List<Task> oversized = tasks.stream().filter(t -> t.minutes() > MAX_TASK_MINUTES).toList();
        if (!oversized.isEmpty()) {
            var severity = oversized.stream().anyMatch(t -> t.minutes() > VERY_LARGE_TASK_MINUTES)
                    ? RiskSeverity.HIGH : RiskSeverity.MEDIUM;
            factors.add(factor(RiskCategory.SCHEDULE, severity, 0.7, 0.6, "Oversized tasks detected",
                    oversized.size() + " tasks exceed " + MAX_TASK_MINUTES + " minutes.",
                    "Decompose tasks >45 min into 15-45 min subtasks.",
                    oversized.stream().map(Task::id).filter(Objects::nonNull).toList()));
        }

        // Chain depth
        if (graph.maxDepth() > DEEP_CHAIN_DEPTH) {
            var severity = graph.maxDepth() > VERY_DEEP_CHAIN_DEPTH ? RiskSeverity.CRITICAL : RiskSeverity.HIGH;
            List<String> deep = graph.nodes().stream()
                    .filter(n -> n.depth() > DEEP_CHAIN_DEPTH)
                    .map(DependencyNode::id)
                    .toList();
            factors.add(factor(RiskCategory.SCHEDULE, severity, 0.6, 0.8, "Deep dependency chains",
                    "Maximum dependency depth is " + graph.maxDepth() + ".",
                    "Flatten the dependency graph.", deep));
        }

        // Cycles
        if (graph.hasCycles()) {
            factors.add(factor(RiskCategory.TECHNICAL, RiskSeverity.CRITICAL, 1.0, 1.0,
                    "Circular dependencies detected",
                    graph.cycleNodes().size() + " tasks are involved in dependency cycles.",
                    "Break the cycles by removing or reversing at least one dependency.", graph.cycleNodes()));
        }

        // Per-node bottlenecks
        List<DependencyNode> bottleneckNodes = graph.nodes().stream()
                .filter(n -> n.outDegree() > BOTTLENECK_DEPENDENTS)
                .toList();
        for (var node : bottleneckNodes) {
            var severity = node.outDegree() > SEVERE_BOTTLENECK_DEPENDENTS ? RiskSeverity.HIGH : RiskSeverity.MEDIUM;
            double impact = Math.min(1.0, 0.3 + (double) node.outDegree() / total);
            factors.add(factor(RiskCategory.SCHEDULE, severity, 0.5, impact,
                    "Bottleneck: \"" + node.title() + "\"",
                    "Task \"" + node.title() + "\" has " + node.outDegree() + " tasks depending on it.",
                    "Prioritize \"" + node.title() + "\" for early completion.", List.of(node.id())));
        }

        // Total effort
        long totalMinutes = tasks.stream().mapToLong(Task::minutes).sum();
        double totalHours = totalMinutes / 60.0;
        if (totalHours > HIGH_EFFORT_HOURS) {
            var severity = totalHours > EXTREME_EFFORT_HOURS ? RiskSeverity.CRITICAL : RiskSeverity.HIGH;
            factors.add(factor(RiskCategory.SCHEDULE, severity, 0.6, 0.7, "High total effort estimate",
                    String.format(Locale.ROOT, "Plan totals %.1f hours of work.", totalHours),
                    "Break the plan into incremental milestones.", allIds));
        }

        int score = aggregateScore(factors);
        var overall = RiskSeverity.forScore(score);

        List<Bottleneck> bottlenecks = graph.nodes().stream()
                .filter(n -> n.outDegree() > 0)
                .sorted(Comparator.comparingInt(DependencyNode::outDegree).reversed())
                .limit(MAX_BOTTLENECKS)
                .map(n -> new Bottleneck(n.id(), n.outDegree(), (double) n.outDegree() / total))
                .toList();

        var recommendations = new ArrayList<String>();
        if (graph.hasCycles()) {
            recommendations.add("CRITICAL: Resolve dependency cycles before starting any work.");
        }
        if (!missingCriteria.isEmpty()) {
            recommendations.add("Add acceptance criteria to " + missingCriteria.size() + " tasks.");
        }
        if (!oversized.isEmpty()) {
            recommendations.add("Decompose " + oversized.size() + " oversized tasks (>45 min).");
        }
        if (topRatio > 0.5) {
            recommendations.add("Re-prioritize tasks: too many " + top + " tasks dilute focus.");
        }
        if (graph.maxDepth() > DEEP_CHAIN_DEPTH) {
            recommendations.add("Flatten dependency chains to reduce cascading delay risk.");
        }
        if (!bottleneckNodes.isEmpty()) {
            recommendations.add("Prioritize bottleneck tasks for early completion.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add(HEALTHY_RECOMMENDATION);
        }

        log.debug("Risk analysis: {} factors, score={}, overall={}", factors.size(), score, overall);
        return new RiskAnalysis(overall, score, factors, recommendations, graph.criticalPath(), bottlenecks);
    }

    static int aggregateScore(List<RiskFactor> factors) {
        double raw = factors.stream().mapToDouble(RiskFactor::riskScore).sum();
        double ceiling = Math.max(factors.size() * RiskSeverity.CRITICAL.weight(), 1);
        long scaled = Math.round(raw / ceiling * 100);
        return (int) Math.max(0, Math.min(100, scaled));
    }

    private RiskFactor factor(RiskCategory category, RiskSeverity severity, double probability, double impact,
                              String title, String description, String mitigation, List<String> affected) {
        return RiskFactor.of(idGenerator.nextId(), category, severity, probability, impact,
                title, description, mitigation, affected);
    }
}
