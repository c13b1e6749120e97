package com.planlens.core.engine;

import com.planlens.core.decomposition.DecompositionAdvisor;
import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.health.PlanHealthScorer;
import com.planlens.core.logging.MdcContext;
import com.planlens.core.metrics.PlanlensMetrics;
import com.planlens.core.model.DecompositionSuggestion;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.PlanReport;
import com.planlens.core.model.RiskAnalysis;
import com.planlens.core.model.ScheduleOptimization;
import com.planlens.core.model.Task;
import com.planlens.core.risk.RiskAnalyzer;
import com.planlens.core.scheduler.ScheduleOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for plan analysis. Exposes the five analysis operations and a
 * combined report over one task snapshot.
 * <p>
 * Every operation is a pure function of its input: the snapshot is never modified
 * and nothing is cached between calls. The only shared state is the risk-factor
 * id sequence.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);

    private final DependencyGraphBuilder graphBuilder;
    private final RiskAnalyzer riskAnalyzer;
    private final DecompositionAdvisor decompositionAdvisor;
    private final ScheduleOptimizer scheduleOptimizer;
    private final PlanHealthScorer healthScorer;
    private final PlanlensMetrics metrics;

    public PlanningEngine(DependencyGraphBuilder graphBuilder,
                          RiskAnalyzer riskAnalyzer,
                          DecompositionAdvisor decompositionAdvisor,
                          ScheduleOptimizer scheduleOptimizer,
                          PlanHealthScorer healthScorer,
                          PlanlensMetrics metrics) {
        this.graphBuilder = graphBuilder;
        this.riskAnalyzer = riskAnalyzer;
        this.decompositionAdvisor = decompositionAdvisor;
        this.scheduleOptimizer = scheduleOptimizer;
        this.healthScorer = healthScorer;
        this.metrics = metrics;
    }

    public RiskAnalysis analyzeRisks(List<Task> tasks) {
        return analyzeRisks(null, tasks);
    }

    public RiskAnalysis analyzeRisks(String planId, List<Task> tasks) {
        var result = run(planId, "risks", tasks, () -> riskAnalyzer.analyze(tasks));
        metrics.recordRiskScore(result.riskScore(), result.overallRisk().name());
        log.info("Risk analysis: {} tasks -> {} ({}), {} factors",
                size(tasks), result.overallRisk(), result.riskScore(), result.factors().size());
        return result;
    }

    public DependencyGraph buildDependencyGraph(List<Task> tasks) {
        return buildDependencyGraph(null, tasks);
    }

    public DependencyGraph buildDependencyGraph(String planId, List<Task> tasks) {
        var graph = run(planId, "graph", tasks, () -> graphBuilder.build(tasks));
        if (graph.hasCycles()) {
            metrics.recordCycleDetected(graph.cycleNodes().size());
            log.warn("Dependency cycle detected among {}", graph.cycleNodes());
        }
        log.info("Dependency graph: {} nodes, {} edges, maxDepth={}, critical path {}",
                graph.nodes().size(), graph.edges().size(), graph.maxDepth(), graph.criticalPath());
        return graph;
    }

    public List<DecompositionSuggestion> suggestDecompositions(List<Task> tasks) {
        return suggestDecompositions(null, tasks);
    }

    public List<DecompositionSuggestion> suggestDecompositions(String planId, List<Task> tasks) {
        var suggestions = run(planId, "decompositions", tasks, () -> decompositionAdvisor.suggest(tasks));
        log.info("Decomposition: {} of {} tasks need splitting", suggestions.size(), size(tasks));
        return suggestions;
    }

    public ScheduleOptimization optimizeSchedule(List<Task> tasks) {
        return optimizeSchedule(null, tasks);
    }

    public ScheduleOptimization optimizeSchedule(String planId, List<Task> tasks) {
        var schedule = run(planId, "schedule", tasks, () -> scheduleOptimizer.optimize(tasks));
        log.info("Schedule: {}h serial -> {}h layered ({}% saved)",
                schedule.originalEstimate().hours(), schedule.optimizedEstimate().hours(), schedule.savings());
        return schedule;
    }

    public PlanHealth calculatePlanHealth(List<Task> tasks) {
        return calculatePlanHealth(null, tasks);
    }

    public PlanHealth calculatePlanHealth(String planId, List<Task> tasks) {
        var health = run(planId, "health", tasks, () -> healthScorer.score(tasks));
        metrics.recordHealthScore(health.score(), health.grade().name());
        log.info("Plan health: {} tasks -> {} ({})", size(tasks), health.score(), health.grade());
        return health;
    }

    /**
     * Runs every analysis over the same snapshot. The dependency graph is built once
     * and shared; each section equals the result of the matching single operation.
     */
    public PlanReport analyzePlan(String planId, List<Task> tasks) {
        var report = run(planId, "report", tasks, () -> {
            if (tasks == null || tasks.isEmpty()) {
                return new PlanReport(planId, 0, DependencyGraph.empty(), riskAnalyzer.analyze(tasks),
                        List.of(), ScheduleOptimization.empty(), healthScorer.score(tasks));
            }
            var graph = graphBuilder.build(tasks);
            return new PlanReport(planId, tasks.size(), graph,
                    riskAnalyzer.analyze(tasks, graph),
                    decompositionAdvisor.suggest(tasks),
                    scheduleOptimizer.optimize(tasks, graph),
                    healthScorer.score(tasks, graph));
        });
        if (report.graph().hasCycles()) {
            metrics.recordCycleDetected(report.graph().cycleNodes().size());
        }
        metrics.recordRiskScore(report.risks().riskScore(), report.risks().overallRisk().name());
        metrics.recordHealthScore(report.health().score(), report.health().grade().name());
        log.info("Plan report: {} tasks, risk {} ({}), health {} ({}), {}% schedule savings",
                report.taskCount(), report.risks().overallRisk(), report.risks().riskScore(),
                report.health().score(), report.health().grade(), report.schedule().savings());
        return report;
    }

    private <T> T run(String planId, String operation, List<Task> tasks, Supplier<T> body) {
        MdcContext.setOperation(planId, operation);
        long start = System.nanoTime();
        try {
            return body.get();
        } finally {
            metrics.recordOperation(operation, size(tasks), System.nanoTime() - start);
            MdcContext.clear();
        }
    }

    private static int size(List<Task> tasks) {
        return tasks != null ? tasks.size() : 0;
    }
}
