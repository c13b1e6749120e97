package com.planlens.core.engine;

import com.planlens.core.decomposition.DecompositionAdvisor;
import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.health.PlanHealthScorer;
import com.planlens.core.metrics.PlanlensMetrics;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.RiskAnalysis;
import com.planlens.core.model.RiskFactor;
import com.planlens.core.model.RiskSeverity;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import com.planlens.core.risk.RiskAnalyzer;
import com.planlens.core.risk.RiskFactorIdGenerator;
import com.planlens.core.scheduler.ScheduleOptimizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static com.planlens.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class PlanningEngineTest {

    private SimpleMeterRegistry registry;
    private RiskFactorIdGenerator idGenerator;
    private PlanningEngine engine;

    private final List<Task> tasks = List.of(
            task("setup").title("Create project skeleton").priority(TaskPriority.P1).minutes(30).build(),
            task("api").title("Implement REST API").priority(TaskPriority.P1).minutes(90).dependsOn("setup").build(),
            task("ui").title("Build dashboard").priority(TaskPriority.P2).minutes(40).dependsOn("setup").build(),
            task("docs").title("Write guide").priority(TaskPriority.P3).minutes(20).criteria(null)
                    .dependsOn("api", "ui").build());

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        idGenerator = new RiskFactorIdGenerator();
        var graphBuilder = new DependencyGraphBuilder();
        engine = new PlanningEngine(graphBuilder,
                new RiskAnalyzer(graphBuilder, idGenerator),
                new DecompositionAdvisor(),
                new ScheduleOptimizer(graphBuilder),
                new PlanHealthScorer(graphBuilder),
                new PlanlensMetrics(registry));
    }

    @Test
    @DisplayName("Graph operation is idempotent")
    void graphIdempotent() {
        assertEquals(engine.buildDependencyGraph(tasks), engine.buildDependencyGraph(tasks));
    }

    @Test
    @DisplayName("Every operation returns equal results on repeated calls")
    void operationsIdempotent() {
        var first = engine.analyzeRisks(tasks);
        var second = engine.analyzeRisks(tasks);
        assertEquals(first.riskScore(), second.riskScore());
        assertEquals(first.overallRisk(), second.overallRisk());
        assertEquals(first.recommendations(), second.recommendations());
        assertEquals(first.criticalPath(), second.criticalPath());
        assertEquals(first.bottlenecks(), second.bottlenecks());
        assertEquals(withoutIds(first), withoutIds(second));

        idGenerator.reset();
        var fromStart = engine.analyzeRisks(tasks);
        idGenerator.reset();
        assertEquals(fromStart, engine.analyzeRisks(tasks));

        assertEquals(engine.suggestDecompositions(tasks), engine.suggestDecompositions(tasks));
        assertEquals(engine.optimizeSchedule(tasks), engine.optimizeSchedule(tasks));
        assertEquals(engine.calculatePlanHealth(tasks), engine.calculatePlanHealth(tasks));
    }

    @Test
    @DisplayName("Operations do not modify the snapshot")
    void snapshotUntouched() {
        var copy = new ArrayList<>(tasks);
        engine.analyzePlan("plan-1", copy);

        assertEquals(tasks, copy);
    }

    @Test
    @DisplayName("Report sections equal the single operations")
    void reportMatchesOperations() {
        idGenerator.reset();
        var risks = engine.analyzeRisks(tasks);
        idGenerator.reset();
        var report = engine.analyzePlan("plan-1", tasks);

        assertEquals("plan-1", report.planId());
        assertEquals(4, report.taskCount());
        assertEquals(engine.buildDependencyGraph(tasks), report.graph());
        assertEquals(risks, report.risks());
        assertEquals(engine.suggestDecompositions(tasks), report.decompositions());
        assertEquals(engine.optimizeSchedule(tasks), report.schedule());
        assertEquals(engine.calculatePlanHealth(tasks), report.health());
    }

    @Test
    @DisplayName("Sample plan flags the oversized API task and the criteria gap")
    void samplePlan() {
        var report = engine.analyzePlan("plan-1", tasks);

        assertEquals(List.of("setup", "api", "docs"), report.graph().criticalPath());
        assertEquals(List.of(List.of("api", "ui")), report.graph().parallelGroups());
        assertEquals(List.of("api", "docs"),
                report.decompositions().stream().map(d -> d.taskId()).toList());
        assertTrue(report.risks().factors().stream().map(RiskFactor::title).toList()
                .containsAll(List.of("Missing acceptance criteria", "Oversized tasks detected")));
        assertEquals(RiskSeverity.forScore(report.risks().riskScore()), report.risks().overallRisk());
        assertEquals(PlanHealth.Grade.forScore(report.health().score()), report.health().grade());
    }

    @Test
    @DisplayName("Empty snapshot yields the empty results of every operation")
    void emptyReport() {
        var report = engine.analyzePlan(null, List.of());

        assertEquals(0, report.taskCount());
        assertTrue(report.graph().nodes().isEmpty());
        assertEquals(RiskSeverity.LOW, report.risks().overallRisk());
        assertTrue(report.decompositions().isEmpty());
        assertEquals(0, report.schedule().savings());
        assertEquals(PlanHealth.Grade.F, report.health().grade());
    }

    @Test
    @DisplayName("Operations record timers and clear the MDC")
    void metricsAndMdc() {
        engine.buildDependencyGraph("plan-1", tasks);
        engine.calculatePlanHealth("plan-1", tasks);

        var timer = registry.find("planlens.operation.duration").tag("operation", "graph").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(registry.find("planlens.health.score").summary());
        assertNull(MDC.get("planId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Cyclic snapshot increments the cycle counter")
    void cycleCounter() {
        engine.buildDependencyGraph(List.of(task("a").dependsOn("b").build(), task("b").dependsOn("a").build()));

        assertEquals(1.0, registry.get("planlens.graph.cycles").counter().count());
    }

    private static List<RiskFactor> withoutIds(RiskAnalysis analysis) {
        return analysis.factors().stream()
                .map(f -> new RiskFactor(null, f.category(), f.severity(), f.probability(), f.impact(),
                        f.riskScore(), f.title(), f.description(), f.mitigation(), f.affectedTasks()))
                .toList();
    }
}
