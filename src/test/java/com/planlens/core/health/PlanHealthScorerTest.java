package com.planlens.core.health;

import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.PlanHealth.Factor;
import com.planlens.core.model.PlanHealth.Grade;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.planlens.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class PlanHealthScorerTest {

    private static final String DETAILED = "x".repeat(60);

    private DependencyGraphBuilder graphBuilder;
    private PlanHealthScorer scorer;

    @BeforeEach
    void setUp() {
        graphBuilder = new DependencyGraphBuilder();
        scorer = new PlanHealthScorer(graphBuilder);
    }

    @Test
    @DisplayName("Empty plan scores 0 with a single no-tasks factor")
    void emptyPlan() {
        var health = scorer.score(List.of());

        assertEquals(0, health.score());
        assertEquals(Grade.F, health.grade());
        assertEquals(1, health.factors().size());
        assertEquals(PlanHealthScorer.NO_TASKS, health.factors().get(0).name());
        assertEquals(1, health.factors().get(0).weight());
    }

    @Test
    @DisplayName("Ideal plan scores 100 and grade A")
    void idealPlan() {
        var tasks = new ArrayList<Task>();
        for (int i = 0; i < 10; i++) {
            var priority = i < 3 ? TaskPriority.P1 : i < 7 ? TaskPriority.P2 : TaskPriority.P3;
            tasks.add(task("t" + i).priority(priority).description(DETAILED).build());
        }
        var health = scorer.score(tasks);

        assertEquals(100, health.score());
        assertEquals(Grade.A, health.grade());
        assertEquals(6, health.factors().size());
        assertTrue(health.factors().stream().allMatch(f -> f.score() == 100), health.factors()::toString);
    }

    @Test
    @DisplayName("Factors come in fixed order with weights summing to 100")
    void factorOrderAndWeights() {
        var health = scorer.score(List.of(task("a").build()));

        assertEquals(List.of(
                PlanHealthScorer.GRANULARITY,
                PlanHealthScorer.CRITERIA_COVERAGE,
                PlanHealthScorer.PRIORITY_BALANCE,
                PlanHealthScorer.DEPENDENCY_HEALTH,
                PlanHealthScorer.DESCRIPTION_QUALITY,
                PlanHealthScorer.DECOMPOSITION_READINESS),
                health.factors().stream().map(Factor::name).toList());
        assertEquals(List.of(25, 20, 15, 20, 10, 10), health.factors().stream().map(Factor::weight).toList());
    }

    @Test
    @DisplayName("Weighted mean with a single-priority plan lands on B")
    void weightedMean() {
        var health = scorer.score(List.of(
                task("a").description(DETAILED).criteria("Done").build(),
                task("b").description(DETAILED).criteria("Done").build()));

        assertEquals(0, factor(health, PlanHealthScorer.PRIORITY_BALANCE).score());
        assertEquals(100, factor(health, PlanHealthScorer.DESCRIPTION_QUALITY).score());
        assertEquals(85, health.score());
        assertEquals(Grade.B, health.grade());
    }

    @Test
    @DisplayName("Single priority is penalized on top of the deviation")
    void allP1() {
        var tasks = new ArrayList<Task>();
        for (int i = 0; i < 5; i++) {
            tasks.add(task("t" + i).priority(TaskPriority.P1).build());
        }
        var factor = factor(scorer.score(tasks), PlanHealthScorer.PRIORITY_BALANCE);

        assertEquals(0, factor.score());
        assertEquals("P1:5 P2:0 P3:0. 1 distinct.", factor.details());
    }

    @Test
    @DisplayName("Granularity counts 15-45 minute tasks and penalizes tasks over 2h")
    void granularity() {
        var health = scorer.score(List.of(
                task("a").minutes(15).build(),
                task("b").minutes(45).build(),
                task("c").minutes(90).build(),
                task("d").minutes(150).build()));
        var factor = factor(health, PlanHealthScorer.GRANULARITY);

        assertEquals(40, factor.score());
        assertEquals("2/4 in 15-45 min. 2 oversized. 1 exceed 2h.", factor.details());
    }

    @Test
    @DisplayName("Criteria coverage is the share of tasks with criteria")
    void criteriaCoverage() {
        var health = scorer.score(List.of(
                task("a").build(),
                task("b").criteria(null).build(),
                task("c").criteria(" ").build(),
                task("d").build()));

        assertEquals(50, factor(health, PlanHealthScorer.CRITERIA_COVERAGE).score());
    }

    @Test
    @DisplayName("Cycles cost half the dependency score")
    void cyclePenalty() {
        var health = scorer.score(List.of(
                task("a").dependsOn("b").build(),
                task("b").dependsOn("a").build()));
        var factor = factor(health, PlanHealthScorer.DEPENDENCY_HEALTH);

        assertEquals(50, factor.score());
        assertEquals("Depth:0. Cycles:YES. AvgIn:1.0.", factor.details());
    }

    @Test
    @DisplayName("Depth over 5 costs 30 points")
    void deepChainPenalty() {
        var tasks = new ArrayList<Task>();
        tasks.add(task("t0").build());
        for (int i = 1; i < 7; i++) {
            tasks.add(task("t" + i).dependsOn("t" + (i - 1)).build());
        }

        assertEquals(70, factor(scorer.score(tasks), PlanHealthScorer.DEPENDENCY_HEALTH).score());
    }

    @Test
    @DisplayName("Dense graph loses points for depth and average in-degree")
    void denseGraphPenalty() {
        var tasks = new ArrayList<Task>();
        var previous = new ArrayList<String>();
        for (int i = 0; i < 6; i++) {
            String id = "t" + i;
            tasks.add(task(id).dependsOn(previous.toArray(String[]::new)).build());
            previous.add(id);
        }
        var factor = factor(scorer.score(tasks), PlanHealthScorer.DEPENDENCY_HEALTH);

        assertEquals(80, factor.score());
        assertEquals("Depth:5. Cycles:No. AvgIn:2.5.", factor.details());
    }

    @Test
    @DisplayName("Description quality blends average length and detailed share")
    void descriptionQuality() {
        var health = scorer.score(List.of(task("a").description("y".repeat(25)).build()));
        assertEquals(25, factor(health, PlanHealthScorer.DESCRIPTION_QUALITY).score());

        var missing = scorer.score(List.of(task("a").description(null).build()));
        assertEquals(0, factor(missing, PlanHealthScorer.DESCRIPTION_QUALITY).score());
    }

    @Test
    @DisplayName("Decomposition readiness penalizes tasks over 1h and 2h")
    void decompositionReadiness() {
        var health = scorer.score(List.of(task("a").minutes(150).build(), task("b").minutes(90).build()));

        assertEquals(55, factor(health, PlanHealthScorer.DECOMPOSITION_READINESS).score());
    }

    @Test
    @DisplayName("Score and every factor stay within 0..100")
    void bounds() {
        var health = scorer.score(List.of(
                task("a").minutes(5000).criteria(null).description(null).priority(TaskPriority.P1).dependsOn("b").build(),
                task("b").minutes(5000).criteria(null).description(null).priority(TaskPriority.P1).dependsOn("a").build()));

        assertTrue(health.score() >= 0 && health.score() <= 100);
        assertEquals(Grade.F, health.grade());
        for (var factor : health.factors()) {
            assertTrue(factor.score() >= 0 && factor.score() <= 100, factor::toString);
        }
    }

    @Test
    @DisplayName("Scoring against a prebuilt graph matches a standalone run")
    void prebuiltGraph() {
        List<Task> tasks = List.of(task("a").build(), task("b").dependsOn("a").build());

        assertEquals(scorer.score(tasks), scorer.score(tasks, graphBuilder.build(tasks)));
    }

    private static Factor factor(PlanHealth health, String name) {
        return health.factors().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing factor " + name));
    }
}
