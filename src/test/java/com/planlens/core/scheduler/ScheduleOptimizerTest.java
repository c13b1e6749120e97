package com.planlens.core.scheduler;

import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.model.ScheduleOptimization.ReorderingSuggestion;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.planlens.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleOptimizerTest {

    private DependencyGraphBuilder graphBuilder;
    private ScheduleOptimizer optimizer;

    @BeforeEach
    void setUp() {
        graphBuilder = new DependencyGraphBuilder();
        optimizer = new ScheduleOptimizer(graphBuilder);
    }

    @Test
    @DisplayName("Empty plan has zero estimates and no suggestions")
    void emptyPlan() {
        var schedule = optimizer.optimize(List.of());

        assertEquals(0.0, schedule.originalEstimate().hours());
        assertEquals(0.0, schedule.optimizedEstimate().days());
        assertEquals(0, schedule.savings());
        assertTrue(schedule.reorderingSuggestions().isEmpty());
        assertTrue(schedule.parallelizationOpportunities().isEmpty());
    }

    @Test
    @DisplayName("Two independent tasks run in parallel")
    void independentTasks() {
        var schedule = optimizer.optimize(List.of(task("a").minutes(60).build(), task("b").minutes(120).build()));

        assertEquals(3.0, schedule.originalEstimate().hours());
        assertEquals(2.0, schedule.optimizedEstimate().hours());
        assertEquals(33, schedule.savings());
        assertEquals(1, schedule.parallelizationOpportunities().size());
        assertEquals(List.of("a", "b"), schedule.parallelizationOpportunities().get(0).tasks());
        assertEquals(60, schedule.parallelizationOpportunities().get(0).savingsMinutes());
    }

    @Test
    @DisplayName("Estimates convert to 8-hour days")
    void workdays() {
        var schedule = optimizer.optimize(List.of(task("a").minutes(480).build()));

        assertEquals(8.0, schedule.originalEstimate().hours());
        assertEquals(1.0, schedule.originalEstimate().days());
        assertEquals(0, schedule.savings());
    }

    @Test
    @DisplayName("Fan-out layers take their longest task")
    void fanOut() {
        var schedule = optimizer.optimize(List.of(
                task("a").minutes(30).build(),
                task("b").minutes(20).dependsOn("a").build(),
                task("c").minutes(20).dependsOn("a").build()));

        assertEquals(1.2, schedule.originalEstimate().hours());
        assertEquals(0.8, schedule.optimizedEstimate().hours());
        assertEquals(29, schedule.savings());
        assertEquals(List.of("b", "c"), schedule.parallelizationOpportunities().get(0).tasks());
        assertEquals(20, schedule.parallelizationOpportunities().get(0).savingsMinutes());
    }

    @Test
    @DisplayName("Serial chain saves nothing")
    void chain() {
        var schedule = optimizer.optimize(List.of(
                task("a").minutes(30).build(),
                task("b").minutes(30).dependsOn("a").build()));

        assertEquals(0, schedule.savings());
        assertEquals(schedule.originalEstimate(), schedule.optimizedEstimate());
        assertTrue(schedule.parallelizationOpportunities().isEmpty());
    }

    @Test
    @DisplayName("Cycle members are added back as serial time")
    void cycleOverhead() {
        var schedule = optimizer.optimize(List.of(
                task("a").minutes(30).dependsOn("b").build(),
                task("b").minutes(30).dependsOn("a").build(),
                task("c").minutes(30).build()));

        assertEquals(1.5, schedule.originalEstimate().hours());
        assertEquals(1.5, schedule.optimizedEstimate().hours());
        assertEquals(0, schedule.savings());
    }

    @Test
    @DisplayName("Cycle fed by a layered root is counted once")
    void cycleFedByRoot() {
        var schedule = optimizer.optimize(List.of(
                task("r").minutes(30).build(),
                task("x").minutes(30).dependsOn("r", "y").build(),
                task("y").minutes(30).dependsOn("x").build()));

        assertEquals(1.5, schedule.originalEstimate().hours());
        assertEquals(1.5, schedule.optimizedEstimate().hours());
        assertEquals(0, schedule.savings());
    }

    @Test
    @DisplayName("Huge estimates in one group do not overflow the savings")
    void hugeEstimates() {
        var schedule = optimizer.optimize(List.of(
                task("a").minutes(Integer.MAX_VALUE).build(),
                task("b").minutes(Integer.MAX_VALUE).build()));

        assertEquals(1, schedule.parallelizationOpportunities().size());
        assertEquals(Integer.MAX_VALUE, schedule.parallelizationOpportunities().get(0).savingsMinutes());
        assertEquals(50, schedule.savings());
    }

    @Test
    @DisplayName("Zero-length tasks in a group save nothing")
    void zeroSavingsGroupDropped() {
        var schedule = optimizer.optimize(List.of(task("a").minutes(0).build(), task("b").minutes(null).build()));

        assertTrue(schedule.parallelizationOpportunities().isEmpty());
        assertEquals(0, schedule.savings());
    }

    @Test
    @DisplayName("Bottlenecks move to the front, low-priority leaves to the back")
    void reordering() {
        var schedule = optimizer.optimize(List.of(
                task("a").build(),
                task("b").priority(TaskPriority.P3).dependsOn("a").build(),
                task("c").dependsOn("a").build(),
                task("d").dependsOn("a").build()));

        assertEquals(List.of(
                new ReorderingSuggestion("a", 0, "Bottleneck: 3 tasks depend on this. Complete early."),
                new ReorderingSuggestion("b", 3, "Low-priority leaf task can be deferred.")),
                schedule.reorderingSuggestions());
        assertEquals(50, schedule.savings());
    }

    @Test
    @DisplayName("At most three low-priority leaves are deferred")
    void deferralLimit() {
        var tasks = new ArrayList<Task>();
        tasks.add(task("r").build());
        for (int i = 0; i < 6; i++) {
            tasks.add(task("l" + i).priority(i < 2 ? TaskPriority.P2 : TaskPriority.P3).dependsOn("r").build());
        }
        var deferred = optimizer.optimize(tasks).reorderingSuggestions().stream()
                .filter(s -> s.suggestedPosition() == tasks.size() - 1)
                .map(ReorderingSuggestion::taskId)
                .toList();

        assertEquals(List.of("l2", "l3", "l4"), deferred);
    }

    @Test
    @DisplayName("Isolated low-priority task is not a deferral candidate")
    void isolatedLeafKept() {
        var schedule = optimizer.optimize(List.of(task("a").priority(TaskPriority.P3).build()));

        assertTrue(schedule.reorderingSuggestions().isEmpty());
    }

    @Test
    @DisplayName("Front-loading is ordered by dependents and capped at five")
    void frontLoadLimit() {
        var tasks = new ArrayList<Task>();
        for (int hub = 0; hub < 6; hub++) {
            tasks.add(task("h" + hub).build());
            for (int i = 0; i < 3 + hub; i++) {
                tasks.add(task("h" + hub + "-" + i).dependsOn("h" + hub).build());
            }
        }
        var frontLoaded = optimizer.optimize(tasks).reorderingSuggestions().stream()
                .filter(s -> s.reason().startsWith("Bottleneck"))
                .toList();

        assertEquals(5, frontLoaded.size());
        assertEquals("h5", frontLoaded.get(0).taskId());
        assertEquals(0, frontLoaded.get(0).suggestedPosition());
        assertEquals(4, frontLoaded.get(4).suggestedPosition());
    }

    @Test
    @DisplayName("Savings stay within 0..100")
    void savingsBounds() {
        assertEquals(0, ScheduleOptimizer.savingsPercent(0, 0));
        assertEquals(0, ScheduleOptimizer.savingsPercent(100, 150));
        assertEquals(100, ScheduleOptimizer.savingsPercent(100, 0));
    }

    @Test
    @DisplayName("Optimizing against a prebuilt graph matches a standalone run")
    void prebuiltGraph() {
        List<Task> tasks = List.of(
                task("a").minutes(30).build(),
                task("b").minutes(40).dependsOn("a").build(),
                task("c").minutes(10).dependsOn("a").build());

        assertEquals(optimizer.optimize(tasks), optimizer.optimize(tasks, graphBuilder.build(tasks)));
    }
}
