package com.planlens.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PlanlensMetricsTest {

    private SimpleMeterRegistry registry;
    private PlanlensMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlanlensMetrics(registry);
    }

    @Test
    @DisplayName("Operation timer and task-count summary are tagged by operation")
    void recordOperation() {
        metrics.recordOperation("schedule", 12, TimeUnit.MILLISECONDS.toNanos(5));

        var timer = registry.get("planlens.operation.duration").tag("operation", "schedule").timer();
        assertEquals(1, timer.count());
        assertEquals(5.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(12.0, registry.get("planlens.operation.task_count").tag("operation", "schedule")
                .summary().totalAmount());
    }

    @Test
    @DisplayName("Risk and health scores are tagged by level")
    void recordScores() {
        metrics.recordRiskScore(42, "MEDIUM");
        metrics.recordHealthScore(85, "B");

        assertEquals(42.0, registry.get("planlens.risk.score").tag("overall", "MEDIUM").summary().totalAmount());
        assertEquals(85.0, registry.get("planlens.health.score").tag("grade", "B").summary().totalAmount());
    }

    @Test
    @DisplayName("Cycle detection counts snapshots and cycle sizes")
    void recordCycle() {
        metrics.recordCycleDetected(3);
        metrics.recordCycleDetected(2);

        assertEquals(2.0, registry.get("planlens.graph.cycles").counter().count());
        assertEquals(5.0, registry.get("planlens.graph.cycle_nodes").summary().totalAmount());
    }
}
