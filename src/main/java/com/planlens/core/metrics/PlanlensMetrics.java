package com.planlens.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan analysis.
 */
@Service
public class PlanlensMetrics {

    private final MeterRegistry registry;

    public PlanlensMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, int taskCount, long nanos) {
        Timer.builder("planlens.operation.duration")
                .tag("operation", operation)
                .register(registry)
                .record(Duration.ofNanos(nanos));

        DistributionSummary.builder("planlens.operation.task_count")
                .description("Tasks per analyzed snapshot")
                .tag("operation", operation)
                .register(registry)
                .record(taskCount);
    }

    public void recordRiskScore(int score, String overallRisk) {
        DistributionSummary.builder("planlens.risk.score")
                .tag("overall", overallRisk)
                .register(registry)
                .record(score);
    }

    public void recordHealthScore(int score, String grade) {
        DistributionSummary.builder("planlens.health.score")
                .tag("grade", grade)
                .register(registry)
                .record(score);
    }

    /**
     * Counts snapshots whose dependency graph contains at least one cycle.
     */
    public void recordCycleDetected(int cycleNodeCount) {
        Counter.builder("planlens.graph.cycles")
                .description("Snapshots with circular dependencies")
                .register(registry)
                .increment();

        DistributionSummary.builder("planlens.graph.cycle_nodes")
                .register(registry)
                .record(cycleNodeCount);
    }
}
