package com.planlens.core.model;

import java.util.List;

/**
 * All analyses of one plan snapshot.
 */
public record PlanReport(
    String planId,
    int taskCount,
    DependencyGraph graph,
    RiskAnalysis risks,
    List<DecompositionSuggestion> decompositions,
    ScheduleOptimization schedule,
    PlanHealth health
) {

    public PlanReport {
        decompositions = List.copyOf(decompositions);
    }
}
