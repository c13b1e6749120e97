package com.planlens.core.model;

import java.util.List;

/**
 * Serial versus layered-parallel schedule estimate.
 *
 * @param originalEstimate             sum of all task durations
 * @param optimizedEstimate            per-layer maximum durations plus cyclic overhead
 * @param savings                      percentage saved, in [0,100]
 * @param reorderingSuggestions        tasks to move to the front or the back
 * @param parallelizationOpportunities same-depth groups with their minutes saved
 */
public record ScheduleOptimization(
    Estimate originalEstimate,
    Estimate optimizedEstimate,
    int savings,
    List<ReorderingSuggestion> reorderingSuggestions,
    List<ParallelizationOpportunity> parallelizationOpportunities
) {

    public ScheduleOptimization {
        reorderingSuggestions = List.copyOf(reorderingSuggestions);
        parallelizationOpportunities = List.copyOf(parallelizationOpportunities);
    }

    public static ScheduleOptimization empty() {
        return new ScheduleOptimization(Estimate.ZERO, Estimate.ZERO, 0, List.of(), List.of());
    }

    /**
     * @param hours hours, one decimal
     * @param days  8-hour workdays, one decimal
     */
    public record Estimate(double hours, double days) {

        public static final Estimate ZERO = new Estimate(0, 0);
        public static final int WORKDAY_HOURS = 8;

        public static Estimate ofMinutes(long minutes) {
            double hours = minutes / 60.0;
            return new Estimate(oneDecimal(hours), oneDecimal(hours / WORKDAY_HOURS));
        }

        private static double oneDecimal(double value) {
            return Math.round(value * 10) / 10.0;
        }
    }

    public record ReorderingSuggestion(String taskId, int suggestedPosition, String reason) {}

    public record ParallelizationOpportunity(List<String> tasks, int savingsMinutes) {

        public ParallelizationOpportunity {
            tasks = List.copyOf(tasks);
        }
    }
}
