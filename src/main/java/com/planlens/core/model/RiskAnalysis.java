package com.planlens.core.model;

import java.util.List;

/**
 * Aggregate risk assessment of a plan.
 *
 * @param overallRisk     level derived from {@code riskScore}
 * @param riskScore       normalized score in [0,100]
 * @param factors         triggered risk factors, in rule order
 * @param recommendations ordered human-readable actions
 * @param criticalPath    critical path of the dependency graph
 * @param bottlenecks     up to five tasks with the most dependents
 */
public record RiskAnalysis(
    RiskSeverity overallRisk,
    int riskScore,
    List<RiskFactor> factors,
    List<String> recommendations,
    List<String> criticalPath,
    List<Bottleneck> bottlenecks
) {

    public RiskAnalysis {
        factors = List.copyOf(factors);
        recommendations = List.copyOf(recommendations);
        criticalPath = List.copyOf(criticalPath);
        bottlenecks = List.copyOf(bottlenecks);
    }

    /**
     * @param taskId         blocking task
     * @param dependentCount number of direct dependents
     * @param blockingRisk   dependents divided by plan size
     */
    public record Bottleneck(String taskId, int dependentCount, double blockingRisk) {}
}
