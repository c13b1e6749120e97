package com.planlens.core.model;

import java.util.List;

/**
 * A single triggered risk rule.
 *
 * @param id            traceability id, unique within a report
 * @param category      risk category
 * @param severity      severity tier
 * @param probability   likelihood in [0,1]
 * @param impact        impact in [0,1]
 * @param riskScore     probability x impact x severity weight
 * @param title         short title
 * @param description   what was detected
 * @param mitigation    suggested action
 * @param affectedTasks ids of the tasks involved
 */
public record RiskFactor(
    String id,
    RiskCategory category,
    RiskSeverity severity,
    double probability,
    double impact,
    double riskScore,
    String title,
    String description,
    String mitigation,
    List<String> affectedTasks
) {

    public RiskFactor {
        affectedTasks = List.copyOf(affectedTasks);
    }

    public static RiskFactor of(String id, RiskCategory category, RiskSeverity severity,
                                double probability, double impact, String title,
                                String description, String mitigation, List<String> affectedTasks) {
        return new RiskFactor(id, category, severity, probability, impact,
                probability * impact * severity.weight(), title, description, mitigation, affectedTasks);
    }
}
