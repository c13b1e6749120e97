package com.planlens.core.model;

/**
 * Ordered severity tiers with their score multipliers.
 */
public enum RiskSeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int weight;

    RiskSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /** Severity for a ratio of offending tasks: &gt;0.5 high, &gt;0.2 medium, else low. */
    public static RiskSeverity forRatio(double ratio) {
        if (ratio > 0.5) return HIGH;
        if (ratio > 0.2) return MEDIUM;
        return LOW;
    }

    /** Overall level for an aggregate 0-100 score. */
    public static RiskSeverity forScore(int score) {
        if (score >= 75) return CRITICAL;
        if (score >= 50) return HIGH;
        if (score >= 25) return MEDIUM;
        return LOW;
    }
}
