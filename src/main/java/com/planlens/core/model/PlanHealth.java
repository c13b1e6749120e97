package com.planlens.core.model;

import java.util.List;

/**
 * Weighted plan quality score.
 *
 * @param score   weighted mean of the factor scores, in [0,100]
 * @param grade   letter grade for {@code score}
 * @param factors individual quality dimensions
 */
public record PlanHealth(int score, Grade grade, List<Factor> factors) {

    public PlanHealth {
        factors = List.copyOf(factors);
    }

    public record Factor(String name, int score, int weight, String details) {}

    public enum Grade {
        A, B, C, D, F;

        public static Grade forScore(int score) {
            if (score >= 90) return A;
            if (score >= 80) return B;
            if (score >= 70) return C;
            if (score >= 60) return D;
            return F;
        }
    }
}
