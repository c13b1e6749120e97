package com.planlens.core.model;

/**
 * Ordered priority tiers. P1 is the most urgent.
 */
public enum TaskPriority {
    P1,
    P2,
    P3;

    public static TaskPriority highest() {
        return P1;
    }

    public static TaskPriority lowest() {
        return P3;
    }
}
