package com.planlens.core.model;

/**
 * Directed edge: {@code to} depends on {@code from}.
 */
public record DependencyEdge(String from, String to) {
}
