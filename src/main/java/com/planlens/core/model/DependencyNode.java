package com.planlens.core.model;

/**
 * A task as seen by the dependency graph.
 *
 * @param id        task id
 * @param title     task title, copied for reporting
 * @param status    task status, copied for reporting
 * @param priority  task priority, copied for reporting
 * @param depth     topological layer, or -1 when the task is part of or behind a cycle
 * @param inDegree  number of in-graph dependencies
 * @param outDegree number of in-graph dependents
 */
public record DependencyNode(
    String id,
    String title,
    TaskStatus status,
    TaskPriority priority,
    int depth,
    int inDegree,
    int outDegree
) {

    public static final int UNREACHABLE = -1;

    /** True when the node has a finite topological layer. */
    public boolean layered() {
        return depth >= 0;
    }
}
