package com.planlens.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Dependency structure derived from a task snapshot. Rebuilt on every call.
 *
 * @param nodes          one node per task, in input order
 * @param edges          edges between existing tasks only
 * @param criticalPath   task ids of the longest-duration chain, root first
 * @param parallelGroups same-depth task sets that can run concurrently
 * @param maxDepth       largest finite depth
 * @param hasCycles      true when any task can reach itself
 * @param cycleNodes     tasks on, or on the DFS path into, a detected cycle
 */
public record DependencyGraph(
    List<DependencyNode> nodes,
    List<DependencyEdge> edges,
    List<String> criticalPath,
    List<List<String>> parallelGroups,
    int maxDepth,
    boolean hasCycles,
    List<String> cycleNodes
) {

    public DependencyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        criticalPath = List.copyOf(criticalPath);
        parallelGroups = parallelGroups.stream().map(List::copyOf).toList();
        cycleNodes = List.copyOf(cycleNodes);
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), List.of(), List.of(), List.of(), 0, false, List.of());
    }

    public Optional<DependencyNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }
}
