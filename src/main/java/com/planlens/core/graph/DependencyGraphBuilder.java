package com.planlens.core.graph;

import com.planlens.core.model.DependencyEdge;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.DependencyNode;
import com.planlens.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the dependency graph of a task snapshot: adjacency, cycle detection,
 * topological layering, critical path and parallel groups.
 * <p>
 * Tasks are addressed by their position in the input list; every per-node
 * structure is an array indexed by that position. Dependencies on ids outside
 * the snapshot are dropped. Never throws on malformed task data.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    /**
     * Builds the graph of {@code snapshot}. Null entries and tasks without an id have
     * no identity to depend on and are left out of the graph.
     */
    public DependencyGraph build(List<Task> snapshot) {
        List<Task> tasks = snapshot == null ? List.of() : snapshot.stream()
                .filter(t -> t != null && t.id() != null)
                .toList();
        if (tasks.isEmpty()) {
            return DependencyGraph.empty();
        }

        var adjacency = Adjacency.of(tasks);
        int n = tasks.size();

        boolean[] inCycle = new boolean[n];
        boolean hasCycles = detectCycles(adjacency, inCycle);
        if (hasCycles) {
            markStronglyConnected(adjacency, inCycle);
        }

        int[] depth = new int[n];
        int maxDepth = assignDepths(adjacency, depth);

        List<String> criticalPath = criticalPath(tasks, adjacency, depth);
        List<List<String>> parallelGroups = parallelGroups(tasks, adjacency, depth);

        var nodes = new ArrayList<DependencyNode>(n);
        var cycleNodes = new ArrayList<String>();
        for (int i = 0; i < n; i++) {
            var task = tasks.get(i);
            nodes.add(new DependencyNode(task.id(), task.title(), task.status(), task.priority(),
                    depth[i], adjacency.predecessors.get(i).size(), adjacency.successors.get(i).size()));
            if (inCycle[i]) {
                cycleNodes.add(task.id());
            }
        }

        log.debug("Dependency graph: {} nodes, {} edges, maxDepth={}, cycles={} {}",
                n, adjacency.edges.size(), maxDepth, hasCycles, cycleNodes);

        return new DependencyGraph(nodes, adjacency.edges, criticalPath, parallelGroups,
                maxDepth, hasCycles, cycleNodes);
    }

    /**
     * Three-color DFS from every still-white node, using an explicit stack of
     * {node, next-successor} frames. On reaching a gray node, that node and every
     * frame on the stack (the current path) are marked as cycle members.
     */
    private boolean detectCycles(Adjacency adjacency, boolean[] inCycle) {
        int n = inCycle.length;
        int[] color = new int[n];
        boolean found = false;
        var stack = new ArrayDeque<int[]>();

        for (int root = 0; root < n; root++) {
            if (color[root] != WHITE) continue;
            color[root] = GRAY;
            stack.push(new int[]{root, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> next = adjacency.successors.get(frame[0]);
                if (frame[1] < next.size()) {
                    int neighbour = next.get(frame[1]++);
                    if (color[neighbour] == GRAY) {
                        found = true;
                        inCycle[neighbour] = true;
                        for (int[] onPath : stack) {
                            inCycle[onPath[0]] = true;
                        }
                    } else if (color[neighbour] == WHITE) {
                        color[neighbour] = GRAY;
                        stack.push(new int[]{neighbour, 0});
                    }
                } else {
                    color[frame[0]] = BLACK;
                    stack.pop();
                }
            }
        }
        return found;
    }

    /**
     * Iterative Tarjan pass marking every member of a strongly connected component
     * larger than one node. Catches cycle members that the path marking above misses
     * because they reach the cycle only through an already finished node.
     */
    private void markStronglyConnected(Adjacency adjacency, boolean[] inCycle) {
        int n = inCycle.length;
        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        var component = new ArrayDeque<Integer>();
        var stack = new ArrayDeque<int[]>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) continue;
            index[root] = low[root] = counter++;
            component.push(root);
            onStack[root] = true;
            stack.push(new int[]{root, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                List<Integer> next = adjacency.successors.get(node);
                if (frame[1] < next.size()) {
                    int neighbour = next.get(frame[1]++);
                    if (index[neighbour] < 0) {
                        index[neighbour] = low[neighbour] = counter++;
                        component.push(neighbour);
                        onStack[neighbour] = true;
                        stack.push(new int[]{neighbour, 0});
                    } else if (onStack[neighbour]) {
                        low[node] = Math.min(low[node], index[neighbour]);
                    }
                    continue;
                }
                stack.pop();
                if (!stack.isEmpty()) {
                    int parent = stack.peek()[0];
                    low[parent] = Math.min(low[parent], low[node]);
                }
                if (low[node] == index[node]) {
                    var members = new ArrayList<Integer>();
                    int member;
                    do {
                        member = component.pop();
                        onStack[member] = false;
                        members.add(member);
                    } while (member != node);
                    if (members.size() > 1) {
                        members.forEach(m -> inCycle[m] = true);
                    }
                }
            }
        }
    }

    /**
     * Kahn layering. Only dequeued nodes get a finite depth; a node with any
     * predecessor on or behind a cycle is never dequeued and keeps
     * {@link DependencyNode#UNREACHABLE}.
     *
     * @return the maximum finite depth
     */
    private int assignDepths(Adjacency adjacency, int[] depth) {
        int n = depth.length;
        int[] tentative = new int[n];
        int[] remaining = new int[n];
        boolean[] dequeued = new boolean[n];
        var queue = new ArrayDeque<Integer>();

        for (int i = 0; i < n; i++) {
            remaining[i] = adjacency.predecessors.get(i).size();
            if (remaining[i] == 0) {
                queue.add(i);
            }
        }

        while (!queue.isEmpty()) {
            int current = queue.poll();
            dequeued[current] = true;
            for (int successor : adjacency.successors.get(current)) {
                tentative[successor] = Math.max(tentative[successor], tentative[current] + 1);
                if (--remaining[successor] == 0) {
                    queue.add(successor);
                }
            }
        }

        int maxDepth = 0;
        for (int i = 0; i < n; i++) {
            depth[i] = dequeued[i] ? tentative[i] : DependencyNode.UNREACHABLE;
            if (dequeued[i]) {
                maxDepth = Math.max(maxDepth, depth[i]);
            }
        }
        return maxDepth;
    }

    /**
     * Longest cumulative-duration chain through the layered nodes, visited in
     * ascending depth order. Ties keep the first candidate encountered.
     */
    private List<String> criticalPath(List<Task> tasks, Adjacency adjacency, int[] depth) {
        int n = tasks.size();
        long[] cumulative = new long[n];
        int[] previous = new int[n];
        boolean[] computed = new boolean[n];
        Arrays.fill(previous, -1);

        List<Integer> order = layeredByDepth(depth);
        int end = -1;
        for (int node : order) {
            int best = -1;
            long bestDuration = -1;
            for (int pred : adjacency.predecessors.get(node)) {
                if (computed[pred] && cumulative[pred] > bestDuration) {
                    bestDuration = cumulative[pred];
                    best = pred;
                }
            }
            cumulative[node] = (best >= 0 ? bestDuration : 0) + tasks.get(node).minutes();
            previous[node] = best;
            computed[node] = true;
            if (end < 0 || cumulative[node] > cumulative[end]) {
                end = node;
            }
        }

        var path = new ArrayDeque<String>();
        for (int cur = end; cur >= 0; cur = previous[cur]) {
            path.addFirst(tasks.get(cur).id());
        }
        return List.copyOf(path);
    }

    /**
     * Same-depth sets of size &gt; 1. Members with a same-depth predecessor inside
     * the set are removed, together with that predecessor.
     */
    private List<List<String>> parallelGroups(List<Task> tasks, Adjacency adjacency, int[] depth) {
        var byDepth = new TreeMap<Integer, List<Integer>>();
        for (int i = 0; i < depth.length; i++) {
            if (depth[i] >= 0) {
                byDepth.computeIfAbsent(depth[i], d -> new ArrayList<>()).add(i);
            }
        }

        var groups = new ArrayList<List<String>>();
        for (var layer : byDepth.values()) {
            if (layer.size() < 2) continue;
            Set<Integer> members = new LinkedHashSet<>(layer);
            Set<Integer> related = new LinkedHashSet<>();
            for (int node : layer) {
                for (int pred : adjacency.predecessors.get(node)) {
                    if (members.contains(pred)) {
                        related.add(node);
                        related.add(pred);
                    }
                }
            }
            List<String> parallel = layer.stream()
                    .filter(i -> !related.contains(i))
                    .map(i -> tasks.get(i).id())
                    .toList();
            if (parallel.size() > 1) {
                groups.add(parallel);
            }
        }
        return groups;
    }

    private static List<Integer> layeredByDepth(int[] depth) {
        var order = new ArrayList<Integer>();
        for (int i = 0; i < depth.length; i++) {
            if (depth[i] >= 0) order.add(i);
        }
        order.sort((a, b) -> Integer.compare(depth[a], depth[b]));
        return order;
    }

    /** Forward and reverse adjacency over input positions. */
    private record Adjacency(
            List<List<Integer>> successors,
            List<List<Integer>> predecessors,
            List<DependencyEdge> edges
    ) {
        static Adjacency of(List<Task> tasks) {
            int n = tasks.size();
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < n; i++) {
                index.putIfAbsent(tasks.get(i).id(), i);
            }

            List<List<Integer>> successors = new ArrayList<>(n);
            List<List<Integer>> predecessors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                successors.add(new ArrayList<>());
                predecessors.add(new ArrayList<>());
            }

            var edges = new ArrayList<DependencyEdge>();
            for (int i = 0; i < n; i++) {
                var task = tasks.get(i);
                for (String dep : task.dependencyIds()) {
                    Integer from = dep != null ? index.get(dep) : null;
                    if (from == null) continue;
                    edges.add(new DependencyEdge(dep, task.id()));
                    successors.get(from).add(i);
                    predecessors.get(i).add(from);
                }
            }
            return new Adjacency(successors, predecessors, edges);
        }
    }
}
