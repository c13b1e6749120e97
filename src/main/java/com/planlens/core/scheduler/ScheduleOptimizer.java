package com.planlens.core.scheduler;

import com.planlens.core.graph.DependencyGraphBuilder;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.DependencyNode;
import com.planlens.core.model.ScheduleOptimization;
import com.planlens.core.model.ScheduleOptimization.Estimate;
import com.planlens.core.model.ScheduleOptimization.ParallelizationOpportunity;
import com.planlens.core.model.ScheduleOptimization.ReorderingSuggestion;
import com.planlens.core.model.Task;
import com.planlens.core.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Estimates how much a plan shrinks when every depth layer runs fully in parallel,
 * and suggests which tasks to pull forward or defer.
 * <p>
 * Layers contribute their longest task. Unlayered cycle members have no layer, so their
 * full durations are added back as serial overhead.
 */
@Service
public class ScheduleOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleOptimizer.class);

    private static final int FRONT_LOAD_MIN_DEPENDENTS = 2;
    private static final int MAX_FRONT_LOADED = 5;
    private static final int MAX_DEFERRED = 3;

    private final DependencyGraphBuilder graphBuilder;

    public ScheduleOptimizer(DependencyGraphBuilder graphBuilder) {
        this.graphBuilder = graphBuilder;
    }

    public ScheduleOptimization optimize(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return ScheduleOptimization.empty();
        }
        return optimize(tasks, graphBuilder.build(tasks));
    }

    /**
     * Optimizes {@code tasks} against a graph already built from the same snapshot.
     */
    public ScheduleOptimization optimize(List<Task> tasks, DependencyGraph graph) {
        if (tasks == null || tasks.isEmpty()) {
            return ScheduleOptimization.empty();
        }
        Map<String, Task> byId = new HashMap<>();
        for (var task : tasks) {
            byId.putIfAbsent(task.id(), task);
        }

        long originalMinutes = tasks.stream().mapToLong(Task::minutes).sum();

        var longestPerLayer = new TreeMap<Integer, Integer>();
        var layered = new HashSet<String>();
        for (var node : graph.nodes()) {
            if (!node.layered()) continue;
            layered.add(node.id());
            longestPerLayer.merge(node.depth(), minutesOf(byId, node.id()), Math::max);
        }
        long optimizedMinutes = longestPerLayer.values().stream().mapToLong(Integer::longValue).sum();

        // the cycle set may include layered tasks on the path into a cycle; those already count above
        var cyclic = new HashSet<>(graph.cycleNodes());
        cyclic.removeAll(layered);
        optimizedMinutes += tasks.stream()
                .filter(t -> cyclic.contains(t.id()))
                .mapToLong(Task::minutes)
                .sum();

        int savings = savingsPercent(originalMinutes, optimizedMinutes);

        var opportunities = new ArrayList<ParallelizationOpportunity>();
        for (var group : graph.parallelGroups()) {
            if (group.size() < 2) continue;
            long total = 0;
            int longest = 0;
            for (String id : group) {
                int minutes = minutesOf(byId, id);
                total += minutes;
                longest = Math.max(longest, minutes);
            }
            long saved = total - longest;
            if (saved > 0) {
                // savings are reported as int minutes
                opportunities.add(new ParallelizationOpportunity(group, (int) Math.min(Integer.MAX_VALUE, saved)));
            }
        }

        var reordering = new ArrayList<ReorderingSuggestion>();
        List<DependencyNode> frontLoaded = graph.nodes().stream()
                .filter(n -> n.outDegree() > FRONT_LOAD_MIN_DEPENDENTS)
                .sorted(Comparator.comparingInt(DependencyNode::outDegree).reversed())
                .limit(MAX_FRONT_LOADED)
                .toList();
        for (int i = 0; i < frontLoaded.size(); i++) {
            var node = frontLoaded.get(i);
            reordering.add(new ReorderingSuggestion(node.id(), i,
                    "Bottleneck: " + node.outDegree() + " tasks depend on this. Complete early."));
        }
        graph.nodes().stream()
                .filter(n -> n.outDegree() == 0 && n.inDegree() > 0)
                .filter(n -> n.priority() == TaskPriority.lowest())
                .limit(MAX_DEFERRED)
                .forEach(n -> reordering.add(new ReorderingSuggestion(n.id(), tasks.size() - 1,
                        "Low-priority leaf task can be deferred.")));

        log.debug("Schedule: {} min serial, {} min layered, {}% saved, {} parallel groups",
                originalMinutes, optimizedMinutes, savings, opportunities.size());

        return new ScheduleOptimization(Estimate.ofMinutes(originalMinutes), Estimate.ofMinutes(optimizedMinutes),
                savings, reordering, opportunities);
    }

    static int savingsPercent(long originalMinutes, long optimizedMinutes) {
        if (originalMinutes <= 0) {
            return 0;
        }
        long percent = Math.round(100.0 * (originalMinutes - optimizedMinutes) / originalMinutes);
        return (int) Math.max(0, Math.min(100, percent));
    }

    private static int minutesOf(Map<String, Task> byId, String id) {
        var task = byId.get(id);
        return task != null ? task.minutes() : 0;
    }
}
