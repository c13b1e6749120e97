package com.planlens.dispatch.cli;

import com.planlens.core.model.DecompositionSuggestion;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.RiskAnalysis;
import com.planlens.core.model.RiskFactor;
import com.planlens.core.model.RiskSeverity;
import com.planlens.core.model.ScheduleOptimization;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for Planlens CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANLENS v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANLENS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        System.out.println(RULE);
    }

    public static void risks(RiskAnalysis analysis) {
        section("Risk Analysis");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Overall: " + severity(analysis.overallRisk()) + " (score " + analysis.riskScore() + "/100)"));
        for (RiskFactor factor : analysis.factors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + severity(factor.severity()) + " " + factor.title()
                            + String.format(Locale.ROOT, " (%.2f)", factor.riskScore())));
            System.out.println("      " + factor.description());
            System.out.println("      -> " + factor.mitigation());
        }
        if (!analysis.criticalPath().isEmpty()) {
            System.out.println("  Critical path: " + String.join(" -> ", analysis.criticalPath()));
        }
        for (var bottleneck : analysis.bottlenecks()) {
            System.out.println(String.format(Locale.ROOT, "  Bottleneck: %s (%d dependents, %.0f%% blocking)",
                    bottleneck.taskId(), bottleneck.dependentCount(), bottleneck.blockingRisk() * 100));
        }
        System.out.println();
        for (String recommendation : analysis.recommendations()) {
            info(recommendation);
        }
    }

    public static void graph(DependencyGraph graph) {
        section("Dependency Graph");
        System.out.println("  Nodes: " + graph.nodes().size() + ", edges: " + graph.edges().size()
                + ", max depth: " + graph.maxDepth());
        for (var node : graph.nodes()) {
            String depth = node.layered() ? String.valueOf(node.depth()) : "-";
            System.out.println(String.format(Locale.ROOT, "  [%s] %-12s in=%d out=%d  %s",
                    depth, node.id(), node.inDegree(), node.outDegree(),
                    node.title() != null ? node.title() : ""));
        }
        if (graph.hasCycles()) {
            error("Cycle detected: " + String.join(", ", graph.cycleNodes()));
        } else {
            success("No dependency cycles");
        }
        if (!graph.criticalPath().isEmpty()) {
            System.out.println("  Critical path: " + String.join(" -> ", graph.criticalPath()));
        }
        for (List<String> group : graph.parallelGroups()) {
            System.out.println("  Parallel: " + String.join(", ", group));
        }
    }

    public static void decompositions(List<DecompositionSuggestion> suggestions) {
        section("Decomposition Suggestions");
        if (suggestions.isEmpty()) {
            success("All tasks are well-sized and specified");
            return;
        }
        for (var suggestion : suggestions) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) " + suggestion.taskId() + "|@ " + suggestion.reason()));
            for (var subtask : suggestion.suggestedSubtasks()) {
                System.out.println("    - " + subtask.title() + " (" + subtask.estimatedMinutes() + " min"
                        + (subtask.priority() != null ? ", " + subtask.priority() : "") + ")");
            }
        }
    }

    public static void schedule(ScheduleOptimization schedule) {
        section("Schedule Optimization");
        System.out.println("  Serial:    " + schedule.originalEstimate().hours() + "h ("
                + schedule.originalEstimate().days() + " days)");
        System.out.println("  Layered:   " + schedule.optimizedEstimate().hours() + "h ("
                + schedule.optimizedEstimate().days() + " days)");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Savings:   @|fg(green) " + schedule.savings() + "%|@"));
        for (var opportunity : schedule.parallelizationOpportunities()) {
            System.out.println("  Parallel:  " + String.join(", ", opportunity.tasks())
                    + " saves " + opportunity.savingsMinutes() + " min");
        }
        for (var move : schedule.reorderingSuggestions()) {
            System.out.println("  Move " + move.taskId() + " to position " + move.suggestedPosition()
                    + ": " + move.reason());
        }
    }

    public static void health(PlanHealth health) {
        section("Plan Health");
        String color = switch (health.grade()) {
            case A, B -> "fg(green)";
            case C, D -> "fg(yellow)";
            case F -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Score: @|bold," + color + " " + health.score() + "/100 (" + health.grade() + ")|@"));
        for (var factor : health.factors()) {
            System.out.println(String.format(Locale.ROOT, "  %-30s %3d  x%-3d %s",
                    factor.name(), factor.score(), factor.weight(), factor.details()));
        }
    }

    private static String severity(RiskSeverity severity) {
        return switch (severity) {
            case LOW -> "@|fg(green) LOW|@";
            case MEDIUM -> "@|fg(yellow) MEDIUM|@";
            case HIGH -> "@|fg(red) HIGH|@";
            case CRITICAL -> "@|fg(red),bold CRITICAL|@";
        };
    }
}
