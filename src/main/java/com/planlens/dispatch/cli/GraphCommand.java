package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.DependencyGraph;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens graph &lt;task-file&gt;
 * <p>
 * Prints node depths and degrees, cycles, the critical path and parallel groups.
 */
@Command(name = "graph", mixinStandardHelpOptions = true, description = "Show the dependency graph")
@Component
public class GraphCommand extends PlanAnalysisCommand<DependencyGraph> {

    public GraphCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected DependencyGraph analyze(String planId, List<Task> tasks) {
        return engine.buildDependencyGraph(planId, tasks);
    }

    @Override
    protected void render(DependencyGraph result) {
        ConsoleOutput.graph(result);
    }
}
