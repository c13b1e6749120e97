package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.DecompositionSuggestion;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens decompose &lt;task-file&gt;
 * <p>
 * Lists tasks that are oversized, vaguely described or missing acceptance
 * criteria, with suggested subtasks for each.
 */
@Command(name = "decompose", mixinStandardHelpOptions = true, description = "Suggest task decompositions")
@Component
public class DecomposeCommand extends PlanAnalysisCommand<List<DecompositionSuggestion>> {

    public DecomposeCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected List<DecompositionSuggestion> analyze(String planId, List<Task> tasks) {
        return engine.suggestDecompositions(planId, tasks);
    }

    @Override
    protected void render(List<DecompositionSuggestion> result) {
        ConsoleOutput.decompositions(result);
    }
}
