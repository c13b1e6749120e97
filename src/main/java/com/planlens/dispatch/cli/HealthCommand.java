package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.PlanHealth;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens health &lt;task-file&gt;
 * <p>
 * Shows the weighted plan health score, the letter grade and each quality factor.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Grade plan health")
@Component
public class HealthCommand extends PlanAnalysisCommand<PlanHealth> {

    public HealthCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected PlanHealth analyze(String planId, List<Task> tasks) {
        return engine.calculatePlanHealth(planId, tasks);
    }

    @Override
    protected void render(PlanHealth result) {
        ConsoleOutput.health(result);
    }
}
