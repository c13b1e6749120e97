package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.PlanReport;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens report &lt;task-file&gt;
 * <p>
 * Runs every analysis over the same snapshot and prints them in one report.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Run all plan analyses")
@Component
public class ReportCommand extends PlanAnalysisCommand<PlanReport> {

    public ReportCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected PlanReport analyze(String planId, List<Task> tasks) {
        return engine.analyzePlan(planId, tasks);
    }

    @Override
    protected void render(PlanReport report) {
        ConsoleOutput.health(report.health());
        ConsoleOutput.risks(report.risks());
        ConsoleOutput.graph(report.graph());
        ConsoleOutput.schedule(report.schedule());
        ConsoleOutput.decompositions(report.decompositions());
    }
}
