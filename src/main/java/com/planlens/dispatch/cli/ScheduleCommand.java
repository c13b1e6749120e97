package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.ScheduleOptimization;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens schedule &lt;task-file&gt;
 * <p>
 * Compares the serial effort with a layer-parallel estimate and suggests reorderings.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true, description = "Estimate a parallelized schedule")
@Component
public class ScheduleCommand extends PlanAnalysisCommand<ScheduleOptimization> {

    public ScheduleCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected ScheduleOptimization analyze(String planId, List<Task> tasks) {
        return engine.optimizeSchedule(planId, tasks);
    }

    @Override
    protected void render(ScheduleOptimization result) {
        ConsoleOutput.schedule(result);
    }
}
