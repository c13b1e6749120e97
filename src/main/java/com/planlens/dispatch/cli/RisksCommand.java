package com.planlens.dispatch.cli;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.RiskAnalysis;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.TaskFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: planlens risks &lt;task-file&gt;
 * <p>
 * Lists triggered risk factors, the aggregate risk score, bottlenecks and recommendations.
 */
@Command(name = "risks", mixinStandardHelpOptions = true, description = "Analyze plan risks")
@Component
public class RisksCommand extends PlanAnalysisCommand<RiskAnalysis> {

    public RisksCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        super(engine, taskFileReader, reportWriter);
    }

    @Override
    protected RiskAnalysis analyze(String planId, List<Task> tasks) {
        return engine.analyzeRisks(planId, tasks);
    }

    @Override
    protected void render(RiskAnalysis result) {
        ConsoleOutput.risks(result);
    }
}
