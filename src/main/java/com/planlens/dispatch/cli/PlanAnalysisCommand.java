package com.planlens.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.InvalidTaskSetException;
import com.planlens.dispatch.io.TaskFileReader;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared plumbing for subcommands that load a task file, run one analysis and
 * print the result as text or JSON. Exit code 0 on success, 1 for unreadable or
 * invalid task files, 2 for an unknown output format.
 *
 * @param <T> analysis result type
 */
public abstract class PlanAnalysisCommand<T> implements Callable<Integer> {

    @Parameters(index = "0", description = "Task snapshot JSON file (array of tasks or {\"tasks\": [...]})")
    private Path taskFile;

    @Option(names = {"--format", "-f"}, description = "Output format: text or json")
    private String format;

    @Option(names = {"--plan-id"}, description = "Plan id for log correlation (overrides the file's planId)")
    private String planId;

    protected final PlanningEngine engine;
    private final TaskFileReader taskFileReader;
    private final ReportWriter reportWriter;

    protected PlanAnalysisCommand(PlanningEngine engine, TaskFileReader taskFileReader, ReportWriter reportWriter) {
        this.engine = engine;
        this.taskFileReader = taskFileReader;
        this.reportWriter = reportWriter;
    }

    protected abstract T analyze(String planId, List<Task> tasks);

    protected abstract void render(T result);

    @Override
    public Integer call() {
        ReportWriter.Format outputFormat;
        try {
            outputFormat = reportWriter.resolve(format);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        try {
            var snapshot = taskFileReader.read(taskFile);
            T result = analyze(planId != null ? planId : snapshot.planId(), snapshot.tasks());
            if (outputFormat == ReportWriter.Format.JSON) {
                System.out.println(reportWriter.toJson(result));
            } else {
                ConsoleOutput.printBanner();
                ConsoleOutput.info(snapshot.tasks().size() + " tasks loaded from " + taskFile);
                render(result);
            }
            return 0;
        } catch (InvalidTaskSetException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot serialize result: " + e.getOriginalMessage());
            return 1;
        }
    }
}
