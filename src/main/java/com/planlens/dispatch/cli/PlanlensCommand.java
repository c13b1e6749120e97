package com.planlens.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Planlens.
 * Routes to subcommands: risks, graph, decompose, schedule, health, report, serve.
 */
@Command(
        name = "planlens",
        mixinStandardHelpOptions = true,
        version = "Planlens 0.1.0",
        description = "Dependency analysis and scheduling heuristics for task plans",
        subcommands = {
                RisksCommand.class,
                GraphCommand.class,
                DecomposeCommand.class,
                ScheduleCommand.class,
                HealthCommand.class,
                ReportCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanlensCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
