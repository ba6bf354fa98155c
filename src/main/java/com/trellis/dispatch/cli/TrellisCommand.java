package com.trellis.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Trellis.
 * Routes to subcommands: threads, timeline, revert, health, serve.
 */
@Command(
        name = "trellis",
        mixinStandardHelpOptions = true,
        version = "Trellis 0.1.0",
        description = "Dependency-gated task coordination with checkpointed agent execution",
        subcommands = {
                ThreadsCommand.class,
                TimelineCommand.class,
                RevertCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TrellisCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // usage via the live spec so subcommands keep their Spring-created instances
        spec.commandLine().usage(System.out);
    }
}
