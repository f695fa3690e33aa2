package com.flowkeeper.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Flowkeeper.
 */
@Command(
        name = "flowkeeper",
        mixinStandardHelpOptions = true,
        version = "Flowkeeper 0.1.0",
        description = "Durable workflow and agent execution engine",
        subcommands = {
                RunCommand.class,
                AgentCommand.class,
                SignalCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FlowkeeperCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
