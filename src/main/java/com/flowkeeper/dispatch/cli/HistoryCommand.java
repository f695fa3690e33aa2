package com.flowkeeper.dispatch.cli;

import com.flowkeeper.core.engine.ExecutionEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: flowkeeper history
 * <p>
 * Lists stored executions as a table: Execution ID | Type | Status | Run.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored executions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ExecutionEngine engine;

    public HistoryCommand(ExecutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> ids = engine.listExecutionIds();
        if (ids.isEmpty()) {
            ConsoleOutput.info("No executions found.");
            return;
        }

        List<String> display = ids.size() > limit ? ids.subList(ids.size() - limit, ids.size()) : ids;

        ConsoleOutput.info("Executions (" + display.size() + " of " + ids.size() + "):");
        System.out.println();
        System.out.printf("  %-28s %-20s %-10s %s%n", "EXECUTION ID", "TYPE", "STATUS", "RUN");
        System.out.println("  " + "-".repeat(66));

        for (String id : display) {
            engine.describe(id).ifPresentOrElse(
                    s -> System.out.printf("  %-28s %-20s %-10s %d%n", id, s.workflowType(), s.status(), s.runId()),
                    () -> System.out.printf("  %-28s %-20s %-10s %s%n", id, "-", "UNKNOWN", "-"));
        }
    }
}
