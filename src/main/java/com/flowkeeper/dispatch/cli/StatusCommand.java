package com.flowkeeper.dispatch.cli;

import com.flowkeeper.core.engine.ExecutionEngine;
import com.flowkeeper.core.substrate.HistoryEvent;
import com.flowkeeper.core.substrate.JournalSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: flowkeeper status &lt;executionId&gt;
 * <p>
 * Shows the journal of an execution: run, status, pending signals and,
 * with {@code --events}, the recorded history of the current run.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show execution status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Execution id")
    private String executionId;

    @Option(names = {"--events", "-e"}, description = "List the recorded history events")
    private boolean showEvents;

    private final ExecutionEngine engine;

    public StatusCommand(ExecutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Optional<JournalSnapshot> found = engine.describe(executionId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Execution not found: " + executionId);
            return;
        }
        JournalSnapshot snapshot = found.get();
        System.out.println("EXECUTION " + snapshot.executionId());
        System.out.println("Type:    " + snapshot.workflowType());
        System.out.println("Run:     " + snapshot.runId());
        System.out.println("Status:  " + snapshot.status());
        System.out.println("Events:  " + snapshot.history().size());
        List<String> pending = snapshot.pendingSignals();
        System.out.println("Pending signals: " + snapshot.pendingSignalCount()
                + (pending.isEmpty() ? "" : " (" + String.join(", ", pending) + ")"));
        engine.record(executionId).ifPresent(record ->
                System.out.println("Record:  " + record.status().wireName()
                        + (record.error() != null ? " (" + record.error() + ")" : "")));
        if (snapshot.failure() != null) {
            ConsoleOutput.error(snapshot.failure());
        }
        if (showEvents) {
            System.out.println();
            for (HistoryEvent event : snapshot.history()) {
                System.out.printf("  %4d %-16s %-28s %s%n", event.sequence(), event.kind(), event.name(),
                        event.failed() ? "FAILED: " + event.failure() : "");
            }
        }
    }
}
