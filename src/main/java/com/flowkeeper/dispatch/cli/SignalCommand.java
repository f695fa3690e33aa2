package com.flowkeeper.dispatch.cli;

import com.flowkeeper.core.engine.ExecutionEngine;
import com.flowkeeper.core.substrate.UnknownExecutionException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flowkeeper signal &lt;executionId&gt; &lt;signal&gt; &lt;payload&gt;
 * <p>
 * Delivers a signal to a stored execution. It is seen when the execution
 * next waits, or after {@code resume} if no process is running it.
 */
@Command(name = "signal", mixinStandardHelpOptions = true, description = "Send a signal to an execution")
@Component
public class SignalCommand implements Runnable {

    @Parameters(index = "0", description = "Execution id")
    private String executionId;

    @Parameters(index = "1", description = "Signal name, e.g. userMessage or userInput")
    private String signalName;

    @Parameters(index = "2", description = "Payload text")
    private String payload;

    private final ExecutionEngine engine;

    public SignalCommand(ExecutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        try {
            engine.signal(executionId, signalName, payload);
            ConsoleOutput.success("Signal '" + signalName + "' delivered to " + executionId);
        } catch (UnknownExecutionException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
