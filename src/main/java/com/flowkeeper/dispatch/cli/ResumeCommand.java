package com.flowkeeper.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowkeeper.core.engine.ExecutionEngine;
import com.flowkeeper.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: flowkeeper resume &lt;executionId&gt;
 * <p>
 * Replays a stored execution from its journal and runs it to the end.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted execution")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Execution id")
    private String executionId;

    private final ExecutionEngine engine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public ResumeCommand(ExecutionEngine engine, EventBus eventBus, ObjectMapper objectMapper) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus.subscribe(executionId, ConsoleOutput::event);
        Object result;
        try {
            result = engine.resume(executionId);
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + RunCommand.rootCauseMessage(e));
            return;
        } finally {
            subscription.unsubscribe();
        }
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            System.out.println(result);
        }
        ConsoleOutput.success("Execution " + executionId + " finished.");
    }
}
