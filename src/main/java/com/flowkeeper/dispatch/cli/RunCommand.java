package com.flowkeeper.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.engine.ExecutionEngine;
import com.flowkeeper.core.events.EventBus;
import com.flowkeeper.core.workflow.NodeBatchResult;
import com.flowkeeper.core.workflow.WorkflowRunResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;

/**
 * CLI command: flowkeeper run &lt;workflowId&gt; [-i key=value]...
 * <p>
 * Runs a stored workflow to completion and prints node events as they happen.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a stored workflow")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Workflow id (file name in the workflows directory)")
    private String workflowId;

    @Option(names = {"--input", "-i"}, description = "Input value; JSON values are parsed, anything else is a string")
    private Map<String, String> inputs;

    @Option(names = {"--id"}, description = "Execution id (generated when omitted)")
    private String executionId;

    @Option(names = {"--nodes"}, split = ",",
            description = "Run only these nodes, in order, as one long-running batch")
    private List<String> nodes;

    private final ExecutionEngine engine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(ExecutionEngine engine, EventBus eventBus, ObjectMapper objectMapper) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String id = executionId != null ? executionId : engine.generateExecutionId();
        ObjectNode inputNode = toInputs(inputs);

        if (nodes != null && !nodes.isEmpty()) {
            runBatch(id, inputNode);
            return;
        }

        ConsoleOutput.info("Execution " + id + " of workflow " + workflowId);
        EventBus.Subscription subscription = eventBus.subscribe(id, ConsoleOutput::event);
        WorkflowRunResult result;
        try {
            result = engine.runWorkflow(id, workflowId, inputNode);
        } catch (Exception e) {
            ConsoleOutput.error("Workflow failed: " + rootCauseMessage(e));
            return;
        } finally {
            subscription.unsubscribe();
        }

        System.out.println();
        System.out.println("OUTPUTS:");
        System.out.println(pretty(result.outputs()));
        System.out.println();
        if (result.success()) {
            ConsoleOutput.success("Workflow complete.");
        } else {
            result.failedNodes().forEach((node, error) -> ConsoleOutput.error(node + ": " + error));
            ConsoleOutput.error("Workflow failed.");
        }
    }

    private void runBatch(String id, ObjectNode inputNode) {
        ConsoleOutput.info("Node batch " + id + " of workflow " + workflowId + ": " + String.join(", ", nodes));
        NodeBatchResult result = engine.runNodeBatch(id, workflowId, nodes, inputNode);
        if (result.success()) {
            ConsoleOutput.success("Completed " + String.join(", ", result.completedNodes()));
        } else {
            ConsoleOutput.error("Batch failed: " + result.error());
        }
    }

    private ObjectNode toInputs(Map<String, String> raw) {
        ObjectNode node = objectMapper.createObjectNode();
        if (raw == null) {
            return node;
        }
        raw.forEach((key, value) -> node.set(key, parseValue(value)));
        return node;
    }

    private JsonNode parseValue(String value) {
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(value);
        }
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return String.valueOf(node);
        }
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
