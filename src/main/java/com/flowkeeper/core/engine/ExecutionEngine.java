package com.flowkeeper.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.agent.AgentOrchestrator;
import com.flowkeeper.core.agent.AgentRunRequest;
import com.flowkeeper.core.agent.AgentRunResult;
import com.flowkeeper.core.agent.ConversationMessage;
import com.flowkeeper.core.agent.ConversationStore;
import com.flowkeeper.core.signal.HumanInputRequest;
import com.flowkeeper.core.signal.HumanInputResult;
import com.flowkeeper.core.signal.HumanInputWorkflow;
import com.flowkeeper.core.substrate.DurableExecutionHost;
import com.flowkeeper.core.substrate.DurableWorkflow;
import com.flowkeeper.core.substrate.JournalSnapshot;
import com.flowkeeper.core.substrate.UnknownExecutionException;
import com.flowkeeper.core.workflow.ExecutionRecord;
import com.flowkeeper.core.workflow.ExecutionRecordStore;
import com.flowkeeper.core.workflow.NodeBatchRequest;
import com.flowkeeper.core.workflow.NodeBatchResult;
import com.flowkeeper.core.workflow.NodeBatchWorkflow;
import com.flowkeeper.core.workflow.WorkflowCatalog;
import com.flowkeeper.core.workflow.WorkflowDefinition;
import com.flowkeeper.core.workflow.WorkflowOrchestrator;
import com.flowkeeper.core.workflow.WorkflowRunRequest;
import com.flowkeeper.core.workflow.WorkflowRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers: starts workflow and agent executions on the
 * durable host, delivers signals and resumes executions left open by a
 * previous process.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);

    private final DurableExecutionHost host;
    private final WorkflowOrchestrator workflowOrchestrator;
    private final AgentOrchestrator agentOrchestrator;
    private final NodeBatchWorkflow nodeBatchWorkflow;
    private final HumanInputWorkflow humanInputWorkflow;
    private final WorkflowCatalog catalog;
    private final ExecutionRecordStore records;
    private final ConversationStore conversations;
    private final Map<String, DurableWorkflow<?, ?>> workflowsByType = new LinkedHashMap<>();

    public ExecutionEngine(DurableExecutionHost host, WorkflowOrchestrator workflowOrchestrator,
                           AgentOrchestrator agentOrchestrator, NodeBatchWorkflow nodeBatchWorkflow,
                           HumanInputWorkflow humanInputWorkflow, WorkflowCatalog catalog,
                           ExecutionRecordStore records, ConversationStore conversations) {
        this.host = host;
        this.workflowOrchestrator = workflowOrchestrator;
        this.agentOrchestrator = agentOrchestrator;
        this.nodeBatchWorkflow = nodeBatchWorkflow;
        this.humanInputWorkflow = humanInputWorkflow;
        this.catalog = catalog;
        this.records = records;
        this.conversations = conversations;
        for (DurableWorkflow<?, ?> workflow : List.of(workflowOrchestrator, agentOrchestrator,
                nodeBatchWorkflow, humanInputWorkflow)) {
            workflowsByType.put(workflow.type(), workflow);
        }
    }

    // --- workflows ---

    public WorkflowRunResult runWorkflow(String workflowId, ObjectNode inputs) {
        return runWorkflow(generateExecutionId(), workflowId, inputs);
    }

    /**
     * Runs a stored workflow to completion on the calling thread.
     *
     * @throws com.flowkeeper.core.workflow.WorkflowDefinitionException if the workflow is unknown or invalid
     */
    public WorkflowRunResult runWorkflow(String executionId, String workflowId, ObjectNode inputs) {
        WorkflowRunRequest request = prepareWorkflow(executionId, workflowId, inputs);
        return host.execute(executionId, workflowOrchestrator, request);
    }

    public CompletableFuture<WorkflowRunResult> startWorkflow(String executionId, String workflowId, ObjectNode inputs) {
        WorkflowRunRequest request = prepareWorkflow(executionId, workflowId, inputs);
        return host.start(executionId, workflowOrchestrator, request);
    }

    /** Runs an ad-hoc definition that is not in the catalog. */
    public WorkflowRunResult runDefinition(String executionId, String workflowId, WorkflowDefinition definition,
                                           ObjectNode inputs) {
        records.create(executionId, workflowId, inputs);
        log.info("Starting execution {} of ad-hoc workflow {}", executionId, workflowId);
        return host.execute(executionId, workflowOrchestrator, new WorkflowRunRequest(workflowId, definition, inputs));
    }

    private WorkflowRunRequest prepareWorkflow(String executionId, String workflowId, ObjectNode inputs) {
        WorkflowDefinition definition = catalog.require(workflowId);
        records.create(executionId, workflowId, inputs);
        log.info("Starting execution {} of workflow {}", executionId, workflowId);
        return new WorkflowRunRequest(workflowId, definition, inputs);
    }

    public NodeBatchResult runNodeBatch(String executionId, String workflowId, List<String> nodeIds, ObjectNode inputs) {
        log.info("Starting node batch {} of workflow {} ({} node(s))", executionId, workflowId, nodeIds.size());
        return host.execute(executionId, nodeBatchWorkflow, new NodeBatchRequest(workflowId, nodeIds, inputs));
    }

    // --- agents ---

    public AgentRunResult runAgent(String executionId, String agentId, String userId, String initialMessage) {
        log.info("Starting agent execution {} for agent {}", executionId, agentId);
        return host.execute(executionId, agentOrchestrator, AgentRunRequest.fresh(agentId, userId, initialMessage));
    }

    public CompletableFuture<AgentRunResult> startAgent(String executionId, String agentId, String userId,
                                                        String initialMessage) {
        log.info("Starting agent execution {} for agent {} in the background", executionId, agentId);
        return host.start(executionId, agentOrchestrator, AgentRunRequest.fresh(agentId, userId, initialMessage));
    }

    public void sendUserMessage(String executionId, String message) {
        signal(executionId, AgentOrchestrator.USER_MESSAGE_SIGNAL, message);
    }

    public List<ConversationMessage> conversation(String executionId) {
        return conversations.loadMessages(executionId);
    }

    // --- human input ---

    public HumanInputResult awaitUserInput(String executionId, String nodeId, String prompt, Duration timeout) {
        return host.execute(executionId, humanInputWorkflow,
                new HumanInputRequest(executionId, nodeId, prompt, "text", timeout));
    }

    public void submitUserInput(String executionId, String response) {
        signal(executionId, HumanInputWorkflow.SIGNAL, response);
    }

    // --- any execution ---

    public void signal(String executionId, String signalName, Object payload) {
        host.signal(executionId, signalName, payload);
    }

    /**
     * Replays and continues an execution whose journal is still open, using the
     * orchestration recorded in its journal.
     *
     * @return the execution's result
     * @throws UnknownExecutionException if no journal exists
     */
    public Object resume(String executionId) {
        JournalSnapshot snapshot = host.describe(executionId)
                .orElseThrow(() -> new UnknownExecutionException(executionId));
        DurableWorkflow<?, ?> workflow = workflowsByType.get(snapshot.workflowType());
        if (workflow == null) {
            throw new IllegalStateException("No orchestration registered for type '" + snapshot.workflowType() + "'");
        }
        log.info("Resuming execution {} ({})", executionId, snapshot.workflowType());
        return host.resume(executionId, workflow);
    }

    public Optional<JournalSnapshot> describe(String executionId) {
        return host.describe(executionId);
    }

    public Optional<ExecutionRecord> record(String executionId) {
        return records.find(executionId);
    }

    public List<String> listExecutionIds() {
        return host.listExecutionIds();
    }

    /**
     * Generates an execution id in the format FLOW-YYYY-NNNN.
     */
    public String generateExecutionId() {
        int count = EXECUTION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("FLOW-%d-%04d", year, count);
    }
}
