package com.flowkeeper.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowkeeper.core.engine.EngineProperties;
import com.flowkeeper.core.events.EventEmitter;
import com.flowkeeper.core.events.EventType;
import com.flowkeeper.core.llm.LlmGateway;
import com.flowkeeper.core.llm.LlmProperties;
import com.flowkeeper.core.llm.LlmRequest;
import com.flowkeeper.core.llm.LlmResponse;
import com.flowkeeper.core.logging.MdcContext;
import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import com.flowkeeper.core.signal.SignalWait;
import com.flowkeeper.core.signal.WaitResult;
import com.flowkeeper.core.substrate.ActivityFailureException;
import com.flowkeeper.core.substrate.ActivityOptions;
import com.flowkeeper.core.substrate.DurableContext;
import com.flowkeeper.core.substrate.DurableWorkflow;
import com.flowkeeper.core.substrate.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable ReAct loop: the model is called with the conversation so far, its
 * tool calls are executed in order and their results appended, until the
 * model answers without tools or the iteration budget runs out.
 * <p>
 * Every {@link AgentProperties#getContinueAsNewThreshold() threshold}
 * iterations the conversation is flushed, trimmed to the agent's memory size
 * and carried into a new run of the same execution, which keeps the journal
 * bounded for long conversations.
 */
@Component
public class AgentOrchestrator implements DurableWorkflow<AgentRunRequest, AgentRunResult> {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    public static final String TYPE = "agent-orchestrator";
    public static final String USER_MESSAGE_SIGNAL = "userMessage";

    private final AgentConfigProvider configProvider;
    private final LlmGateway llm;
    private final ToolExecutor toolExecutor;
    private final ConversationStore conversationStore;
    private final EventEmitter events;
    private final AgentProperties agentProperties;
    private final EngineProperties engineProperties;
    private final LlmProperties llmProperties;
    private final FlowkeeperMetrics metrics;
    private final ObjectMapper objectMapper;

    public AgentOrchestrator(AgentConfigProvider configProvider, LlmGateway llm, ToolExecutor toolExecutor,
                             ConversationStore conversationStore, EventEmitter events,
                             AgentProperties agentProperties, EngineProperties engineProperties,
                             LlmProperties llmProperties, FlowkeeperMetrics metrics, ObjectMapper objectMapper) {
        this.configProvider = configProvider;
        this.llm = llm;
        this.toolExecutor = toolExecutor;
        this.conversationStore = conversationStore;
        this.events = events;
        this.agentProperties = agentProperties;
        this.engineProperties = engineProperties;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<AgentRunRequest> inputType() {
        return AgentRunRequest.class;
    }

    @Override
    public Class<AgentRunResult> outputType() {
        return AgentRunResult.class;
    }

    @Override
    public AgentRunResult run(DurableContext ctx, AgentRunRequest request) {
        MdcContext.setAgent(ctx.executionId(), request.agentId());
        AgentConfig config;
        ConversationWindow window;
        if (request.isContinuation()) {
            config = request.config();
            window = ConversationWindow.from(request.checkpoint());
            log.info("Agent {} continuing at iteration {} with {} carried message(s)",
                    request.agentId(), request.iterations(), window.size());
        } else {
            config = loadConfig(ctx, request);
            window = ConversationWindow.empty();
            long now = ctx.currentTime().toEpochMilli();
            window.appendSaved(ConversationMessage.system("sys-" + ctx.randomUuid(), config.systemPrompt(), now));
            if (request.initialMessage() != null && !request.initialMessage().isBlank()) {
                window.append(ConversationMessage.user("user-" + ctx.randomUuid(), request.initialMessage(), now));
            }
            events.emit(ctx, EventType.AGENT_STARTED, payload("agentId", request.agentId(), "agentName", config.name()));
            log.info("Agent {} ({}) started", request.agentId(), config.name());
        }
        return loop(ctx, request, config, window);
    }

    private AgentConfig loadConfig(DurableContext ctx, AgentRunRequest request) {
        try {
            return ctx.executeActivity("getAgentConfig", engineProperties.getPersistence().toOptions(),
                    AgentConfig.class, activity -> configProvider.get(request.agentId(), request.userId()));
        } catch (ActivityFailureException e) {
            throw new AgentConfigException(e.getMessage());
        }
    }

    private AgentRunResult loop(DurableContext ctx, AgentRunRequest request, AgentConfig config,
                                ConversationWindow window) {
        SignalChannel<String> userMessages = ctx.signalChannel(USER_MESSAGE_SIGNAL, String.class);
        int maxIterations = config.maxIterations() > 0 ? config.maxIterations() : agentProperties.getDefaultMaxIterations();
        int threshold = agentProperties.getContinueAsNewThreshold();
        int persistInterval = agentProperties.getPersistInterval();
        int runStart = request.iterations();
        int iteration = runStart;

        while (iteration < maxIterations) {
            if (iteration > runStart && iteration % threshold == 0) {
                persistUnsaved(ctx, window);
                ConversationCheckpoint next = window.summarize(config.memoryConfig().maxMessages());
                if (!ctx.isReplaying()) {
                    metrics.recordCheckpoint("continue-as-new");
                }
                log.info("Agent {} checkpointing at iteration {}: {} -> {} message(s)",
                        request.agentId(), iteration, window.size(), next.messages().size());
                throw ctx.continueAsNew(request.continuation(next, iteration, config));
            }

            events.emit(ctx, EventType.AGENT_THINKING, payload("iteration", iteration));
            LlmResponse response;
            try {
                response = callModel(ctx, config, window);
            } catch (ActivityFailureException e) {
                log.error("Agent {} model call failed: {}", request.agentId(), e.getMessage());
                return fail(ctx, e.getMessage(), iteration, window);
            }

            long now = ctx.currentTime().toEpochMilli();
            ConversationMessage reply = ConversationMessage.assistant(
                    "asst-" + ctx.randomUuid(), response.content(), response.toolCalls(), now);
            window.append(reply);
            events.emit(ctx, EventType.AGENT_MESSAGE, payload("message", reply));

            if (!response.hasToolCalls()) {
                if (!response.requiresUserInput()) {
                    persistUnsaved(ctx, window);
                    int iterations = iteration + 1;
                    events.emit(ctx, EventType.AGENT_COMPLETED,
                            payload("finalMessage", response.content(), "iterations", iterations));
                    if (!ctx.isReplaying()) {
                        metrics.recordAgentIterations(iterations);
                    }
                    log.info("Agent {} completed after {} iteration(s)", request.agentId(), iterations);
                    return AgentRunResult.completed(response.content(), iterations, window.messages());
                }

                Duration timeout = agentProperties.getUserInputTimeout();
                log.info("Agent {} waiting for user input", request.agentId());
                WaitResult<String> input = new SignalWait<>(ctx, userMessages).await(timeout);
                if (!ctx.isReplaying()) {
                    metrics.recordSignalWait(USER_MESSAGE_SIGNAL, input.received());
                }
                if (input.timedOut()) {
                    return fail(ctx, "User input timeout after " + describe(timeout), iteration, window);
                }
                ConversationMessage userMessage = ConversationMessage.user(
                        "user-" + ctx.randomUuid(), input.value(), ctx.currentTime().toEpochMilli());
                window.append(userMessage);
                events.emit(ctx, EventType.AGENT_MESSAGE, payload("message", userMessage));
                iteration++;
                continue;
            }

            for (ToolCall call : response.toolCalls()) {
                runTool(ctx, request, config, window, call);
            }

            if (iteration > 0 && iteration % persistInterval == 0) {
                if (persistUnsaved(ctx, window) > 0 && !ctx.isReplaying()) {
                    metrics.recordCheckpoint("incremental");
                }
            }
            iteration++;
        }

        persistUnsaved(ctx, window);
        return fail(ctx, "Max iterations (" + maxIterations + ") reached", iteration, window);
    }

    private LlmResponse callModel(DurableContext ctx, AgentConfig config, ConversationWindow window) {
        LlmRequest llmRequest = new LlmRequest(
                llmProperties.modelOr(config.model()),
                llmProperties.providerOr(config.provider()),
                config.connectionId(),
                window.messages(),
                config.availableTools(),
                config.temperature(),
                config.maxTokens());
        LlmResponse response = ctx.executeActivity("callLLM", engineProperties.getLlm().toOptions(),
                LlmResponse.class, activity -> llm.call(llmRequest));
        return response != null ? response : LlmResponse.text("");
    }

    private void runTool(DurableContext ctx, AgentRunRequest request, AgentConfig config,
                         ConversationWindow window, ToolCall call) {
        String executionId = ctx.executionId();
        String toolType = config.availableTools().stream()
                .filter(t -> call.name().equals(t.name()))
                .map(ToolDefinition::type)
                .findFirst()
                .orElse("unknown");
        events.emit(ctx, EventType.AGENT_TOOL_CALL_STARTED,
                payload("toolName", call.name(), "toolCallId", call.id(), "arguments", call.arguments()));

        ActivityOptions options = engineProperties.getTool().toOptions();
        String content;
        try {
            JsonNode result = ctx.executeActivity("executeTool:" + call.name(), options, JsonNode.class,
                    activity -> toolExecutor.execute(executionId, call, config.availableTools(),
                            request.userId(), request.agentId()));
            content = toJson(result);
            events.emit(ctx, EventType.AGENT_TOOL_CALL_COMPLETED,
                    payload("toolName", call.name(), "toolCallId", call.id(), "result", result));
            if (!ctx.isReplaying()) {
                metrics.recordToolCall(toolType, true);
            }
        } catch (ActivityFailureException e) {
            log.warn("Tool {} failed: {}", call.name(), e.getMessage());
            content = toJson(objectMapper.createObjectNode().put("error", e.getMessage()));
            events.emit(ctx, EventType.AGENT_TOOL_CALL_FAILED,
                    payload("toolName", call.name(), "toolCallId", call.id(), "error", e.getMessage()));
            if (!ctx.isReplaying()) {
                metrics.recordToolCall(toolType, false);
            }
        }
        window.append(ConversationMessage.tool("tool-" + ctx.randomUuid(), content, call,
                ctx.currentTime().toEpochMilli()));
    }

    /** Writes messages not yet in the conversation store; returns how many were pending. */
    private int persistUnsaved(DurableContext ctx, ConversationWindow window) {
        List<ConversationMessage> unsaved = window.unsaved();
        if (unsaved.isEmpty()) {
            return 0;
        }
        String executionId = ctx.executionId();
        ctx.executeActivity("saveConversation", engineProperties.getPersistence().toOptions(), Integer.class,
                activity -> conversationStore.saveMessages(executionId, unsaved));
        window.markSaved(unsaved);
        return unsaved.size();
    }

    private AgentRunResult fail(DurableContext ctx, String error, int iteration, ConversationWindow window) {
        events.emit(ctx, EventType.AGENT_FAILED, payload("error", error, "iterations", iteration));
        if (!ctx.isReplaying()) {
            metrics.recordAgentIterations(iteration);
        }
        log.warn("Agent run {} failed: {}", ctx.executionId(), error);
        return AgentRunResult.failed(error, iteration, window.messages());
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return String.valueOf(node);
        }
    }

    static String describe(Duration timeout) {
        if (timeout.toMinutes() > 0 && timeout.toSecondsPart() == 0 && timeout.toMillisPart() == 0) {
            long minutes = timeout.toMinutes();
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        if (timeout.toSeconds() > 0 && timeout.toMillisPart() == 0) {
            return timeout.toSeconds() + " seconds";
        }
        return timeout.toMillis() + "ms";
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
