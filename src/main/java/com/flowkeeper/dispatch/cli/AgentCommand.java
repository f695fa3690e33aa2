package com.flowkeeper.dispatch.cli;

import com.flowkeeper.core.agent.AgentOrchestrator;
import com.flowkeeper.core.agent.AgentRunResult;
import com.flowkeeper.core.agent.ConversationMessage;
import com.flowkeeper.core.engine.ExecutionEngine;
import com.flowkeeper.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: flowkeeper agent &lt;agentId&gt; -m "&lt;message&gt;"
 * <p>
 * Runs an agent conversation. With {@code --interactive}, lines typed on
 * stdin are delivered as {@code userMessage} signals while the agent runs.
 */
@Command(name = "agent", mixinStandardHelpOptions = true, description = "Run an agent")
@Component
public class AgentCommand implements Runnable {

    @Parameters(index = "0", description = "Agent id")
    private String agentId;

    @Option(names = {"--message", "-m"}, description = "Initial user message")
    private String message;

    @Option(names = {"--user", "-u"}, description = "User running the agent", defaultValue = "cli")
    private String userId;

    @Option(names = {"--id"}, description = "Execution id (generated when omitted)")
    private String executionId;

    @Option(names = {"--interactive"}, description = "Forward stdin lines as user messages")
    private boolean interactive;

    private final ExecutionEngine engine;
    private final EventBus eventBus;

    public AgentCommand(ExecutionEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String id = executionId != null ? executionId : engine.generateExecutionId();
        ConsoleOutput.info("Agent execution " + id);

        EventBus.Subscription subscription = eventBus.subscribe(id, event -> {
            if ("agent.message".equals(event.eventType())
                    && event.payload().get("message") instanceof ConversationMessage m) {
                ConsoleOutput.agent(m.role().wireName(), m.content() != null ? m.content() : "");
            } else if (!"agent.message".equals(event.eventType())) {
                ConsoleOutput.event(event);
            }
        });
        AgentRunResult result;
        try {
            CompletableFuture<AgentRunResult> future = engine.startAgent(id, agentId, userId, message);
            if (interactive) {
                forwardStdin(id, future);
            }
            result = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted; resume with: flowkeeper resume " + id);
            return;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Agent failed: " + RunCommand.rootCauseMessage(e));
            return;
        } finally {
            subscription.unsubscribe();
        }

        System.out.println();
        if (result.success()) {
            ConsoleOutput.success("Agent finished after " + result.iterations() + " iteration(s).");
        } else {
            ConsoleOutput.error("Agent failed after " + result.iterations() + " iteration(s): " + result.error());
        }
    }

    private void forwardStdin(String id, CompletableFuture<AgentRunResult> future) {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                String line;
                while (!future.isDone() && (line = in.readLine()) != null) {
                    if (!line.isBlank()) {
                        engine.signal(id, AgentOrchestrator.USER_MESSAGE_SIGNAL, line);
                    }
                }
            } catch (IOException e) {
                ConsoleOutput.error("Stopped reading input: " + e.getMessage());
            }
        }, "flowkeeper-stdin");
        reader.setDaemon(true);
        reader.start();
    }
}
