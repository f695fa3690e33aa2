package com.flowkeeper.core.substrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.flowkeeper.core.engine.EngineProperties;
import com.flowkeeper.core.logging.MdcContext;
import com.flowkeeper.core.metrics.FlowkeeperMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference {@link DurableExecutionHost} that runs orchestrations in this JVM
 * and journals every command through a {@link JournalStore}.
 * <p>
 * Orchestrations run on the calling thread ({@link #execute}) or on a fixed
 * orchestration pool ({@link #start}); activity attempts always run on a
 * separate cached pool so their timeouts can be enforced. Executions that were
 * open when the JVM stopped are picked up again with {@link #resume}, which
 * replays the stored history.
 */
@Service
public class InProcessExecutionHost implements DurableExecutionHost {

    private static final Logger log = LoggerFactory.getLogger(InProcessExecutionHost.class);

    private final JournalStore journalStore;
    private final ObjectMapper objectMapper;
    private final FlowkeeperMetrics metrics;
    private final Clock clock;
    private final ExecutorService orchestrationPool;
    private final ExecutorService activityPool;
    private final ActivityRunner activityRunner;

    /** Journals of executions currently driven by this host. */
    private final Map<String, ExecutionJournal> live = new ConcurrentHashMap<>();
    private final Object registryLock = new Object();

    @Autowired
    public InProcessExecutionHost(JournalStore journalStore, ObjectMapper objectMapper,
                                  FlowkeeperMetrics metrics, EngineProperties properties) {
        this(journalStore, objectMapper, metrics, properties.getOrchestrationPoolSize(),
                Sleeper.SYSTEM, Clock.systemUTC());
    }

    public InProcessExecutionHost(JournalStore journalStore, ObjectMapper objectMapper,
                                  FlowkeeperMetrics metrics, int orchestrationPoolSize,
                                  Sleeper sleeper, Clock clock) {
        this.journalStore = journalStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.orchestrationPool = Executors.newFixedThreadPool(orchestrationPoolSize, namedThreads("flowkeeper-orchestration"));
        this.activityPool = Executors.newCachedThreadPool(namedThreads("flowkeeper-activity"));
        this.activityRunner = new ActivityRunner(activityPool, sleeper, metrics);
    }

    @Override
    public <I, O> O execute(String executionId, DurableWorkflow<I, O> workflow, I input) {
        ExecutionJournal journal;
        synchronized (registryLock) {
            journal = journalStore.load(executionId)
                    .map(ExecutionJournal::restore)
                    .orElse(null);
            if (journal == null) {
                journal = ExecutionJournal.open(executionId, workflow.type(), encode(input), clock.millis());
                journal.persist(journalStore);
                log.info("Opened execution {} ({})", executionId, workflow.type());
            } else {
                checkType(journal, workflow);
            }
            claim(journal);
        }
        return drive(journal, workflow);
    }

    @Override
    public <I, O> CompletableFuture<O> start(String executionId, DurableWorkflow<I, O> workflow, I input) {
        return CompletableFuture.supplyAsync(() -> execute(executionId, workflow, input), orchestrationPool);
    }

    @Override
    public <I, O> O resume(String executionId, DurableWorkflow<I, O> workflow) {
        ExecutionJournal journal;
        synchronized (registryLock) {
            journal = journalStore.load(executionId)
                    .map(ExecutionJournal::restore)
                    .orElseThrow(() -> new UnknownExecutionException(executionId));
            checkType(journal, workflow);
            claim(journal);
        }
        log.info("Resuming execution {} at run {} with {} recorded events",
                executionId, journal.runId(), journal.historySize());
        return drive(journal, workflow);
    }

    @Override
    public void signal(String executionId, String signalName, Object payload) {
        JsonNode value = encode(payload);
        synchronized (registryLock) {
            ExecutionJournal journal = live.get(executionId);
            if (journal == null) {
                journal = journalStore.load(executionId)
                        .map(ExecutionJournal::restore)
                        .orElseThrow(() -> new UnknownExecutionException(executionId));
            }
            if (journal.status().isTerminal()) {
                log.warn("Ignoring signal '{}' for {} execution {}",
                        signalName, journal.status().name().toLowerCase(), executionId);
                return;
            }
            journal.deliverSignal(signalName, value, clock.millis());
            journal.persist(journalStore);
            log.debug("Delivered signal '{}' to {}", signalName, executionId);
        }
    }

    @Override
    public Optional<JournalSnapshot> describe(String executionId) {
        ExecutionJournal journal = live.get(executionId);
        if (journal != null) {
            return Optional.of(journal.snapshot());
        }
        return journalStore.load(executionId);
    }

    @Override
    public List<String> listExecutionIds() {
        return journalStore.listExecutionIds();
    }

    @PreDestroy
    public void shutdown() {
        orchestrationPool.shutdown();
        activityPool.shutdown();
        try {
            if (!orchestrationPool.awaitTermination(5, TimeUnit.SECONDS)) {
                orchestrationPool.shutdownNow();
            }
            if (!activityPool.awaitTermination(5, TimeUnit.SECONDS)) {
                activityPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            orchestrationPool.shutdownNow();
            activityPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Execution host stopped");
    }

    // --- run loop ---

    /** Registers an open journal as live; caller holds the registry lock. */
    private void claim(ExecutionJournal journal) {
        if (journal.status().isTerminal()) {
            return;
        }
        if (live.putIfAbsent(journal.executionId(), journal) != null) {
            throw new IllegalStateException("Execution " + journal.executionId() + " is already running");
        }
    }

    private <I, O> O drive(ExecutionJournal journal, DurableWorkflow<I, O> workflow) {
        String executionId = journal.executionId();
        switch (journal.status()) {
            case COMPLETED:
                log.info("Execution {} already completed; returning recorded result", executionId);
                return decode(journal.result(), workflow.outputType());
            case FAILED:
                throw new ExecutionFailedException(executionId, journal.failure());
            default:
                break;
        }

        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        try {
            while (true) {
                MdcContext.setExecution(executionId, journal.runId());
                JournalContext context = new JournalContext(journal, journalStore, activityRunner, objectMapper, clock);
                if (journal.historySize() > 0) {
                    metrics.recordReplay(workflow.type(), journal.historySize());
                }
                I input = decode(journal.input(), workflow.inputType());
                try {
                    O output = workflow.run(context, input);
                    journal.complete(encode(output), clock.millis());
                    journal.persist(journalStore);
                    metrics.recordExecutionResult(workflow.type(), "completed");
                    log.info("Execution {} completed after {} run(s)", executionId, journal.runId());
                    return output;
                } catch (ContinueAsNewException continuation) {
                    journal.continueAsNew(encode(continuation.nextInput()), clock.millis());
                    journal.persist(journalStore);
                    journalStore.releaseRunsBefore(executionId, journal.runId());
                    metrics.recordContinuation(workflow.type());
                    log.info("Execution {} continued as new (run {})", executionId, journal.runId());
                } catch (CancellationException e) {
                    // Host shutdown or interrupted caller: leave the journal open for resume.
                    log.warn("Execution {} interrupted; journal left open", executionId);
                    throw e;
                } catch (RuntimeException e) {
                    journal.fail(messageOf(e), clock.millis());
                    journal.persist(journalStore);
                    metrics.recordExecutionResult(workflow.type(), "failed");
                    log.error("Execution {} failed: {}", executionId, messageOf(e));
                    throw e;
                }
            }
        } finally {
            live.remove(executionId);
            if (previousMdc != null) {
                MDC.setContextMap(previousMdc);
            } else {
                MdcContext.clear();
            }
        }
    }

    private static void checkType(ExecutionJournal journal, DurableWorkflow<?, ?> workflow) {
        if (!journal.workflowType().equals(workflow.type())) {
            throw new IllegalArgumentException("Execution " + journal.executionId() + " belongs to workflow type '"
                    + journal.workflowType() + "', not '" + workflow.type() + "'");
        }
    }

    private JsonNode encode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        return objectMapper.valueToTree(value);
    }

    private <T> T decode(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, type);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
