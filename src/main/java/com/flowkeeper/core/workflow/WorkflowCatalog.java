package com.flowkeeper.core.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Stored workflow definitions by id. Definitions come from JSON files in the
 * configured directory and from {@link #register}.
 */
@Service
public class WorkflowCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCatalog.class);

    private final ObjectMapper objectMapper;
    private final WorkflowProperties properties;
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    public WorkflowCatalog(ObjectMapper objectMapper, WorkflowProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    void loadDirectory() {
        Path dir = Path.of(properties.getDirectory());
        if (!Files.isDirectory(dir)) {
            log.debug("Workflow directory {} not found; catalog starts empty", dir.toAbsolutePath());
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(this::loadFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list workflow directory " + dir, e);
        }
        log.info("Loaded {} workflow definition(s) from {}", definitions.size(), dir);
    }

    private void loadFile(Path file) {
        String fileName = file.getFileName().toString();
        String id = fileName.substring(0, fileName.length() - ".json".length());
        try {
            register(id, objectMapper.readValue(file.toFile(), WorkflowDefinition.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable workflow file {}: {}", file, e.getMessage());
        }
    }

    public void register(String workflowId, WorkflowDefinition definition) {
        definitions.put(workflowId, definition);
    }

    public Optional<WorkflowDefinition> find(String workflowId) {
        return Optional.ofNullable(definitions.get(workflowId));
    }

    /**
     * @throws WorkflowDefinitionException if no such workflow is stored
     */
    public WorkflowDefinition require(String workflowId) {
        return find(workflowId).orElseThrow(() -> new WorkflowDefinitionException("Workflow " + workflowId + " not found"));
    }

    public List<String> ids() {
        return List.copyOf(new TreeMap<>(definitions).keySet());
    }
}
