package com.flowkeeper.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Agent configs read from {@code <agentId>.json} files in
 * {@code flowkeeper.agents.directory}, plus any registered at runtime.
 * An agent with an {@code owner} is only visible to that user.
 */
@Service
public class AgentCatalog implements AgentConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalog.class);

    private final ObjectMapper objectMapper;
    private final String directory;
    private final Map<String, AgentConfig> agents = new ConcurrentHashMap<>();

    public AgentCatalog(ObjectMapper objectMapper,
                        @Value("${flowkeeper.agents.directory:agents}") String directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    @PostConstruct
    void loadDirectory() {
        Path dir = Path.of(directory);
        if (!Files.isDirectory(dir)) {
            log.debug("Agent directory {} not found; no agents loaded", dir.toAbsolutePath());
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(this::loadFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list agent directory " + dir, e);
        }
        log.info("Loaded {} agent config(s) from {}", agents.size(), dir);
    }

    private void loadFile(Path file) {
        String fileName = file.getFileName().toString();
        String id = fileName.substring(0, fileName.length() - ".json".length());
        try {
            register(id, objectMapper.readValue(file.toFile(), AgentConfig.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable agent file {}: {}", file, e.getMessage());
        }
    }

    public void register(String agentId, AgentConfig config) {
        AgentConfig withId = config.id() != null ? config : new AgentConfig(agentId, config.name(),
                config.systemPrompt(), config.model(), config.provider(), config.connectionId(),
                config.temperature(), config.maxTokens(), config.maxIterations(), config.availableTools(),
                config.memoryConfig(), config.owner());
        agents.put(agentId, withId);
    }

    @Override
    public AgentConfig get(String agentId, String userId) {
        AgentConfig config = agents.get(agentId);
        // Agents owned by someone else look the same as missing ones.
        if (config == null || (config.owner() != null && !config.owner().equals(userId))) {
            throw new AgentConfigException("Agent " + agentId + " not found");
        }
        return config;
    }

    public List<String> ids() {
        return List.copyOf(new TreeMap<>(agents).keySet());
    }
}
