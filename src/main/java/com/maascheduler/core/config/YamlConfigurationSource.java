package com.maascheduler.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Task catalog backed by a YAML file ({@code maa.scheduler.config-file}).
 * <p>
 * The file is read lazily on first access and again on every {@link #reload()}. A reload that fails
 * keeps the previously loaded definitions in place.
 */
@Component
public class YamlConfigurationSource implements ConfigurationSource {

    private static final Logger log = LoggerFactory.getLogger(YamlConfigurationSource.class);

    private final Path file;
    private final ObjectMapper yaml;
    private final TaskCatalogMapper mapper;

    private volatile Snapshot snapshot;

    @Autowired
    public YamlConfigurationSource(SchedulerProperties properties) {
        this(Path.of(properties.getScheduler().getConfigFile()));
    }

    public YamlConfigurationSource(Path file) {
        this.file = file;
        this.yaml = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
        this.mapper = new TaskCatalogMapper();
    }

    @Override
    public List<TaskDefinition> getTasks() {
        return current().tasks();
    }

    @Override
    public List<ResourceGroup> getResourceGroups() {
        return current().groups();
    }

    @Override
    public synchronized void reload() {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Task catalog not found: " + file.toAbsolutePath());
        }
        TaskCatalogDocument document;
        try {
            document = yaml.readValue(file.toFile(), TaskCatalogDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse task catalog " + file + ": " + e.getMessage(), e);
        }
        if (document == null) {
            document = new TaskCatalogDocument(List.of(), List.of());
        }
        List<TaskDefinition> tasks = mapper.toTasks(document);
        List<ResourceGroup> groups = mapper.toGroups(document);
        snapshot = new Snapshot(List.copyOf(tasks), List.copyOf(groups));
        log.info("Loaded {} tasks and {} resource groups from {}", tasks.size(), groups.size(), file);
    }

    @Override
    public synchronized void setTaskEnabled(String taskId, boolean enabled) {
        try {
            JsonNode root = yaml.readTree(file.toFile());
            JsonNode tasks = root == null ? null : root.get("tasks");
            boolean found = false;
            if (tasks != null && tasks.isArray()) {
                for (JsonNode task : tasks) {
                    if (taskId.equals(task.path("id").asText(null))) {
                        ((ObjectNode) task).put("enabled", enabled);
                        found = true;
                    }
                }
            }
            if (!found) {
                throw new ConfigurationException("Task " + taskId + " is not in " + file);
            }
            yaml.writeValue(file.toFile(), root);
            log.info("Task {} {} in {}", taskId, enabled ? "enabled" : "disabled", file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot update task catalog " + file + ": " + e.getMessage(), e);
        }
        reload();
    }

    public Path file() {
        return file;
    }

    private Snapshot current() {
        Snapshot loaded = snapshot;
        if (loaded == null) {
            synchronized (this) {
                if (snapshot == null) {
                    reload();
                }
                loaded = snapshot;
            }
        }
        return loaded;
    }

    private record Snapshot(List<TaskDefinition> tasks, List<ResourceGroup> groups) {}
}
