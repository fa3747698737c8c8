package com.maascheduler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.maascheduler.core.model.SchedulerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Small JSON document holding state that must survive restarts: the scheduler mode and the last
 * resolution applied to each device.
 */
@Component
public class AppStateStore {

    private static final Logger log = LoggerFactory.getLogger(AppStateStore.class);

    private final Path file;
    private final ObjectMapper json;

    private State state;

    @Autowired
    public AppStateStore(SchedulerProperties properties) {
        this(Path.of(properties.getScheduler().getStateFile()));
    }

    public AppStateStore(Path file) {
        this.file = file;
        this.json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public synchronized SchedulerMode getMode() {
        String mode = load().mode;
        if (mode == null) {
            return SchedulerMode.SCHEDULER;
        }
        try {
            return SchedulerMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring persisted mode '{}': {}", mode, e.getMessage());
            return SchedulerMode.SCHEDULER;
        }
    }

    public synchronized void setMode(SchedulerMode mode) {
        load().mode = mode.label();
        save();
    }

    public synchronized Optional<String> lastResolution(String deviceId) {
        return Optional.ofNullable(load().resolutions.get(deviceId));
    }

    public synchronized void recordResolution(String deviceId, String resolution) {
        load().resolutions.put(deviceId, resolution);
        save();
    }

    private State load() {
        if (state != null) {
            return state;
        }
        state = new State();
        if (Files.isRegularFile(file)) {
            try {
                state = json.readValue(file.toFile(), State.class);
                if (state.resolutions == null) {
                    state.resolutions = new LinkedHashMap<>();
                }
            } catch (IOException e) {
                log.warn("Cannot read app state {}, starting fresh: {}", file, e.getMessage());
                state = new State();
            }
        }
        return state;
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            json.writeValue(file.toFile(), state);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write app state " + file + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class State {
        @JsonProperty("mode")
        public String mode;

        @JsonProperty("last_device_resolution")
        public Map<String, String> resolutions = new LinkedHashMap<>();
    }
}
