package com.maascheduler.core.config;

import com.maascheduler.core.model.TaskDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YamlConfigurationSourceTest {

    private static final String CATALOG = """
            resource_groups:
              - name: emulator
                max_concurrent: 1
            tasks:
              - id: daily
                priority: 1
                resource_group: emulator
                main_command: maa run daily
                triggers:
                  - trigger_type: scheduled
                    start_time: "04:00"
                    end_time: "06:00"
              - id: shop
                enabled: false
                main_command: maa run mall
                unknown_field: ignored
            """;

    @TempDir
    Path tempDir;

    private Path writeCatalog(String content) throws IOException {
        Path file = tempDir.resolve("tasks.yaml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("loads tasks and groups lazily on first access")
    void loadsLazily() throws IOException {
        var source = new YamlConfigurationSource(writeCatalog(CATALOG));

        List<TaskDefinition> tasks = source.getTasks();

        assertEquals(List.of("daily", "shop"), tasks.stream().map(TaskDefinition::id).toList());
        assertFalse(tasks.get(1).enabled());
        assertEquals("emulator", source.getResourceGroups().get(0).name());
    }

    @Test
    @DisplayName("missing file raises ConfigurationException")
    void missingFile() {
        var source = new YamlConfigurationSource(tempDir.resolve("absent.yaml"));
        assertThrows(ConfigurationException.class, source::getTasks);
    }

    @Test
    @DisplayName("failed reload keeps the previous definitions")
    void failedReloadKeepsSnapshot() throws IOException {
        Path file = writeCatalog(CATALOG);
        var source = new YamlConfigurationSource(file);
        source.reload();

        Files.writeString(file, "tasks: [ {id: broken");

        assertThrows(ConfigurationException.class, source::reload);
        assertEquals(2, source.getTasks().size());
    }

    @Test
    @DisplayName("reload picks up edits")
    void reloadPicksUpEdits() throws IOException {
        Path file = writeCatalog(CATALOG);
        var source = new YamlConfigurationSource(file);
        source.reload();

        Files.writeString(file, CATALOG.replace("priority: 1", "priority: 7"));
        source.reload();

        assertEquals(7, source.getTasks().get(0).priority());
    }

    @Test
    @DisplayName("setTaskEnabled writes the flag back to the file")
    void setTaskEnabled() throws IOException {
        Path file = writeCatalog(CATALOG);
        var source = new YamlConfigurationSource(file);

        source.setTaskEnabled("shop", true);

        assertTrue(source.getTasks().get(1).enabled());
        assertTrue(new YamlConfigurationSource(file).getTasks().get(1).enabled());
    }

    @Test
    @DisplayName("setTaskEnabled rejects unknown tasks")
    void setTaskEnabledUnknown() throws IOException {
        var source = new YamlConfigurationSource(writeCatalog(CATALOG));
        assertThrows(ConfigurationException.class, () -> source.setTaskEnabled("ghost", false));
    }
}
