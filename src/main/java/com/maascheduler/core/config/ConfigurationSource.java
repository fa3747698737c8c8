package com.maascheduler.core.config;

import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.TaskDefinition;

import java.util.List;

/**
 * Supplies task and resource-group definitions. Read once at start and again on every explicit reload.
 */
public interface ConfigurationSource {

    List<TaskDefinition> getTasks();

    List<ResourceGroup> getResourceGroups();

    /**
     * Re-reads the underlying catalog.
     *
     * @throws ConfigurationException when the catalog cannot be read at all
     */
    void reload();

    /**
     * Persists a task's enabled flag and refreshes the cached definitions.
     *
     * @throws ConfigurationException when the task is unknown or the catalog cannot be written
     */
    void setTaskEnabled(String taskId, boolean enabled);
}
