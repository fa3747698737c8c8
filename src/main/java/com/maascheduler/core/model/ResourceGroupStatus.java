package com.maascheduler.core.model;

import java.util.List;

/**
 * Point-in-time occupancy of a resource group.
 */
public record ResourceGroupStatus(
        String name,
        String description,
        int maxConcurrent,
        int runningCount,
        int available,
        List<String> runningTasks
) {}
