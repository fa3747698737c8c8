package com.maascheduler.core.model;

/**
 * A named pool limiting how many tasks may use a shared physical resource at once.
 */
public record ResourceGroup(String name, String description, int maxConcurrent) {

    public static final String DEFAULT_GROUP = "default";

    public ResourceGroup {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource group name must not be blank");
        }
        description = description == null ? "" : description;
        maxConcurrent = Math.max(1, maxConcurrent);
    }
}
