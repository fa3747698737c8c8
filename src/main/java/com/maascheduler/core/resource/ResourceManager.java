package com.maascheduler.core.resource;

import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.ResourceGroupStatus;
import com.maascheduler.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control over named resource groups.
 * <p>
 * Each group has a maximum number of concurrent occupants. A task naming an unknown group is admitted
 * (fail-open) and logged, so a typo in the catalog never deadlocks the dispatcher.
 */
@Component
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final Map<String, ResourceGroup> groups = new LinkedHashMap<>();
    private final Map<String, Set<String>> occupants = new LinkedHashMap<>();

    public ResourceManager() {
        loadGroups(List.of());
    }

    /**
     * Replaces the group definitions. Live occupancy of groups that still exist is kept, so tasks
     * running across a reload continue to count against their group.
     */
    public void loadGroups(Collection<ResourceGroup> definitions) {
        lock.lock();
        try {
            groups.clear();
            for (ResourceGroup group : definitions) {
                groups.put(group.name(), group);
            }
            groups.putIfAbsent(ResourceGroup.DEFAULT_GROUP,
                    new ResourceGroup(ResourceGroup.DEFAULT_GROUP, "Default resource group", 1));
            for (String name : groups.keySet()) {
                occupants.computeIfAbsent(name, k -> new LinkedHashSet<>());
            }
            occupants.keySet().removeIf(name -> !groups.containsKey(name) && occupants.get(name).isEmpty());
            log.info("Loaded {} resource groups: {}", groups.size(), groups.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean canStart(TaskDefinition task) {
        lock.lock();
        try {
            return hasFreeSlot(task);
        } finally {
            lock.unlock();
        }
    }

    public void allocate(TaskDefinition task) {
        lock.lock();
        try {
            occupants.computeIfAbsent(task.resourceGroup(), k -> new LinkedHashSet<>()).add(task.id());
            log.debug("Allocated slot in group {} to task {}", task.resourceGroup(), task.id());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks admission and allocates in one step.
     *
     * @return true when the task now holds a slot
     */
    public boolean tryAllocate(TaskDefinition task) {
        lock.lock();
        try {
            if (!hasFreeSlot(task)) {
                return false;
            }
            allocate(task);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void release(TaskDefinition task) {
        lock.lock();
        try {
            Set<String> holders = occupants.get(task.resourceGroup());
            if (holders != null && holders.remove(task.id())) {
                log.debug("Released slot in group {} held by task {}", task.resourceGroup(), task.id());
            }
            if (holders != null && holders.isEmpty() && !groups.containsKey(task.resourceGroup())) {
                occupants.remove(task.resourceGroup());
            }
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until some slot is released or the timeout elapses.
     *
     * @return true if a release happened before the timeout
     */
    public boolean awaitRelease(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            return released.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    public boolean isFull(String groupName) {
        lock.lock();
        try {
            ResourceGroup group = groups.get(groupName);
            return group != null && runningCount(groupName) >= group.maxConcurrent();
        } finally {
            lock.unlock();
        }
    }

    public List<String> occupantsOf(String groupName) {
        lock.lock();
        try {
            return List.copyOf(occupants.getOrDefault(groupName, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    public List<ResourceGroupStatus> status() {
        lock.lock();
        try {
            List<ResourceGroupStatus> result = new ArrayList<>();
            for (ResourceGroup group : groups.values()) {
                int running = runningCount(group.name());
                result.add(new ResourceGroupStatus(group.name(), group.description(), group.maxConcurrent(),
                        running, Math.max(0, group.maxConcurrent() - running),
                        List.copyOf(occupants.getOrDefault(group.name(), Set.of()))));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private boolean hasFreeSlot(TaskDefinition task) {
        ResourceGroup group = groups.get(task.resourceGroup());
        if (group == null) {
            log.warn("Task {} references unknown resource group '{}', admitting it", task.id(), task.resourceGroup());
            return true;
        }
        return runningCount(group.name()) < group.maxConcurrent();
    }

    private int runningCount(String groupName) {
        Set<String> holders = occupants.get(groupName);
        return holders == null ? 0 : holders.size();
    }
}
