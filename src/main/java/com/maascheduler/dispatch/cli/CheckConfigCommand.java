package com.maascheduler.dispatch.cli;

import com.maascheduler.core.config.ConfigurationException;
import com.maascheduler.core.config.ConfigurationSource;
import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.trigger.TriggerEvaluator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CLI command: maa-scheduler check-config
 * <p>
 * Loads the task catalog without starting anything and prints every task with its triggers and next
 * fire times. Tasks referring to an undeclared resource group are flagged.
 */
@Command(name = "check-config", mixinStandardHelpOptions = true, description = "Validate the task catalog")
@Component
public class CheckConfigCommand implements Runnable {

    private final ConfigurationSource config;
    private final TriggerEvaluator evaluator;
    private final Clock clock;

    public CheckConfigCommand(ConfigurationSource config, TriggerEvaluator evaluator, Clock schedulerClock) {
        this.config = config;
        this.evaluator = evaluator;
        this.clock = schedulerClock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<TaskDefinition> tasks;
        List<ResourceGroup> groups;
        try {
            config.reload();
            tasks = config.getTasks();
            groups = config.getResourceGroups();
        } catch (ConfigurationException e) {
            ConsoleOutput.error("Catalog invalid: " + e.getMessage());
            return;
        }

        Set<String> groupNames = groups.stream().map(ResourceGroup::name).collect(Collectors.toSet());
        ConsoleOutput.info("Resource groups (" + groups.size() + "):");
        for (ResourceGroup group : groups) {
            System.out.printf("  %-16s max %d  %s%n", group.name(), group.maxConcurrent(), group.description());
        }
        System.out.println();

        ConsoleOutput.info("Tasks (" + tasks.size() + "):");
        LocalDateTime now = LocalDateTime.now(clock);
        int warnings = 0;
        for (TaskDefinition task : tasks) {
            System.out.printf("  %-20s %-8s priority %-3d group %s%n", task.id(),
                    task.enabled() ? "enabled" : "disabled", task.priority(), task.resourceGroup());
            if (!groupNames.contains(task.resourceGroup())
                    && !ResourceGroup.DEFAULT_GROUP.equals(task.resourceGroup())) {
                ConsoleOutput.warn("Task " + task.id() + " uses undeclared group '" + task.resourceGroup()
                        + "', it will run without a concurrency limit");
                warnings++;
            }
            if (task.command() == null || task.command().isBlank()) {
                ConsoleOutput.warn("Task " + task.id() + " has no command");
                warnings++;
            }
            for (TriggerSpec trigger : task.triggers()) {
                if (trigger instanceof TriggerSpec.Invalid invalid) {
                    ConsoleOutput.warn("Task " + task.id() + " has an unusable trigger: " + invalid.reason());
                    warnings++;
                    continue;
                }
                String next = evaluator.nextFireTime(trigger, now).map(LocalDateTime::toString).orElse("never");
                System.out.printf("      %-14s next %s%n", trigger.type().label(), next);
            }
        }
        System.out.println();
        if (warnings == 0) {
            ConsoleOutput.success("Catalog OK");
        } else {
            ConsoleOutput.warn("Catalog loaded with " + warnings + " warning(s)");
        }
    }
}
