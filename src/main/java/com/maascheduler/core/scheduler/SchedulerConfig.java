package com.maascheduler.core.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class SchedulerConfig {

    /**
     * Single timer thread shared by trigger timers and delayed retry/repeat re-enqueues.
     * Work submitted here must never block.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService schedulerTimer() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock schedulerClock() {
        return Clock.systemDefaultZone();
    }
}
