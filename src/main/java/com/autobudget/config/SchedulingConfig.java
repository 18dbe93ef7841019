package com.autobudget.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler and clock for the control loop.
 *
 * <p>The scheduler has exactly one thread, so scheduled cycles run strictly one after the
 * other. On shutdown it waits for an in-flight cycle instead of interrupting it; the stop
 * signal is only observed between cycles.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock(AutoBudgetConfig autoBudgetConfig) {
        return Clock.system(autoBudgetConfig.getZone());
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("autobudget-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.setErrorHandler(
                throwable -> log.error("Scheduled task failed: {}", throwable.getMessage(), throwable));
        return scheduler;
    }
}
