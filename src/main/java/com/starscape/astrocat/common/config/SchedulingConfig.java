package com.starscape.astrocat.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Enables @Scheduled sweeps and provides the worker pool that runs solve tasks,
 * bulk operations and the sweeps themselves.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public ThreadPoolTaskScheduler solveTaskScheduler(AstrometryProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, properties.getWorkerThreads()));
        scheduler.setThreadNamePrefix("solve-");
        scheduler.setErrorHandler(t -> log.error("Background task failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
