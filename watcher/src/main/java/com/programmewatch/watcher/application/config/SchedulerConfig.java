package com.programmewatch.watcher.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * One polling thread per market, so a market blocked in a slow fetch or a
 * backoff wait never delays another market's tick.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler pollTaskScheduler(WatcherProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.marketKeys().size());
        scheduler.setThreadNamePrefix("poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        // PollScheduler drives the graceful part of shutdown itself
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
