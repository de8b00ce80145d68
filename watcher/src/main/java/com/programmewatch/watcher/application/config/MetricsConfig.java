package com.programmewatch.watcher.application.config;

import com.programmewatch.watcher.application.scheduler.PollScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter cyclesCompletedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.cycles.completed")
                .description("Cycles that committed with every alert delivered")
                .register(registry);
    }

    @Bean
    public Counter cyclesDegradedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.cycles.degraded")
                .description("Cycles that committed with at least one undelivered alert")
                .register(registry);
    }

    @Bean
    public Counter cyclesAbortedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.cycles.aborted")
                .description("Cycles aborted without advancing the snapshot")
                .register(registry);
    }

    @Bean
    public Counter changesDetectedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.changes.detected")
                .description("Programme appearances and disappearances detected")
                .register(registry);
    }

    @Bean
    public Counter alertsDeliveredCounter(MeterRegistry registry) {
        return Counter.builder("watcher.alerts.delivered")
                .description("Programme alerts handed to the mail transport")
                .register(registry);
    }

    @Bean
    public Counter alertsFailedCounter(MeterRegistry registry) {
        return Counter.builder("watcher.alerts.failed")
                .description("Programme alerts that exhausted their retries")
                .register(registry);
    }

    @Bean
    public Gauge runningCyclesGauge(MeterRegistry registry, PollScheduler pollScheduler) {
        return Gauge.builder("watcher.markets.running", pollScheduler::runningCycles)
                .description("Markets with a cycle in progress")
                .register(registry);
    }
}
