package com.programmewatch.watcher.application.scheduler;

import com.programmewatch.watcher.application.config.WatcherProperties;
import com.programmewatch.watcher.domain.cycle.CycleReport;
import com.programmewatch.watcher.domain.cycle.MarketCycle;
import com.programmewatch.watcher.domain.cycle.MarketStatus;
import com.programmewatch.watcher.domain.exceptions.UnknownMarketException;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns one independently scheduled {@link MarketPoller} per configured market.
 *
 * <p>Each market runs with a fixed delay between the end of one cycle and the start
 * of the next. On shutdown the schedules are cancelled, running cycles get the
 * configured grace period to finish their dispatch, and anything still running
 * after that is interrupted; an interrupted cycle commits nothing.
 */
@Slf4j
@Component
public class PollScheduler implements SmartLifecycle {

    private static final Duration ABORT_WAIT = Duration.ofSeconds(5);

    private final WatcherProperties properties;
    private final ThreadPoolTaskScheduler pollTaskScheduler;
    private final Clock clock;
    private final Counter cyclesCompletedCounter;
    private final Counter cyclesDegradedCounter;
    private final Counter cyclesAbortedCounter;
    private final Counter changesDetectedCounter;
    private final Counter alertsDeliveredCounter;
    private final Counter alertsFailedCounter;
    private final Map<String, MarketPoller> pollers = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PollScheduler(
            WatcherProperties properties,
            MarketCycle marketCycle,
            ThreadPoolTaskScheduler pollTaskScheduler,
            Clock clock,
            Counter cyclesCompletedCounter,
            Counter cyclesDegradedCounter,
            Counter cyclesAbortedCounter,
            Counter changesDetectedCounter,
            Counter alertsDeliveredCounter,
            Counter alertsFailedCounter) {
        this.properties = properties;
        this.pollTaskScheduler = pollTaskScheduler;
        this.clock = clock;
        this.cyclesCompletedCounter = cyclesCompletedCounter;
        this.cyclesDegradedCounter = cyclesDegradedCounter;
        this.cyclesAbortedCounter = cyclesAbortedCounter;
        this.changesDetectedCounter = changesDetectedCounter;
        this.alertsDeliveredCounter = alertsDeliveredCounter;
        this.alertsFailedCounter = alertsFailedCounter;
        for (var marketKey : properties.marketKeys()) {
            pollers.put(marketKey, new MarketPoller(marketKey, marketCycle, clock, this::record));
        }
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        var firstRun = clock.instant().plus(properties.initialDelay());
        for (var poller : pollers.values()) {
            poller.attach(pollTaskScheduler.scheduleWithFixedDelay(poller::tick, firstRun, properties.interval()));
        }
        log.info("Polling markets {} every {} (first run at {})", pollers.keySet(), properties.interval(), firstRun);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        pollers.values().forEach(MarketPoller::cancelSchedule);

        var deadline = System.nanoTime() + properties.shutdownGrace().toNanos();
        var unfinished = pollers.values().stream()
                .filter(p -> !p.awaitIdle(Duration.ofNanos(deadline - System.nanoTime())))
                .toList();
        if (unfinished.isEmpty()) {
            log.info("Polling stopped");
            return;
        }

        var markets = unfinished.stream().map(MarketPoller::marketKey).toList();
        log.error("shutdown.grace.exceeded: markets={}, grace={} - interrupting, snapshots stay unchanged",
                markets, properties.shutdownGrace());
        pollTaskScheduler.getScheduledExecutor().shutdownNow();
        for (var poller : unfinished) {
            if (!poller.awaitIdle(ABORT_WAIT)) {
                log.error("cycle.abandoned: market={} did not stop after interrupt", poller.marketKey());
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public List<MarketStatus> statuses() {
        return pollers.values().stream().map(MarketPoller::status).toList();
    }

    public MarketStatus status(String marketKey) {
        return poller(marketKey).status();
    }

    /** Runs a cycle for the market now, outside its schedule. */
    public CycleReport runNow(String marketKey) {
        return poller(marketKey).runNow();
    }

    public int runningCycles() {
        return (int) pollers.values().stream().filter(MarketPoller::isRunning).count();
    }

    private MarketPoller poller(String marketKey) {
        var poller = marketKey == null ? null : pollers.get(marketKey.strip().toUpperCase(Locale.ROOT));
        if (poller == null) {
            throw UnknownMarketException.of(marketKey);
        }
        return poller;
    }

    private void record(CycleReport report) {
        switch (report.outcome()) {
            case COMPLETED -> cyclesCompletedCounter.increment();
            case DEGRADED -> cyclesDegradedCounter.increment();
            case ABORTED -> cyclesAbortedCounter.increment();
        }
        changesDetectedCounter.increment(report.changes().size());
        alertsDeliveredCounter.increment(report.deliveredCount());
        alertsFailedCounter.increment(report.failedCount());
    }
}
