package com.programmewatch.watcher.application.scheduler;

import com.programmewatch.common.id.UlidGenerator;
import com.programmewatch.watcher.domain.cycle.CyclePhase;
import com.programmewatch.watcher.domain.cycle.CycleReport;
import com.programmewatch.watcher.domain.cycle.MarketCycle;
import com.programmewatch.watcher.domain.cycle.MarketStatus;
import com.programmewatch.watcher.domain.exceptions.CycleAbortedException;
import com.programmewatch.watcher.domain.exceptions.CycleInProgressException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Scheduling state of one market. Cycles of the same market never overlap: a tick
 * that finds a cycle still running is skipped. Every failure is contained here and
 * recorded in the market's status.
 */
@Slf4j
public class MarketPoller {

    private final String marketKey;
    private final MarketCycle marketCycle;
    private final Clock clock;
    private final Consumer<CycleReport> reportListener;
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<MarketStatus> status;
    private volatile ScheduledFuture<?> schedule;

    public MarketPoller(String marketKey, MarketCycle marketCycle, Clock clock, Consumer<CycleReport> reportListener) {
        this.marketKey = marketKey;
        this.marketCycle = marketCycle;
        this.clock = clock;
        this.reportListener = reportListener;
        this.status = new AtomicReference<>(MarketStatus.idle(marketKey));
    }

    public String marketKey() {
        return marketKey;
    }

    public MarketStatus status() {
        return status.get();
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    /** Entry point of the scheduled task; never throws. */
    public void tick() {
        if (!cycleLock.tryLock()) {
            log.warn("cycle.skipped: market={}, reason=previous cycle still running", marketKey);
            return;
        }
        try {
            runLocked();
        } catch (RuntimeException e) {
            log.error("Unexpected failure outside the cycle of market {}", marketKey, e);
        } finally {
            cycleLock.unlock();
        }
    }

    /** Runs one cycle on the caller's thread. */
    public CycleReport runNow() {
        if (!cycleLock.tryLock()) {
            throw CycleInProgressException.of(marketKey);
        }
        try {
            return runLocked();
        } finally {
            cycleLock.unlock();
        }
    }

    void attach(ScheduledFuture<?> schedule) {
        this.schedule = schedule;
    }

    void cancelSchedule() {
        var current = schedule;
        if (current != null) {
            current.cancel(false);
        }
    }

    /** @return {@code true} if no cycle is running anymore within the timeout */
    boolean awaitIdle(Duration timeout) {
        try {
            if (cycleLock.tryLock(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CycleReport runLocked() {
        var cycleId = UlidGenerator.generate(clock.instant());
        var startedAt = clock.instant();
        CycleReport report;
        try {
            report = marketCycle.run(marketKey, cycleId, this::enterPhase);
        } catch (CycleAbortedException e) {
            log.warn("cycle.aborted: market={}, cycle_id={}, phase={}, error={}",
                    marketKey, cycleId, e.getPhase(), e.getMessage());
            report = CycleReport.aborted(cycleId, marketKey, startedAt, clock.instant(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("cycle.aborted: market={}, cycle_id={}, phase={}, unexpected error",
                    marketKey, cycleId, status.get().phase(), e);
            report = CycleReport.aborted(cycleId, marketKey, startedAt, clock.instant(), String.valueOf(e.getMessage()));
        }

        var finished = report;
        status.updateAndGet(s -> s.after(finished));
        try {
            reportListener.accept(report);
        } catch (RuntimeException e) {
            log.warn("Cycle report listener failed for market {}: {}", marketKey, e.getMessage());
        }
        return report;
    }

    private void enterPhase(CyclePhase phase) {
        status.updateAndGet(s -> s.toBuilder().phase(phase).build());
    }
}
