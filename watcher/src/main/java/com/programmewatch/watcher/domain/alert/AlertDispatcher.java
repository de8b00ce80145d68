package com.programmewatch.watcher.domain.alert;

import com.programmewatch.common.id.UlidGenerator;
import com.programmewatch.watcher.domain.change.Change;
import com.programmewatch.watcher.domain.cycle.CyclePhase;
import com.programmewatch.watcher.domain.exceptions.CycleAbortedException;
import com.programmewatch.watcher.domain.exceptions.NotifyException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the changes of one cycle into alert deliveries. Each change is sent at
 * most {@code maxAttempts} times with exponential backoff and always ends
 * DELIVERED or FAILED; a FAILED change does not stop the remaining ones.
 * Backoff waits happen on the calling market's thread only.
 */
@Slf4j
@RequiredArgsConstructor
public class AlertDispatcher {

    private final Notifier notifier;
    private final AlertMessageComposer composer;
    private final AlertPreferences preferences;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DeliveryLog deliveryLog;

    /**
     * @return one terminal record per dispatched change, in input order; changes of a
     *         kind disabled in {@link AlertPreferences} are skipped and have no record
     * @throws CycleAbortedException if the thread is interrupted while backing off
     */
    public List<DeliveryRecord> dispatch(List<Change> changes) {
        var records = new ArrayList<DeliveryRecord>(changes.size());
        for (var change : changes) {
            if (!preferences.allows(change.kind())) {
                log.info("alert.suppressed: market={}, programme_id={}, kind={}",
                        change.marketKey(), change.programmeId(), change.kind());
                continue;
            }
            var record = deliver(change);
            deliveryLog.append(record);
            records.add(record);
        }
        return List.copyOf(records);
    }

    private DeliveryRecord deliver(Change change) {
        var message = composer.compose(change);
        var record = DeliveryRecord.pending(UlidGenerator.generate(clock.instant()), change);

        while (true) {
            var attempt = record.attempts() + 1;
            try {
                notifier.send(preferences.recipients(), message.subject(), message.body());
                log.info("alert.delivered: market={}, programme_id={}, kind={}, attempts={}",
                        change.marketKey(), change.programmeId(), change.kind(), attempt);
                return record.toBuilder()
                        .attempts(attempt)
                        .lastAttemptAt(clock.instant())
                        .status(DeliveryStatus.DELIVERED)
                        .lastError(null)
                        .build();
            } catch (NotifyException e) {
                record = record.toBuilder()
                        .attempts(attempt)
                        .lastAttemptAt(clock.instant())
                        .lastError(e.getMessage())
                        .build();

                if (retryPolicy.exhaustedAfter(attempt)) {
                    log.error("alert.failed: market={}, programme_id={}, kind={}, attempts={}, error={} "
                                    + "- manual follow-up required",
                            change.marketKey(), change.programmeId(), change.kind(), attempt, e.getMessage());
                    return record.toBuilder().status(DeliveryStatus.FAILED).build();
                }

                var delay = retryPolicy.delayAfter(attempt);
                log.warn("alert.retry: market={}, programme_id={}, attempt={}/{}, retry_in={}ms, error={}",
                        change.marketKey(), change.programmeId(), attempt, retryPolicy.maxAttempts(),
                        delay.toMillis(), e.getMessage());
                backOff(change, delay);
            }
        }
    }

    private void backOff(Change change, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CycleAbortedException.interrupted(change.marketKey(), CyclePhase.DISPATCHING, e);
        }
    }
}
