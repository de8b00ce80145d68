package com.programmewatch.watcher.domain.cycle;

import com.programmewatch.watcher.domain.alert.AlertDispatcher;
import com.programmewatch.watcher.domain.alert.DeliveryRecord;
import com.programmewatch.watcher.domain.alert.OperatorAlerter;
import com.programmewatch.watcher.domain.change.ChangeDetector;
import com.programmewatch.watcher.domain.exceptions.CycleAbortedException;
import com.programmewatch.watcher.domain.exceptions.StorageException;
import com.programmewatch.watcher.domain.exceptions.UpstreamException;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import com.programmewatch.watcher.domain.programme.ProgrammeSource;
import com.programmewatch.watcher.domain.snapshot.SnapshotStore;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One fetch-diff-dispatch-commit pass for one market.
 *
 * <p>The persisted snapshot only advances after every change of the transition has
 * reached DELIVERED or FAILED. A cycle that finds no change against an existing
 * snapshot commits nothing, so the persisted state stays byte-identical.
 *
 * <p>Failures end the cycle with {@link CycleAbortedException} and leave the
 * persisted snapshot untouched. A commit failure after dispatch means the next
 * cycle re-sends the same alerts.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketCycle {

    private final ProgrammeSource programmeSource;
    private final SnapshotStore snapshotStore;
    private final ChangeDetector changeDetector;
    private final AlertDispatcher alertDispatcher;
    private final OperatorAlerter operatorAlerter;
    private final Clock clock;

    public CycleReport run(String marketKey, String cycleId, CyclePhaseListener listener) {
        var startedAt = clock.instant();

        listener.onPhase(CyclePhase.FETCHING);
        var current = fetch(marketKey);

        listener.onPhase(CyclePhase.DIFFING);
        var previous = load(marketKey);
        var changes = changeDetector.diff(previous.orElse(null), current);
        if (previous.isEmpty()) {
            log.info("cycle.baseline: market={}, cycle_id={}, programmes={}", marketKey, cycleId, current.size());
        }

        listener.onPhase(CyclePhase.DISPATCHING);
        var deliveries = alertDispatcher.dispatch(changes);
        var failed = deliveries.stream().filter(DeliveryRecord::isFailed).toList();
        if (!failed.isEmpty()) {
            operatorAlerter.deliveriesFailed(marketKey, failed);
        }

        listener.onPhase(CyclePhase.COMMITTING);
        var commitNeeded = previous.isEmpty() || !changes.isEmpty();
        if (commitNeeded) {
            commit(marketKey, current, deliveries.size());
        }

        var report = CycleReport.builder()
                .cycleId(cycleId)
                .marketKey(marketKey)
                .outcome(failed.isEmpty() ? CycleOutcome.COMPLETED : CycleOutcome.DEGRADED)
                .changes(changes)
                .deliveries(deliveries)
                .committed(commitNeeded)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .build();

        if (report.outcome() == CycleOutcome.DEGRADED) {
            log.warn("cycle.degraded: market={}, cycle_id={}, changes={}, delivered={}, failed={}",
                    marketKey, cycleId, changes.size(), report.deliveredCount(), report.failedCount());
        } else {
            log.info("cycle.completed: market={}, cycle_id={}, programmes={}, changes={}, delivered={}, committed={}",
                    marketKey, cycleId, current.size(), changes.size(), report.deliveredCount(), commitNeeded);
        }
        listener.onPhase(CyclePhase.IDLE);
        return report;
    }

    private ProgrammeSnapshot fetch(String marketKey) {
        try {
            var snapshot = programmeSource.fetchActive(marketKey);
            if (!marketKey.equals(snapshot.marketKey())) {
                throw UpstreamException.schemaMismatch(
                        marketKey, "snapshot belongs to market " + snapshot.marketKey(), null);
            }
            return snapshot;
        } catch (UpstreamException e) {
            if (e.isPermanent()) {
                operatorAlerter.upstreamFailed(marketKey, e);
            }
            throw CycleAbortedException.of(marketKey, CyclePhase.FETCHING, e);
        }
    }

    private Optional<ProgrammeSnapshot> load(String marketKey) {
        try {
            return snapshotStore.load(marketKey);
        } catch (StorageException e) {
            operatorAlerter.storageFailed(marketKey, e);
            throw CycleAbortedException.of(marketKey, CyclePhase.DIFFING, e);
        }
    }

    private void commit(String marketKey, ProgrammeSnapshot current, int dispatched) {
        try {
            snapshotStore.commit(marketKey, current);
        } catch (StorageException e) {
            if (dispatched > 0) {
                log.error("cycle.commit.failed: market={}, dispatched={} - these alerts will be re-sent next cycle",
                        marketKey, dispatched);
            }
            operatorAlerter.storageFailed(marketKey, e);
            throw CycleAbortedException.of(marketKey, CyclePhase.COMMITTING, e);
        }
    }
}
