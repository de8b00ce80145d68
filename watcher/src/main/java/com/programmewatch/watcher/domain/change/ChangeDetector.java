package com.programmewatch.watcher.domain.change;

import com.programmewatch.watcher.domain.programme.ProgrammeId;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes the classified difference between the last reconciled snapshot of a
 * market and the freshly fetched one. Pure: no I/O, no clock.
 */
@Component
public class ChangeDetector {

    /**
     * @param previous last reconciled snapshot, or {@code null} on the first run for
     *                 the market; a first run yields no changes and only establishes
     *                 the baseline
     * @param current  snapshot just fetched from the network
     * @return changes sorted by programme id, DISAPPEARED before APPEARED on a tie
     */
    public List<Change> diff(ProgrammeSnapshot previous, ProgrammeSnapshot current) {
        if (previous == null) {
            return List.of();
        }
        if (!previous.marketKey().equals(current.marketKey())) {
            throw new IllegalArgumentException(
                    "Cannot diff market " + previous.marketKey() + " against " + current.marketKey());
        }

        var changes = new ArrayList<Change>();
        for (var id : current.programmes()) {
            if (!previous.contains(id)) {
                changes.add(change(current, id, ChangeKind.APPEARED, current.nameOf(id).orElse(null)));
            }
        }
        for (var id : previous.programmes()) {
            if (!current.contains(id)) {
                changes.add(change(current, id, ChangeKind.DISAPPEARED, previous.nameOf(id).orElse(null)));
            }
        }
        changes.sort(Change.ORDER);
        return List.copyOf(changes);
    }

    private Change change(ProgrammeSnapshot current, ProgrammeId id, ChangeKind kind, String name) {
        return Change.builder()
                .marketKey(current.marketKey())
                .programmeId(id)
                .programmeName(name)
                .kind(kind)
                .detectedAt(current.observedAt())
                .build();
    }
}
