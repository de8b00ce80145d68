package com.programmewatch.watcher.domain.programme;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Builder;

/**
 * Active programmes of one market at one point in time. Immutable; {@code names}
 * only carries display names for message composition and never affects equality
 * of the programme set.
 */
@Builder(toBuilder = true)
public record ProgrammeSnapshot(
        String marketKey,
        Instant observedAt,
        SortedSet<ProgrammeId> programmes,
        Map<ProgrammeId, String> names) {

    public ProgrammeSnapshot {
        Objects.requireNonNull(marketKey, "marketKey");
        Objects.requireNonNull(observedAt, "observedAt");
        programmes = Collections.unmodifiableSortedSet(
                programmes == null ? new TreeSet<>() : new TreeSet<>(programmes));
        var knownNames = new TreeMap<ProgrammeId, String>();
        if (names != null) {
            names.forEach((id, name) -> {
                if (name != null && !name.isBlank()) {
                    knownNames.put(id, name);
                }
            });
        }
        names = Collections.unmodifiableMap(knownNames);
    }

    public static ProgrammeSnapshot of(String marketKey, Instant observedAt, Collection<ProgrammeId> programmes) {
        return new ProgrammeSnapshot(marketKey, observedAt, new TreeSet<>(programmes), Map.of());
    }

    public boolean contains(ProgrammeId programmeId) {
        return programmes.contains(programmeId);
    }

    public Optional<String> nameOf(ProgrammeId programmeId) {
        return Optional.ofNullable(names.get(programmeId));
    }

    public int size() {
        return programmes.size();
    }
}
