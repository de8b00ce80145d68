package com.programmewatch.watcher.infrastructure.file;

import com.programmewatch.watcher.domain.programme.ProgrammeId;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/** On-disk layout of one market's snapshot (version 1). */
record SnapshotDocument(
        int version,
        String marketKey,
        Instant observedAt,
        List<String> programmes,
        Map<String, String> names) {

    static final int CURRENT_VERSION = 1;

    static SnapshotDocument from(ProgrammeSnapshot snapshot) {
        var ids = new ArrayList<String>(snapshot.size());
        snapshot.programmes().forEach(id -> ids.add(id.value()));
        var names = new TreeMap<String, String>();
        snapshot.names().forEach((id, name) -> {
            if (snapshot.contains(id)) {
                names.put(id.value(), name);
            }
        });
        return new SnapshotDocument(CURRENT_VERSION, snapshot.marketKey(), snapshot.observedAt(), ids, names);
    }

    ProgrammeSnapshot toSnapshot() {
        var ids = new TreeSet<ProgrammeId>();
        if (programmes != null) {
            programmes.forEach(id -> ids.add(ProgrammeId.of(requireId(id))));
        }
        var byId = new TreeMap<ProgrammeId, String>();
        if (names != null) {
            names.forEach((id, name) -> byId.put(ProgrammeId.of(requireId(id)), name));
        }
        return new ProgrammeSnapshot(marketKey, observedAt, ids, byId);
    }

    private static String requireId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Snapshot contains a null programme id");
        }
        return id;
    }
}
