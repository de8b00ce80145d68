package com.programmewatch.watcher.test.fixtures;

import com.programmewatch.watcher.domain.change.Change;
import com.programmewatch.watcher.domain.change.ChangeKind;
import com.programmewatch.watcher.domain.programme.ProgrammeId;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import java.time.Instant;
import java.util.Arrays;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProgrammeFixtures {

    public static final String SOME_MARKET = "GB";
    public static final String SOME_OTHER_MARKET = "DE";
    public static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");
    public static final Instant T1 = Instant.parse("2024-05-01T12:00:00Z");

    public static ProgrammeSnapshot snapshot(String marketKey, Instant observedAt, long... ids) {
        var programmes = new TreeSet<ProgrammeId>();
        var names = new TreeMap<ProgrammeId, String>();
        Arrays.stream(ids).mapToObj(ProgrammeId::of).forEach(id -> {
            programmes.add(id);
            names.put(id, "Merchant " + id);
        });
        return new ProgrammeSnapshot(marketKey, observedAt, programmes, names);
    }

    public static ProgrammeSnapshot snapshot(Instant observedAt, long... ids) {
        return snapshot(SOME_MARKET, observedAt, ids);
    }

    public static Change.ChangeBuilder appearedBuilder(long id) {
        return Change.builder()
                .marketKey(SOME_MARKET)
                .programmeId(ProgrammeId.of(id))
                .programmeName("Merchant " + id)
                .kind(ChangeKind.APPEARED)
                .detectedAt(T1);
    }

    public static Change.ChangeBuilder disappearedBuilder(long id) {
        return appearedBuilder(id).kind(ChangeKind.DISAPPEARED);
    }
}
