package com.programmewatch.watcher.domain.change;

import com.programmewatch.watcher.domain.programme.ProgrammeId;
import java.time.Instant;
import java.util.Comparator;
import lombok.Builder;

@Builder(toBuilder = true)
public record Change(
        String marketKey,
        ProgrammeId programmeId,
        String programmeName,
        ChangeKind kind,
        Instant detectedAt) {

    public static final Comparator<Change> ORDER =
            Comparator.comparing(Change::programmeId).thenComparing(Change::kind);

    public String displayName() {
        return programmeName == null || programmeName.isBlank() ? "#" + programmeId : programmeName;
    }
}
