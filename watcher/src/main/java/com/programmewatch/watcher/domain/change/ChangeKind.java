package com.programmewatch.watcher.domain.change;

/** Declaration order is the tie-break order when two changes share a programme id. */
public enum ChangeKind {
    DISAPPEARED,
    APPEARED
}
