package com.programmewatch.watcher.domain.snapshot;

import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import java.util.Optional;

/**
 * Durable last-reconciled snapshot per market. Both operations fail with
 * {@link com.programmewatch.watcher.domain.exceptions.StorageException} on I/O errors.
 */
public interface SnapshotStore {

    /** Empty on the first run for a market. */
    Optional<ProgrammeSnapshot> load(String marketKey);

    /**
     * Atomically replaces the persisted snapshot of the market. A partially written
     * commit is never observable by {@link #load(String)}. Commits are serialised per
     * market and never wait on commits of other markets.
     */
    void commit(String marketKey, ProgrammeSnapshot snapshot);
}
