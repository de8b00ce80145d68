package com.programmewatch.watcher.domain.programme;

/**
 * Port to the affiliate network. Implementations fail with
 * {@link com.programmewatch.watcher.domain.exceptions.UpstreamException}, classified
 * as transient (retried on the next scheduled tick) or permanent (operator attention).
 */
public interface ProgrammeSource {

    ProgrammeSnapshot fetchActive(String marketKey);
}
