package com.scanfleet.core.model;

/**
 * Immutable view of the run counters taken after (or during) a batch.
 */
public record StatsSnapshot(
        int created,
        int existing,
        int scanned,
        int configOnly,
        int empty,
        int failed
) {

    /** Number of jobs that reached a terminal outcome. */
    public int terminalTotal() {
        return scanned + configOnly + empty + failed;
    }
}
