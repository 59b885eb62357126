package com.scanfleet.core.scan;

/**
 * What a pipeline does when one of its phases exits unsuccessfully.
 */
public enum PhasePolicy {
    /** Abort the pipeline; the job is counted as failed. */
    FATAL,
    /** Log a warning and continue with the next phase. */
    TOLERATED,
    /** Abandon this pipeline and fall back to a sources-only scan. */
    FALLBACK_ON_FAILURE
}
