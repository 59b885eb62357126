package com.scanfleet.core.model;

/**
 * Terminal outcome of a job. Every job ends in exactly one of these.
 */
public enum ScanOutcome {
    SCANNED,
    CONFIG_ONLY,
    EMPTY,
    FAILED
}
