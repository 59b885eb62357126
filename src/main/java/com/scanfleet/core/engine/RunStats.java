package com.scanfleet.core.engine;

import com.scanfleet.core.model.RegistrationResult;
import com.scanfleet.core.model.ScanOutcome;
import com.scanfleet.core.model.StatsSnapshot;

/**
 * Run-wide counters shared by all workers. Every increment happens under one lock and
 * counters only ever grow.
 */
public class RunStats {

    private final Object lock = new Object();

    private int created;
    private int existing;
    private int scanned;
    private int configOnly;
    private int empty;
    private int failed;

    public void recordRegistration(RegistrationResult result) {
        synchronized (lock) {
            switch (result) {
                case CREATED -> created++;
                case EXISTING -> existing++;
            }
        }
    }

    public void recordOutcome(ScanOutcome outcome) {
        synchronized (lock) {
            switch (outcome) {
                case SCANNED -> scanned++;
                case CONFIG_ONLY -> configOnly++;
                case EMPTY -> empty++;
                case FAILED -> failed++;
            }
        }
    }

    public StatsSnapshot snapshot() {
        synchronized (lock) {
            return new StatsSnapshot(created, existing, scanned, configOnly, empty, failed);
        }
    }
}
