package com.scanfleet.core.scan;

/**
 * Outcome of a phase that either succeeded or failed under {@link PhasePolicy#TOLERATED}.
 */
public record PhaseResult(String phase, PhasePolicy policy, int exitCode) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
