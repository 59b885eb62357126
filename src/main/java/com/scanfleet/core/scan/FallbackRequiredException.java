package com.scanfleet.core.scan;

/**
 * A {@link PhasePolicy#FALLBACK_ON_FAILURE} phase failed and the pipeline must be replaced
 * by a sources-only scan.
 */
public class FallbackRequiredException extends RuntimeException {

    private final String phase;

    public FallbackRequiredException(String phase, int exitCode) {
        super("Phase '%s' failed with exit code %d".formatted(phase, exitCode));
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
