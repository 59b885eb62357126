package com.scanfleet.core.scan;

/**
 * A {@link PhasePolicy#FATAL} phase failed; no analysis is submitted for the job.
 */
public class ScanAbortedException extends RuntimeException {

    private final String phase;
    private final int exitCode;

    public ScanAbortedException(String phase, int exitCode, String detail) {
        super("Phase '%s' failed with exit code %d%s".formatted(
                phase, exitCode, detail == null || detail.isBlank() ? "" : ": " + detail));
        this.phase = phase;
        this.exitCode = exitCode;
    }

    public String getPhase() {
        return phase;
    }

    public int getExitCode() {
        return exitCode;
    }
}
