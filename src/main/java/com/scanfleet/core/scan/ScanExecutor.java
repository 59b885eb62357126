package com.scanfleet.core.scan;

import com.scanfleet.core.model.Ecosystem;

/**
 * Build, test, coverage and scan pipeline for one ecosystem.
 */
public interface ScanExecutor {

    Ecosystem ecosystem();

    /**
     * Runs the pipeline in {@link ScanContext#scanPath()}.
     *
     * @throws ScanAbortedException       when a fatal phase fails
     * @throws FallbackRequiredException  when the pipeline asks to be replaced by a sources-only scan
     */
    void execute(ScanContext context);

    /**
     * Whether any unexpected failure of this pipeline should downgrade to a sources-only
     * scan instead of failing the job.
     */
    default boolean fallsBackToGeneric() {
        return false;
    }
}
