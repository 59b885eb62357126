package com.scanfleet.core.scan;

import com.scanfleet.core.model.Classification;
import com.scanfleet.core.model.RepositoryJob;

import java.nio.file.Path;

/**
 * Everything an executor needs to build, test and scan one job.
 *
 * @param description project description passed to the scanner, or {@code null}
 */
public record ScanContext(
        RepositoryJob job,
        Classification classification,
        String projectName,
        String description
) {

    public static ScanContext of(RepositoryJob job, Classification classification) {
        return new ScanContext(job, classification, job.displayName(), null);
    }

    public ScanContext withMetadata(String name, String newDescription) {
        return new ScanContext(job, classification, name, newDescription);
    }

    public Path scanPath() {
        return job.scanPath();
    }

    public String projectKey() {
        return job.projectKey();
    }
}
