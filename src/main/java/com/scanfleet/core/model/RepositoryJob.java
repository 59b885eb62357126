package com.scanfleet.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work: a repository bound to its analysis-server identity and its location on disk.
 *
 * @param prefix        logical namespace the repository was listed under
 * @param name          repository name derived from its origin
 * @param projectKey    analysis-server key ({@code prefix_name})
 * @param displayName   analysis-server display name ({@code prefix-name})
 * @param remoteUrl     clone URL, or {@code null} for a local-directory job
 * @param checkoutPath  root of the working copy
 * @param scanPath      directory scanned; equal to or below {@code checkoutPath}
 * @param extraCommands shell commands run in {@code scanPath} before classification
 */
public record RepositoryJob(
        String prefix,
        String name,
        String projectKey,
        String displayName,
        String remoteUrl,
        Path checkoutPath,
        Path scanPath,
        List<String> extraCommands
) {

    public RepositoryJob {
        Objects.requireNonNull(projectKey, "projectKey");
        Objects.requireNonNull(checkoutPath, "checkoutPath");
        checkoutPath = checkoutPath.toAbsolutePath().normalize();
        scanPath = scanPath == null ? checkoutPath : scanPath.toAbsolutePath().normalize();
        if (!scanPath.startsWith(checkoutPath)) {
            throw new IllegalArgumentException(
                    "Scan path %s is outside checkout %s".formatted(scanPath, checkoutPath));
        }
        extraCommands = extraCommands == null ? List.of() : List.copyOf(extraCommands);
    }

    public boolean isLocal() {
        return remoteUrl == null;
    }
}
