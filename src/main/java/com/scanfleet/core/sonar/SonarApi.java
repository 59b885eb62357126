package com.scanfleet.core.sonar;

/**
 * The analysis-server operations the onboarding pipeline depends on.
 * Implementations are owned by a single worker and need not be thread-safe.
 */
public interface SonarApi {

    boolean projectExists(String projectKey);

    void createProject(String projectKey, String name);

    void renameDefaultBranch(String projectKey, String branch);

    void updateMetadata(String projectKey, String name, String description);
}
