package com.scanfleet.core.sonar;

import com.scanfleet.core.model.RegistrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Idempotent project registration against the analysis server.
 *
 * <p>{@link #ensureProject} checks existence before creating, and serialises calls for the
 * same key so that two workers never both attempt the create. Branch and metadata updates
 * are best-effort: failures are logged and never propagated.
 */
@Service
public class ProjectRegistrar {

    private static final Logger log = LoggerFactory.getLogger(ProjectRegistrar.class);

    static final String CONFIG_ONLY_SUFFIX = " (config-only)";
    static final String CONFIG_ONLY_DESCRIPTION =
            "Performance-test repository; only test plans and properties are analysed.";

    private final ConcurrentHashMap<String, Object> keyLocks = new ConcurrentHashMap<>();

    /**
     * Creates the project unless it already exists.
     *
     * @throws SonarApiException if the existence check or the creation fails
     */
    public RegistrationResult ensureProject(SonarApi api, String projectKey, String name) {
        Object lock = keyLocks.computeIfAbsent(projectKey, k -> new Object());
        synchronized (lock) {
            if (api.projectExists(projectKey)) {
                log.info("Project {} already exists", projectKey);
                return RegistrationResult.EXISTING;
            }
            api.createProject(projectKey, name);
            log.info("Project {} created", projectKey);
            return RegistrationResult.CREATED;
        }
    }

    public void syncDefaultBranch(SonarApi api, String projectKey, String branch) {
        try {
            api.renameDefaultBranch(projectKey, branch);
        } catch (RuntimeException e) {
            log.warn("Could not set default branch of {} to {}: {}", projectKey, branch, e.getMessage());
        }
    }

    public void updateMetadata(SonarApi api, String projectKey, String name, String description) {
        try {
            api.updateMetadata(projectKey, name, description);
        } catch (RuntimeException e) {
            log.warn("Could not update metadata of {}: {}", projectKey, e.getMessage());
        }
    }

    /**
     * Display name used for configuration-only projects.
     */
    public static String configOnlyName(String displayName) {
        return displayName.endsWith(CONFIG_ONLY_SUFFIX) ? displayName : displayName + CONFIG_ONLY_SUFFIX;
    }

    public static String configOnlyDescription() {
        return CONFIG_ONLY_DESCRIPTION;
    }
}
