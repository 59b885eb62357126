package com.scanfleet.core.config;

import com.scanfleet.core.model.ExtraCommandOverride;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "scanfleet")
public class ScanfleetProperties {

    private Sonar sonar = new Sonar();
    private int workers = 1;
    private String reposFile = "repos.txt";
    private String workspaceDir = System.getProperty("java.io.tmpdir");
    private String localRoot = ".";
    private String localPrefix = "local";
    private boolean convertToSsh = true;
    private Map<String, RepoOverride> overrides = new LinkedHashMap<>();

    /**
     * Fails fast when the analysis-server endpoint or credential is missing.
     *
     * @throws MissingConfigurationException naming every missing value
     */
    public void validate() {
        var missing = new ArrayList<String>();
        if (isBlank(sonar.host)) missing.add("SONAR_HOST (scanfleet.sonar.host)");
        if (isBlank(sonar.token)) missing.add("SONAR_TOKEN (scanfleet.sonar.token)");
        if (!missing.isEmpty()) {
            throw new MissingConfigurationException(missing);
        }
    }

    /**
     * Returns the override configured for a repository name, or {@link ExtraCommandOverride#NONE}.
     */
    public ExtraCommandOverride overrideFor(String repoName) {
        var override = overrides.get(repoName);
        return override == null ? ExtraCommandOverride.NONE : override.toOverride();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public Sonar getSonar() { return sonar; }
    public void setSonar(Sonar sonar) { this.sonar = sonar; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public String getReposFile() { return reposFile; }
    public void setReposFile(String reposFile) { this.reposFile = reposFile; }
    public String getWorkspaceDir() { return workspaceDir; }
    public void setWorkspaceDir(String workspaceDir) { this.workspaceDir = workspaceDir; }
    public String getLocalRoot() { return localRoot; }
    public void setLocalRoot(String localRoot) { this.localRoot = localRoot; }
    public String getLocalPrefix() { return localPrefix; }
    public void setLocalPrefix(String localPrefix) { this.localPrefix = localPrefix; }
    public boolean isConvertToSsh() { return convertToSsh; }
    public void setConvertToSsh(boolean convertToSsh) { this.convertToSsh = convertToSsh; }
    public Map<String, RepoOverride> getOverrides() { return overrides; }
    public void setOverrides(Map<String, RepoOverride> overrides) { this.overrides = overrides; }

    public static class Sonar {
        private String host = "";
        private String token = "";
        private int maxRetries = 3;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;
        private String scannerCommand = "sonar-scanner";
        private String metadataEndpoint = "/api/projects/update";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public String getScannerCommand() { return scannerCommand; }
        public void setScannerCommand(String scannerCommand) { this.scannerCommand = scannerCommand; }
        public String getMetadataEndpoint() { return metadataEndpoint; }
        public void setMetadataEndpoint(String metadataEndpoint) { this.metadataEndpoint = metadataEndpoint; }
    }

    /**
     * Bindable form of {@link ExtraCommandOverride}.
     */
    public static class RepoOverride {
        private String workdir;
        private List<String> commands = new ArrayList<>();

        public ExtraCommandOverride toOverride() {
            return new ExtraCommandOverride(workdir, commands);
        }

        public String getWorkdir() { return workdir; }
        public void setWorkdir(String workdir) { this.workdir = workdir; }
        public List<String> getCommands() { return commands; }
        public void setCommands(List<String> commands) { this.commands = commands; }
    }
}
