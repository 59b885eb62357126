package com.scanfleet.core.scan;

import com.scanfleet.core.config.ScanfleetProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects {@code sonar.*} analysis properties and renders them for the different scanner
 * front ends (scanner CLI, Maven plugin, .NET begin step).
 */
public final class ScannerInvocation {

    private final Map<String, String> properties = new LinkedHashMap<>();

    private ScannerInvocation() {}

    /**
     * Starts an invocation with project identity, server and credential already set.
     */
    public static ScannerInvocation forProject(ScanContext context, ScanfleetProperties.Sonar sonar) {
        var invocation = new ScannerInvocation()
                .property("sonar.projectKey", context.projectKey())
                .property("sonar.projectName", context.projectName())
                .property("sonar.host.url", sonar.getHost())
                .property("sonar.token", sonar.getToken());
        if (context.description() != null) {
            invocation.property("sonar.projectDescription", context.description());
        }
        return invocation;
    }

    public ScannerInvocation property(String key, String value) {
        properties.put(key, value);
        return this;
    }

    public String get(String key) {
        return properties.get(key);
    }

    public Map<String, String> properties() {
        return Map.copyOf(properties);
    }

    /**
     * Renders {@code executable... -Dkey=value...}, as understood by the scanner CLI and the
     * Maven/Gradle plugins.
     */
    public List<String> command(String... executable) {
        var command = new ArrayList<>(List.of(executable));
        properties.forEach((k, v) -> command.add("-D" + k + "=" + v));
        return command;
    }

    /**
     * Renders the .NET scanner {@code begin} step: key and name as {@code /k:} and {@code /n:},
     * everything else as {@code /d:key=value}.
     */
    public List<String> dotnetBegin() {
        var command = new ArrayList<>(List.of("dotnet", "sonarscanner", "begin"));
        properties.forEach((k, v) -> {
            switch (k) {
                case "sonar.projectKey" -> command.add("/k:" + v);
                case "sonar.projectName" -> command.add("/n:" + v);
                default -> command.add("/d:" + k + "=" + v);
            }
        });
        return command;
    }

    /**
     * Renders the .NET scanner {@code end} step, which only needs the credential again.
     */
    public List<String> dotnetEnd() {
        return List.of("dotnet", "sonarscanner", "end", "/d:sonar.token=" + properties.get("sonar.token"));
    }
}
