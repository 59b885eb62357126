package com.scanfleet.core.jobs;

import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.model.ExtraCommandOverride;
import com.scanfleet.core.model.RepositoryJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Stream;

/**
 * Turns repository-list entries or local directories into {@link RepositoryJob}s.
 *
 * <p>Remote checkouts live under {@code <workspace>/<projectKey>}, so repositories that share
 * a name under different prefixes never share a working copy. Applies the per-repository
 * override (scan-root redirection and extra commands) and drops later jobs whose project key
 * repeats an earlier one.
 */
@Component
public class JobFactory {

    private static final Logger log = LoggerFactory.getLogger(JobFactory.class);

    private final ScanfleetProperties properties;

    public JobFactory(ScanfleetProperties properties) {
        this.properties = properties;
    }

    public List<RepositoryJob> fromEntries(List<RepositoryEntry> entries) {
        Path workspace = Path.of(properties.getWorkspaceDir());
        var jobs = new ArrayList<RepositoryJob>();
        for (var entry : entries) {
            String url = properties.isConvertToSsh() ? RepositoryUrls.toSsh(entry.url()) : entry.url();
            String key = projectKey(entry.prefix(), entry.name());
            jobs.add(build(entry.prefix(), entry.name(), url, workspace.resolve(key)));
        }
        return dedupe(jobs);
    }

    /**
     * One job per non-hidden subdirectory of {@code root}, in name order. Local jobs are
     * scanned in place and never cloned or pulled.
     */
    public List<RepositoryJob> fromLocalRoot(Path root) throws IOException {
        var jobs = new ArrayList<RepositoryJob>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path dir : children.filter(Files::isDirectory)
                    .filter(d -> !d.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList()) {
                jobs.add(build(properties.getLocalPrefix(), dir.getFileName().toString(), null, dir));
            }
        }
        return dedupe(jobs);
    }

    RepositoryJob build(String prefix, String name, String remoteUrl, Path checkoutPath) {
        ExtraCommandOverride override = properties.overrideFor(name);
        Path scanPath = resolveScanPath(name, checkoutPath, override);
        return new RepositoryJob(
                prefix,
                name,
                projectKey(prefix, name),
                displayName(prefix, name),
                remoteUrl,
                checkoutPath,
                scanPath,
                override.commands());
    }

    public static String projectKey(String prefix, String name) {
        return prefix + "_" + name;
    }

    public static String displayName(String prefix, String name) {
        return prefix + "-" + name;
    }

    /**
     * Resolves the override working directory. The checkout may not exist yet when jobs are
     * planned, so existence is only enforced for local jobs' existing checkouts; an empty,
     * absolute or escaping workdir falls back to the checkout root.
     */
    static Path resolveScanPath(String name, Path checkoutPath, ExtraCommandOverride override) {
        if (!override.hasWorkdir()) {
            if (!override.commands().isEmpty()) {
                log.warn("Override for {} has no workdir, using repository root", name);
            }
            return checkoutPath;
        }
        Path root = checkoutPath.toAbsolutePath().normalize();
        Path candidate = root.resolve(override.workdir()).normalize();
        if (Path.of(override.workdir()).isAbsolute() || !candidate.startsWith(root)) {
            log.warn("Override workdir '{}' for {} is outside the repository, using repository root",
                    override.workdir(), name);
            return root;
        }
        if (Files.isDirectory(root) && !Files.isDirectory(candidate)) {
            log.warn("Override workdir '{}' for {} does not exist, using repository root",
                    override.workdir(), name);
            return root;
        }
        return candidate;
    }

    private static List<RepositoryJob> dedupe(List<RepositoryJob> jobs) {
        var byKey = new LinkedHashMap<String, RepositoryJob>();
        for (var job : jobs) {
            var previous = byKey.putIfAbsent(job.projectKey(), job);
            if (previous != null) {
                log.warn("Duplicate project key {} ({}), keeping the first entry",
                        job.projectKey(), job.remoteUrl() != null ? job.remoteUrl() : job.checkoutPath());
            }
        }
        return List.copyOf(byKey.values());
    }
}
