package com.scanfleet.dispatch.cli;

import com.scanfleet.core.config.MissingConfigurationException;
import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.engine.JobRunner;
import com.scanfleet.core.engine.RunStats;
import com.scanfleet.core.jobs.JobFactory;
import com.scanfleet.core.jobs.RepositoryListParser;
import com.scanfleet.core.model.RepositoryJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Top-level CLI command: onboards every repository in the list (or every directory under
 * the local root) and prints a summary once all jobs have finished.
 */
@Command(
        name = "scanfleet",
        mixinStandardHelpOptions = true,
        version = "scanfleet 0.1.0",
        description = "Bulk-onboards repositories into a SonarQube server: register, sync, classify, build, test and scan"
)
@Component
public class ScanfleetCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanfleetCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_MISSING_CONFIG = 2;

    @Option(names = {"--local", "-l"},
            description = "Scan subdirectories of the local root instead of cloning the repository list")
    boolean local;

    @Option(names = {"--local-root"},
            description = "Directory whose subdirectories are scanned in local mode (default: scanfleet.local-root)")
    Path localRoot;

    @Option(names = {"--repos-file", "-f"},
            description = "Repository list file, one 'prefix,url' per line (default: scanfleet.repos-file)")
    Path reposFile;

    @Option(names = {"--workers", "-w"},
            description = "Maximum number of repositories processed in parallel (default: scanfleet.workers)")
    Integer workers;

    private final ScanfleetProperties properties;
    private final RepositoryListParser listParser;
    private final JobFactory jobFactory;
    private final JobRunner jobRunner;

    public ScanfleetCommand(ScanfleetProperties properties,
                            RepositoryListParser listParser,
                            JobFactory jobFactory,
                            JobRunner jobRunner) {
        this.properties = properties;
        this.listParser = listParser;
        this.jobFactory = jobFactory;
        this.jobRunner = jobRunner;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        try {
            properties.validate();
        } catch (MissingConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_MISSING_CONFIG;
        }

        int workerCount = workers != null ? workers : properties.getWorkers();
        if (workerCount < 1) {
            ConsoleOutput.error("--workers must be at least 1, was " + workerCount);
            return EXIT_INPUT_ERROR;
        }

        List<RepositoryJob> jobs;
        try {
            jobs = enumerateJobs();
        } catch (IOException e) {
            log.error("Could not enumerate repositories", e);
            ConsoleOutput.error("Could not enumerate repositories: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        ConsoleOutput.info("%d repositor%s to process with %d worker%s".formatted(
                jobs.size(), jobs.size() == 1 ? "y" : "ies", workerCount, workerCount == 1 ? "" : "s"));

        var stats = new RunStats();
        jobRunner.run(jobs, workerCount, stats);

        ConsoleOutput.summary(stats.snapshot());
        ConsoleOutput.success("All repos processed.");
        return EXIT_OK;
    }

    private List<RepositoryJob> enumerateJobs() throws IOException {
        if (local) {
            Path root = localRoot != null ? localRoot : Path.of(properties.getLocalRoot());
            ConsoleOutput.info("Local mode: scanning directories under " + root.toAbsolutePath());
            return jobFactory.fromLocalRoot(root);
        }
        Path list = reposFile != null ? reposFile : Path.of(properties.getReposFile());
        ConsoleOutput.info("Reading repository list " + list.toAbsolutePath());
        return jobFactory.fromEntries(listParser.parse(list));
    }
}
