package com.scanfleet.core.engine;

import com.scanfleet.core.git.RepositorySync;
import com.scanfleet.core.logging.MdcContext;
import com.scanfleet.core.model.Classification;
import com.scanfleet.core.model.RegistrationResult;
import com.scanfleet.core.model.RepositoryJob;
import com.scanfleet.core.model.ScanOutcome;
import com.scanfleet.core.process.CommandResult;
import com.scanfleet.core.process.CommandRunner;
import com.scanfleet.core.scan.ScanContext;
import com.scanfleet.core.scan.ScanDispatcher;
import com.scanfleet.core.scanner.RepositoryClassifier;
import com.scanfleet.core.sonar.ProjectRegistrar;
import com.scanfleet.core.sonar.SonarApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;

/**
 * Drives one job end to end: register, synchronise, run override commands, classify,
 * align the default branch and dispatch to a pipeline. Steps run strictly in that order.
 *
 * <p>The registration counter is recorded here as soon as it is known; the terminal
 * outcome is left to the caller so that thrown failures are counted exactly once.
 */
@Service
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final ProjectRegistrar registrar;
    private final RepositorySync repositorySync;
    private final CommandRunner commandRunner;
    private final RepositoryClassifier classifier;
    private final ScanDispatcher dispatcher;

    public JobProcessor(ProjectRegistrar registrar,
                        RepositorySync repositorySync,
                        CommandRunner commandRunner,
                        RepositoryClassifier classifier,
                        ScanDispatcher dispatcher) {
        this.registrar = registrar;
        this.repositorySync = repositorySync;
        this.commandRunner = commandRunner;
        this.classifier = classifier;
        this.dispatcher = dispatcher;
    }

    /**
     * Processes a job with the calling worker's client.
     *
     * @return the terminal outcome; never {@link ScanOutcome#FAILED}, failures are thrown
     */
    public ScanOutcome process(RepositoryJob job, SonarApi api, RunStats stats) {
        log.info("Processing {} ({})", job.name(), job.prefix());

        MdcContext.setPhase("register");
        RegistrationResult registration = registrar.ensureProject(api, job.projectKey(), job.displayName());
        stats.recordRegistration(registration);

        MdcContext.setPhase("sync");
        String branch = job.isLocal()
                ? repositorySync.defaultBranch(job.checkoutPath())
                : repositorySync.synchronize(job.remoteUrl(), job.checkoutPath());

        RepositoryJob effective = verifyScanPath(job);
        runExtraCommands(effective);

        MdcContext.setPhase("classify");
        Classification classification = classifier.classify(effective.scanPath());

        MdcContext.setPhase("branch");
        registrar.syncDefaultBranch(api, job.projectKey(), branch);

        MdcContext.setPhase("scan");
        ScanOutcome outcome = dispatcher.dispatch(ScanContext.of(effective, classification), api);
        log.info("{} finished: {}", job.projectKey(), outcome);
        return outcome;
    }

    /**
     * An override workdir can only be checked once the checkout exists; fall back to the
     * repository root if it is missing.
     */
    private RepositoryJob verifyScanPath(RepositoryJob job) {
        if (job.scanPath().equals(job.checkoutPath()) || Files.isDirectory(job.scanPath())) {
            return job;
        }
        log.warn("Workdir {} does not exist, using repository root", job.scanPath());
        return new RepositoryJob(job.prefix(), job.name(), job.projectKey(), job.displayName(),
                job.remoteUrl(), job.checkoutPath(), job.checkoutPath(), job.extraCommands());
    }

    private void runExtraCommands(RepositoryJob job) {
        if (job.extraCommands().isEmpty()) {
            return;
        }
        MdcContext.setPhase("extra-commands");
        for (String command : job.extraCommands()) {
            CommandResult result = commandRunner.runShell(job.scanPath(), command);
            if (!result.succeeded()) {
                log.warn("Extra command failed with exit code {}: {}", result.exitCode(), command);
            }
        }
    }
}
