package com.scanfleet.core.git;

import com.scanfleet.core.process.CommandResult;
import com.scanfleet.core.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings a repository working copy to the tip of its default branch.
 *
 * <p>A missing checkout is cloned (failure is fatal for the job); an existing one is pulled
 * once, and a failed pull only logs a warning. The default branch is read from
 * {@code origin/HEAD} and checked out.
 *
 * <p>This class shells out to the {@code git} CLI rather than depending on JGit.
 */
@Service
public class RepositorySync {

    private static final Logger log = LoggerFactory.getLogger(RepositorySync.class);

    static final String FALLBACK_BRANCH = "main";

    private final CommandRunner commandRunner;

    public RepositorySync(CommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    /**
     * Clones or updates the repository and checks out its default branch.
     *
     * @param remoteUrl   clone URL
     * @param checkoutDir working-copy location
     * @return the default branch name
     * @throws GitSyncException if the clone fails
     */
    public String synchronize(String remoteUrl, Path checkoutDir) {
        if (Files.isDirectory(checkoutDir.resolve(".git"))) {
            log.info("Repo already exists at {}, pulling latest changes", checkoutDir);
            int pullExit = runGit(checkoutDir, "pull", "--ff-only");
            if (pullExit != 0) {
                log.warn("git pull failed (exit code {}), continuing with existing checkout", pullExit);
            }
        } else {
            log.info("Cloning {}", remoteUrl);
            createParent(checkoutDir);
            int cloneExit = runGit(checkoutDir.getParent(), "clone", remoteUrl, checkoutDir.toString());
            if (cloneExit != 0) {
                throw new GitSyncException(
                        "Failed to clone '%s' (exit code %d)".formatted(remoteUrl, cloneExit));
            }
        }

        String branch = defaultBranch(checkoutDir);
        int checkoutExit = runGit(checkoutDir, "checkout", branch);
        if (checkoutExit != 0) {
            log.warn("Could not check out {} (exit code {})", branch, checkoutExit);
        }
        return branch;
    }

    /**
     * Reads the remote default branch, e.g. {@code origin/develop} becomes {@code develop}.
     * Falls back to {@value #FALLBACK_BRANCH} when origin/HEAD is not set.
     */
    public String defaultBranch(Path checkoutDir) {
        var result = runGitOutput(checkoutDir, "symbolic-ref", "--short", "refs/remotes/origin/HEAD");
        if (result.succeeded()) {
            String branch = parseDefaultBranch(result.outputTail());
            if (branch != null) {
                return branch;
            }
        }
        log.debug("origin/HEAD not set in {}, assuming {}", checkoutDir, FALLBACK_BRANCH);
        return FALLBACK_BRANCH;
    }

    static String parseDefaultBranch(String symbolicRef) {
        if (symbolicRef == null || symbolicRef.isBlank()) {
            return null;
        }
        String ref = symbolicRef.strip();
        int newline = ref.lastIndexOf('\n');
        if (newline >= 0) {
            ref = ref.substring(newline + 1).strip();
        }
        if (ref.startsWith("origin/")) {
            ref = ref.substring("origin/".length());
        }
        return ref.isEmpty() ? null : ref;
    }

    /**
     * Runs a git command and returns the exit code.
     */
    int runGit(Path workDir, String... args) {
        return runGitOutput(workDir, args).exitCode();
    }

    /**
     * Runs a git command and returns its result including the output tail.
     */
    CommandResult runGitOutput(Path workDir, String... args) {
        return commandRunner.run(workDir, buildCommand(args));
    }

    private static List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    private static void createParent(Path checkoutDir) {
        try {
            Files.createDirectories(checkoutDir.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create " + checkoutDir.getParent(), e);
        }
    }
}
