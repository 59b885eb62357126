package com.scanfleet.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Runs external commands (build tools, test runners, git, the scanner) and reports their
 * exit status. Output is merged, consumed line by line, masked and logged at DEBUG; the last
 * lines are kept for error reporting.
 *
 * <p>Commands that cannot be started are reported as a failed {@link CommandResult} with
 * exit code {@value #START_FAILURE_EXIT_CODE} rather than thrown, so callers apply one
 * failure policy regardless of why a tool failed.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public static final int START_FAILURE_EXIT_CODE = 127;

    private static final int TAIL_LINES = 20;

    private final SecretMasker masker;

    public CommandRunner(SecretMasker masker) {
        this.masker = masker;
    }

    /**
     * Runs a command and waits for it to exit.
     *
     * @param workDir working directory for the command
     * @param command program and arguments
     * @return exit status and output tail
     */
    public CommandResult run(Path workDir, List<String> command) {
        String printable = masker.mask(command);
        log.info("Running in {}: {}", workDir, printable);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.warn("Could not start '{}': {}", printable, e.getMessage());
            return new CommandResult(START_FAILURE_EXIT_CODE, masker.mask(e.getMessage()));
        }

        Deque<String> tail = new ArrayDeque<>(TAIL_LINES);
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String masked = masker.mask(line);
                log.debug("{}: {}", command.get(0), masked);
                if (tail.size() == TAIL_LINES) {
                    tail.removeFirst();
                }
                tail.addLast(masked);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("Command exited with code {}: {}", exitCode, printable);
            }
            return new CommandResult(exitCode, String.join("\n", tail));
        } catch (IOException e) {
            process.destroyForcibly();
            throw new CommandExecutionException("I/O failure while running " + printable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CommandExecutionException("Interrupted while running " + printable, e);
        }
    }

    /**
     * Runs a shell command string through {@code bash -lc}.
     */
    public CommandResult runShell(Path workDir, String script) {
        return run(workDir, List.of("bash", "-lc", script));
    }
}
