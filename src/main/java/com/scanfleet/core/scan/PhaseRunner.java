package com.scanfleet.core.scan;

import com.scanfleet.core.logging.MdcContext;
import com.scanfleet.core.metrics.ScanfleetMetrics;
import com.scanfleet.core.process.CommandResult;
import com.scanfleet.core.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs a {@link Phase} and applies its {@link PhasePolicy} the same way for every pipeline:
 * fatal failures throw {@link ScanAbortedException}, fallback failures throw
 * {@link FallbackRequiredException}, tolerated failures are logged and returned.
 */
@Component
public class PhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunner.class);

    private final CommandRunner commandRunner;
    private final ScanfleetMetrics metrics;

    public PhaseRunner(CommandRunner commandRunner, ScanfleetMetrics metrics) {
        this.commandRunner = commandRunner;
        this.metrics = metrics;
    }

    public PhaseResult run(Path workDir, Phase phase) {
        MdcContext.setPhase(phase.name());
        CommandResult result = commandRunner.run(workDir, phase.command());
        if (result.succeeded()) {
            log.info("[{}] succeeded", phase.name());
            return new PhaseResult(phase.name(), phase.policy(), 0);
        }

        metrics.recordPhaseFailure(phase.name(), phase.policy());
        return switch (phase.policy()) {
            case FATAL -> {
                log.error("[{}] failed with exit code {}, aborting pipeline", phase.name(), result.exitCode());
                throw new ScanAbortedException(phase.name(), result.exitCode(), lastLine(result.outputTail()));
            }
            case FALLBACK_ON_FAILURE -> {
                log.warn("[{}] failed with exit code {}, falling back to sources-only scan",
                        phase.name(), result.exitCode());
                throw new FallbackRequiredException(phase.name(), result.exitCode());
            }
            case TOLERATED -> {
                log.warn("[{}] failed with exit code {}, continuing", phase.name(), result.exitCode());
                yield new PhaseResult(phase.name(), phase.policy(), result.exitCode());
            }
        };
    }

    private static String lastLine(String tail) {
        if (tail == null || tail.isBlank()) {
            return "";
        }
        int newline = tail.lastIndexOf('\n');
        return newline < 0 ? tail : tail.substring(newline + 1);
    }
}
