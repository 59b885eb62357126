package com.scanfleet.core.scan;

import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * pytest under coverage, then the scanner. Test failures are tolerated; the coverage report
 * is attached only if the test phase left one behind.
 */
@Component
public class PythonScanExecutor implements ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PythonScanExecutor.class);

    static final String COVERAGE_REPORT = "coverage.xml";

    private final PhaseRunner phaseRunner;
    private final ScanfleetProperties properties;

    public PythonScanExecutor(PhaseRunner phaseRunner, ScanfleetProperties properties) {
        this.phaseRunner = phaseRunner;
        this.properties = properties;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.PYTHON;
    }

    @Override
    public void execute(ScanContext context) {
        Path dir = context.scanPath();
        CoverageReports.removeStale(dir.resolve(COVERAGE_REPORT));
        phaseRunner.run(dir, Phase.tolerated("python-test",
                List.of("python3", "-m", "coverage", "run", "-m", "pytest")));
        phaseRunner.run(dir, Phase.tolerated("python-coverage",
                List.of("python3", "-m", "coverage", "xml", "-o", COVERAGE_REPORT)));

        var invocation = ScannerInvocation.forProject(context, properties.getSonar())
                .property("sonar.sources", ".")
                .property("sonar.exclusions", "**/.venv/**,**/venv/**,**/__pycache__/**");
        if (Files.isRegularFile(dir.resolve(COVERAGE_REPORT))) {
            invocation.property("sonar.python.coverage.reportPaths", COVERAGE_REPORT);
        } else {
            log.warn("No {} produced, scanning without coverage", COVERAGE_REPORT);
        }
        phaseRunner.run(dir, Phase.fatal("sonar-scanner",
                invocation.command(properties.getSonar().getScannerCommand())));
    }
}
