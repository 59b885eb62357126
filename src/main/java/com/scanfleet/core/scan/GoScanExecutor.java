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
 * {@code go test} with a cover profile, then the scanner. Test failures are tolerated; the
 * profile is attached only if this run wrote one.
 */
@Component
public class GoScanExecutor implements ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(GoScanExecutor.class);

    static final String COVER_PROFILE = "coverage.out";

    private final PhaseRunner phaseRunner;
    private final ScanfleetProperties properties;

    public GoScanExecutor(PhaseRunner phaseRunner, ScanfleetProperties properties) {
        this.phaseRunner = phaseRunner;
        this.properties = properties;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.GO;
    }

    @Override
    public void execute(ScanContext context) {
        Path dir = context.scanPath();
        CoverageReports.removeStale(dir.resolve(COVER_PROFILE));
        phaseRunner.run(dir, Phase.tolerated("go-test",
                List.of("go", "test", "./...", "-coverprofile=" + COVER_PROFILE)));

        var invocation = ScannerInvocation.forProject(context, properties.getSonar())
                .property("sonar.sources", ".")
                .property("sonar.exclusions", "**/*_test.go,**/vendor/**")
                .property("sonar.tests", ".")
                .property("sonar.test.inclusions", "**/*_test.go");
        if (Files.isRegularFile(dir.resolve(COVER_PROFILE))) {
            invocation.property("sonar.go.coverage.reportPaths", COVER_PROFILE);
        } else {
            log.warn("No {} produced, scanning without coverage", COVER_PROFILE);
        }
        phaseRunner.run(dir, Phase.fatal("sonar-scanner",
                invocation.command(properties.getSonar().getScannerCommand())));
    }
}
