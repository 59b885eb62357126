package com.scanfleet.core.scan;

import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.model.Classification;
import com.scanfleet.core.model.Ecosystem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Sources-only scan with no build or test phase. Also serves config and performance-test
 * repositories, restricted to the files that matter for them.
 */
@Component
public class GenericScanExecutor implements ScanExecutor {

    static final String DEFAULT_EXCLUSIONS = "**/node_modules/**,**/.git/**";
    static final String PERFORMANCE_TEST_INCLUSIONS = "**/*.jmx,**/*.properties";

    private final PhaseRunner phaseRunner;
    private final ScanfleetProperties properties;

    public GenericScanExecutor(PhaseRunner phaseRunner, ScanfleetProperties properties) {
        this.phaseRunner = phaseRunner;
        this.properties = properties;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.GENERIC;
    }

    @Override
    public void execute(ScanContext context) {
        scan(context, null);
    }

    /**
     * Scans only the infrastructure-as-code kinds recorded in the classification tags.
     */
    public void scanConfig(ScanContext context) {
        scan(context, configInclusions(context.classification()));
    }

    public void scanPerformanceTests(ScanContext context) {
        scan(context, PERFORMANCE_TEST_INCLUSIONS);
    }

    static String configInclusions(Classification classification) {
        var patterns = new ArrayList<String>();
        if (classification.hasTag(Classification.TAG_YAML)) {
            patterns.add("**/*.yaml");
            patterns.add("**/*.yml");
        }
        if (classification.hasTag(Classification.TAG_TERRAFORM)) {
            patterns.add("**/*.tf");
            patterns.add("**/*.tfvars");
        }
        return String.join(",", patterns);
    }

    private void scan(ScanContext context, String inclusions) {
        var invocation = ScannerInvocation.forProject(context, properties.getSonar())
                .property("sonar.sources", ".")
                .property("sonar.exclusions", DEFAULT_EXCLUSIONS);
        if (inclusions != null && !inclusions.isBlank()) {
            invocation.property("sonar.inclusions", inclusions);
        }
        phaseRunner.run(context.scanPath(), Phase.fatal("sonar-scanner",
                invocation.command(properties.getSonar().getScannerCommand())));
    }
}
