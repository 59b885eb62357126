package com.scanfleet.core.scan;

import com.scanfleet.core.logging.MdcContext;
import com.scanfleet.core.metrics.ScanfleetMetrics;
import com.scanfleet.core.model.Ecosystem;
import com.scanfleet.core.model.ScanOutcome;
import com.scanfleet.core.scanner.EcosystemDetector;
import com.scanfleet.core.sonar.ProjectRegistrar;
import com.scanfleet.core.sonar.SonarApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes a classified repository to its pipeline and reports the terminal outcome.
 */
@Service
public class ScanDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScanDispatcher.class);

    private final EcosystemDetector detector;
    private final ProjectRegistrar registrar;
    private final ScanfleetMetrics metrics;
    private final JavaScanExecutor javaExecutor;
    private final DotnetScanExecutor dotnetExecutor;
    private final PythonScanExecutor pythonExecutor;
    private final GoScanExecutor goExecutor;
    private final GenericScanExecutor genericExecutor;

    public ScanDispatcher(EcosystemDetector detector,
                          ProjectRegistrar registrar,
                          ScanfleetMetrics metrics,
                          JavaScanExecutor javaExecutor,
                          DotnetScanExecutor dotnetExecutor,
                          PythonScanExecutor pythonExecutor,
                          GoScanExecutor goExecutor,
                          GenericScanExecutor genericExecutor) {
        this.detector = detector;
        this.registrar = registrar;
        this.metrics = metrics;
        this.javaExecutor = javaExecutor;
        this.dotnetExecutor = dotnetExecutor;
        this.pythonExecutor = pythonExecutor;
        this.goExecutor = goExecutor;
        this.genericExecutor = genericExecutor;
    }

    /**
     * Runs the pipeline matching the context's classification.
     *
     * @param api the calling worker's analysis-server client
     * @return {@link ScanOutcome#SCANNED}, {@link ScanOutcome#CONFIG_ONLY} or {@link ScanOutcome#EMPTY}
     * @throws ScanAbortedException if a fatal phase fails
     */
    public ScanOutcome dispatch(ScanContext context, SonarApi api) {
        return switch (context.classification().category()) {
            case EMPTY -> {
                log.info("No recognised files in {}, skipping scan", context.scanPath());
                yield ScanOutcome.EMPTY;
            }
            case CONFIG -> {
                log.info("Config-only repository {}, scanning {}",
                        context.projectKey(), context.classification().tags());
                genericExecutor.scanConfig(context);
                yield ScanOutcome.CONFIG_ONLY;
            }
            case PERFORMANCE_TEST -> {
                String name = ProjectRegistrar.configOnlyName(context.projectName());
                String description = ProjectRegistrar.configOnlyDescription();
                MdcContext.setPhase("update-metadata");
                registrar.updateMetadata(api, context.projectKey(), name, description);
                log.info("Performance-test repository {}, scanning test plans", context.projectKey());
                genericExecutor.scanPerformanceTests(context.withMetadata(name, description));
                yield ScanOutcome.CONFIG_ONLY;
            }
            case CODE -> {
                runCodePipeline(context, detector.detect(context.scanPath()));
                yield ScanOutcome.SCANNED;
            }
        };
    }

    private void runCodePipeline(ScanContext context, Ecosystem ecosystem) {
        ScanExecutor executor = switch (ecosystem) {
            case JAVA -> javaExecutor;
            case DOTNET -> dotnetExecutor;
            case PYTHON -> pythonExecutor;
            case GO -> goExecutor;
            case GENERIC -> genericExecutor;
        };
        log.info("Running {} pipeline for {}", ecosystem, context.projectKey());
        try {
            executor.execute(context);
        } catch (FallbackRequiredException e) {
            fallBack(context, ecosystem, e);
        } catch (ScanAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            if (!executor.fallsBackToGeneric()) {
                throw e;
            }
            fallBack(context, ecosystem, e);
        }
    }

    private void fallBack(ScanContext context, Ecosystem ecosystem, RuntimeException cause) {
        log.warn("{} pipeline for {} failed ({}), falling back to sources-only scan",
                ecosystem, context.projectKey(), cause.getMessage());
        metrics.recordFallback(ecosystem.name().toLowerCase());
        genericExecutor.execute(context);
    }
}
