package com.scanfleet.core.metrics;

import com.scanfleet.core.model.ScanOutcome;
import com.scanfleet.core.scan.PhasePolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for onboarding runs.
 */
@Service
public class ScanfleetMetrics {

    private final MeterRegistry registry;

    public ScanfleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(ScanOutcome outcome) {
        Counter.builder("scanfleet.jobs.total")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordJobDuration(ScanOutcome outcome, long ms) {
        Timer.builder("scanfleet.job.duration")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a build, test or scan phase that did not succeed.
     *
     * @param phase  phase name, e.g. {@code dotnet-build}
     * @param policy the policy that was applied to the failure
     */
    public void recordPhaseFailure(String phase, PhasePolicy policy) {
        Counter.builder("scanfleet.phase.failures")
                .description("Build/test/scan phases that exited unsuccessfully")
                .tag("phase", phase)
                .tag("policy", policy.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordFallback(String ecosystem) {
        Counter.builder("scanfleet.fallbacks.total")
                .description("Pipelines downgraded to a sources-only scan")
                .tag("ecosystem", ecosystem)
                .register(registry)
                .increment();
    }
}
