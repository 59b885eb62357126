package com.scanfleet.core.engine;

import com.scanfleet.core.logging.MdcContext;
import com.scanfleet.core.metrics.ScanfleetMetrics;
import com.scanfleet.core.model.RepositoryJob;
import com.scanfleet.core.model.ScanOutcome;
import com.scanfleet.core.sonar.SonarApi;
import com.scanfleet.core.sonar.SonarClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a batch of jobs with at most {@code workers} running at once.
 *
 * <p>Each worker owns the analysis-server client built for it when it is submitted and
 * drains a shared queue of jobs. A job that throws is logged and counted as failed without
 * affecting any other job. {@link #run} returns only after every job has reached a terminal
 * outcome.
 */
@Service
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobProcessor processor;
    private final SonarClientFactory clientFactory;
    private final ScanfleetMetrics metrics;

    public JobRunner(JobProcessor processor, SonarClientFactory clientFactory, ScanfleetMetrics metrics) {
        this.processor = processor;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
    }

    public void run(List<RepositoryJob> jobs, int workers, RunStats stats) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, was " + workers);
        }
        if (jobs.isEmpty()) {
            log.info("No jobs to run");
            return;
        }

        int poolSize = Math.min(workers, jobs.size());
        if (poolSize == 1) {
            log.info("Running {} job(s) sequentially", jobs.size());
            SonarApi api = clientFactory.create();
            for (var job : jobs) {
                runIsolated(job, api, stats);
            }
            return;
        }

        log.info("Running {} jobs on {} workers", jobs.size(), poolSize);
        Queue<RepositoryJob> queue = new ConcurrentLinkedQueue<>(jobs);
        var threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "scanfleet-worker-" + threadIds.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
        try {
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < poolSize; i++) {
                SonarApi api = clientFactory.create();
                futures.add(executor.submit(() -> drain(queue, api, stats)));
            }
            awaitAll(futures);
        } finally {
            executor.shutdown();
        }
    }

    private void drain(Queue<RepositoryJob> queue, SonarApi api, RunStats stats) {
        RepositoryJob job;
        while ((job = queue.poll()) != null) {
            runIsolated(job, api, stats);
        }
    }

    /**
     * Runs one job and records exactly one terminal outcome, whatever happens inside it.
     */
    void runIsolated(RepositoryJob job, SonarApi api, RunStats stats) {
        long startMs = System.currentTimeMillis();
        ScanOutcome outcome;
        MdcContext.setJob(job.projectKey());
        try {
            outcome = processor.process(job, api, stats);
        } catch (Throwable t) {
            log.error("Failed processing {}: {}", job.name(), t.getMessage(), t);
            outcome = ScanOutcome.FAILED;
        } finally {
            MdcContext.clear();
        }
        stats.recordOutcome(outcome);
        metrics.recordJobResult(outcome);
        metrics.recordJobDuration(outcome, System.currentTimeMillis() - startMs);
    }

    private static void awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (var future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // keep waiting; the batch must finish before the summary is printed
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.error("Worker terminated unexpectedly", e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
