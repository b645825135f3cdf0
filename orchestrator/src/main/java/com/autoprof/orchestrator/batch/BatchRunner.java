package com.autoprof.orchestrator.batch;

import com.autoprof.orchestrator.engine.Options;
import com.autoprof.orchestrator.engine.Outcome;
import com.autoprof.orchestrator.engine.PipelineEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the engine over a list of images.
 *
 * Images are independent: each gets its own options (see
 * {@link OptionsBroadcaster}), results and timing. With {@value Options#N_PROCS}
 * greater than one they are spread over a fixed pool of that many threads in
 * contiguous chunks; images may finish in any order, but the returned
 * outcomes are always in input order.
 *
 * A failed image only costs its own slot in the outcome list. Mean step times
 * are logged when the batch ends.
 */
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    // Above this many images, workers take them in chunks to cut dispatch overhead.
    static final int LARGE_BATCH_THRESHOLD = 100;
    static final int LARGE_BATCH_CHUNK     = 5;

    private final PipelineEngine engine;
    private final MeterRegistry  meterRegistry;
    private final int            defaultWorkers;

    public BatchRunner(PipelineEngine engine, MeterRegistry meterRegistry) {
        this(engine, meterRegistry, 1);
    }

    /**
     * @param defaultWorkers pool size used when the options carry no
     *                       {@value Options#N_PROCS}
     */
    public BatchRunner(PipelineEngine engine, MeterRegistry meterRegistry, int defaultWorkers) {
        this.engine         = engine;
        this.meterRegistry  = meterRegistry;
        this.defaultWorkers = defaultWorkers;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * @param options batch options; {@value Options#IMAGE_FILE} must be a list
     * @throws IllegalArgumentException if the image list is missing or a
     *         list-valued option has the wrong length
     */
    public BatchResult run(Options options) {
        List<Options> jobs = prepareJobs(options);
        int workers = options.getInt(Options.N_PROCS, defaultWorkers);

        long start = System.nanoTime();
        List<Outcome> outcomes = workers > 1
                ? runParallel(jobs, workers)
                : runSequential(jobs);
        long elapsed = System.nanoTime() - start;

        meterRegistry.timer("autoprof.batch.duration").record(elapsed, TimeUnit.NANOSECONDS);
        log.info("All Images Finished Processing at {} sec", String.format("%.1f", elapsed / 1e9));

        BatchResult result = new BatchResult(outcomes, TimingAggregator.meanTimings(outcomes), elapsed / 1e9);
        report(result);
        return result;
    }

    /**
     * Validate the image list and build one options object per image.
     * Runs before any image is touched, so configuration errors surface to the
     * caller instead of failing every image.
     */
    public static List<Options> prepareJobs(Options options) {
        Object files = options.get(Options.IMAGE_FILE);
        if (!(files instanceof List)) {
            throw new IllegalArgumentException(
                    "Option '" + Options.IMAGE_FILE + "' must be a list of image files for batch processing");
        }
        return OptionsBroadcaster.broadcast(options, ((List<?>) files).size());
    }

    // ------------------------------------------------------------------
    // Execution modes
    // ------------------------------------------------------------------

    private List<Outcome> runSequential(List<Options> jobs) {
        List<Outcome> outcomes = new ArrayList<>(jobs.size());
        for (Options job : jobs) {
            outcomes.add(engine.run(job));
        }
        return outcomes;
    }

    private List<Outcome> runParallel(List<Options> jobs, int workers) {
        int n = jobs.size();
        int chunk = n > LARGE_BATCH_THRESHOLD ? LARGE_BATCH_CHUNK : 1;
        Outcome[] slots = new Outcome[n];

        // Worker threads don't inherit MDC; carry the caller's run context over.
        Map<String, String> context = MDC.getCopyOfContextMap();

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int from = 0; from < n; from += chunk) {
                int lo = from;
                int hi = Math.min(n, from + chunk);
                futures.add(pool.submit(() -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        for (int i = lo; i < hi; i++) {
                            slots[i] = engine.run(jobs.get(i));
                        }
                    } finally {
                        MDC.clear();
                    }
                }));
            }
            awaitAll(futures);
        } finally {
            pool.shutdownNow();
        }

        // A slot is only empty if its chunk died outside the engine or we were interrupted.
        for (int i = 0; i < n; i++) {
            if (slots[i] == null) {
                slots[i] = Outcome.failure();
            }
        }
        return Arrays.asList(slots);
    }

    private static void awaitAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Worker chunk failed outside the pipeline engine: {}",
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while waiting for batch workers; unfinished images are marked failed");
                futures.forEach(f -> f.cancel(true));
                return;
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "autoprof-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    private static void report(BatchResult result) {
        if (result.allFailed()) {
            log.error("All images failed to process!");
            return;
        }
        if (!result.failedIndices().isEmpty()) {
            log.warn("{} of {} images failed: indices {}",
                    result.failedIndices().size(), result.outcomes().size(), result.failedIndices());
        }
        result.meanTimings().forEach((step, seconds) ->
                log.info("{} took {} seconds on average", step, String.format("%.3f", seconds)));
    }
}
