package com.autoprof.orchestrator.service;

import com.autoprof.orchestrator.batch.BatchResult;
import com.autoprof.orchestrator.batch.BatchRunner;
import com.autoprof.orchestrator.engine.Options;
import com.autoprof.orchestrator.engine.Outcome;
import com.autoprof.orchestrator.engine.PipelineEngine;
import com.autoprof.orchestrator.image.ImageReader;
import com.autoprof.orchestrator.model.ProcessMode;
import com.autoprof.orchestrator.model.RunRecord;
import com.autoprof.orchestrator.model.RunState;
import com.autoprof.orchestrator.repository.RunRepository;
import com.autoprof.orchestrator.step.BuiltinSequences;
import com.autoprof.orchestrator.step.SequenceGraph;
import com.autoprof.orchestrator.step.SequenceUpdate;
import com.autoprof.orchestrator.step.StepRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Turns a run request (mode + options + optional sequence override) into
 * engine or batch executions.
 *
 * Each run works on its own copy of the default sequence graph:
 *   1. start from the default graph,
 *   2. swap in the forced "head" if the mode is forced,
 *   3. apply the caller's sequence update, which wins over the mode default.
 * The step registry is shared by all runs.
 *
 * Everything that can be wrong with a request is checked in {@link #submit}
 * before the run is queued, so configuration errors reach the caller
 * synchronously instead of showing up as N failed images.
 *
 * Run records are saved after every transition. Each save commits on its own,
 * so pollers see QUEUED, RUNNING and the terminal state as they happen.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final StepRegistry    registry;
    private final SequenceGraph   defaultSequences;
    private final ImageReader     imageReader;
    private final MeterRegistry   meterRegistry;
    private final RunRepository   runRepo;
    private final int             defaultWorkers;
    private final Duration        retention;
    private final ExecutorService runners;

    public RunService(StepRegistry registry,
                      SequenceGraph defaultSequences,
                      ImageReader imageReader,
                      MeterRegistry meterRegistry,
                      RunRepository runRepo,
                      @Value("${autoprof.batch.default-workers:1}") int defaultWorkers,
                      @Value("${autoprof.runs.concurrency:1}") int runConcurrency,
                      @Value("${autoprof.runs.retention-minutes:60}") long retentionMinutes) {
        this.registry         = registry;
        this.defaultSequences = defaultSequences;
        this.imageReader      = imageReader;
        this.meterRegistry    = meterRegistry;
        this.runRepo          = runRepo;
        this.defaultWorkers   = defaultWorkers;
        this.retention        = Duration.ofMinutes(retentionMinutes);
        this.runners          = Executors.newFixedThreadPool(Math.max(1, runConcurrency));
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate a run, store it as QUEUED and execute it in the background.
     *
     * @throws IllegalArgumentException                                     on a bad image list or options
     * @throws com.autoprof.orchestrator.step.SequenceConfigException       on a bad sequence update
     */
    public RunRecord submit(ProcessMode mode, Options options, SequenceUpdate update) {
        SequenceGraph sequences = sequencesFor(mode, update);
        List<String> imageFiles = imageFiles(mode, options);

        RunRecord run = runRepo.save(new RunRecord(mode, imageFiles));
        log.info("Run {} queued: mode='{}', {} image(s)", run.getId(), mode.value(), imageFiles.size());
        runners.submit(() -> execute(run, options, sequences));
        return run;
    }

    /** Same as {@link #submit} but blocks until the run has finished. */
    public RunRecord runNow(ProcessMode mode, Options options, SequenceUpdate update) {
        SequenceGraph sequences = sequencesFor(mode, update);
        RunRecord run = runRepo.save(new RunRecord(mode, imageFiles(mode, options)));
        return execute(run, options, sequences);
    }

    @Transactional(readOnly = true)
    public Optional<RunRecord> findById(UUID id) {
        return runRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveRuns() {
        return runRepo.existsByStateIn(RunState.active());
    }

    // ------------------------------------------------------------------
    // Default pipeline configuration
    // ------------------------------------------------------------------

    /**
     * Change the default sequences used by future runs.
     *
     * @throws IllegalStateException while a run is queued or running; runs
     *         read the registry while they execute, so configuration only
     *         changes between runs
     */
    public void updateSequences(SequenceUpdate update) {
        if (hasActiveRuns()) {
            throw new IllegalStateException("Cannot change pipeline sequences while runs are in progress");
        }
        update.applyTo(defaultSequences);
    }

    public Map<String, List<String>> sequences() {
        return defaultSequences.asMap();
    }

    public List<String> stepNames() {
        return registry.stepNames();
    }

    /**
     * The sequence graph a run in {@code mode} would use with {@code update}
     * applied: a private copy, so nothing leaks into the defaults.
     */
    public SequenceGraph sequencesFor(ProcessMode mode, SequenceUpdate update) {
        SequenceGraph graph = defaultSequences.copy();
        if (mode.isForced()) {
            graph.updateSequences(BuiltinSequences.FORCED);
        }
        if (update != null) {
            update.applyTo(graph);
        }
        return graph;
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /** Drop finished runs older than the retention window. Runs every minute. */
    @Scheduled(fixedDelay = 60_000)
    @Transactional
    public void evictFinishedRuns() {
        long removed = runRepo.deleteByStateInAndFinishedAtBefore(
                RunState.finished(), Instant.now().minus(retention));
        if (removed > 0) {
            log.info("Evicted {} finished run(s) older than {}", removed, retention);
        }
    }

    @PreDestroy
    void shutdown() {
        runners.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run to a terminal state. Whatever escapes the engine or the batch runner
     * marks the run FAILED, so a run never stays RUNNING and blocks
     * reconfiguration.
     */
    private RunRecord execute(RunRecord run, Options options, SequenceGraph sequences) {
        MDC.put("runId", run.getId().toString());
        try {
            run.markRunning();
            run = runRepo.save(run);
            log.info("Run {} started with head sequence {}", run.getId(), sequences.head());

            PipelineEngine engine = new PipelineEngine(registry, sequences, imageReader, meterRegistry);
            if (run.getProcessMode().isList()) {
                BatchResult result = new BatchRunner(engine, meterRegistry, defaultWorkers).run(options);
                run.complete(result.outcomes(), result.meanTimings());
            } else {
                Outcome outcome = engine.run(options);
                run.complete(List.of(outcome), outcome.isSuccess() ? outcome.timing() : Map.of());
            }
            log.info("Run {} {}", run.getId(), run.getState());
            return runRepo.save(run);
        } catch (Throwable e) {
            log.error("Run {} failed: {}", run.getId(), e.getMessage(), e);
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            RunRecord failed = runRepo.save(run);
            PipelineEngine.rethrowIfFatal(e);
            return failed;
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * The image files a run covers, checking that the option shape matches
     * the mode (a string for single-image modes, a list for list modes) and
     * that every list-valued option lines up with the image list.
     */
    private static List<String> imageFiles(ProcessMode mode, Options options) {
        Object files = options.get(Options.IMAGE_FILE);
        if (mode.isList()) {
            BatchRunner.prepareJobs(options);
            return ((List<?>) files).stream().map(String::valueOf).toList();
        }
        if (!(files instanceof String)) {
            throw new IllegalArgumentException(
                    "Option '" + Options.IMAGE_FILE + "' must be a single image file for process mode '"
                    + mode.value() + "'");
        }
        return List.of((String) files);
    }
}
