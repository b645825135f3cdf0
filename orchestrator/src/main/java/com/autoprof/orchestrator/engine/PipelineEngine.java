package com.autoprof.orchestrator.engine;

import com.autoprof.orchestrator.image.ImageData;
import com.autoprof.orchestrator.image.ImageReader;
import com.autoprof.orchestrator.step.BranchStep;
import com.autoprof.orchestrator.step.PipelineStep;
import com.autoprof.orchestrator.step.RegularStep;
import com.autoprof.orchestrator.step.SequenceGraph;
import com.autoprof.orchestrator.step.StepOutput;
import com.autoprof.orchestrator.step.StepRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the step sequence over one image.
 *
 * The engine is a small state machine over (sequence name, index), starting at
 * ("head", 0):
 * <ul>
 *   <li>a {@link RegularStep} is timed, its partial results are merged into
 *       the image's results (last write wins) and the index advances;</li>
 *   <li>a {@link BranchStep} either jumps to index 0 of the sequence it names
 *       or lets the index advance;</li>
 *   <li>the run succeeds once the index passes the end of the current
 *       sequence.</li>
 * </ul>
 *
 * Any failure (unreadable image, blank frame, a step throwing an exception or
 * an error, a step returning no output, an unknown step or sequence name) ends
 * the image immediately with {@link Outcome#failure()}.
 * Nothing propagates to the caller, so one bad image never takes a batch down.
 *
 * <p>Only the timing leaves the engine. The final image and results are
 * dropped; a terminal step is expected to persist whatever matters.
 *
 * <p>The engine holds no per-run state, so one instance can serve many worker
 * threads at once as long as the registry and sequences are not changed while
 * it runs.
 */
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    /** Side of the centred window that must contain at least one non-zero pixel. */
    static final int CENTRE_WINDOW = 20;

    private final StepRegistry  registry;
    private final SequenceGraph sequences;
    private final ImageReader   imageReader;
    private final MeterRegistry meterRegistry;

    public PipelineEngine(StepRegistry registry,
                          SequenceGraph sequences,
                          ImageReader imageReader,
                          MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.sequences     = sequences;
        this.imageReader   = imageReader;
        this.meterRegistry = meterRegistry;
    }

    public SequenceGraph sequences() {
        return sequences;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Process one image end to end.
     *
     * @param options must contain {@value Options#IMAGE_FILE}; may contain
     *                {@value Options#NAME}
     * @return the per-step timing on success, the failure sentinel otherwise
     */
    public Outcome run(Options options) {
        WorkerRandom.reseed();

        String jobName = resolveJobName(options);
        Options jobOptions = jobName.equals(options.get(Options.NAME))
                ? options
                : options.with(Options.NAME, jobName);

        MDC.put("image", jobName);
        try {
            Map<String, Double> timing = execute(jobName, jobOptions);
            countOutcome("success");
            return Outcome.success(timing);
        } catch (PipelineException e) {
            countOutcome(e.getKind().name().toLowerCase());
            return Outcome.failure();
        } finally {
            MDC.remove("image");
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private Map<String, Double> execute(String jobName, Options options) {
        ImageData image = loadImage(jobName, options);

        long start = System.nanoTime();
        Map<String, Object> results = new HashMap<>();
        Map<String, Object> resultsView = Collections.unmodifiableMap(results);
        Map<String, Double> timing = new LinkedHashMap<>();

        String sequence = SequenceGraph.HEAD;
        int index = 0;
        String stepName = null;
        try {
            List<String> steps = sequences.sequence(sequence);
            while (index < steps.size()) {
                stepName = steps.get(index);
                log.info("{}: {} {} at: {} sec", jobName, sequence, stepName, seconds(start));
                PipelineStep step = registry.get(stepName);

                if (step instanceof BranchStep) {
                    Optional<String> decision = ((BranchStep) step).decide(image, resultsView, options);
                    if (decision != null && decision.isPresent()) {
                        sequence = decision.get();
                        steps = sequences.sequence(sequence);
                        index = 0;
                    } else {
                        index++;
                    }
                } else {
                    long stepStart = System.nanoTime();
                    StepOutput out = ((RegularStep) step).apply(image, resultsView, options);
                    long elapsed = System.nanoTime() - stepStart;
                    if (out == null) {
                        throw new IllegalStateException("Step returned no output");
                    }

                    results.putAll(out.partialResults());
                    image = out.image();
                    timing.put(stepName, elapsed / 1e9);
                    meterRegistry.timer("autoprof.step.duration", "step", stepName)
                            .record(elapsed, TimeUnit.NANOSECONDS);
                    index++;
                }
            }
        } catch (Throwable e) {
            rethrowIfFatal(e);
            log.error("{}: on step {} got error: {}", jobName, stepName, e.getMessage(), e);
            throw new PipelineException(PipelineException.Kind.STEP_FAULT, stepName,
                    "Step '" + stepName + "' failed for " + jobName + ": " + e.getMessage(), e);
        }

        log.info("{}: Processing Complete! (at {} sec)", jobName, seconds(start));
        return timing;
    }

    /**
     * Read the primary image and reject frames whose centre is missing.
     */
    private ImageData loadImage(String jobName, Options options) {
        String imageFile = options.getString(Options.IMAGE_FILE).orElse(null);
        ImageData image;
        try {
            image = imageReader.read(imageFile, options);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            log.error("{}: could not read image {}: {}", jobName, imageFile, e.getMessage());
            throw new PipelineException(PipelineException.Kind.IMAGE_LOAD,
                    "Could not read image " + imageFile, e);
        }

        if (image == null || image.isCentreBlank(CENTRE_WINDOW)) {
            log.error("{}: Large chunk of data missing, impossible to process image", jobName);
            throw new PipelineException(PipelineException.Kind.EMPTY_FRAME,
                    "Centre of " + imageFile + " is empty");
        }
        return image;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * The explicit {@value Options#NAME} option when it is a string, otherwise
     * the image file name without its directory and without everything from
     * its first dot ("data/ngc1234.fits.gz" gives "ngc1234").
     */
    static String resolveJobName(Options options) {
        Optional<String> explicit = options.getString(Options.NAME);
        if (explicit.isPresent()) {
            return explicit.get();
        }
        String imageFile = options.getString(Options.IMAGE_FILE).orElse("");
        int slash = Math.max(imageFile.lastIndexOf('/'), imageFile.lastIndexOf('\\'));
        String fileName = imageFile.substring(slash + 1);
        int dot = fileName.indexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Steps are third-party code, so assertion failures, linkage errors and
     * stack overflows count as a failed image like any exception. Only a JVM
     * that can no longer run anything (out of memory, internal error) stops
     * the caller.
     */
    public static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }

    private void countOutcome(String status) {
        meterRegistry.counter("autoprof.image.outcomes", "status", status).increment();
    }

    private static String seconds(long startNanos) {
        return String.format("%.1f", (System.nanoTime() - startNanos) / 1e9);
    }
}
