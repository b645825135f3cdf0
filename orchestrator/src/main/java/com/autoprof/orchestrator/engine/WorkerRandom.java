package com.autoprof.orchestrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Random;

/**
 * Per-thread random generator for steps that need random numbers.
 *
 * Worker threads started at nearly the same instant would otherwise draw
 * correlated sequences, so the engine reseeds the calling thread's generator
 * at the start of every image from the process id, the thread id and the
 * sub-second part of the wall clock.
 */
public final class WorkerRandom {

    private static final Logger log = LoggerFactory.getLogger(WorkerRandom.class);

    private static final ThreadLocal<Random> RANDOM = ThreadLocal.withInitial(Random::new);

    private WorkerRandom() {}

    /** The calling thread's generator. */
    public static Random current() {
        return RANDOM.get();
    }

    /**
     * Reseed the calling thread's generator.
     *
     * Best effort: seeding never decides whether an image succeeds, so any
     * failure here is logged at debug level and otherwise ignored. This is the
     * only place in the engine where an exception is dropped.
     */
    static void reseed() {
        try {
            Random random = RANDOM.get();
            random.setSeed(seedFor(random.nextInt(10_000), ProcessHandle.current().pid(),
                    Thread.currentThread().getId(), Instant.now()));
        } catch (RuntimeException e) {
            log.debug("Could not reseed worker random generator: {}", e.getMessage());
        }
    }

    /** Only the sub-second part of {@code now} takes part, so the date and time of day don't matter. */
    static long seedFor(int draw, long pid, long threadId, Instant now) {
        return (draw + 1L) * pid * (threadId + 1) * (now.getNano() + 1L);
    }
}
