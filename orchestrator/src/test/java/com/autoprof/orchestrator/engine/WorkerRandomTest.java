package com.autoprof.orchestrator.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerRandomTest {

    @Test
    void seedFor_usesSubSecondPartOfWallClock() {
        Instant quarterPast = Instant.parse("2024-01-01T00:00:00.250Z");
        Instant sameFraction = Instant.parse("2025-06-30T17:45:12.250Z");
        Instant otherFraction = Instant.parse("2024-01-01T00:00:00.750Z");

        assertThat(WorkerRandom.seedFor(7, 4242, 3, quarterPast))
                .isEqualTo(WorkerRandom.seedFor(7, 4242, 3, sameFraction));
        assertThat(WorkerRandom.seedFor(7, 4242, 3, quarterPast))
                .isNotEqualTo(WorkerRandom.seedFor(7, 4242, 3, otherFraction));
    }

    @Test
    void seedFor_differsPerThreadAndIsPositive() {
        Instant now = Instant.parse("2024-01-01T00:00:00.000000001Z");

        long first  = WorkerRandom.seedFor(0, 100, 1, now);
        long second = WorkerRandom.seedFor(0, 100, 2, now);

        assertThat(first).isNotEqualTo(second);
        assertThat(first).isPositive();
        assertThat(WorkerRandom.seedFor(9_999, 100, 2, Instant.parse("2024-01-01T00:00:00.999999999Z")))
                .isPositive();
    }

    @Test
    void current_isPerThread() throws Exception {
        Random here = WorkerRandom.current();
        WorkerRandom.reseed();

        Random there = CompletableFuture.supplyAsync(WorkerRandom::current).get();

        assertThat(WorkerRandom.current()).isSameAs(here);
        assertThat(there).isNotSameAs(here);
    }
}
