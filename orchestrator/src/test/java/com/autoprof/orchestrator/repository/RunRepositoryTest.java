package com.autoprof.orchestrator.repository;

import com.autoprof.orchestrator.engine.Outcome;
import com.autoprof.orchestrator.model.ProcessMode;
import com.autoprof.orchestrator.model.RunRecord;
import com.autoprof.orchestrator.model.RunState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JPA slice test for the runs table, against the embedded H2 database.
 * Each test flushes and clears the persistence context so reads come from the table.
 */
@DataJpaTest
class RunRepositoryTest {

    @Autowired RunRepository     runRepo;
    @Autowired TestEntityManager em;

    @Test
    void finishedRun_roundTripsOutcomesInImageOrder() {
        Map<String, Double> timing = new LinkedHashMap<>();
        timing.put("background", 0.25);
        timing.put("psf", 1.5);
        RunRecord run = new RunRecord(ProcessMode.IMAGE_LIST, List.of("a.fits", "b.fits", "c.fits"));
        run.markRunning();
        run.complete(List.of(Outcome.success(timing), Outcome.failure(), Outcome.success(timing)), timing);

        runRepo.save(run);
        em.flush();
        em.clear();

        RunRecord loaded = runRepo.findById(run.getId()).orElseThrow();
        assertThat(loaded.getState()).isEqualTo(RunState.DONE);
        assertThat(loaded.getProcessMode()).isEqualTo(ProcessMode.IMAGE_LIST);
        assertThat(loaded.getImageFiles()).containsExactly("a.fits", "b.fits", "c.fits");
        assertThat(loaded.getOutcomes()).hasSize(3);
        assertThat(loaded.getOutcomes().get(0).timing()).containsExactly(
                Map.entry("background", 0.25), Map.entry("psf", 1.5));
        assertThat(loaded.getOutcomes().get(1).isFailure()).isTrue();
        assertThat(loaded.getOutcomes().get(2).isSuccess()).isTrue();
        assertThat(loaded.getMeanTimings().keySet()).containsExactly("background", "psf");
    }

    @Test
    void existsByStateIn_seesOnlyActiveRuns() {
        RunRecord done = new RunRecord(ProcessMode.IMAGE, List.of("a.fits"));
        done.fail("unreadable");
        runRepo.save(done);
        em.flush();

        assertThat(runRepo.existsByStateIn(RunState.active())).isFalse();

        runRepo.save(new RunRecord(ProcessMode.IMAGE, List.of("b.fits")));
        em.flush();

        assertThat(runRepo.existsByStateIn(RunState.active())).isTrue();
    }

    @Test
    void deleteByStateInAndFinishedAtBefore_keepsActiveAndRecentRuns() {
        RunRecord finished = new RunRecord(ProcessMode.IMAGE, List.of("old.fits"));
        finished.fail("no stars found");
        RunRecord queued = new RunRecord(ProcessMode.IMAGE, List.of("waiting.fits"));
        runRepo.save(finished);
        runRepo.save(queued);
        em.flush();
        em.clear();

        long removedEarly = runRepo.deleteByStateInAndFinishedAtBefore(
                RunState.finished(), finished.getFinishedAt().minusSeconds(60));
        long removed = runRepo.deleteByStateInAndFinishedAtBefore(
                RunState.finished(), Instant.now().plusSeconds(60));
        em.flush();

        assertThat(removedEarly).isZero();
        assertThat(removed).isEqualTo(1);
        assertThat(runRepo.findById(finished.getId())).isEmpty();
        assertThat(runRepo.findById(queued.getId())).isPresent();
    }
}
