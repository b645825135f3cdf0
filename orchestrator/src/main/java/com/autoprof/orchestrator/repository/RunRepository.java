package com.autoprof.orchestrator.repository;

import com.autoprof.orchestrator.model.RunRecord;
import com.autoprof.orchestrator.model.RunState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * CRUD + query operations for the runs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface RunRepository extends JpaRepository<RunRecord, UUID> {

    /** True while any run is in one of the given states (used to guard reconfiguration). */
    boolean existsByStateIn(Collection<RunState> states);

    /** Remove runs in the given states that finished before {@code cutoff}. Needs a transaction. */
    long deleteByStateInAndFinishedAtBefore(Collection<RunState> states, Instant cutoff);
}
