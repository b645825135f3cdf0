package com.autoprof.orchestrator.model;

import com.autoprof.orchestrator.engine.Outcome;
import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One submitted run: a single image or a list of images processed with one
 * mode and one sequence configuration.
 *
 * The id is assigned on construction so a run can be returned to the caller
 * before the first save. {@link Persistable#isNew()} tells Spring Data to
 * persist rather than merge on that first save.
 *
 * DB table: runs (image list in run_images)
 */
@Entity
@Table(name = "runs")
public class RunRecord implements Persistable<UUID> {

    @Id
    private UUID id = UUID.randomUUID();

    @Enumerated(EnumType.STRING)
    @Column(name = "process_mode", nullable = false)
    private ProcessMode processMode;

    // Order matters: outcome i belongs to image i.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "run_images", joinColumns = @JoinColumn(name = "run_id"))
    @OrderColumn(name = "image_index")
    @Column(name = "image_file", nullable = false, length = 1024)
    private List<String> imageFiles = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.QUEUED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // JSON array, one entry per image: the timing map, or null for a failed image.
    @Lob
    @Convert(converter = OutcomeListConverter.class)
    @Column(name = "outcomes_json")
    private List<Outcome> outcomes = new ArrayList<>();

    @Lob
    @Convert(converter = TimingMapConverter.class)
    @Column(name = "mean_timings_json")
    private Map<String, Double> meanTimings = new LinkedHashMap<>();

    @Column(name = "error_message", length = 4000)
    private String error;

    @Transient
    private boolean isNew = true;

    @PostPersist
    @PostLoad
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RunRecord() {}   // required by JPA

    public RunRecord(ProcessMode processMode, List<String> imageFiles) {
        this.processMode = processMode;
        this.imageFiles  = new ArrayList<>(imageFiles);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning() {
        this.startedAt = Instant.now();
        this.state     = RunState.RUNNING;
    }

    /** DONE if at least one image succeeded, FAILED otherwise. */
    public void complete(List<Outcome> outcomes, Map<String, Double> meanTimings) {
        this.outcomes    = new ArrayList<>(outcomes);
        this.meanTimings = new LinkedHashMap<>(meanTimings);
        this.finishedAt  = Instant.now();
        this.state = outcomes.stream().anyMatch(Outcome::isSuccess) ? RunState.DONE : RunState.FAILED;
    }

    public void fail(String error) {
        this.error      = error != null && error.length() > 4000 ? error.substring(0, 4000) : error;
        this.finishedAt = Instant.now();
        this.state      = RunState.FAILED;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    @Override
    public UUID                getId()          { return id; }
    @Override
    public boolean             isNew()          { return isNew; }
    public ProcessMode         getProcessMode() { return processMode; }
    public List<String>        getImageFiles()  { return Collections.unmodifiableList(imageFiles); }
    public Instant             getCreatedAt()   { return createdAt; }
    public RunState            getState()       { return state; }
    public Instant             getStartedAt()   { return startedAt; }
    public Instant             getFinishedAt()  { return finishedAt; }
    public List<Outcome>       getOutcomes()    { return Collections.unmodifiableList(outcomes); }
    public Map<String, Double> getMeanTimings() { return Collections.unmodifiableMap(meanTimings); }
    public String              getError()       { return error; }
}
