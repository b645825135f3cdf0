package com.autoprof.orchestrator.engine;

/**
 * Why a single image could not be processed.
 *
 * The engine raises these internally and converts them to
 * {@link Outcome#failure()} at the per-image boundary, so they never reach
 * the batch.
 */
public class PipelineException extends RuntimeException {

    public enum Kind { IMAGE_LOAD, EMPTY_FRAME, STEP_FAULT }

    private final Kind   kind;
    private final String stepName;

    public PipelineException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public PipelineException(Kind kind, String stepName, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.stepName = stepName;
    }

    public Kind getKind() { return kind; }

    /** The step that was running, for STEP_FAULT; null otherwise. */
    public String getStepName() { return stepName; }
}
