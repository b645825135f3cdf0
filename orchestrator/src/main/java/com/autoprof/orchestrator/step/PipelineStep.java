package com.autoprof.orchestrator.step;

/**
 * A unit of work the engine can dispatch by name.
 *
 * There are exactly two kinds:
 * <ul>
 *   <li>{@link RegularStep} transforms the image and contributes results.
 *       Its wall-clock time is recorded.</li>
 *   <li>{@link BranchStep} inspects the current state and may redirect
 *       execution to another named sequence. Never timed.</li>
 * </ul>
 *
 * Steps must not throw for recoverable conditions: any exception aborts the
 * whole image. Return a marker value in the results instead.
 */
public interface PipelineStep {
}
