package com.autoprof.orchestrator.step;

/**
 * Thrown when a sequence update or lookup is inconsistent with the graph:
 * a replacement mapping without a "head" sequence, or a reference to a
 * sequence that does not exist.
 */
public class SequenceConfigException extends RuntimeException {

    public SequenceConfigException(String message) {
        super(message);
    }
}
