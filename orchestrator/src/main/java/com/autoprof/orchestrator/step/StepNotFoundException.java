package com.autoprof.orchestrator.step;

public class StepNotFoundException extends RuntimeException {
    public StepNotFoundException(String name) {
        super("No step registered with name: '" + name + "'");
    }
}
