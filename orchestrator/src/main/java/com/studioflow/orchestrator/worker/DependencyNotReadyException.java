package com.studioflow.orchestrator.worker;

import java.util.List;

/**
 * Thrown by a {@link JobHandler} that found a prerequisite resource missing
 * (e.g. an image a video is built from). The worker requeues the job
 * instead of failing it.
 */
public class DependencyNotReadyException extends Exception {

    private final List<String> waitingFor;

    public DependencyNotReadyException(List<String> waitingFor) {
        super("Waiting for dependencies: " + String.join(", ", waitingFor));
        this.waitingFor = List.copyOf(waitingFor);
    }

    public List<String> waitingFor() { return waitingFor; }
}
