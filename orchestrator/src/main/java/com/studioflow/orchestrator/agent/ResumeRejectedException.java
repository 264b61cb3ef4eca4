package com.studioflow.orchestrator.agent;

/**
 * A resume or new turn that the thread's current checkpoint does not allow:
 * no action awaiting approval, an approval still outstanding, or another
 * execution of the same thread in flight.
 */
public class ResumeRejectedException extends RuntimeException {

    public ResumeRejectedException(String message) {
        super(message);
    }
}
