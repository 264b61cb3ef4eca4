package com.studioflow.orchestrator.agent;

/** How one graph execution handed control back to the caller. */
public enum GraphOutcome {
    /** The model replied without a tool call (or the iteration bound was hit). */
    COMPLETED,
    /** Suspended at WAIT_FOR_APPROVAL; the latest checkpoint holds the pending action. */
    INTERRUPTED
}
