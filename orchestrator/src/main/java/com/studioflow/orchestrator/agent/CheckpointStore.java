package com.studioflow.orchestrator.agent;

import java.util.Optional;

/**
 * Persists agent state after every graph step, keyed by thread id.
 * Only the agent graph reads and writes checkpoints.
 */
public interface CheckpointStore {

    /** Appends a new version for the thread. */
    void save(String threadId, GraphNode nextNode, AgentState state);

    /** The resume point: the highest version written for the thread. */
    Optional<Checkpoint> latest(String threadId);
}
