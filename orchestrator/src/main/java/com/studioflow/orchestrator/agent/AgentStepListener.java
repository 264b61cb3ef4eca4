package com.studioflow.orchestrator.agent;

/** Notified after each graph node ran and its checkpoint was written. */
@FunctionalInterface
public interface AgentStepListener {

    AgentStepListener NONE = (node, state) -> {};

    void onStep(GraphNode completed, AgentState state);
}
