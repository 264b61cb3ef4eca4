package com.studioflow.orchestrator.agent;

/** A restored snapshot: the node to run next and the state to run it on. */
public record Checkpoint(String threadId, long version, GraphNode nextNode, AgentState state) {

    public boolean awaitingApproval() {
        return nextNode == GraphNode.WAIT_FOR_APPROVAL && state.getPendingAction() != null;
    }
}
