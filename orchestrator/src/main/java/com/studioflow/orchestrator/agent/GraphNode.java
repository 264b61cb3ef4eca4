package com.studioflow.orchestrator.agent;

/**
 * Nodes of the agent state machine.
 *
 *   COLLECT_CONTEXT → CALL_MODEL
 *   CALL_MODEL → CHECK_CONFIRMATION (tool call present) | END
 *   CHECK_CONFIRMATION → WAIT_FOR_APPROVAL (gated tool) | EXECUTE_TOOL
 *   WAIT_FOR_APPROVAL → EXECUTE_TOOL (only after a resume)
 *   EXECUTE_TOOL → CALL_MODEL
 */
public enum GraphNode {
    COLLECT_CONTEXT,
    CALL_MODEL,
    CHECK_CONFIRMATION,
    WAIT_FOR_APPROVAL,
    EXECUTE_TOOL,
    END
}
