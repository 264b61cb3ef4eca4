package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.agent.AgentContext;
import com.studioflow.orchestrator.agent.ApprovalDecision;

/**
 * Body of POST /api/agent/stream. Two mutually exclusive shapes:
 *
 *   new turn: {message, context, conversationId}
 *   resume:   {threadId, resumeValue: {approved, reason?}}
 */
public record AgentStreamRequest(
        String           message,
        AgentContext     context,
        String           conversationId,
        String           threadId,
        ApprovalDecision resumeValue
) {
    public boolean isResume() {
        return threadId != null && resumeValue != null;
    }

    public boolean isNewTurn() {
        return message != null && !message.isBlank() && conversationId != null
                && context != null && context.projectId() != null;
    }
}
