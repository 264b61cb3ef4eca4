package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.studioflow.orchestrator.model.MessageRole;

/**
 * One turn of model-facing history.
 *
 * toolCall is set on assistant turns that request a tool; toolCallId is set
 * on tool turns and names the call they answer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentMessage(MessageRole role, String content, ToolCall toolCall, String toolCallId) {

    public static AgentMessage system(String content) {
        return new AgentMessage(MessageRole.SYSTEM, content, null, null);
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(MessageRole.USER, content, null, null);
    }

    public static AgentMessage assistant(String content, ToolCall toolCall) {
        return new AgentMessage(MessageRole.ASSISTANT, content, toolCall, null);
    }

    public static AgentMessage tool(String toolCallId, String content) {
        return new AgentMessage(MessageRole.TOOL, content, null, toolCallId);
    }

    public boolean hasToolCall() {
        return role == MessageRole.ASSISTANT && toolCall != null;
    }
}
