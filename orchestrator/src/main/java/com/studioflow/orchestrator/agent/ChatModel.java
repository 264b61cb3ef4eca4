package com.studioflow.orchestrator.agent;

import com.studioflow.orchestrator.agent.tool.ToolDefinition;

import java.util.List;

/**
 * The text-completion provider as seen by the call-model node.
 */
public interface ChatModel {

    /**
     * One model invocation over the full history with the tool catalogue bound.
     *
     * @throws ProviderException on any transport, HTTP or response-shape failure
     */
    ModelReply complete(List<AgentMessage> history, List<ToolDefinition> tools);
}
