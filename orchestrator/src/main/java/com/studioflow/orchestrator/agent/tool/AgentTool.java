package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A function the agent may call.
 *
 * Implementations are Spring beans collected by {@link ToolRegistry}.
 * Expected failures (bad arguments, a refused job) are returned as
 * {@link ToolResult#failure}; anything thrown is converted by the graph.
 */
public interface AgentTool {

    ToolDefinition definition();

    ToolResult execute(JsonNode arguments, ToolInvocation invocation);
}
