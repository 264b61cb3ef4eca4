package com.studioflow.orchestrator.agent.tool;

/** Who is calling a tool and from where. */
public record ToolInvocation(String userId, String projectId, String toolCallId) {}
