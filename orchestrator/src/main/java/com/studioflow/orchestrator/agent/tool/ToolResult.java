package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome handed back to the model as the tool message.
 * jobId is set by tools that enqueue work.
 */
public record ToolResult(boolean success, JsonNode data, String error, String jobId) {

    public static ToolResult ok(JsonNode data) {
        return new ToolResult(true, data, null, null);
    }

    public static ToolResult jobCreated(JsonNode data, String jobId) {
        return new ToolResult(true, data, null, jobId);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null);
    }
}
