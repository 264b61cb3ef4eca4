package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the model sees of a tool, plus whether a human must approve each call.
 *
 * @param inputSchema JSON Schema of the arguments object, sent as-is to the provider
 */
public record ToolDefinition(
        String       name,
        String       displayName,
        String       description,
        ToolCategory category,
        boolean      requiresConfirmation,
        JsonNode     inputSchema
) {}
