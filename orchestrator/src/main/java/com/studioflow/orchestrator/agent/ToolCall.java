package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;

/** One function call requested by the model. */
public record ToolCall(String id, String name, JsonNode arguments) {}
