package com.studioflow.orchestrator.agent;

/** Text and at most one tool call; either may be absent. */
public record ModelReply(String content, ToolCall toolCall) {}
