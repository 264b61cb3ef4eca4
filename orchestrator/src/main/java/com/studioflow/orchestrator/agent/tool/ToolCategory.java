package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCategory {
    READ,
    GENERATION,
    MODIFICATION,
    DELETION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
