package com.studioflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ACTIVE while the agent is executing, AWAITING_APPROVAL while a pending
 * action is outstanding, COMPLETED once the last execution ended (normally
 * or with an error).
 */
public enum ConversationStatus {
    ACTIVE,
    AWAITING_APPROVAL,
    COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
