package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FunctionCallStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FunctionCallStatus fromWireName(String value) {
        return FunctionCallStatus.valueOf(value.trim().toUpperCase());
    }
}
