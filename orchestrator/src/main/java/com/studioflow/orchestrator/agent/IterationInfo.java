package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One model invocation as shown in the UI: what the model said and which
 * tool (if any) it ran with what outcome.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IterationInfo(
        String       id,
        int          iterationNumber,
        String       content,
        FunctionCall functionCall,
        Instant      timestamp
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FunctionCall(
            String             id,
            String             name,
            String             displayName,
            String             description,
            String             category,
            FunctionCallStatus status,
            String             result,
            String             error
    ) {}

    public IterationInfo withFunctionCall(FunctionCall call) {
        return new IterationInfo(id, iterationNumber, content, call, timestamp);
    }
}
