package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.studioflow.orchestrator.agent.tool.CreditCost;

import java.time.Instant;

/**
 * A confirmation-gated tool call waiting for the user's decision.
 * creditCost is null when the estimate could not be computed.
 */
public record PendingAction(
        String       id,
        FunctionCall functionCall,
        String       message,
        CreditCost   creditCost,
        Instant      createdAt
) {
    public record FunctionCall(
            String   id,
            String   name,
            String   displayName,
            JsonNode arguments,
            String   category
    ) {}
}
