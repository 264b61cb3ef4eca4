package com.studioflow.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a handler produced.
 *
 * {@code awaitingChildren} means the handler spawned sub-jobs; the job stays
 * PROCESSING and parent aggregation completes or fails it later.
 */
public record HandlerOutcome(JsonNode result, boolean awaitingChildren) {

    public static HandlerOutcome completed(JsonNode result) {
        return new HandlerOutcome(result, false);
    }

    public static HandlerOutcome waitingOnChildren() {
        return new HandlerOutcome(null, true);
    }
}
