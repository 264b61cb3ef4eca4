package com.studioflow.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Request bodies of the worker-only /internal/jobs endpoints. */
public final class WorkerRequests {

    private WorkerRequests() {}

    public record Progress(Integer progress, Integer currentStep, String message) {}

    public record Complete(JsonNode resultData) {}

    public record Fail(String errorMessage) {}

    public record Requeue(Integer retryCount, List<String> waitingFor) {}
}
