package com.studioflow.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.studioflow.orchestrator.model.JobType;

import java.util.UUID;

/**
 * Everything needed to enqueue a job.
 *
 * @param input      opaque payload for the job's handler; may be null
 * @param totalSteps optional step counter upper bound
 * @param parentJob  optional parent; must belong to the same owner
 */
public record CreateJobCommand(
        String   ownerId,
        String   projectId,
        JobType  type,
        JsonNode input,
        Integer  totalSteps,
        UUID     parentJob
) {
    public static CreateJobCommand of(String ownerId, String projectId, JobType type, JsonNode input) {
        return new CreateJobCommand(ownerId, projectId, type, input, null, null);
    }
}
