package com.studioflow.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.studioflow.orchestrator.model.JobType;

import java.util.UUID;

/** Request body for POST /api/jobs. */
public record CreateJobRequest(
        JobType  type,
        String   projectId,
        JsonNode inputData,
        Integer  totalSteps,
        UUID     parentJobId
) {}
