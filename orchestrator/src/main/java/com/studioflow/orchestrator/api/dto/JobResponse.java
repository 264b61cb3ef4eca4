package com.studioflow.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.JobType;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire view of a job, used by the REST API and the job event stream.
 * inputData and resultData are emitted as the JSON the handler stored.
 */
public record JobResponse(
        UUID      id,
        String    projectId,
        JobType   type,
        JobStatus status,
        int       progress,
        int       currentStep,
        Integer   totalSteps,
        String    progressMessage,
        String    errorMessage,
        @JsonRawValue String resultData,
        @JsonRawValue String inputData,
        UUID      parentJobId,
        @JsonProperty("isImported") boolean isImported,
        Instant   createdAt,
        Instant   startedAt,
        Instant   completedAt,
        Instant   updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getProjectId(),
                job.getType(),
                job.getStatus(),
                job.getProgress(),
                job.getCurrentStep(),
                job.getTotalSteps(),
                job.getProgressMessage(),
                job.getErrorMessage(),
                job.getResultData(),
                job.getInputData(),
                job.getParentJobId(),
                job.isImported(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getUpdatedAt()
        );
    }
}
