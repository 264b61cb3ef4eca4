package com.studioflow.orchestrator.worker;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobType;

/**
 * Typed processing for one {@link JobType}.
 *
 * Only handlers know the schema of their job's inputData and resultData;
 * the queue treats both as opaque JSON. Every handler bean is collected by
 * {@link JobHandlerRegistry}, and the in-process worker claims only the
 * types that have a handler. All other types are left to external workers.
 */
public interface JobHandler {

    JobType type();

    /**
     * Process a job that has already been moved to PROCESSING.
     *
     * @throws DependencyNotReadyException to requeue the job until a prerequisite exists
     * @throws Exception                   any other failure fails the job with its message
     */
    HandlerOutcome handle(Job job, JobContext context) throws Exception;
}
