package com.studioflow.orchestrator.worker;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle given to a {@link JobHandler} for reporting progress and checking
 * for cancellation between expensive sub-steps.
 */
public class JobContext {

    private static final Logger log = LoggerFactory.getLogger(JobContext.class);

    private final Job        job;
    private final JobService jobService;

    public JobContext(Job job, JobService jobService) {
        this.job        = job;
        this.jobService = jobService;
    }

    public JobService jobService() { return jobService; }

    public void progress(int percent, String message) {
        progress(percent, null, message);
    }

    public void progress(int percent, Integer step, String message) {
        JobOperationResult<Job> result = jobService.updateProgress(job.getId(), percent, step, message);
        if (!result.success()) {
            log.debug("Progress update for job {} rejected: {}", job.getId(), result.message());
        }
    }

    /** True once the job left PROCESSING for any reason (usually a user cancel). */
    public boolean isCancelled() {
        return jobService.currentStatus(job.getId())
                .map(status -> status != JobStatus.PROCESSING)
                .orElse(false);
    }
}
