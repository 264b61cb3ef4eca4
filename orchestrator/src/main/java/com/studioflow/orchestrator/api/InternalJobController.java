package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.api.dto.JobResponse;
import com.studioflow.orchestrator.api.dto.WorkerRequests;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.JobError;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Worker-facing queue operations. Reachable only with a valid X-Worker-Token
 * (see {@link com.studioflow.orchestrator.config.WorkerTokenFilter}).
 */
@RestController
@RequestMapping("/internal/jobs")
public class InternalJobController {

    static final String WORKER_HEADER = "X-Worker-Id";

    private final JobService jobService;

    public InternalJobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Claim up to {@code limit} pending jobs, oldest first. {@code types}
     * restricts the claim to the job types this worker can run.
     */
    @PostMapping("/claim")
    public ResponseEntity<Object> claim(@RequestParam(defaultValue = "10") int limit,
                                        @RequestParam(required = false) List<String> types,
                                        @RequestHeader(value = WORKER_HEADER, defaultValue = "external") String workerId) {
        List<JobType> filter = new ArrayList<>();
        if (types != null) {
            for (String t : types) {
                try {
                    filter.add(JobType.fromWireName(t));
                } catch (IllegalArgumentException e) {
                    return JobResults.error(JobError.INVALID_ARGUMENT, "Unknown job type: " + t);
                }
            }
        }
        var result = filter.isEmpty()
                ? jobService.claimBatch(limit, workerId)
                : jobService.claimBatch(limit, workerId, filter);
        return JobResults.respond(result, jobs -> jobs.stream().map(JobResponse::from).toList());
    }

    /** {@code started:false} means another worker won the race; the caller drops the job. */
    @PostMapping("/{id}/start")
    public ResponseEntity<Object> start(@PathVariable UUID id) {
        return JobResults.respond(jobService.start(id), started -> Map.of("started", started));
    }

    @PostMapping("/{id}/progress")
    public ResponseEntity<Object> progress(@PathVariable UUID id, @RequestBody WorkerRequests.Progress req) {
        if (req.progress() == null) {
            return JobResults.error(JobError.INVALID_ARGUMENT, "progress is required");
        }
        return JobResults.respond(
                jobService.updateProgress(id, req.progress(), req.currentStep(), req.message()),
                JobResponse::from);
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<Object> complete(@PathVariable UUID id,
                                           @RequestBody(required = false) WorkerRequests.Complete req) {
        return JobResults.respond(
                jobService.complete(id, req == null ? null : req.resultData()),
                JobResponse::from);
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<Object> fail(@PathVariable UUID id, @RequestBody WorkerRequests.Fail req) {
        return JobResults.respond(jobService.fail(id, req.errorMessage()), JobResponse::from);
    }

    @PostMapping("/{id}/requeue")
    public ResponseEntity<Object> requeue(@PathVariable UUID id, @RequestBody WorkerRequests.Requeue req) {
        int retryCount = req.retryCount() == null ? 0 : req.retryCount();
        List<String> waitingFor = req.waitingFor() == null ? List.of() : req.waitingFor();
        return JobResults.respond(jobService.requeue(id, retryCount, waitingFor), JobResponse::from);
    }
}
