package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.api.dto.CreateJobRequest;
import com.studioflow.orchestrator.api.dto.JobResponse;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.service.CreateJobCommand;
import com.studioflow.orchestrator.service.JobError;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * User-facing job API. The caller is identified by the X-User-Id header set
 * by the upstream auth layer; every lookup is scoped to that owner.
 *
 * POST /api/jobs                   enqueue a job (201, or 429 when rate limited)
 * GET  /api/jobs                   list own jobs, newest first
 * GET  /api/jobs/{id}              one job
 * POST /api/jobs/{id}/cancel       cancel a pending or processing job
 * POST /api/jobs/{id}/retry        new job copied from a failed or cancelled one
 * POST /api/jobs/{id}/imported     flag a completed job's results as imported
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    static final String USER_HEADER = "X-User-Id";

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/jobs \
     *     -H "X-User-Id: u1" -H "Content-Type: application/json" \
     *     -d '{"type":"asset_image_generation","projectId":"p1","inputData":{"prompt":"a red fox"}}'
     */
    @PostMapping
    public ResponseEntity<Object> create(@RequestHeader(USER_HEADER) String userId,
                                         @RequestBody CreateJobRequest req) {
        CreateJobCommand cmd = new CreateJobCommand(
                userId, req.projectId(), req.type(), req.inputData(), req.totalSteps(), req.parentJobId());
        return JobResults.respond(jobService.create(cmd), HttpStatus.CREATED, id -> Map.of("id", id));
    }

    /**
     * @param status comma-separated wire names, e.g. {@code pending,processing}; absent means all
     */
    @GetMapping
    public ResponseEntity<Object> list(@RequestHeader(USER_HEADER) String userId,
                                       @RequestParam(required = false) List<String> status,
                                       @RequestParam(required = false) String projectId,
                                       @RequestParam(required = false) Integer limit) {
        List<JobStatus> statuses = new ArrayList<>();
        if (status != null) {
            for (String s : status) {
                try {
                    statuses.add(JobStatus.fromWireName(s));
                } catch (IllegalArgumentException e) {
                    return JobResults.error(JobError.INVALID_ARGUMENT, "Unknown job status: " + s);
                }
            }
        }
        return JobResults.respond(jobService.list(userId, statuses, projectId, limit),
                jobs -> jobs.stream().map(JobResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return JobResults.respond(jobService.get(userId, id), JobResponse::from);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Object> cancel(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return JobResults.respond(jobService.cancel(userId, id), JobResponse::from);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Object> retry(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return JobResults.respond(jobService.retry(userId, id), HttpStatus.CREATED,
                newId -> Map.of("id", newId, "retriedFromId", id));
    }

    @PostMapping("/{id}/imported")
    public ResponseEntity<Object> markImported(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID id) {
        return JobResults.respond(jobService.markImported(userId, id), JobResponse::from);
    }
}
