package com.studioflow.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * The job queue.
 *
 * User-facing operations (create, cancel, retry, list, get, markImported)
 * are scoped by owner: a job that belongs to someone else is reported as
 * NOT_FOUND. Worker-facing operations (claimBatch, start, updateProgress,
 * complete, fail, requeue) are not owner-checked; the capability token is
 * verified by the HTTP layer before any of them is reached.
 *
 * Every mutation returns a {@link JobOperationResult}. Store failures are
 * caught here and reported as STORE_ERROR so that a worker can decide what
 * to do without unwinding its own loop.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int MAX_CLAIM_BATCH = 100;
    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT = 100;

    // Keys written into inputData by requeue().
    public static final String RETRY_COUNT_KEY = "_retryCount";
    public static final String WAITING_FOR_KEY = "_waitingFor";

    private static final String REQUEUE_HOLDER = "requeue-backoff";

    // First key of the two-key advisory lock taken per owner by create() and retry().
    static final int OWNER_LOCK_NAMESPACE = 0x5f10;

    private static final int STREAM_ACTIVE_LIMIT = 20;
    private static final int STREAM_RECENT_LIMIT = 10;

    private final JobRepository         jobRepo;
    private final JobRateLimiter        rateLimiter;
    private final TransactionOperations tx;
    private final ObjectMapper          objectMapper;
    private final MeterRegistry         meterRegistry;
    private final Clock                 clock;
    private final Duration              claimLease;
    private final Duration              requeueDelay;

    public JobService(JobRepository jobRepo,
                      JobRateLimiter rateLimiter,
                      TransactionOperations tx,
                      ObjectMapper objectMapper,
                      MeterRegistry meterRegistry,
                      Clock clock,
                      @Value("${studioflow.queue.claim-lease:60s}") Duration claimLease,
                      @Value("${studioflow.queue.requeue-delay:10s}") Duration requeueDelay) {
        this.jobRepo       = jobRepo;
        this.rateLimiter   = rateLimiter;
        this.tx            = tx;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.claimLease    = claimLease;
        this.requeueDelay  = requeueDelay;
    }

    // ------------------------------------------------------------------
    // User-facing operations
    // ------------------------------------------------------------------

    /**
     * Enqueue a new PENDING job after the owner's rate limits are checked.
     *
     * The check and the insert share one transaction that holds the owner's
     * advisory lock, so concurrent requests of one owner cannot all pass the
     * check against the same count.
     *
     * @return the new job's id, or RATE_LIMITED / INVALID_ARGUMENT / NOT_FOUND (parent)
     */
    public JobOperationResult<UUID> create(CreateJobCommand cmd) {
        if (cmd.ownerId() == null || cmd.ownerId().isBlank()) {
            return JobOperationResult.failure(JobError.INVALID_ARGUMENT, "Owner is required");
        }
        if (cmd.type() == null) {
            return JobOperationResult.failure(JobError.INVALID_ARGUMENT, "Job type is required");
        }
        if (cmd.totalSteps() != null && cmd.totalSteps() < 1) {
            return JobOperationResult.failure(JobError.INVALID_ARGUMENT, "totalSteps must be positive");
        }

        return guarded("create", () -> {
            JobOperationResult<UUID> refused = admit(cmd.ownerId());
            if (refused != null) {
                return refused;
            }
            if (cmd.parentJob() != null
                    && jobRepo.findByIdAndUserId(cmd.parentJob(), cmd.ownerId()).isEmpty()) {
                return JobOperationResult.failure(JobError.NOT_FOUND,
                        "Parent job not found: " + cmd.parentJob());
            }
            Job job = new Job(cmd.ownerId(), cmd.projectId(), cmd.type(),
                    cmd.input() == null ? null : cmd.input().toString(), cmd.totalSteps());
            job.setParentJobId(cmd.parentJob());
            job.setCreatedAt(clock.instant());
            Job saved = jobRepo.save(job);

            meterRegistry.counter("studioflow.jobs.created", "type", cmd.type().wireName()).increment();
            log.info("Job {} created: type={} user={} project={}",
                    saved.getId(), cmd.type(), cmd.ownerId(), cmd.projectId());
            return JobOperationResult.ok(saved.getId());
        });
    }

    /** Cancel a PENDING or PROCESSING job. Running workers notice cooperatively. */
    public JobOperationResult<Job> cancel(String ownerId, UUID jobId) {
        JobOperationResult<Job> result = guarded("cancel", () -> {
            Optional<Job> found = jobRepo.findOwnedForUpdate(jobId, ownerId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus().isTerminal()) {
                return invalidTransition(job, "cancel");
            }
            job.terminate(JobStatus.CANCELLED, clock.instant());
            log.info("Job {} cancelled by user {}", jobId, ownerId);
            return JobOperationResult.ok(jobRepo.save(job));
        });
        if (result.success()) {
            syncParent(result.value().getParentJobId());
        }
        return result;
    }

    /**
     * Retry a FAILED or CANCELLED job by inserting a fresh PENDING copy.
     * The original row is left exactly as it was. The copy counts against
     * the owner's rate limits like any new job.
     */
    public JobOperationResult<UUID> retry(String ownerId, UUID jobId) {
        return guarded("retry", () -> {
            Optional<Job> original = jobRepo.findByIdAndUserId(jobId, ownerId);
            if (original.isEmpty()) {
                return notFound(jobId);
            }
            Job old = original.get();
            if (!old.getStatus().isRetryable()) {
                return JobOperationResult.failure(JobError.INVALID_TRANSITION,
                        "Only failed or cancelled jobs can be retried (job " + jobId + " is "
                                + old.getStatus().wireName() + ")");
            }
            JobOperationResult<UUID> refused = admit(ownerId);
            if (refused != null) {
                return refused;
            }

            Job copy = Job.retryOf(old);
            copy.setCreatedAt(clock.instant());
            Job saved = jobRepo.save(copy);
            meterRegistry.counter("studioflow.jobs.created", "type", old.getType().wireName()).increment();
            log.info("Job {} retried as {}", jobId, saved.getId());
            return JobOperationResult.ok(saved.getId());
        });
    }

    public JobOperationResult<Job> get(String ownerId, UUID jobId) {
        return guarded("get", () -> jobRepo.findByIdAndUserId(jobId, ownerId)
                .map(JobOperationResult::ok)
                .orElseGet(() -> notFound(jobId)));
    }

    /**
     * Newest first. An empty or null status filter means every status;
     * limit is clamped to [1, 100] and defaults to 50.
     */
    public JobOperationResult<List<Job>> list(String ownerId, Collection<JobStatus> statuses,
                                              String projectId, Integer limit) {
        Collection<JobStatus> filter = (statuses == null || statuses.isEmpty())
                ? List.of(JobStatus.values()) : statuses;
        int size = limit == null ? DEFAULT_LIST_LIMIT : clamp(limit, 1, MAX_LIST_LIMIT);
        return guarded("list", () -> JobOperationResult.ok(
                jobRepo.search(ownerId, filter, projectId, PageRequest.of(0, size))));
    }

    /** Flags a completed job's results as imported into the project. */
    public JobOperationResult<Job> markImported(String ownerId, UUID jobId) {
        return guarded("markImported", () -> {
            Optional<Job> found = jobRepo.findOwnedForUpdate(jobId, ownerId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus() != JobStatus.COMPLETED) {
                return invalidTransition(job, "mark as imported");
            }
            job.setImported(true);
            return JobOperationResult.ok(jobRepo.save(job));
        });
    }

    /**
     * The owner's jobs as shown by the job event stream: up to 20 active jobs
     * plus up to 10 jobs that reached a terminal status inside {@code recentWindow}.
     *
     * Read-only; store exceptions propagate so the stream can report them.
     */
    public List<Job> streamSnapshot(String ownerId, Duration recentWindow) {
        List<Job> active = jobRepo.findByUserIdAndStatusInOrderByCreatedAtDesc(
                ownerId, JobStatus.ACTIVE, PageRequest.of(0, STREAM_ACTIVE_LIMIT));
        List<Job> recent = jobRepo.findByUserIdAndStatusInAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
                ownerId, JobStatus.TERMINAL, clock.instant().minus(recentWindow),
                PageRequest.of(0, STREAM_RECENT_LIMIT));
        return Stream.concat(active.stream(), recent.stream()).toList();
    }

    // ------------------------------------------------------------------
    // Worker-facing operations
    // ------------------------------------------------------------------

    /**
     * Claim up to {@code limit} PENDING jobs, oldest first.
     *
     * Rows stay PENDING; each one gets a short lease in the same transaction
     * that locked it, so no concurrent or later claimant receives it until the
     * claimant calls {@link #start} or the lease runs out.
     */
    public JobOperationResult<List<Job>> claimBatch(int limit, String claimant) {
        return claimBatch(limit, claimant, null);
    }

    /** Same as {@link #claimBatch(int, String)}, restricted to the given types (null or empty means all). */
    public JobOperationResult<List<Job>> claimBatch(int limit, String claimant, Collection<JobType> types) {
        int size = clamp(limit, 1, MAX_CLAIM_BATCH);
        Collection<JobType> wanted = (types == null || types.isEmpty()) ? List.of(JobType.values()) : types;
        List<String> typeNames = wanted.stream().map(JobType::name).toList();
        return guarded("claimBatch", () -> {
            Instant now = clock.instant();
            List<Job> jobs = jobRepo.lockClaimable(now, typeNames, size);
            for (Job job : jobs) {
                job.lease(claimant, now.plus(claimLease));
            }
            jobRepo.saveAll(jobs);
            if (!jobs.isEmpty()) {
                meterRegistry.counter("studioflow.jobs.claimed").increment(jobs.size());
                log.debug("{} claimed {} job(s)", claimant, jobs.size());
            }
            return JobOperationResult.ok(jobs);
        });
    }

    /**
     * PENDING → PROCESSING. Any other status is left untouched and reported
     * as {@code false}, which makes duplicate start calls harmless.
     */
    public JobOperationResult<Boolean> start(UUID jobId) {
        return guarded("start", () -> {
            Optional<Job> found = jobRepo.findForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus() != JobStatus.PENDING) {
                log.debug("Job {} not started: status is {}", jobId, job.getStatus());
                return JobOperationResult.ok(false);
            }
            job.setStatus(JobStatus.PROCESSING);
            // A requeued job keeps its original start time.
            if (job.getStartedAt() == null) {
                job.setStartedAt(clock.instant());
            }
            job.releaseLease();
            jobRepo.save(job);
            return JobOperationResult.ok(true);
        });
    }

    /** PROCESSING only. Progress is clamped into [0, 100]; status never changes. */
    public JobOperationResult<Job> updateProgress(UUID jobId, int progress, Integer step, String message) {
        return guarded("updateProgress", () -> {
            Optional<Job> found = jobRepo.findForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus() != JobStatus.PROCESSING) {
                return invalidTransition(job, "update progress of");
            }
            job.setProgress(progress);
            if (step != null) {
                job.setCurrentStep(step);
            }
            if (message != null) {
                job.setProgressMessage(message);
            }
            return JobOperationResult.ok(jobRepo.save(job));
        });
    }

    /** PROCESSING → COMPLETED with progress 100 and the given result payload. */
    public JobOperationResult<Job> complete(UUID jobId, JsonNode result) {
        JobOperationResult<Job> outcome = guarded("complete", () -> {
            Optional<Job> found = jobRepo.findForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus() != JobStatus.PROCESSING) {
                return invalidTransition(job, "complete");
            }
            job.setProgress(100);
            job.setResultData(result == null ? null : result.toString());
            job.terminate(JobStatus.COMPLETED, clock.instant());
            log.info("Job {} completed", jobId);
            return JobOperationResult.ok(jobRepo.save(job));
        });
        if (outcome.success()) {
            syncParent(outcome.value().getParentJobId());
        }
        return outcome;
    }

    /** PENDING | PROCESSING → FAILED. */
    public JobOperationResult<Job> fail(UUID jobId, String errorMessage) {
        JobOperationResult<Job> outcome = guarded("fail", () -> {
            Optional<Job> found = jobRepo.findForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus().isTerminal()) {
                return invalidTransition(job, "fail");
            }
            job.setErrorMessage(errorMessage);
            job.terminate(JobStatus.FAILED, clock.instant());
            log.warn("Job {} failed: {}", jobId, errorMessage);
            return JobOperationResult.ok(jobRepo.save(job));
        });
        if (outcome.success()) {
            syncParent(outcome.value().getParentJobId());
        }
        return outcome;
    }

    /**
     * PROCESSING → PENDING while the job waits on resources that are not ready yet.
     *
     * {@code _retryCount} and {@code _waitingFor} are written into inputData so the
     * next attempt (possibly on another worker) can see how long it has been waiting.
     * startedAt is preserved.
     */
    public JobOperationResult<Job> requeue(UUID jobId, int retryCount, List<String> waitingFor) {
        return guarded("requeue", () -> {
            Optional<Job> found = jobRepo.findForUpdate(jobId);
            if (found.isEmpty()) {
                return notFound(jobId);
            }
            Job job = found.get();
            if (job.getStatus() != JobStatus.PROCESSING) {
                return invalidTransition(job, "requeue");
            }
            ObjectNode input;
            try {
                input = inputAsObject(job.getInputData());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return JobOperationResult.failure(JobError.INVALID_ARGUMENT,
                        "inputData of job " + jobId + " is not a JSON object");
            }
            input.put(RETRY_COUNT_KEY, retryCount);
            ArrayNode waiting = input.putArray(WAITING_FOR_KEY);
            List<String> deps = waitingFor == null ? List.of() : waitingFor;
            deps.forEach(waiting::add);

            job.setInputData(input.toString());
            job.setStatus(JobStatus.PENDING);
            job.setProgressMessage("Waiting for dependencies: " + String.join(", ", deps));
            // Held back briefly so the next claim does not spin on a dependency that is still missing.
            job.lease(REQUEUE_HOLDER, clock.instant().plus(requeueDelay));
            log.info("Job {} requeued (retry {}), waiting for {}", jobId, retryCount, deps);
            return JobOperationResult.ok(jobRepo.save(job));
        });
    }

    /**
     * Insert PENDING children of a job that is being processed, in one transaction.
     *
     * Children skip the owner's rate limits: admission was decided when the
     * parent was created. Their completion drives the parent through
     * {@link #syncParent}.
     */
    public JobOperationResult<List<UUID>> createChildren(UUID parentId, JobType type, List<JsonNode> inputs) {
        return guarded("createChildren", () -> {
            Optional<Job> found = jobRepo.findForUpdate(parentId);
            if (found.isEmpty()) {
                return notFound(parentId);
            }
            Job parent = found.get();
            if (parent.getStatus() != JobStatus.PROCESSING) {
                return invalidTransition(parent, "add sub-jobs to");
            }
            Instant now = clock.instant();
            List<Job> children = inputs.stream().map(input -> {
                Job child = new Job(parent.getUserId(), parent.getProjectId(), type,
                        input == null ? null : input.toString(), null);
                child.setParentJobId(parentId);
                child.setCreatedAt(now);
                return child;
            }).toList();
            List<UUID> ids = jobRepo.saveAll(children).stream().map(Job::getId).toList();
            meterRegistry.counter("studioflow.jobs.created", "type", type.wireName()).increment(ids.size());
            log.info("Job {} spawned {} {} sub-job(s)", parentId, ids.size(), type);
            return JobOperationResult.ok(ids);
        });
    }

    /** Current status, used by workers to notice cancellation between sub-steps. */
    public Optional<JobStatus> currentStatus(UUID jobId) {
        try {
            return jobRepo.findById(jobId).map(Job::getStatus);
        } catch (DataAccessException e) {
            log.warn("Could not read status of job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Maintenance
    // ------------------------------------------------------------------

    /**
     * Fail PROCESSING jobs that exceeded their type's processing timeout,
     * or that somehow never recorded a start time.
     *
     * @return number of jobs failed
     */
    public int failStalledJobs() {
        Instant now = clock.instant();
        List<Job> processing;
        try {
            processing = jobRepo.findByStatus(JobStatus.PROCESSING);
        } catch (DataAccessException e) {
            log.error("Could not scan for stalled jobs: {}", e.getMessage(), e);
            return 0;
        }

        int failed = 0;
        for (Job job : processing) {
            Duration timeout = job.getType().processingTimeout();
            boolean stalled = job.getStartedAt() == null
                    || job.getStartedAt().plus(timeout).isBefore(now);
            if (!stalled) {
                continue;
            }
            String reason = job.getStartedAt() == null
                    ? "Job timed out: processing without a start time"
                    : "Job timed out after " + timeout.toMinutes() + " minutes of processing";
            if (fail(job.getId(), reason).success()) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} stalled job(s)", failed);
        }
        return failed;
    }

    // ------------------------------------------------------------------
    // Parent aggregation
    // ------------------------------------------------------------------

    /**
     * Recompute a parent's status and progress from its children.
     *
     *   any child failed        → FAILED ("k/n sub-jobs failed")
     *   all children completed  → COMPLETED, progress 100
     *   all children cancelled  → CANCELLED
     *   any child still active  → PROCESSING, average progress
     *   otherwise (completed and cancelled mix) → COMPLETED
     *
     * A parent already in a terminal status is never touched. Runs in its own
     * transaction after the child's change committed and holds the parent's
     * row lock while it reads the children, so when siblings finish together
     * the last one to get the lock sees all of their final statuses.
     * Failures are logged and do not affect the child's outcome.
     */
    void syncParent(UUID parentId) {
        if (parentId == null) {
            return;
        }
        try {
            tx.executeWithoutResult(status -> {
                Job parent = jobRepo.findForUpdate(parentId).orElse(null);
                if (parent == null || parent.getStatus().isTerminal()) {
                    return;
                }
                List<Job> children = jobRepo.findByParentJobId(parentId);
                if (children.isEmpty()) {
                    return;
                }
                aggregate(parent, children, clock.instant());
                jobRepo.save(parent);
            });
        } catch (RuntimeException e) {
            log.error("Could not update parent job {}: {}", parentId, e.getMessage(), e);
        }
    }

    static void aggregate(Job parent, List<Job> children, Instant now) {
        int total = children.size();
        long failed    = children.stream().filter(c -> c.getStatus() == JobStatus.FAILED).count();
        long completed = children.stream().filter(c -> c.getStatus() == JobStatus.COMPLETED).count();
        long cancelled = children.stream().filter(c -> c.getStatus() == JobStatus.CANCELLED).count();
        boolean anyActive = children.stream().anyMatch(c -> !c.getStatus().isTerminal());

        if (failed > 0) {
            parent.setErrorMessage(failed + "/" + total + " sub-jobs failed");
            parent.terminate(JobStatus.FAILED, now);
        } else if (cancelled == total) {
            parent.terminate(JobStatus.CANCELLED, now);
        } else if (anyActive) {
            if (parent.getStatus() == JobStatus.PENDING) {
                parent.setStatus(JobStatus.PROCESSING);
                if (parent.getStartedAt() == null) {
                    parent.setStartedAt(now);
                }
            }
            int sum = children.stream().mapToInt(Job::getProgress).sum();
            parent.setProgress(sum / total);
            parent.setProgressMessage(completed + "/" + total + " sub-jobs completed");
        } else {
            parent.setProgress(100);
            parent.terminate(JobStatus.COMPLETED, now);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Takes the owner's advisory lock and runs the rate-limit check. Must be
     * called inside the transaction that inserts the job.
     *
     * @return null when the owner may create another job
     */
    private <T> JobOperationResult<T> admit(String ownerId) {
        jobRepo.lockOwner(OWNER_LOCK_NAMESPACE, ownerId);
        RateLimitDecision decision = rateLimiter.check(ownerId);
        if (decision.allowed()) {
            return null;
        }
        meterRegistry.counter("studioflow.jobs.rate_limited").increment();
        log.info("Job creation refused for user {}: {}", ownerId, decision.message());
        return JobOperationResult.failure(JobError.RATE_LIMITED, decision.message());
    }

    private <T> JobOperationResult<T> guarded(String operation, Supplier<JobOperationResult<T>> body) {
        try {
            return tx.execute(status -> {
                JobOperationResult<T> result = body.get();
                if (!result.success()) {
                    status.setRollbackOnly();
                }
                return result;
            });
        } catch (DataAccessException | TransactionException e) {
            return storeError(operation, e);
        }
    }

    private ObjectNode inputAsObject(String inputData) throws JsonProcessingException {
        if (inputData == null || inputData.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node = objectMapper.readTree(inputData);
        if (node == null || node.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("not an object");
        }
        return (ObjectNode) node;
    }

    private static <T> JobOperationResult<T> storeError(String operation, RuntimeException e) {
        log.error("Job store error during {}: {}", operation, e.getMessage(), e);
        return JobOperationResult.failure(JobError.STORE_ERROR, "Job store unavailable");
    }

    private static <T> JobOperationResult<T> notFound(UUID jobId) {
        return JobOperationResult.failure(JobError.NOT_FOUND, "Job not found: " + jobId);
    }

    private static <T> JobOperationResult<T> invalidTransition(Job job, String action) {
        return JobOperationResult.failure(JobError.INVALID_TRANSITION,
                "Cannot " + action + " job " + job.getId() + " in status " + job.getStatus().wireName());
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
