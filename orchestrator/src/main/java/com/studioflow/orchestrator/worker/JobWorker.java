package com.studioflow.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker loop.
 *
 * Every poll interval it claims as many jobs as it has free slots, for the
 * job types that have a registered {@link JobHandler}, and runs each one on
 * a fixed pool. External workers do the same over /internal/jobs; the claim
 * lease keeps the two from ever receiving the same row.
 *
 * Per job:
 *   start → handler → complete | fail
 *   DependencyNotReadyException → requeue, until max-dependency-retries is exceeded
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "studioflow.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobService         jobService;
    private final JobHandlerRegistry handlers;
    private final ObjectMapper       objectMapper;
    private final int                concurrency;
    private final int                maxDependencyRetries;
    private final String             workerId;
    private final ExecutorService    workers;
    private final AtomicInteger      inFlight = new AtomicInteger();

    public JobWorker(JobService jobService,
                     JobHandlerRegistry handlers,
                     ObjectMapper objectMapper,
                     @Value("${studioflow.worker.concurrency:10}") int concurrency,
                     @Value("${studioflow.worker.max-dependency-retries:20}") int maxDependencyRetries) {
        this.jobService           = jobService;
        this.handlers             = handlers;
        this.objectMapper         = objectMapper;
        this.concurrency          = concurrency;
        this.maxDependencyRetries = maxDependencyRetries;
        this.workerId             = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        this.workers              = Executors.newFixedThreadPool(concurrency);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }

    /**
     * Claim up to the number of free slots and dispatch each job.
     * fixedDelay: the next tick starts a full interval after this one returned.
     */
    @Scheduled(fixedDelayString = "${studioflow.worker.poll-interval-ms:2000}")
    public void tick() {
        int free = concurrency - inFlight.get();
        if (free <= 0 || handlers.types().isEmpty()) {
            return;
        }
        JobOperationResult<List<Job>> claimed = jobService.claimBatch(free, workerId, handlers.types());
        if (!claimed.success()) {
            log.warn("Claim failed: {} {}", claimed.error(), claimed.message());
            return;
        }
        for (Job job : claimed.value()) {
            inFlight.incrementAndGet();
            workers.submit(() -> {
                try {
                    process(job);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        }
    }

    /** Run one claimed job to completion, failure, or requeue. */
    void process(Job job) {
        MDC.put("jobId",   job.getId().toString());
        MDC.put("jobType", job.getType().wireName());
        try {
            JobOperationResult<Boolean> started = jobService.start(job.getId());
            if (!started.success() || !Boolean.TRUE.equals(started.value())) {
                log.info("Skipping job {}: could not be started ({})", job.getId(),
                        started.success() ? "no longer pending" : started.message());
                return;
            }

            Optional<JobHandler> handler = handlers.find(job.getType());
            if (handler.isEmpty()) {
                jobService.fail(job.getId(), "No handler registered for job type " + job.getType().wireName());
                return;
            }

            HandlerOutcome outcome = handler.get().handle(job, new JobContext(job, jobService));
            if (outcome.awaitingChildren()) {
                log.info("Job {} is waiting for its sub-jobs", job.getId());
                return;
            }
            JobOperationResult<Job> done = jobService.complete(job.getId(), outcome.result());
            if (!done.success()) {
                log.warn("Could not complete job {}: {} {}", job.getId(), done.error(), done.message());
            }
        } catch (DependencyNotReadyException e) {
            requeueOrGiveUp(job, e);
        } catch (Exception e) {
            log.error("Job {} failed in handler: {}", job.getId(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            jobService.fail(job.getId(), message);
        } finally {
            MDC.clear();
        }
    }

    private void requeueOrGiveUp(Job job, DependencyNotReadyException e) {
        int attempt = retryCount(job) + 1;
        if (attempt > maxDependencyRetries) {
            jobService.fail(job.getId(), "Dependency timeout: still waiting for "
                    + String.join(", ", e.waitingFor()) + " after " + maxDependencyRetries + " retries");
            return;
        }
        JobOperationResult<Job> requeued = jobService.requeue(job.getId(), attempt, e.waitingFor());
        if (!requeued.success()) {
            log.warn("Could not requeue job {}: {} {}", job.getId(), requeued.error(), requeued.message());
        }
    }

    /** _retryCount as written by the previous requeue, 0 if absent or unreadable. */
    int retryCount(Job job) {
        if (job.getInputData() == null) {
            return 0;
        }
        try {
            JsonNode input = objectMapper.readTree(job.getInputData());
            return input.path(JobService.RETRY_COUNT_KEY).asInt(0);
        } catch (Exception e) {
            log.debug("Unreadable inputData on job {}: {}", job.getId(), e.getMessage());
            return 0;
        }
    }
}
