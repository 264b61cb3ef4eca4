package com.studioflow.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobWorkerTest {

    @Mock JobService jobService;

    final ObjectMapper objectMapper = new ObjectMapper();
    JobWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.shutdown();
        }
    }

    private JobWorker workerWith(JobHandler... handlers) {
        worker = new JobWorker(jobService, new JobHandlerRegistry(List.of(handlers)), objectMapper, 2, 20);
        return worker;
    }

    // ------------------------------------------------------------------
    // process()
    // ------------------------------------------------------------------

    @Test
    void process_handlerSucceeds_completesWithResult() {
        JsonNode result = objectMapper.createObjectNode().put("url", "https://cdn/x.png");
        Job job = job(JobType.ASSET_IMAGE_GENERATION, "{}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));
        when(jobService.complete(job.getId(), result)).thenReturn(JobOperationResult.ok(job));

        workerWith(handler(JobType.ASSET_IMAGE_GENERATION, (j, ctx) -> HandlerOutcome.completed(result)))
                .process(job);

        verify(jobService).complete(job.getId(), result);
        verify(jobService, never()).fail(any(), any());
    }

    @Test
    void process_startLost_handlerNeverRuns() {
        Job job = job(JobType.ASSET_IMAGE_GENERATION, "{}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(false));
        boolean[] ran = {false};

        workerWith(handler(JobType.ASSET_IMAGE_GENERATION, (j, ctx) -> {
            ran[0] = true;
            return HandlerOutcome.completed(null);
        })).process(job);

        assertThat(ran[0]).isFalse();
        verify(jobService, never()).complete(any(), any());
    }

    @Test
    void process_noHandlerForType_failsJob() {
        Job job = job(JobType.FINAL_VIDEO_EXPORT, "{}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));

        workerWith().process(job);

        verify(jobService).fail(job.getId(), "No handler registered for job type final_video_export");
    }

    @Test
    void process_handlerThrows_failsWithMessage() {
        Job job = job(JobType.ASSET_IMAGE_GENERATION, "{}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));

        workerWith(handler(JobType.ASSET_IMAGE_GENERATION, (j, ctx) -> {
            throw new IllegalStateException("provider said no");
        })).process(job);

        verify(jobService).fail(job.getId(), "provider said no");
    }

    @Test
    void process_dependencyMissing_requeuesWithNextRetryCount() {
        Job job = job(JobType.VIDEO_GENERATION, "{\"_retryCount\":2}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));
        when(jobService.requeue(job.getId(), 3, List.of("img-1"))).thenReturn(JobOperationResult.ok(job));

        workerWith(handler(JobType.VIDEO_GENERATION, (j, ctx) -> {
            throw new DependencyNotReadyException(List.of("img-1"));
        })).process(job);

        verify(jobService).requeue(job.getId(), 3, List.of("img-1"));
        verify(jobService, never()).fail(any(), any());
    }

    @Test
    void process_dependencyRetriesExhausted_failsWithTimeout() {
        Job job = job(JobType.VIDEO_GENERATION, "{\"_retryCount\":20}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));

        workerWith(handler(JobType.VIDEO_GENERATION, (j, ctx) -> {
            throw new DependencyNotReadyException(List.of("img-1"));
        })).process(job);

        verify(jobService).fail(eq(job.getId()), startsWith("Dependency timeout"));
        verify(jobService, never()).requeue(any(), anyInt(), any());
    }

    @Test
    void process_handlerSpawnedChildren_jobLeftProcessing() {
        Job job = job(JobType.BATCH_IMAGE_GENERATION, "{}");
        when(jobService.start(job.getId())).thenReturn(JobOperationResult.ok(true));

        workerWith(handler(JobType.BATCH_IMAGE_GENERATION, (j, ctx) -> HandlerOutcome.waitingOnChildren()))
                .process(job);

        verify(jobService, never()).complete(any(), any());
        verify(jobService, never()).fail(any(), any());
    }

    // ------------------------------------------------------------------
    // tick() / retryCount()
    // ------------------------------------------------------------------

    @Test
    void tick_noHandlers_claimsNothing() {
        workerWith().tick();

        verifyNoInteractions(jobService);
    }

    @Test
    void tick_claimsOnlyHandledTypes() {
        when(jobService.claimBatch(eq(2), any(), eq(Set.of(JobType.BATCH_IMAGE_GENERATION))))
                .thenReturn(JobOperationResult.ok(List.of()));

        workerWith(handler(JobType.BATCH_IMAGE_GENERATION, (j, ctx) -> HandlerOutcome.completed(null))).tick();

        verify(jobService).claimBatch(eq(2), startsWith("worker-"), eq(Set.of(JobType.BATCH_IMAGE_GENERATION)));
    }

    @Test
    void retryCount_unreadableInput_isZero() {
        JobWorker w = workerWith();
        assertThat(w.retryCount(job(JobType.VIDEO_GENERATION, "not json"))).isZero();
        assertThat(w.retryCount(job(JobType.VIDEO_GENERATION, null))).isZero();
        assertThat(w.retryCount(job(JobType.VIDEO_GENERATION, "{\"_retryCount\":4}"))).isEqualTo(4);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    interface Body {
        HandlerOutcome handle(Job job, JobContext context) throws Exception;
    }

    static JobHandler handler(JobType type, Body body) {
        return new JobHandler() {
            @Override public JobType type() { return type; }
            @Override public HandlerOutcome handle(Job job, JobContext context) throws Exception {
                return body.handle(job, context);
            }
        };
    }

    static Job job(JobType type, String input) {
        Job job = new Job("u1", "p1", type, input, null);
        job.setStatus(JobStatus.PENDING);
        try {
            var f = Job.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
