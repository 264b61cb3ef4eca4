package com.studioflow.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.agent.AgentContext;
import com.studioflow.orchestrator.agent.AgentState;
import com.studioflow.orchestrator.agent.Checkpoint;
import com.studioflow.orchestrator.agent.CheckpointStore;
import com.studioflow.orchestrator.agent.GraphNode;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.service.CreateJobCommand;
import com.studioflow.orchestrator.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Queue semantics that only a real PostgreSQL can show: row locking with
 * SKIP LOCKED, the claim lease, and Flyway's schema matching the entities.
 *
 * The in-process worker is disabled so nothing claims rows behind the test's back.
 */
@SpringBootTest(properties = {
        "studioflow.worker.enabled=false",
        "studioflow.queue.max-active-jobs-per-user=1000",
        "studioflow.queue.max-jobs-per-day=1000"
})
@Testcontainers(disabledWithoutDocker = true)
class JobQueueIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("studioflow")
            .withUsername("studioflow")
            .withPassword("studioflow");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired JobService      jobService;
    @Autowired JobRepository   jobRepository;
    @Autowired CheckpointStore checkpointStore;
    @Autowired ObjectMapper    objectMapper;

    @BeforeEach
    void cleanQueue() {
        jobRepository.deleteAll();
    }

    private UUID enqueue(String userId, JobType type) {
        JsonNode input = objectMapper.createObjectNode().put("prompt", "p");
        return jobService.create(CreateJobCommand.of(userId, "p1", type, input)).value();
    }

    // ------------------------------------------------------------------
    // claimBatch()
    // ------------------------------------------------------------------

    @Test
    void concurrentClaims_neverHandOutTheSameJobTwice() throws Exception {
        for (int i = 0; i < 30; i++) {
            enqueue("u" + (i % 3), JobType.ASSET_IMAGE_GENERATION);
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<Job>>> claimants = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                String claimant = "worker-" + w;
                claimants.add(() -> jobService.claimBatch(10, claimant).value());
            }
            List<UUID> claimed = new ArrayList<>();
            for (Future<List<Job>> f : pool.invokeAll(claimants)) {
                f.get().forEach(job -> claimed.add(job.getId()));
            }

            Set<UUID> distinct = new HashSet<>(claimed);
            assertThat(distinct).hasSameSizeAs(claimed);
            assertThat(claimed).hasSize(30);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void leasedJob_notClaimableAgainUntilStarted() {
        UUID id = enqueue("u1", JobType.VIDEO_GENERATION);

        List<Job> first = jobService.claimBatch(5, "worker-a").value();
        List<Job> second = jobService.claimBatch(5, "worker-b").value();

        assertThat(first).extracting(Job::getId).containsExactly(id);
        assertThat(second).isEmpty();
        assertThat(jobService.start(id).value()).isTrue();
        assertThat(jobService.start(id).value()).isFalse();
        assertThat(jobRepository.findById(id).orElseThrow().getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void typeFilteredClaim_leavesOtherTypesPending() {
        UUID video = enqueue("u1", JobType.VIDEO_GENERATION);
        UUID image = enqueue("u1", JobType.ASSET_IMAGE_GENERATION);

        List<Job> claimed = jobService.claimBatch(5, "gpu", List.of(JobType.VIDEO_GENERATION)).value();

        assertThat(claimed).extracting(Job::getId).containsExactly(video);
        assertThat(jobService.claimBatch(5, "any").value()).extracting(Job::getId).containsExactly(image);
    }

    // ------------------------------------------------------------------
    // Parent aggregation
    // ------------------------------------------------------------------

    @Test
    void batchParent_completesWhenLastChildCompletes() {
        UUID parent = enqueue("u1", JobType.BATCH_IMAGE_GENERATION);
        jobService.start(parent);
        List<UUID> children = jobService.createChildren(parent, JobType.ASSET_IMAGE_GENERATION,
                List.of(objectMapper.createObjectNode(), objectMapper.createObjectNode())).value();

        for (UUID child : children) {
            assertThat(jobService.start(child).value()).isTrue();
        }
        jobService.complete(children.get(0), objectMapper.createObjectNode().put("url", "a"));

        Job midway = jobRepository.findById(parent).orElseThrow();
        assertThat(midway.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(midway.getProgress()).isEqualTo(50);

        jobService.complete(children.get(1), objectMapper.createObjectNode().put("url", "b"));

        assertThat(jobRepository.findById(parent).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void siblingsCompletingTogether_parentEndsCompleted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            for (int round = 0; round < 5; round++) {
                UUID parent = enqueue("u1", JobType.BATCH_IMAGE_GENERATION);
                jobService.start(parent);
                List<JsonNode> inputs = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    inputs.add(objectMapper.createObjectNode().put("prompt", "p" + i));
                }
                List<UUID> children = jobService.createChildren(parent, JobType.ASSET_IMAGE_GENERATION, inputs).value();
                children.forEach(jobService::start);

                List<Callable<Boolean>> completions = new ArrayList<>();
                for (UUID child : children) {
                    completions.add(() -> jobService.complete(child, objectMapper.createObjectNode()).success());
                }
                for (Future<Boolean> f : pool.invokeAll(completions)) {
                    assertThat(f.get()).isTrue();
                }

                Job finished = jobRepository.findById(parent).orElseThrow();
                assertThat(finished.getStatus()).isEqualTo(JobStatus.COMPLETED);
                assertThat(finished.getProgress()).isEqualTo(100);
                assertThat(finished.getCompletedAt()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cancelRacingComplete_exactlyOneWinsAndTheRowAgrees() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 10; round++) {
                UUID id = enqueue("u1", JobType.VIDEO_GENERATION);
                jobService.start(id);

                List<Callable<JobStatus>> racers = List.of(
                        () -> jobService.cancel("u1", id).success() ? JobStatus.CANCELLED : null,
                        () -> jobService.complete(id, objectMapper.createObjectNode()).success() ? JobStatus.COMPLETED : null);
                List<JobStatus> winners = new ArrayList<>();
                for (Future<JobStatus> f : pool.invokeAll(racers)) {
                    if (f.get() != null) {
                        winners.add(f.get());
                    }
                }

                assertThat(winners).hasSize(1);
                assertThat(jobRepository.findById(id).orElseThrow().getStatus()).isEqualTo(winners.get(0));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @Test
    void checkpoints_latestVersionWins() {
        String threadId = "p1_" + UUID.randomUUID();
        AgentState state = new AgentState(threadId, "u1", "p1", threadId.substring(3));
        state.beginTurn("hello", new AgentContext("p1", null, null));

        checkpointStore.save(threadId, GraphNode.COLLECT_CONTEXT, state);
        checkpointStore.save(threadId, GraphNode.CALL_MODEL, state);

        Checkpoint latest = checkpointStore.latest(threadId).orElseThrow();
        assertThat(latest.version()).isEqualTo(2);
        assertThat(latest.nextNode()).isEqualTo(GraphNode.CALL_MODEL);
        assertThat(latest.state().getMessages()).extracting(m -> m.content()).contains("hello");
        assertThat(checkpointStore.latest("p1_unknown")).isEmpty();
    }
}
