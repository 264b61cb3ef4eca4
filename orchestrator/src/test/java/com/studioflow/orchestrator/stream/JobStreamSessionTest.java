package com.studioflow.orchestrator.stream;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStreamSessionTest {

    static final Instant  NOW    = Instant.parse("2026-03-01T10:00:00Z");
    static final Duration WINDOW = Duration.ofMinutes(5);

    @Mock JobService jobService;

    RecordingSink    sink;
    JobStreamSession session;
    int              closeCallbacks;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        session = new JobStreamSession("u1", sink, jobService, WINDOW, Clock.fixed(NOW, ZoneOffset.UTC));
        session.onClose(() -> closeCallbacks++);
    }

    @Test
    void connectedThenPoll_sendsSnapshotOfOwnJobs() {
        Job job = new Job("u1", "p1", JobType.VIDEO_GENERATION, null, null);
        job.setStatus(JobStatus.PROCESSING);
        when(jobService.streamSnapshot("u1", WINDOW)).thenReturn(List.of(job));

        session.connected();
        session.poll();

        assertThat(sink.events).extracting(JobStreamEvent::type).containsExactly("connected", "jobs_update");
        JobStreamEvent update = sink.events.get(1);
        assertThat(update.timestamp()).isEqualTo(NOW);
        assertThat(update.jobs()).singleElement()
                .satisfies(j -> assertThat(j.status()).isEqualTo(JobStatus.PROCESSING));
    }

    @Test
    void poll_queryFails_sendsErrorFrameAndStaysOpen() {
        when(jobService.streamSnapshot("u1", WINDOW)).thenThrow(new IllegalStateException("db down"));

        session.poll();

        assertThat(sink.events).singleElement()
                .satisfies(e -> {
                    assertThat(e.type()).isEqualTo("error");
                    assertThat(e.message()).isEqualTo("Failed to load jobs");
                });
        assertThat(session.isClosed()).isFalse();
    }

    @Test
    void writeFails_sessionClosesWithoutCompletingResponse() {
        sink.broken = true;

        session.heartbeat();
        session.poll();

        assertThat(session.isClosed()).isTrue();
        assertThat(closeCallbacks).isEqualTo(1);
        assertThat(sink.completed).isZero();
        verifyNoInteractions(jobService);
    }

    @Test
    void close_isIdempotentAndStopsFurtherFrames() {
        session.close();
        session.close();
        session.heartbeat();

        assertThat(closeCallbacks).isEqualTo(1);
        assertThat(sink.completed).isEqualTo(1);
        assertThat(sink.events).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static class RecordingSink implements EventSink<JobStreamEvent> {
        final List<JobStreamEvent> events = new ArrayList<>();
        int completed;
        boolean broken;

        @Override
        public void send(JobStreamEvent event) throws IOException {
            if (broken) {
                throw new IOException("Broken pipe");
            }
            events.add(event);
        }

        @Override
        public void complete() {
            completed++;
        }
    }
}
