package com.studioflow.orchestrator.stream;

import com.studioflow.orchestrator.api.dto.JobResponse;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client's job event stream.
 *
 * Every poll pushes a full snapshot of the owner's active and recently
 * finished jobs; clients must treat repeated snapshots as idempotent. A
 * failed query is reported as an error frame and the stream stays open.
 * A failed write means the client left, and the session closes itself.
 */
public class JobStreamSession {

    private static final Logger log = LoggerFactory.getLogger(JobStreamSession.class);

    private final String                    userId;
    private final EventSink<JobStreamEvent> sink;
    private final JobService                jobService;
    private final Duration                  recentWindow;
    private final Clock                     clock;
    private final AtomicBoolean             closed = new AtomicBoolean();
    private volatile Runnable               onClose = () -> {};

    public JobStreamSession(String userId, EventSink<JobStreamEvent> sink, JobService jobService,
                            Duration recentWindow, Clock clock) {
        this.userId       = userId;
        this.sink         = sink;
        this.jobService   = jobService;
        this.recentWindow = recentWindow;
        this.clock        = clock;
    }

    /** Runs once when the session closes for any reason (e.g. to cancel its timers). */
    public void onClose(Runnable callback) {
        this.onClose = callback;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void connected() {
        push(JobStreamEvent.connected());
    }

    public void poll() {
        if (closed.get()) {
            return;
        }
        List<Job> jobs;
        try {
            jobs = jobService.streamSnapshot(userId, recentWindow);
        } catch (RuntimeException e) {
            log.warn("Job stream query failed for user {}: {}", userId, e.getMessage());
            push(JobStreamEvent.error("Failed to load jobs"));
            return;
        }
        push(JobStreamEvent.update(jobs.stream().map(JobResponse::from).toList(), clock.instant()));
    }

    public void heartbeat() {
        push(JobStreamEvent.heartbeat());
    }

    /** Ends the response and stops the session. Idempotent. */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
            sink.complete();
        }
    }

    /** Called when the container already ended the response (timeout, disconnect). */
    void closedByContainer() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }

    private void push(JobStreamEvent event) {
        if (closed.get()) {
            return;
        }
        try {
            sink.send(event);
        } catch (IOException | IllegalStateException e) {
            log.debug("Job stream for user {} closed: {}", userId, e.getMessage());
            closedByContainer();
        }
    }
}
