package com.studioflow.orchestrator.stream;

import com.studioflow.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Opens job event streams.
 *
 *   poll every 2 s      → jobs_update snapshot
 *   every 30 s          → heartbeat (keeps proxies from closing an idle connection)
 *   after 10 min        → response ends; the client reconnects
 *
 * Nothing is held between ticks except the two scheduled tasks, which are
 * cancelled as soon as the response ends.
 */
@Component
public class JobEventStream {

    private static final Logger log = LoggerFactory.getLogger(JobEventStream.class);

    private final JobService    jobService;
    private final TaskScheduler scheduler;
    private final Clock         clock;
    private final Duration      pollInterval;
    private final Duration      heartbeatInterval;
    private final Duration      maxLifetime;
    private final Duration      recentWindow;

    public JobEventStream(JobService jobService,
                          TaskScheduler scheduler,
                          Clock clock,
                          @Value("${studioflow.stream.poll-interval:2s}") Duration pollInterval,
                          @Value("${studioflow.stream.heartbeat-interval:30s}") Duration heartbeatInterval,
                          @Value("${studioflow.stream.max-lifetime:10m}") Duration maxLifetime,
                          @Value("${studioflow.stream.recent-window:5m}") Duration recentWindow) {
        this.jobService        = jobService;
        this.scheduler         = scheduler;
        this.clock             = clock;
        this.pollInterval      = pollInterval;
        this.heartbeatInterval = heartbeatInterval;
        this.maxLifetime       = maxLifetime;
        this.recentWindow      = recentWindow;
    }

    public SseEmitter open(String userId) {
        SseEmitter emitter = new SseEmitter(maxLifetime.toMillis());
        JobStreamSession session = new JobStreamSession(
                userId, new SseEventSink<>(emitter), jobService, recentWindow, clock);

        session.connected();
        session.poll();

        ScheduledFuture<?> polling = scheduler.scheduleAtFixedRate(session::poll,
                clock.instant().plus(pollInterval), pollInterval);
        ScheduledFuture<?> beating = scheduler.scheduleAtFixedRate(session::heartbeat,
                clock.instant().plus(heartbeatInterval), heartbeatInterval);
        session.onClose(() -> {
            polling.cancel(false);
            beating.cancel(false);
        });
        if (session.isClosed()) {
            polling.cancel(false);
            beating.cancel(false);
        }

        emitter.onTimeout(session::close);
        emitter.onCompletion(session::closedByContainer);
        emitter.onError(e -> session.closedByContainer());

        log.debug("Job stream opened for user {}", userId);
        return emitter;
    }
}
