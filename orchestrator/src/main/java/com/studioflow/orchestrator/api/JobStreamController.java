package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.stream.JobEventStream;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * GET /api/jobs/stream: server-sent events with the caller's active and
 * recently finished jobs: one {@code connected} event, then {@code update}
 * every poll and {@code heartbeat} on idle connections.
 */
@RestController
public class JobStreamController {

    private final JobEventStream stream;

    public JobStreamController(JobEventStream stream) {
        this.stream = stream;
    }

    @GetMapping(path = "/api/jobs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader(JobController.USER_HEADER) String userId) {
        return stream.open(userId);
    }
}
