package com.studioflow.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.agent.AgentRunService;
import com.studioflow.orchestrator.api.dto.AgentStreamRequest;
import com.studioflow.orchestrator.stream.AgentEvent;
import com.studioflow.orchestrator.stream.NdjsonEventSink;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * POST /api/agent/stream: runs the assistant and streams its events as
 * newline-delimited JSON.
 *
 * The body is either a new turn {message, context, conversationId} or a
 * resume {threadId, resumeValue}. Anything else is rejected with 400 before
 * the stream opens; refusals after that point (e.g. nothing to resume)
 * arrive as an {@code error} event.
 */
@RestController
public class AgentController {

    private final AgentRunService runs;
    private final ObjectMapper    objectMapper;

    public AgentController(AgentRunService runs, ObjectMapper objectMapper) {
        this.runs         = runs;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/api/agent/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(@RequestHeader(JobController.USER_HEADER) String userId,
                                                      @RequestBody AgentStreamRequest req) {
        boolean resume  = req.isResume();
        boolean newTurn = req.isNewTurn();
        if (resume == newTurn) {
            throw new BadRequestException(
                    "Send either {message, context.projectId, conversationId} or {threadId, resumeValue}");
        }

        // The execution owns the stream's lifetime.
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(-1L);
        NdjsonEventSink<AgentEvent> sink = new NdjsonEventSink<>(emitter, objectMapper);
        if (resume) {
            runs.streamResume(userId, req.threadId(), req.resumeValue(), sink);
        } else {
            runs.streamTurn(userId, req.conversationId(), req.message(), req.context(), sink);
        }
        return ResponseEntity.ok().contentType(NdjsonEventSink.NDJSON_UTF8).body(emitter);
    }
}
