package com.studioflow.orchestrator.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/** Newline-delimited JSON: one object per line, flushed as it is written. */
public class NdjsonEventSink<E> implements EventSink<E> {

    public static final MediaType NDJSON_UTF8 =
            new MediaType("application", "x-ndjson", StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final ObjectMapper        objectMapper;
    private final AtomicBoolean       completed = new AtomicBoolean();

    public NdjsonEventSink(ResponseBodyEmitter emitter, ObjectMapper objectMapper) {
        this.emitter      = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(E event) throws IOException {
        emitter.send(objectMapper.writeValueAsString(event) + "\n", NDJSON_UTF8);
    }

    @Override
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }
}
