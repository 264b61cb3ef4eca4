package com.studioflow.orchestrator.stream;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Server-sent events: one {@code data:} frame of JSON per event. */
public class SseEventSink<E> implements EventSink<E> {

    private final SseEmitter    emitter;
    private final AtomicBoolean completed = new AtomicBoolean();

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(E event) throws IOException {
        emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }
}
