package com.studioflow.orchestrator.stream;

import java.io.IOException;

/**
 * Consumer side of a push channel to one client.
 *
 * The job stream feeds one from a poll loop, the agent stream from graph
 * transitions; both only ever see this interface.
 */
public interface EventSink<E> {

    /** @throws IOException when the client has gone away */
    void send(E event) throws IOException;

    /** Ends the response. Safe to call more than once. */
    void complete();
}
