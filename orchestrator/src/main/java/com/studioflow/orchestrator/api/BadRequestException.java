package com.studioflow.orchestrator.api;

/** Request body is well-formed JSON but not a shape the endpoint accepts. */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
