package com.studioflow.orchestrator.api.dto;

/** Body of every non-2xx response: {"success":false,"error":CODE,"message":...}. */
public record ErrorResponse(boolean success, String error, String message) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(false, error, message);
    }
}
