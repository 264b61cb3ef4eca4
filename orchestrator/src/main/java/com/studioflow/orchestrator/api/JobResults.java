package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.api.dto.ErrorResponse;
import com.studioflow.orchestrator.service.JobError;
import com.studioflow.orchestrator.service.JobOperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/** Turns {@link JobOperationResult}s into HTTP responses. */
final class JobResults {

    private JobResults() {}

    static HttpStatus statusOf(JobError error) {
        return switch (error) {
            case RATE_LIMITED       -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case NOT_FOUND          -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED       -> HttpStatus.UNAUTHORIZED;
            case INVALID_ARGUMENT   -> HttpStatus.BAD_REQUEST;
            case STORE_ERROR        -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static ResponseEntity<Object> error(JobError error, String message) {
        return ResponseEntity.status(statusOf(error)).body(ErrorResponse.of(error.name(), message));
    }

    static <T> ResponseEntity<Object> respond(JobOperationResult<T> result, Function<T, ?> body) {
        return respond(result, HttpStatus.OK, body);
    }

    static <T> ResponseEntity<Object> respond(JobOperationResult<T> result, HttpStatus onSuccess,
                                              Function<T, ?> body) {
        if (!result.success()) {
            return error(result.error(), result.message());
        }
        return ResponseEntity.status(onSuccess).body(body.apply(result.value()));
    }
}
