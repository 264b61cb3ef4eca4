package com.studioflow.orchestrator.api;

import com.studioflow.orchestrator.service.JobError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Request-shape problems, rendered in the same {success,error,message} body as queue failures. */
@ControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Object> missingHeader(MissingRequestHeaderException ex) {
        if (JobController.USER_HEADER.equals(ex.getHeaderName())) {
            return JobResults.error(JobError.UNAUTHORIZED, "Missing " + JobController.USER_HEADER + " header");
        }
        return JobResults.error(JobError.INVALID_ARGUMENT, "Missing " + ex.getHeaderName() + " header");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> unreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return JobResults.error(JobError.INVALID_ARGUMENT, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Object> typeMismatch(MethodArgumentTypeMismatchException ex) {
        return JobResults.error(JobError.INVALID_ARGUMENT, "Invalid value for " + ex.getName() + ": " + ex.getValue());
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Object> badRequest(BadRequestException ex) {
        return JobResults.error(JobError.INVALID_ARGUMENT, ex.getMessage());
    }
}
