package com.studioflow.orchestrator.service;

/** Failure codes carried by {@link JobOperationResult}. */
public enum JobError {
    RATE_LIMITED,
    INVALID_TRANSITION,
    NOT_FOUND,
    UNAUTHORIZED,
    INVALID_ARGUMENT,
    STORE_ERROR
}
