package com.studioflow.orchestrator.service;

/**
 * Outcome of a queue operation.
 *
 * Queue mutations never throw past {@link JobService}; worker loops inspect
 * the error code and decide whether to retry, requeue or give up.
 */
public record JobOperationResult<T>(boolean success, T value, JobError error, String message) {

    public static <T> JobOperationResult<T> ok(T value) {
        return new JobOperationResult<>(true, value, null, null);
    }

    public static <T> JobOperationResult<T> failure(JobError error, String message) {
        return new JobOperationResult<>(false, null, error, message);
    }

    /** Re-types a failure so it can be returned from an operation with a different value type. */
    public <R> JobOperationResult<R> asFailure() {
        if (success) {
            throw new IllegalStateException("Not a failure");
        }
        return new JobOperationResult<>(false, null, error, message);
    }
}
