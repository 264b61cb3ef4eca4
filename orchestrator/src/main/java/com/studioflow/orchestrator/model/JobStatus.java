package com.studioflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a queued {@link Job}.
 *
 * Transitions:
 *   PENDING    → PROCESSING (worker calls start)
 *   PROCESSING → PENDING    (requeue while waiting on a dependency; soft retry)
 *   PENDING | PROCESSING → COMPLETED | FAILED | CANCELLED
 *
 * Terminal states never change again. Retrying a FAILED or CANCELLED job
 * inserts a new row instead of reopening the old one.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<JobStatus> ACTIVE   = EnumSet.of(PENDING, PROCESSING);
    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase());
    }
}
