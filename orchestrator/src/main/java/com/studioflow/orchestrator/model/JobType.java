package com.studioflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Closed set of work kinds the queue accepts.
 *
 * Each type carries the processing timeout used by the stalled-job reaper;
 * video rendering and final export legitimately run much longer than a
 * single image. A batch stays PROCESSING until all of its sub-jobs finish.
 */
public enum JobType {
    BATCH_IMAGE_GENERATION(Duration.ofMinutes(30)),
    ASSET_IMAGE_GENERATION(Duration.ofMinutes(10)),
    VIDEO_GENERATION(Duration.ofMinutes(30)),
    FINAL_VIDEO_EXPORT(Duration.ofMinutes(60));

    private final Duration processingTimeout;

    JobType(Duration processingTimeout) {
        this.processingTimeout = processingTimeout;
    }

    public Duration processingTimeout() {
        return processingTimeout;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobType fromWireName(String value) {
        return JobType.valueOf(value.trim().toUpperCase());
    }
}
