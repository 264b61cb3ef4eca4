package com.studioflow.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.studioflow.orchestrator.api.dto.JobResponse;

import java.time.Instant;
import java.util.List;

/** One frame of the job event stream. Only the fields of the given type are written. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStreamEvent(String type, List<JobResponse> jobs, Instant timestamp, String message) {

    public static JobStreamEvent connected() {
        return new JobStreamEvent("connected", null, null, null);
    }

    public static JobStreamEvent update(List<JobResponse> jobs, Instant timestamp) {
        return new JobStreamEvent("jobs_update", jobs, timestamp, null);
    }

    public static JobStreamEvent heartbeat() {
        return new JobStreamEvent("heartbeat", null, null, null);
    }

    public static JobStreamEvent error(String message) {
        return new JobStreamEvent("error", null, null, message);
    }
}
