package com.studioflow.orchestrator.service;

import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails jobs whose worker died while they were PROCESSING.
 *
 * Claimed-but-never-started jobs need no reaping: their lease simply expires
 * and the next claim picks them up again.
 */
@Component
@EnableScheduling
public class StalledJobReaper {

    private final JobService jobService;

    public StalledJobReaper(JobService jobService) {
        this.jobService = jobService;
    }

    @Scheduled(fixedDelayString = "${studioflow.worker.stalled-check-interval-ms:60000}",
               initialDelayString = "${studioflow.worker.stalled-check-interval-ms:60000}")
    public void reap() {
        jobService.failStalledJobs();
    }
}
