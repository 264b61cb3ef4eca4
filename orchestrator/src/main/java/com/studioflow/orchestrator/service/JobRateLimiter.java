package com.studioflow.orchestrator.service;

import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Per-user admission control for job creation.
 *
 * Two caps apply:
 *   - active jobs (PENDING + PROCESSING) at any moment
 *   - jobs created since local midnight in the configured zone
 *
 * A failing count query lets the request through. Availability matters
 * more than strict enforcement here; the failure is logged at WARN.
 * Called from inside the job's insert transaction, where a store failure
 * also rolls back the insert and the caller reports STORE_ERROR.
 *
 * The refusal message is resolved through the MessageSource with the
 * locale of the current request (Accept-Language), falling back to English.
 */
@Component
public class JobRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(JobRateLimiter.class);

    private final JobRepository jobRepo;
    private final MessageSource messages;
    private final Clock         clock;
    private final int           maxActive;
    private final int           maxPerDay;
    private final ZoneId        zone;

    public JobRateLimiter(JobRepository jobRepo,
                          MessageSource messages,
                          Clock clock,
                          @Value("${studioflow.queue.max-active-jobs-per-user:10}") int maxActive,
                          @Value("${studioflow.queue.max-jobs-per-day:1000}") int maxPerDay,
                          @Value("${studioflow.queue.rate-limit-zone:UTC}") String zone) {
        this.jobRepo   = jobRepo;
        this.messages  = messages;
        this.clock     = clock;
        this.maxActive = maxActive;
        this.maxPerDay = maxPerDay;
        this.zone      = ZoneId.of(zone);
    }

    public RateLimitDecision check(String userId) {
        long active;
        long today;
        try {
            active = jobRepo.countByUserIdAndStatusIn(userId, JobStatus.ACTIVE);
            if (active >= maxActive) {
                return RateLimitDecision.deny(message("job.rate-limited.active",
                        "You already have {0,number,#} jobs in progress (limit {1,number,#}). Wait for some to finish and try again.",
                        active, maxActive));
            }
            today = jobRepo.countByUserIdAndCreatedAtGreaterThanEqual(userId, startOfToday());
        } catch (RuntimeException e) {
            log.warn("Rate limit check failed for user {}, allowing request: {}", userId, e.getMessage(), e);
            return RateLimitDecision.allow();
        }

        if (today >= maxPerDay) {
            return RateLimitDecision.deny(message("job.rate-limited.daily",
                    "You have created {0,number,#} jobs today (limit {1,number,#}). Try again tomorrow.",
                    today, maxPerDay));
        }
        return RateLimitDecision.allow();
    }

    /** Local midnight of the current day in the configured zone. */
    Instant startOfToday() {
        return LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toInstant();
    }

    private String message(String code, String fallback, long current, int cap) {
        return messages.getMessage(code, new Object[]{current, cap}, fallback, LocaleContextHolder.getLocale());
    }
}
