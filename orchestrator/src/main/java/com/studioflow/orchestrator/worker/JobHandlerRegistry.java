package com.studioflow.orchestrator.worker;

import com.studioflow.orchestrator.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects every {@link JobHandler} bean at startup, one per job type.
 */
@Component
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> allHandlers) {
        for (JobHandler handler : allHandlers) {
            JobHandler previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for job type " + handler.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            log.info("Registered job handler for '{}' ({})", handler.type().wireName(),
                    handler.getClass().getSimpleName());
        }
    }

    public Optional<JobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /** Types the in-process worker can execute. */
    public Set<JobType> types() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
