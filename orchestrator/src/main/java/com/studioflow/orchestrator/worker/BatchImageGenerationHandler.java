package com.studioflow.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.JobOperationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fans a batch out into one asset_image_generation sub-job per entry.
 *
 * Input:  {"assets": [{...asset image input...}, ...]}
 *
 * The batch itself produces nothing; it completes (or fails) when its
 * sub-jobs do. An empty batch completes immediately.
 */
@Component
public class BatchImageGenerationHandler implements JobHandler {

    private final ObjectMapper objectMapper;

    public BatchImageGenerationHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public JobType type() {
        return JobType.BATCH_IMAGE_GENERATION;
    }

    @Override
    public HandlerOutcome handle(Job job, JobContext context) throws Exception {
        JsonNode input = job.getInputData() == null
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(job.getInputData());
        JsonNode assets = input.path("assets");
        if (!assets.isMissingNode() && !assets.isArray()) {
            throw new IllegalArgumentException("'assets' must be an array");
        }

        List<JsonNode> items = new ArrayList<>();
        assets.forEach(items::add);
        if (items.isEmpty()) {
            return HandlerOutcome.completed(objectMapper.createObjectNode().put("subJobs", 0));
        }

        JobOperationResult<List<UUID>> spawned = context.jobService()
                .createChildren(job.getId(), JobType.ASSET_IMAGE_GENERATION, items);
        if (!spawned.success()) {
            throw new IllegalStateException("Could not create sub-jobs: " + spawned.message());
        }
        context.progress(0, "0/" + items.size() + " sub-jobs completed");
        return HandlerOutcome.waitingOnChildren();
    }
}
