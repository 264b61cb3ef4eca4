package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.CreateJobCommand;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Enqueues image generation for one or more assets.
 *
 * A single asset becomes one asset_image_generation job; several become a
 * batch_image_generation job that fans out into sub-jobs.
 */
@Component
public class GenerateAssetsTool implements AgentTool {

    public static final String NAME = "generate_assets";
    static final int MAX_ASSETS = 20;

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Generate images",
            "Generate an image for each listed asset. Costs credits; the user is asked to approve first.",
            ToolCategory.GENERATION,
            true,
            ToolSchemas.parse("""
                    {
                      "type": "object",
                      "properties": {
                        "assets": {
                          "type": "array",
                          "minItems": 1,
                          "maxItems": 20,
                          "items": {
                            "type": "object",
                            "properties": {
                              "assetId": {"type": "string"},
                              "name":    {"type": "string"},
                              "prompt":  {"type": "string", "description": "What the image should show"}
                            },
                            "required": ["prompt"]
                          }
                        }
                      },
                      "required": ["assets"]
                    }
                    """));

    private final JobService   jobService;
    private final ObjectMapper objectMapper;

    public GenerateAssetsTool(JobService jobService, ObjectMapper objectMapper) {
        this.jobService   = jobService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(JsonNode arguments, ToolInvocation invocation) {
        JsonNode assets = arguments.path("assets");
        if (!assets.isArray() || assets.isEmpty()) {
            return ToolResult.failure("'assets' must be a non-empty array");
        }
        if (assets.size() > MAX_ASSETS) {
            return ToolResult.failure("At most " + MAX_ASSETS + " assets per request");
        }
        for (JsonNode asset : assets) {
            if (asset.path("prompt").asText("").isBlank()) {
                return ToolResult.failure("Every asset needs a prompt");
            }
        }

        JobType type;
        JsonNode input;
        if (assets.size() == 1) {
            type  = JobType.ASSET_IMAGE_GENERATION;
            input = assets.get(0);
        } else {
            type = JobType.BATCH_IMAGE_GENERATION;
            ObjectNode batch = objectMapper.createObjectNode();
            batch.set("assets", assets);
            input = batch;
        }

        JobOperationResult<UUID> created = jobService.create(
                CreateJobCommand.of(invocation.userId(), invocation.projectId(), type, input));
        if (!created.success()) {
            return ToolResult.failure(created.message());
        }
        ObjectNode data = objectMapper.createObjectNode()
                .put("jobId", created.value().toString())
                .put("type", type.wireName())
                .put("assetCount", assets.size());
        return ToolResult.jobCreated(data, created.value().toString());
    }
}
