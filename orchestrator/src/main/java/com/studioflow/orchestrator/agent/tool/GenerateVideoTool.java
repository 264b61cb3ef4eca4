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

/** Enqueues an image-to-video clip. Clips are rendered as 5 or 10 seconds. */
@Component
public class GenerateVideoTool implements AgentTool {

    public static final String NAME = "generate_video";

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Generate video",
            "Animate an existing image asset into a short video clip (5 or 10 seconds). "
                    + "Costs credits; the user is asked to approve first.",
            ToolCategory.GENERATION,
            true,
            ToolSchemas.parse("""
                    {
                      "type": "object",
                      "properties": {
                        "imageAssetId": {"type": "string", "description": "Asset whose image is animated"},
                        "prompt":       {"type": "string", "description": "Motion and camera description"},
                        "duration":     {"type": "integer", "enum": [5, 10]}
                      },
                      "required": ["imageAssetId", "prompt"]
                    }
                    """));

    private final JobService   jobService;
    private final ObjectMapper objectMapper;

    public GenerateVideoTool(JobService jobService, ObjectMapper objectMapper) {
        this.jobService   = jobService;
        this.objectMapper = objectMapper;
    }

    /** Requested length rounded to what the renderer produces. */
    static int billedSeconds(int requestedSeconds) {
        return requestedSeconds > 5 ? 10 : 5;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(JsonNode arguments, ToolInvocation invocation) {
        String imageAssetId = arguments.path("imageAssetId").asText("");
        String prompt       = arguments.path("prompt").asText("");
        if (imageAssetId.isBlank() || prompt.isBlank()) {
            return ToolResult.failure("'imageAssetId' and 'prompt' are required");
        }

        ObjectNode input = objectMapper.createObjectNode()
                .put("imageAssetId", imageAssetId)
                .put("prompt", prompt)
                .put("duration", billedSeconds(arguments.path("duration").asInt(5)));

        JobOperationResult<UUID> created = jobService.create(CreateJobCommand.of(
                invocation.userId(), invocation.projectId(), JobType.VIDEO_GENERATION, input));
        if (!created.success()) {
            return ToolResult.failure(created.message());
        }
        ObjectNode data = objectMapper.createObjectNode()
                .put("jobId", created.value().toString())
                .put("type", JobType.VIDEO_GENERATION.wireName());
        return ToolResult.jobCreated(data, created.value().toString());
    }
}
