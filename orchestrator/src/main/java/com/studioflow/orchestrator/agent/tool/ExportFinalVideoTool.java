package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.model.JobType;
import com.studioflow.orchestrator.service.CreateJobCommand;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

@Component
public class ExportFinalVideoTool implements AgentTool {

    public static final String NAME = "export_final_video";
    private static final Set<String> RESOLUTIONS = Set.of("720p", "1080p");

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Export final video",
            "Render the project's timeline into the final video file.",
            ToolCategory.GENERATION,
            true,
            ToolSchemas.parse("""
                    {
                      "type": "object",
                      "properties": {
                        "resolution":       {"type": "string", "enum": ["720p", "1080p"]},
                        "includeSubtitles": {"type": "boolean"}
                      }
                    }
                    """));

    private final JobService   jobService;
    private final ObjectMapper objectMapper;

    public ExportFinalVideoTool(JobService jobService, ObjectMapper objectMapper) {
        this.jobService   = jobService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(JsonNode arguments, ToolInvocation invocation) {
        if (invocation.projectId() == null) {
            return ToolResult.failure("No project is open");
        }
        String resolution = arguments.path("resolution").asText("1080p");
        if (!RESOLUTIONS.contains(resolution)) {
            return ToolResult.failure("Unsupported resolution: " + resolution);
        }
        ObjectNode input = objectMapper.createObjectNode()
                .put("projectId", invocation.projectId())
                .put("resolution", resolution)
                .put("includeSubtitles", arguments.path("includeSubtitles").asBoolean(true));

        JobOperationResult<UUID> created = jobService.create(CreateJobCommand.of(
                invocation.userId(), invocation.projectId(), JobType.FINAL_VIDEO_EXPORT, input));
        if (!created.success()) {
            return ToolResult.failure(created.message());
        }
        ObjectNode data = objectMapper.createObjectNode()
                .put("jobId", created.value().toString())
                .put("type", JobType.FINAL_VIDEO_EXPORT.wireName());
        return ToolResult.jobCreated(data, created.value().toString());
    }
}
