package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class CancelJobTool implements AgentTool {

    public static final String NAME = "cancel_job";

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Cancel job",
            "Cancel one of the user's pending or running jobs.",
            ToolCategory.MODIFICATION,
            true,
            ToolSchemas.parse("""
                    {
                      "type": "object",
                      "properties": {
                        "jobId": {"type": "string", "description": "Id returned by query_jobs"}
                      },
                      "required": ["jobId"]
                    }
                    """));

    private final JobService   jobService;
    private final ObjectMapper objectMapper;

    public CancelJobTool(JobService jobService, ObjectMapper objectMapper) {
        this.jobService   = jobService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(JsonNode arguments, ToolInvocation invocation) {
        UUID jobId;
        try {
            jobId = UUID.fromString(arguments.path("jobId").asText(""));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure("'jobId' is not a valid job id");
        }
        JobOperationResult<Job> cancelled = jobService.cancel(invocation.userId(), jobId);
        if (!cancelled.success()) {
            return ToolResult.failure(cancelled.message());
        }
        return ToolResult.ok(objectMapper.createObjectNode()
                .put("jobId", jobId.toString())
                .put("status", cancelled.value().getStatus().wireName()));
    }
}
