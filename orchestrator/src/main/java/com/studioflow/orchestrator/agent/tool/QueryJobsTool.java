package com.studioflow.orchestrator.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read-only: lists the user's jobs in the current project so the model can
 * report progress or pick a job to cancel.
 */
@Component
public class QueryJobsTool implements AgentTool {

    public static final String NAME = "query_jobs";
    private static final int MAX_RESULTS = 20;

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Query jobs",
            "List the user's recent generation jobs in this project with their status and progress.",
            ToolCategory.READ,
            false,
            ToolSchemas.parse("""
                    {
                      "type": "object",
                      "properties": {
                        "status": {
                          "type": "string",
                          "enum": ["active", "pending", "processing", "completed", "failed", "cancelled"],
                          "description": "Only jobs in this status; 'active' means pending or processing"
                        },
                        "limit": {"type": "integer", "minimum": 1, "maximum": 20}
                      }
                    }
                    """));

    private final JobService   jobService;
    private final ObjectMapper objectMapper;

    public QueryJobsTool(JobService jobService, ObjectMapper objectMapper) {
        this.jobService   = jobService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(JsonNode arguments, ToolInvocation invocation) {
        Collection<JobStatus> statuses;
        String status = arguments.path("status").asText("");
        try {
            statuses = switch (status) {
                case "" -> List.of();
                case "active" -> JobStatus.ACTIVE;
                default -> Set.of(JobStatus.fromWireName(status));
            };
        } catch (IllegalArgumentException e) {
            return ToolResult.failure("Unknown status: " + status);
        }
        int limit = Math.min(MAX_RESULTS, Math.max(1, arguments.path("limit").asInt(10)));

        JobOperationResult<List<Job>> found =
                jobService.list(invocation.userId(), statuses, invocation.projectId(), limit);
        if (!found.success()) {
            return ToolResult.failure(found.message());
        }

        ObjectNode data = objectMapper.createObjectNode();
        ArrayNode jobs = data.putArray("jobs");
        for (Job job : found.value()) {
            ObjectNode node = jobs.addObject();
            node.put("id", job.getId().toString());
            node.put("type", job.getType().wireName());
            node.put("status", job.getStatus().wireName());
            node.put("progress", job.getProgress());
            if (job.getProgressMessage() != null) {
                node.put("progressMessage", job.getProgressMessage());
            }
            if (job.getErrorMessage() != null) {
                node.put("errorMessage", job.getErrorMessage());
            }
            node.put("createdAt", job.getCreatedAt().toString());
        }
        data.put("count", found.value().size());
        return ToolResult.ok(data);
    }
}
