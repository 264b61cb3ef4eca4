package com.studioflow.orchestrator.agent;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.service.JobOperationResult;
import com.studioflow.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the system message of a thread from the editor context and the
 * user's jobs that are still running in the project.
 */
@Component
public class ContextCollector {

    private static final Logger log = LoggerFactory.getLogger(ContextCollector.class);
    private static final int MAX_ACTIVE_JOBS = 10;

    private final JobService   jobService;
    private final AgentPrompts prompts;

    public ContextCollector(JobService jobService, AgentPrompts prompts) {
        this.jobService = jobService;
        this.prompts    = prompts;
    }

    public AgentMessage systemMessage(AgentState state) {
        return AgentMessage.system(prompts.system(describe(state)));
    }

    String describe(AgentState state) {
        StringBuilder sb = new StringBuilder();
        sb.append("Project: ").append(state.getProjectId()).append('\n');

        AgentContext ctx = state.getContext();
        if (ctx != null) {
            if (ctx.activeView() != null) {
                sb.append("Open view: ").append(ctx.activeView()).append('\n');
            }
            if (!ctx.selectedAssetIds().isEmpty()) {
                sb.append("Selected assets: ").append(String.join(", ", ctx.selectedAssetIds())).append('\n');
            }
        }

        JobOperationResult<List<Job>> active =
                jobService.list(state.getUserId(), JobStatus.ACTIVE, state.getProjectId(), MAX_ACTIVE_JOBS);
        if (!active.success()) {
            // Context is best effort; the model can still call query_jobs.
            log.warn("Could not load active jobs for context: {}", active.message());
        } else if (active.value().isEmpty()) {
            sb.append("Running jobs: none\n");
        } else {
            sb.append("Running jobs:\n");
            for (Job job : active.value()) {
                sb.append("  - ").append(job.getId()).append(' ')
                  .append(job.getType().wireName()).append(' ')
                  .append(job.getStatus().wireName()).append(' ')
                  .append(job.getProgress()).append("%\n");
            }
        }
        return sb.toString();
    }
}
