package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.studioflow.orchestrator.agent.tool.CreditCost;
import com.studioflow.orchestrator.agent.tool.CreditEstimator;
import com.studioflow.orchestrator.agent.tool.ToolDefinition;
import com.studioflow.orchestrator.agent.tool.ToolInvocation;
import com.studioflow.orchestrator.agent.tool.ToolRegistry;
import com.studioflow.orchestrator.agent.tool.ToolResult;
import com.studioflow.orchestrator.model.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The agent state machine.
 *
 * {@link #route} is the transition function: given the node that just ran
 * and the resulting state, it names the next node. {@link #run} applies
 * nodes one at a time and writes a checkpoint (state + next node) after
 * every step, so an execution can stop at WAIT_FOR_APPROVAL and be picked
 * up later from the checkpoint alone. No thread waits across that pause.
 *
 * Failure handling:
 *   - anything thrown while executing a tool becomes a failed tool message
 *   - a {@link ProviderException} from the model ends the execution; the
 *     checkpoint written by the previous step stays the resume point
 */
@Component
public class AgentGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentGraph.class);

    private static final String DEFAULT_REJECTION = "User rejected this action";

    private final ChatModel        model;
    private final ToolRegistry     tools;
    private final CreditEstimator  credits;
    private final ContextCollector contextCollector;
    private final CheckpointStore  checkpoints;
    private final ObjectMapper     objectMapper;
    private final Clock            clock;
    private final int              maxIterations;

    public AgentGraph(ChatModel model,
                      ToolRegistry tools,
                      CreditEstimator credits,
                      ContextCollector contextCollector,
                      CheckpointStore checkpoints,
                      ObjectMapper objectMapper,
                      Clock clock,
                      @Value("${studioflow.agent.max-iterations:20}") int maxIterations) {
        this.model            = model;
        this.tools            = tools;
        this.credits          = credits;
        this.contextCollector = contextCollector;
        this.checkpoints      = checkpoints;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
        this.maxIterations    = maxIterations;
    }

    // ------------------------------------------------------------------
    // Engine
    // ------------------------------------------------------------------

    /**
     * Run from {@code entry} until the model stops calling tools or a gated
     * tool call needs approval.
     *
     * Entering at WAIT_FOR_APPROVAL with {@code userApproval} set is how a
     * suspended execution is resumed.
     */
    public GraphOutcome run(AgentState state, GraphNode entry, AgentStepListener listener) {
        GraphNode node = entry;
        while (node != GraphNode.END) {
            if (node == GraphNode.WAIT_FOR_APPROVAL) {
                if (state.getUserApproval() == null) {
                    log.info("Thread {} waiting for approval of {}", state.getThreadId(),
                            state.getPendingAction() == null ? "?" : state.getPendingAction().functionCall().name());
                    return GraphOutcome.INTERRUPTED;
                }
                node = route(GraphNode.WAIT_FOR_APPROVAL, state);
                continue;
            }

            apply(node, state);
            GraphNode next = route(node, state);
            checkpoints.save(state.getThreadId(), next, state);
            listener.onStep(node, state);
            node = next;
        }
        return GraphOutcome.COMPLETED;
    }

    /** Transition function. Reads the state, never changes it. */
    public static GraphNode route(GraphNode completed, AgentState state) {
        return switch (completed) {
            case COLLECT_CONTEXT -> GraphNode.CALL_MODEL;
            case CALL_MODEL -> {
                AgentMessage last = state.lastMessage();
                yield last != null && last.hasToolCall() ? GraphNode.CHECK_CONFIRMATION : GraphNode.END;
            }
            case CHECK_CONFIRMATION -> state.getPendingAction() != null
                    ? GraphNode.WAIT_FOR_APPROVAL : GraphNode.EXECUTE_TOOL;
            case WAIT_FOR_APPROVAL -> GraphNode.EXECUTE_TOOL;
            case EXECUTE_TOOL -> GraphNode.CALL_MODEL;
            case END -> GraphNode.END;
        };
    }

    private void apply(GraphNode node, AgentState state) {
        switch (node) {
            case COLLECT_CONTEXT    -> collectContext(state);
            case CALL_MODEL         -> callModel(state);
            case CHECK_CONFIRMATION -> checkConfirmation(state);
            case EXECUTE_TOOL       -> executeTool(state);
            default -> throw new IllegalStateException("Node " + node + " has no action");
        }
    }

    // ------------------------------------------------------------------
    // Nodes
    // ------------------------------------------------------------------

    /** Builds the system message once per thread; later turns reuse it. */
    void collectContext(AgentState state) {
        if (state.getMessages().stream().anyMatch(m -> m.role() == MessageRole.SYSTEM)) {
            return;
        }
        state.getMessages().add(0, contextCollector.systemMessage(state));
    }

    void callModel(AgentState state) {
        if (state.getCurrentIteration() >= maxIterations) {
            log.warn("Thread {} hit the iteration limit ({})", state.getThreadId(), maxIterations);
            state.getMessages().add(AgentMessage.assistant(
                    "I stopped after " + maxIterations + " steps. Tell me how you would like to continue.", null));
            return;
        }

        ModelReply reply = model.complete(List.copyOf(state.getMessages()), tools.definitions());

        ToolCall call = reply.toolCall();
        if (call != null) {
            String id = call.id() != null ? call.id() : "fc-" + UUID.randomUUID();
            JsonNode args = call.arguments() != null ? call.arguments() : objectMapper.createObjectNode();
            call = new ToolCall(id, call.name(), args);
        }
        int iteration = state.getCurrentIteration() + 1;
        state.getMessages().add(AgentMessage.assistant(reply.content(), call));
        state.getIterations().add(new IterationInfo(
                "iter-" + UUID.randomUUID(), iteration, reply.content(), null, clock.instant()));
        state.setCurrentIteration(iteration);
    }

    /** Builds the pending action for gated tools; ungated and unknown tools pass straight through. */
    void checkConfirmation(AgentState state) {
        ToolCall call = state.lastMessage().toolCall();
        Optional<ToolDefinition> found = tools.find(call.name());
        if (found.isEmpty() || !found.get().requiresConfirmation()) {
            return;
        }
        ToolDefinition def = found.get();

        CreditCost cost = null;
        try {
            cost = credits.estimate(call);
        } catch (RuntimeException e) {
            log.warn("Credit estimate failed for {}: {}", call.name(), e.getMessage());
        }

        String content = state.lastMessage().content();
        String message = content != null && !content.isBlank() ? content : "Ready to run: " + def.displayName();
        state.setPendingAction(new PendingAction(
                "action-" + UUID.randomUUID(),
                new PendingAction.FunctionCall(call.id(), call.name(), def.displayName(),
                        call.arguments(), def.category().wireName()),
                message,
                cost,
                clock.instant()));
        markLastIteration(state, functionCall(call, found, FunctionCallStatus.PENDING, null, null));
    }

    void executeTool(AgentState state) {
        ToolCall call = state.lastMessage().toolCall();
        Optional<ToolDefinition> def = tools.find(call.name());
        ApprovalDecision approval = state.getUserApproval();

        ObjectNode content = objectMapper.createObjectNode();
        if (approval != null && !approval.approved()) {
            String reason = approval.reason() != null && !approval.reason().isBlank()
                    ? approval.reason() : DEFAULT_REJECTION;
            content.put("success", false).put("error", reason).put("userRejected", true);
            markLastIteration(state, functionCall(call, def, FunctionCallStatus.FAILED, null, reason));
            log.info("Tool {} rejected by user: {}", call.name(), reason);
        } else {
            ToolResult result;
            try {
                result = tools.execute(call.name(), call.arguments(),
                        new ToolInvocation(state.getUserId(), state.getProjectId(), call.id()));
            } catch (RuntimeException e) {
                log.warn("Tool {} threw: {}", call.name(), e.getMessage(), e);
                result = ToolResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            content.put("success", result.success());
            if (result.data() != null) {
                content.set("data", result.data());
            }
            if (result.error() != null) {
                content.put("error", result.error());
            }
            if (result.jobId() != null) {
                content.put("jobId", result.jobId());
            }
            markLastIteration(state, functionCall(call, def,
                    result.success() ? FunctionCallStatus.COMPLETED : FunctionCallStatus.FAILED,
                    result.success() ? "ok" : null,
                    result.error()));
        }

        state.getMessages().add(AgentMessage.tool(call.id(), content.toString()));
        state.setPendingAction(null);
        state.setUserApproval(null);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static IterationInfo.FunctionCall functionCall(ToolCall call, Optional<ToolDefinition> def,
                                                           FunctionCallStatus status, String result, String error) {
        return new IterationInfo.FunctionCall(
                call.id(),
                call.name(),
                def.map(ToolDefinition::displayName).orElse(call.name()),
                def.map(ToolDefinition::description).orElse(null),
                def.map(d -> d.category().wireName()).orElse("unknown"),
                status,
                result,
                error);
    }

    private static void markLastIteration(AgentState state, IterationInfo.FunctionCall call) {
        List<IterationInfo> iterations = state.getIterations();
        if (!iterations.isEmpty()) {
            int last = iterations.size() - 1;
            iterations.set(last, iterations.get(last).withFunctionCall(call));
        }
    }
}
