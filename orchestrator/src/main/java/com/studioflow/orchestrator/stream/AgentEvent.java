package com.studioflow.orchestrator.stream;

import com.studioflow.orchestrator.agent.IterationInfo;
import com.studioflow.orchestrator.agent.PendingAction;

import java.util.List;

/** One line of the agent event stream: {"type":..., "data":...}. */
public record AgentEvent(String type, Object data) {

    public record StateUpdate(List<IterationInfo> iterations, int currentIteration, PendingAction pendingAction) {}

    public record Interrupt(String action, PendingAction pendingAction, String threadId) {}

    public static final String DONE                 = "done";
    public static final String PENDING_CONFIRMATION = "pending_confirmation";

    public static AgentEvent userMessageId(String id) {
        return new AgentEvent("user_message_id", id);
    }

    public static AgentEvent assistantMessageId(String id) {
        return new AgentEvent("assistant_message_id", id);
    }

    public static AgentEvent stateUpdate(List<IterationInfo> iterations, int currentIteration, PendingAction pending) {
        return new AgentEvent("state_update", new StateUpdate(List.copyOf(iterations), currentIteration, pending));
    }

    public static AgentEvent interrupt(PendingAction pending, String threadId) {
        return new AgentEvent("interrupt", new Interrupt("approval_required", pending, threadId));
    }

    public static AgentEvent complete(String outcome) {
        return new AgentEvent("complete", outcome);
    }

    public static AgentEvent error(String message) {
        return new AgentEvent("error", message);
    }
}
