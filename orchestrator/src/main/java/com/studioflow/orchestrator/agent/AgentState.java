package com.studioflow.orchestrator.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * State threaded through the agent graph for one thread.
 *
 * The whole object is the checkpoint payload, so it must stay a plain
 * Jackson bean. Bump {@link #SCHEMA_VERSION} when a field changes meaning.
 */
public class AgentState {

    public static final int SCHEMA_VERSION = 1;

    private String             threadId;
    private String             userId;
    private String             projectId;
    private String             conversationId;
    private AgentContext       context;
    private List<AgentMessage> messages   = new ArrayList<>();
    private List<IterationInfo> iterations = new ArrayList<>();
    private int                currentIteration;
    private PendingAction      pendingAction;
    private ApprovalDecision   userApproval;

    public AgentState() {}   // Jackson

    public AgentState(String threadId, String userId, String projectId, String conversationId) {
        this.threadId       = threadId;
        this.userId         = userId;
        this.projectId      = projectId;
        this.conversationId = conversationId;
    }

    /** Last message of the history, or null when empty. */
    public AgentMessage lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    /** Starts a new execution: the iteration log restarts, history is kept. */
    public void beginTurn(String userMessage, AgentContext context) {
        this.context          = context;
        this.iterations       = new ArrayList<>();
        this.currentIteration = 0;
        this.userApproval     = null;
        this.messages.add(AgentMessage.user(userMessage));
    }

    public String              getThreadId()         { return threadId; }
    public String              getUserId()           { return userId; }
    public String              getProjectId()        { return projectId; }
    public String              getConversationId()   { return conversationId; }
    public AgentContext        getContext()          { return context; }
    public List<AgentMessage>  getMessages()         { return messages; }
    public List<IterationInfo> getIterations()       { return iterations; }
    public int                 getCurrentIteration() { return currentIteration; }
    public PendingAction       getPendingAction()    { return pendingAction; }
    public ApprovalDecision    getUserApproval()     { return userApproval; }

    public void setThreadId(String threadId)                 { this.threadId = threadId; }
    public void setUserId(String userId)                     { this.userId = userId; }
    public void setProjectId(String projectId)               { this.projectId = projectId; }
    public void setConversationId(String conversationId)     { this.conversationId = conversationId; }
    public void setContext(AgentContext context)             { this.context = context; }
    public void setMessages(List<AgentMessage> messages)     { this.messages = new ArrayList<>(messages); }
    public void setIterations(List<IterationInfo> iterations) { this.iterations = new ArrayList<>(iterations); }
    public void setCurrentIteration(int currentIteration)    { this.currentIteration = currentIteration; }
    public void setPendingAction(PendingAction pendingAction) { this.pendingAction = pendingAction; }
    public void setUserApproval(ApprovalDecision userApproval) { this.userApproval = userApproval; }
}
