package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.Conversation;
import com.studioflow.orchestrator.model.ConversationMessage;
import com.studioflow.orchestrator.model.ConversationStatus;
import com.studioflow.orchestrator.model.MessageRole;
import com.studioflow.orchestrator.repository.ConversationMessageRepository;
import com.studioflow.orchestrator.repository.ConversationRepository;
import com.studioflow.orchestrator.stream.AgentEvent;
import com.studioflow.orchestrator.stream.EventSink;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs agent executions and narrates them to an {@link EventSink}.
 *
 * A new turn appends the user's message to the thread and runs the graph
 * from the top. A resume applies the user's approval decision to the latest
 * checkpoint and continues after WAIT_FOR_APPROVAL. Either way the stream
 * ends exactly once: after complete, after interrupt + complete, or after
 * an error.
 *
 * Executions of one thread never overlap inside this process; a second
 * request while one is running is refused rather than queued.
 *
 * At most {@code concurrency} executions run at once and at most
 * {@code queue-capacity} wait for a slot. Beyond that the request gets an
 * error event straight away.
 */
@Service
public class AgentRunService {

    private static final Logger log = LoggerFactory.getLogger(AgentRunService.class);

    static final String GENERIC_ERROR = "The assistant ran into a problem. Please try again.";
    static final String BUSY_ERROR    = "The assistant is busy right now. Please try again in a moment.";
    private static final int TITLE_LENGTH = 50;

    private final AgentGraph                    graph;
    private final CheckpointStore               checkpoints;
    private final ConversationRepository        conversations;
    private final ConversationMessageRepository messages;
    private final ObjectMapper                  objectMapper;
    private final ThreadPoolExecutor            executor;
    private final Set<String>                   running = ConcurrentHashMap.newKeySet();

    public AgentRunService(AgentGraph graph,
                           CheckpointStore checkpoints,
                           ConversationRepository conversations,
                           ConversationMessageRepository messages,
                           ObjectMapper objectMapper,
                           @Value("${studioflow.agent.concurrency:8}") int concurrency,
                           @Value("${studioflow.agent.queue-capacity:32}") int queueCapacity) {
        this.graph         = graph;
        this.checkpoints   = checkpoints;
        this.conversations = conversations;
        this.messages      = messages;
        this.objectMapper  = objectMapper;
        this.executor      = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    // ------------------------------------------------------------------
    // Entry points used by the HTTP layer (return immediately)
    // ------------------------------------------------------------------

    public void streamTurn(String userId, String conversationId, String message,
                           AgentContext context, EventSink<AgentEvent> sink) {
        submit(() -> runTurn(userId, conversationId, message, context, sink), sink);
    }

    public void streamResume(String userId, String threadId, ApprovalDecision decision,
                             EventSink<AgentEvent> sink) {
        submit(() -> runResume(userId, threadId, decision, sink), sink);
    }

    private void submit(Runnable execution, EventSink<AgentEvent> sink) {
        try {
            executor.execute(execution);
        } catch (RejectedExecutionException e) {
            log.warn("Agent execution refused: {} running, {} waiting",
                    executor.getActiveCount(), executor.getQueue().size());
            emit(sink, AgentEvent.error(BUSY_ERROR));
            sink.complete();
        }
    }

    // ------------------------------------------------------------------
    // Synchronous executions
    // ------------------------------------------------------------------

    /** New conversation turn; threadId is derived from (projectId, conversationId). */
    public void runTurn(String userId, String conversationId, String message,
                        AgentContext context, EventSink<AgentEvent> sink) {
        String threadId;
        try {
            threadId = ThreadIds.of(context == null ? null : context.projectId(), conversationId);
        } catch (IllegalArgumentException e) {
            emit(sink, AgentEvent.error(e.getMessage()));
            sink.complete();
            return;
        }
        if (!running.add(threadId)) {
            emit(sink, AgentEvent.error("This conversation is already running"));
            sink.complete();
            return;
        }

        MDC.put("threadId", threadId);
        MDC.put("conversationId", conversationId);
        try {
            Conversation conversation = openConversation(userId, context, conversationId, message, threadId);

            Optional<Checkpoint> latest = checkpoints.latest(threadId);
            if (latest.isPresent() && latest.get().awaitingApproval()) {
                throw new ResumeRejectedException("Approve or reject the pending action first");
            }
            AgentState state = latest.map(Checkpoint::state)
                    .orElseGet(() -> new AgentState(threadId, userId, context.projectId(), conversationId));
            state.beginTurn(message, context);

            ConversationMessage userRow = messages.save(
                    new ConversationMessage(conversationId, MessageRole.USER, message));
            emit(sink, AgentEvent.userMessageId(userRow.getId().toString()));

            log.info("Agent turn started on thread {}", threadId);
            execute(state, GraphNode.COLLECT_CONTEXT, conversation, sink);
        } catch (ResumeRejectedException e) {
            log.info("Turn refused on thread {}: {}", threadId, e.getMessage());
            emit(sink, AgentEvent.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Could not start agent turn on thread {}: {}", threadId, e.getMessage(), e);
            emit(sink, AgentEvent.error(GENERIC_ERROR));
        } finally {
            running.remove(threadId);
            sink.complete();
            MDC.remove("threadId");
            MDC.remove("conversationId");
        }
    }

    /**
     * Resume after an interrupt. Only the latest checkpoint is consulted; if it
     * is not waiting for approval (already resumed, or never suspended) the
     * request is refused and no tool runs.
     */
    public void runResume(String userId, String threadId, ApprovalDecision decision,
                          EventSink<AgentEvent> sink) {
        String conversationId;
        try {
            conversationId = ThreadIds.conversationId(threadId);
        } catch (IllegalArgumentException e) {
            emit(sink, AgentEvent.error(e.getMessage()));
            sink.complete();
            return;
        }
        if (!running.add(threadId)) {
            emit(sink, AgentEvent.error("This conversation is already running"));
            sink.complete();
            return;
        }

        MDC.put("threadId", threadId);
        MDC.put("conversationId", conversationId);
        try {
            Conversation conversation = conversations.findByIdAndUserId(conversationId, userId)
                    .filter(c -> threadId.equals(c.getThreadId()))
                    .orElseThrow(() -> new ResumeRejectedException("Conversation not found"));
            Checkpoint checkpoint = checkpoints.latest(threadId)
                    .filter(Checkpoint::awaitingApproval)
                    .orElseThrow(() -> new ResumeRejectedException("No action is awaiting approval"));

            AgentState state = checkpoint.state();
            state.setUserApproval(decision);
            log.info("Resuming thread {} from checkpoint v{} ({})", threadId, checkpoint.version(),
                    decision.approved() ? "approved" : "rejected");
            execute(state, GraphNode.WAIT_FOR_APPROVAL, conversation, sink);
        } catch (ResumeRejectedException e) {
            log.info("Resume refused on thread {}: {}", threadId, e.getMessage());
            emit(sink, AgentEvent.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Could not resume thread {}: {}", threadId, e.getMessage(), e);
            emit(sink, AgentEvent.error(GENERIC_ERROR));
        } finally {
            running.remove(threadId);
            sink.complete();
            MDC.remove("threadId");
            MDC.remove("conversationId");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void execute(AgentState state, GraphNode entry, Conversation conversation, EventSink<AgentEvent> sink) {
        ConversationMessage assistantRow = messages.save(
                new ConversationMessage(conversation.getId(), MessageRole.ASSISTANT, ""));
        emit(sink, AgentEvent.assistantMessageId(assistantRow.getId().toString()));
        updateStatus(conversation, ConversationStatus.ACTIVE);

        try {
            GraphOutcome outcome = graph.run(state, entry, (node, s) ->
                    emit(sink, AgentEvent.stateUpdate(s.getIterations(), s.getCurrentIteration(), s.getPendingAction())));

            assistantRow.setIterations(toJson(state));
            if (outcome == GraphOutcome.INTERRUPTED) {
                assistantRow.setContent(state.getPendingAction().message());
                messages.save(assistantRow);
                updateStatus(conversation, ConversationStatus.AWAITING_APPROVAL);
                emit(sink, AgentEvent.interrupt(state.getPendingAction(), state.getThreadId()));
                emit(sink, AgentEvent.complete(AgentEvent.PENDING_CONFIRMATION));
            } else {
                assistantRow.setContent(finalReply(state));
                messages.save(assistantRow);
                updateStatus(conversation, ConversationStatus.COMPLETED);
                emit(sink, AgentEvent.complete(AgentEvent.DONE));
            }
        } catch (RuntimeException e) {
            // ProviderException lands here too; the last checkpoint stays the resume point.
            log.error("Agent execution failed on thread {}: {}", state.getThreadId(), e.getMessage(), e);
            updateStatus(conversation, ConversationStatus.COMPLETED);
            emit(sink, AgentEvent.error(GENERIC_ERROR));
        }
    }

    private Conversation openConversation(String userId, AgentContext context, String conversationId,
                                          String message, String threadId) {
        Optional<Conversation> existing = conversations.findById(conversationId);
        if (existing.isPresent()) {
            Conversation c = existing.get();
            if (!c.getUserId().equals(userId) || !c.getProjectId().equals(context.projectId())) {
                throw new ResumeRejectedException("Conversation not found");
            }
            if (c.getThreadId() == null) {
                c.setThreadId(threadId);
            }
            c.setContext(writeJson(context));
            return conversations.save(c);
        }
        String title = message.length() > TITLE_LENGTH ? message.substring(0, TITLE_LENGTH) + "…" : message;
        Conversation created = new Conversation(conversationId, context.projectId(), userId, title);
        created.setThreadId(threadId);
        created.setContext(writeJson(context));
        return conversations.save(created);
    }

    private void updateStatus(Conversation conversation, ConversationStatus status) {
        try {
            conversation.setStatus(status);
            conversations.save(conversation);
        } catch (RuntimeException e) {
            log.warn("Could not set conversation {} to {}: {}", conversation.getId(), status, e.getMessage());
        }
    }

    private static String finalReply(AgentState state) {
        AgentMessage last = state.lastMessage();
        return last != null && last.role() == MessageRole.ASSISTANT && last.content() != null ? last.content() : "";
    }

    private String toJson(AgentState state) {
        return writeJson(state.getIterations());
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + value.getClass().getSimpleName(), e);
        }
    }

    /** The execution carries on when the client has gone; its result is in the checkpoint and the message rows. */
    private static void emit(EventSink<AgentEvent> sink, AgentEvent event) {
        try {
            sink.send(event);
        } catch (IOException | IllegalStateException e) {
            log.debug("Agent stream client gone, dropped {}: {}", event.type(), e.getMessage());
        }
    }
}
