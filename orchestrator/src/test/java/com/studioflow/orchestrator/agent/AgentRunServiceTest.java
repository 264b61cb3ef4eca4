package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.agent.tool.CreditEstimator;
import com.studioflow.orchestrator.agent.tool.ToolCategory;
import com.studioflow.orchestrator.agent.tool.ToolRegistry;
import com.studioflow.orchestrator.agent.tool.ToolResult;
import com.studioflow.orchestrator.model.Conversation;
import com.studioflow.orchestrator.model.ConversationMessage;
import com.studioflow.orchestrator.model.ConversationStatus;
import com.studioflow.orchestrator.model.MessageRole;
import com.studioflow.orchestrator.repository.ConversationMessageRepository;
import com.studioflow.orchestrator.repository.ConversationRepository;
import com.studioflow.orchestrator.stream.AgentEvent;
import com.studioflow.orchestrator.stream.EventSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end agent executions over the real graph, with the model scripted
 * and conversations kept in maps behind mocked repositories.
 */
class AgentRunServiceTest {

    static final AgentContext CONTEXT = new AgentContext("p1", "storyboard", List.of());
    static final String THREAD = "p1_c1";

    final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    ScriptedChatModel       model;
    InMemoryCheckpointStore checkpoints;
    FakeTool                generateAssets;
    Map<String, Conversation>      conversationRows = new HashMap<>();
    List<ConversationMessage>      messageRows      = new ArrayList<>();
    AgentRunService service;

    @BeforeEach
    void setUp() throws Exception {
        model = new ScriptedChatModel();
        checkpoints = new InMemoryCheckpointStore(objectMapper);
        generateAssets = new FakeTool("generate_assets", ToolCategory.GENERATION, true,
                args -> ToolResult.jobCreated(objectMapper.createObjectNode(), "job-1"));

        ContextCollector context = mock(ContextCollector.class);
        when(context.systemMessage(any())).thenReturn(AgentMessage.system("system"));
        AgentGraph graph = new AgentGraph(model,
                new ToolRegistry(List.of(generateAssets), new SimpleMeterRegistry()),
                new CreditEstimator(), context, checkpoints, objectMapper, Clock.systemUTC(), 20);

        ConversationRepository conversations = mock(ConversationRepository.class);
        when(conversations.save(any())).thenAnswer(inv -> {
            Conversation c = inv.getArgument(0);
            conversationRows.put(c.getId(), c);
            return c;
        });
        when(conversations.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(conversationRows.get(inv.<String>getArgument(0))));
        when(conversations.findByIdAndUserId(anyString(), anyString())).thenAnswer(inv ->
                Optional.ofNullable(conversationRows.get(inv.<String>getArgument(0)))
                        .filter(c -> c.getUserId().equals(inv.getArgument(1))));

        ConversationMessageRepository messages = mock(ConversationMessageRepository.class);
        when(messages.save(any())).thenAnswer(inv -> {
            ConversationMessage m = inv.getArgument(0);
            if (m.getId() == null) {
                var f = ConversationMessage.class.getDeclaredField("id");
                f.setAccessible(true);
                f.set(m, UUID.randomUUID());
                messageRows.add(m);
            }
            return m;
        });

        service = new AgentRunService(graph, checkpoints, conversations, messages, objectMapper, 1, 1);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private RecordingSink turn(String user, String message) {
        RecordingSink sink = new RecordingSink();
        service.runTurn(user, "c1", message, CONTEXT, sink);
        return sink;
    }

    private RecordingSink resume(String user, boolean approved) {
        RecordingSink sink = new RecordingSink();
        service.runResume(user, THREAD, new ApprovalDecision(approved, null), sink);
        return sink;
    }

    // ------------------------------------------------------------------
    // New turns
    // ------------------------------------------------------------------

    @Test
    void turn_plainAnswer_streamsIdsStateAndDone() {
        model.reply("Hello there");

        RecordingSink sink = turn("u1", "hi");

        assertThat(sink.types()).containsExactly("user_message_id", "assistant_message_id",
                "state_update", "state_update", "complete");
        assertThat(sink.last().data()).isEqualTo(AgentEvent.DONE);
        assertThat(sink.completed).isEqualTo(1);

        Conversation conversation = conversationRows.get("c1");
        assertThat(conversation.getStatus()).isEqualTo(ConversationStatus.COMPLETED);
        assertThat(conversation.getThreadId()).isEqualTo(THREAD);
        assertThat(conversation.getTitle()).isEqualTo("hi");
        ConversationMessage assistant = messageRows.get(1);
        assertThat(assistant.getRole()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(assistant.getContent()).isEqualTo("Hello there");
        assertThat(assistant.getIterations()).contains("Hello there");
    }

    @Test
    void turn_gatedTool_interruptsAndMarksConversationAwaitingApproval() throws Exception {
        model.call("Making it.", new ToolCall("call-1", "generate_assets", objectMapper.readTree("{}")));

        RecordingSink sink = turn("u1", "make an image");

        assertThat(sink.types()).endsWith("interrupt", "complete");
        assertThat(sink.last().data()).isEqualTo(AgentEvent.PENDING_CONFIRMATION);
        AgentEvent.Interrupt interrupt = (AgentEvent.Interrupt) sink.events.get(sink.events.size() - 2).data();
        assertThat(interrupt.action()).isEqualTo("approval_required");
        assertThat(interrupt.threadId()).isEqualTo(THREAD);
        assertThat(interrupt.pendingAction().functionCall().name()).isEqualTo("generate_assets");
        assertThat(conversationRows.get("c1").getStatus()).isEqualTo(ConversationStatus.AWAITING_APPROVAL);
        assertThat(generateAssets.invocations).isEmpty();
        assertThat(sink.completed).isEqualTo(1);
    }

    @Test
    void turn_whileApprovalPending_isRefused() throws Exception {
        model.call(null, new ToolCall("call-1", "generate_assets", objectMapper.readTree("{}")));
        turn("u1", "make an image");

        RecordingSink second = turn("u1", "never mind, something else");

        assertThat(second.types()).containsExactly("error");
        assertThat(second.completed).isEqualTo(1);
        assertThat(model.calls()).isEqualTo(1);
    }

    @Test
    void turn_providerFails_genericErrorAndConversationClosed() {
        model.fail(new ProviderException(500, "internal"));

        RecordingSink sink = turn("u1", "hi");

        assertThat(sink.last().type()).isEqualTo("error");
        assertThat(sink.last().data()).isEqualTo(AgentRunService.GENERIC_ERROR);
        assertThat(sink.completed).isEqualTo(1);
        assertThat(conversationRows.get("c1").getStatus()).isEqualTo(ConversationStatus.COMPLETED);
    }

    @Test
    void turn_conversationOfAnotherUser_isRefused() {
        conversationRows.put("c1", new Conversation("c1", "p1", "someone-else", "theirs"));

        RecordingSink sink = turn("u1", "hi");

        assertThat(sink.types()).containsExactly("error");
        assertThat(model.calls()).isZero();
    }

    @Test
    void turn_projectIdWithSeparator_isRefused() {
        RecordingSink sink = new RecordingSink();

        service.runTurn("u1", "c1", "hi", new AgentContext("bad_project", null, null), sink);

        assertThat(sink.types()).containsExactly("error");
        assertThat(sink.completed).isEqualTo(1);
    }

    @Test
    void turn_clientGone_executionStillFinishes() {
        model.reply("done anyway");
        RecordingSink sink = new RecordingSink();
        sink.broken = true;

        service.runTurn("u1", "c1", "hi", CONTEXT, sink);

        assertThat(conversationRows.get("c1").getStatus()).isEqualTo(ConversationStatus.COMPLETED);
        assertThat(messageRows.get(1).getContent()).isEqualTo("done anyway");
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    @Test
    void resume_approved_runsToolOnceAndSecondResumeIsRefused() throws Exception {
        model.call(null, new ToolCall("call-1", "generate_assets", objectMapper.readTree("{}")))
             .reply("Queued.");
        turn("u1", "make an image");

        RecordingSink first = resume("u1", true);
        RecordingSink second = resume("u1", true);

        assertThat(first.types()).startsWith("assistant_message_id").endsWith("complete");
        assertThat(first.last().data()).isEqualTo(AgentEvent.DONE);
        assertThat(generateAssets.invocations).hasSize(1);
        assertThat(conversationRows.get("c1").getStatus()).isEqualTo(ConversationStatus.COMPLETED);

        assertThat(second.types()).containsExactly("error");
        assertThat(second.last().data()).isEqualTo("No action is awaiting approval");
        assertThat(generateAssets.invocations).hasSize(1);
    }

    @Test
    void resume_rejected_completesWithoutRunningTool() throws Exception {
        model.call(null, new ToolCall("call-1", "generate_assets", objectMapper.readTree("{}")))
             .reply("Understood, skipped.");
        turn("u1", "make an image");

        RecordingSink sink = resume("u1", false);

        assertThat(sink.last().data()).isEqualTo(AgentEvent.DONE);
        assertThat(generateAssets.invocations).isEmpty();
    }

    @Test
    void resume_byAnotherUser_isRefused() throws Exception {
        model.call(null, new ToolCall("call-1", "generate_assets", objectMapper.readTree("{}")));
        turn("u1", "make an image");

        RecordingSink sink = resume("intruder", true);

        assertThat(sink.types()).containsExactly("error");
        assertThat(generateAssets.invocations).isEmpty();
        assertThat(checkpoints.latest(THREAD).orElseThrow().awaitingApproval()).isTrue();
    }

    @Test
    void resume_malformedThreadId_isRefused() {
        RecordingSink sink = new RecordingSink();

        service.runResume("u1", "no-separator", new ApprovalDecision(true, null), sink);

        assertThat(sink.types()).containsExactly("error");
        assertThat(sink.completed).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Saturation
    // ------------------------------------------------------------------

    @Test
    void streamTurn_poolAndQueueFull_refusedWithBusyError() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RecordingSink stuck = new RecordingSink() {
            @Override
            public void send(AgentEvent event) throws IOException {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.send(event);
            }
        };
        RecordingSink refused = new RecordingSink();
        try {
            service.streamTurn("u1", "c1", "one", CONTEXT, stuck);                 // occupies the only slot
            service.streamTurn("u1", "c2", "two", CONTEXT, new RecordingSink());   // fills the queue
            service.streamTurn("u1", "c3", "three", CONTEXT, refused);
        } finally {
            release.countDown();
        }

        assertThat(refused.types()).containsExactly("error");
        assertThat(refused.last().data()).isEqualTo(AgentRunService.BUSY_ERROR);
        assertThat(refused.completed).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static class RecordingSink implements EventSink<AgentEvent> {
        final List<AgentEvent> events = new ArrayList<>();
        int completed;
        boolean broken;

        @Override
        public void send(AgentEvent event) throws IOException {
            if (broken) {
                throw new IOException("Broken pipe");
            }
            events.add(event);
        }

        @Override
        public void complete() {
            completed++;
        }

        List<String> types() {
            return events.stream().map(AgentEvent::type).toList();
        }

        AgentEvent last() {
            return events.get(events.size() - 1);
        }
    }
}
