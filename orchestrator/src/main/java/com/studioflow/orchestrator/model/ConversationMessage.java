package com.studioflow.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A message shown in the conversation UI.
 *
 * These rows are the user-facing transcript; the model-facing history lives
 * in the agent checkpoint. An assistant row is created empty when an
 * execution starts (its id is streamed to the client) and filled in with
 * the final reply and iteration log when the execution ends or suspends.
 *
 * DB table: conversation_message  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "conversation_message")
public class ConversationMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "conversation_id", nullable = false, updatable = false)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private MessageRole role;

    @Column(columnDefinition = "TEXT")
    private String content;

    // JSON array of IterationInfo, written for assistant rows.
    @Column(columnDefinition = "TEXT")
    private String iterations;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ConversationMessage() {}   // required by JPA

    public ConversationMessage(String conversationId, MessageRole role, String content) {
        this.conversationId = conversationId;
        this.role           = role;
        this.content        = content;
    }

    public UUID        getId()             { return id; }
    public String      getConversationId() { return conversationId; }
    public MessageRole getRole()           { return role; }
    public String      getContent()        { return content; }
    public String      getIterations()     { return iterations; }
    public Instant     getCreatedAt()      { return createdAt; }

    public void setContent(String content)       { this.content = content; }
    public void setIterations(String iterations) { this.iterations = iterations; }
}
