package com.studioflow.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * A user's chat with the agent inside one project.
 *
 * threadId is the key of the conversation's checkpoints. It is written the
 * first time a turn runs and never changes afterwards.
 *
 * DB table: conversation  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "conversation")
public class Conversation {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConversationStatus status = ConversationStatus.ACTIVE;

    @Column(name = "thread_id")
    private String threadId;

    // Serialized AgentContext captured when the conversation was opened.
    @Column(columnDefinition = "TEXT")
    private String context;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Conversation() {}   // required by JPA

    public Conversation(String id, String projectId, String userId, String title) {
        this.id        = id;
        this.projectId = projectId;
        this.userId    = userId;
        this.title     = title;
    }

    public String             getId()             { return id; }
    public String             getProjectId()      { return projectId; }
    public String             getUserId()         { return userId; }
    public String             getTitle()          { return title; }
    public ConversationStatus getStatus()         { return status; }
    public String             getThreadId()       { return threadId; }
    public String             getContext()        { return context; }
    public Instant            getCreatedAt()      { return createdAt; }
    public Instant            getLastActivityAt() { return lastActivityAt; }

    public void setThreadId(String threadId) { this.threadId = threadId; }
    public void setContext(String context)   { this.context = context; }

    public void setStatus(ConversationStatus status) {
        this.status = status;
        this.lastActivityAt = Instant.now();
    }
}
