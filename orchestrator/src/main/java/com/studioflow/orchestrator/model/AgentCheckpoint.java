package com.studioflow.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One persisted snapshot of agent state, written after every graph step.
 *
 * (threadId, version) is unique; the highest version of a thread is the
 * resume point. The payload is the JSON-serialised AgentState and is only
 * ever read back by the checkpoint store.
 *
 * DB table: agent_checkpoint  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "agent_checkpoint")
public class AgentCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "thread_id", nullable = false, updatable = false)
    private String threadId;

    @Column(nullable = false, updatable = false)
    private long version;

    // Node the graph executes next when resumed from this snapshot.
    @Column(name = "next_node", nullable = false, updatable = false)
    private String nextNode;

    @Column(name = "schema_version", nullable = false, updatable = false)
    private int schemaVersion;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AgentCheckpoint() {}   // required by JPA

    public AgentCheckpoint(String threadId, long version, String nextNode, int schemaVersion, String payload) {
        this.threadId      = threadId;
        this.version       = version;
        this.nextNode      = nextNode;
        this.schemaVersion = schemaVersion;
        this.payload       = payload;
    }

    public UUID    getId()            { return id; }
    public String  getThreadId()      { return threadId; }
    public long    getVersion()       { return version; }
    public String  getNextNode()      { return nextNode; }
    public int     getSchemaVersion() { return schemaVersion; }
    public String  getPayload()       { return payload; }
    public Instant getCreatedAt()     { return createdAt; }
}
