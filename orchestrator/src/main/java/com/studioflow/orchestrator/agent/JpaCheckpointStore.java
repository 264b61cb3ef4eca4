package com.studioflow.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.AgentCheckpoint;
import com.studioflow.orchestrator.repository.AgentCheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checkpoints in the agent_checkpoint table, one row per step.
 *
 * (thread_id, version) is unique, so two executions of the same thread
 * racing to write the same version fail loudly instead of interleaving.
 */
@Component
public class JpaCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCheckpointStore.class);

    private final AgentCheckpointRepository repo;
    private final ObjectMapper              objectMapper;

    public JpaCheckpointStore(AgentCheckpointRepository repo, ObjectMapper objectMapper) {
        this.repo         = repo;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(String threadId, GraphNode nextNode, AgentState state) {
        long version = repo.findFirstByThreadIdOrderByVersionDesc(threadId)
                .map(AgentCheckpoint::getVersion)
                .orElse(0L) + 1;
        String payload;
        try {
            payload = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise agent state for " + threadId, e);
        }
        repo.save(new AgentCheckpoint(threadId, version, nextNode.name(), AgentState.SCHEMA_VERSION, payload));
        log.debug("Checkpoint {} v{} → {}", threadId, version, nextNode);
    }

    @Override
    public Optional<Checkpoint> latest(String threadId) {
        return repo.findFirstByThreadIdOrderByVersionDesc(threadId).map(row -> {
            if (row.getSchemaVersion() != AgentState.SCHEMA_VERSION) {
                log.warn("Checkpoint {} v{} has schema {}, current is {}",
                        threadId, row.getVersion(), row.getSchemaVersion(), AgentState.SCHEMA_VERSION);
            }
            try {
                AgentState state = objectMapper.readValue(row.getPayload(), AgentState.class);
                return new Checkpoint(threadId, row.getVersion(), GraphNode.valueOf(row.getNextNode()), state);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt checkpoint " + threadId + " v" + row.getVersion(), e);
            }
        });
    }
}
