package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.AgentCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Checkpoints are append-only; the highest version per thread is the resume point.
 */
public interface AgentCheckpointRepository extends JpaRepository<AgentCheckpoint, UUID> {

    Optional<AgentCheckpoint> findFirstByThreadIdOrderByVersionDesc(String threadId);

    long countByThreadId(String threadId);
}
