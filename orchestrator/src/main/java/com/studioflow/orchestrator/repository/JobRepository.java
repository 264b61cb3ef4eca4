package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + queue queries for the job table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Lock up to {@code limit} claimable PENDING rows, oldest first.
     *
     * FOR UPDATE SKIP LOCKED means:
     *   - FOR UPDATE  : rows are locked until the surrounding transaction ends
     *   - SKIP LOCKED : rows another claimant has locked are left out instead of waited on
     *
     * types holds JobType names; external workers pass every type.
     * A row whose lease is still running was handed out by an earlier claim
     * and is not claimable until the lease expires or the job is started.
     *
     * Must run inside a transaction; the caller writes the lease before commit.
     */
    @Query(value = """
            SELECT * FROM job
            WHERE status = 'PENDING'
              AND type IN (:types)
              AND (claim_expires_at IS NULL OR claim_expires_at < :now)
            ORDER BY created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Job> lockClaimable(@Param("now") Instant now,
                            @Param("types") Collection<String> types,
                            @Param("limit") int limit);

    /**
     * Load a job and hold its row lock until the surrounding transaction ends.
     *
     * Every status change goes through this (or {@link #findOwnedForUpdate}),
     * so two writers of the same row run one after the other and the second
     * one sees the first one's result.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findForUpdate(@Param("id") UUID id);

    /** Same as {@link #findForUpdate}, restricted to the owner's jobs. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id AND j.userId = :userId")
    Optional<Job> findOwnedForUpdate(@Param("id") UUID id, @Param("userId") String userId);

    Optional<Job> findByIdAndUserId(UUID id, String userId);

    List<Job> findByParentJobId(UUID parentJobId);

    List<Job> findByStatus(JobStatus status);

    // --- rate limiting ---

    /**
     * Transaction-scoped advisory lock on one owner. Job creations of the same
     * owner queue up behind it, so the rate-limit counts they read include every
     * job inserted before them. Released at commit or rollback.
     */
    @Query(value = "SELECT count(*) FROM pg_advisory_xact_lock(:namespace, hashtext(:userId))",
            nativeQuery = true)
    long lockOwner(@Param("namespace") int namespace, @Param("userId") String userId);

    long countByUserIdAndStatusIn(String userId, Collection<JobStatus> statuses);

    long countByUserIdAndCreatedAtGreaterThanEqual(String userId, Instant since);

    // --- listing ---

    @Query("""
            SELECT j FROM Job j
            WHERE j.userId = :userId
              AND j.status IN :statuses
              AND (:projectId IS NULL OR j.projectId = :projectId)
            ORDER BY j.createdAt DESC
            """)
    List<Job> search(@Param("userId") String userId,
                     @Param("statuses") Collection<JobStatus> statuses,
                     @Param("projectId") String projectId,
                     Pageable page);

    // --- job event stream ---

    List<Job> findByUserIdAndStatusInOrderByCreatedAtDesc(
            String userId, Collection<JobStatus> statuses, Pageable page);

    List<Job> findByUserIdAndStatusInAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
            String userId, Collection<JobStatus> statuses, Instant since, Pageable page);
}
