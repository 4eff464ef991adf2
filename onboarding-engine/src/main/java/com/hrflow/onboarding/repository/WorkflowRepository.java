package com.hrflow.onboarding.repository;

import com.hrflow.onboarding.model.WorkflowInstance;
import com.hrflow.onboarding.model.WorkflowStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the onboarding_workflows table.
 */
public interface WorkflowRepository extends JpaRepository<WorkflowInstance, UUID> {

    /**
     * Load a workflow and hold a row lock on it until the surrounding
     * transaction ends.
     *
     * SELECT ... FOR UPDATE serialises every mutating command on the same
     * workflow: a second command for that id waits here until the first one
     * commits or rolls back, then sees its result. Commands on other
     * workflows lock other rows and are never blocked.
     *
     * The lock wait is bounded by the hint below and, on PostgreSQL, by the
     * session lock_timeout set in application.yml. A timeout surfaces as a
     * PessimisticLockingFailureException, which the engine reports as a
     * retryable persistence error.
     *
     * Must run inside a @Transactional method in the service layer.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT w FROM WorkflowInstance w WHERE w.id = :id")
    Optional<WorkflowInstance> findByIdForUpdate(@Param("id") UUID id);

    /** Used to reject a second active onboarding for the same employee. */
    boolean existsByEmployeeIdAndStatus(UUID employeeId, WorkflowStatus status);

    List<WorkflowInstance> findByStatusOrderByStartedAtDesc(WorkflowStatus status);

    List<WorkflowInstance> findAllByOrderByStartedAtDesc();

    long countByStatus(WorkflowStatus status);

    List<WorkflowInstance> findByStatusAndCompletedAtGreaterThanEqual(WorkflowStatus status, Instant since);
}
