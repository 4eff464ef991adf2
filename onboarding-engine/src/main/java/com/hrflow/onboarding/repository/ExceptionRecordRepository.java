package com.hrflow.onboarding.repository;

import com.hrflow.onboarding.model.ExceptionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Inserts new exception rows and resolves an exception id to its workflow.
 * Resolution itself goes through the owning workflow under its row lock.
 */
public interface ExceptionRecordRepository extends JpaRepository<ExceptionRecord, UUID> {

    @Query("SELECT e.workflow.id FROM ExceptionRecord e WHERE e.id = :id")
    Optional<UUID> findWorkflowIdById(@Param("id") UUID id);
}
