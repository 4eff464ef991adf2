package com.hrflow.onboarding.repository;

import com.hrflow.onboarding.model.DocumentRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Inserts new document rows. Signing goes through the owning workflow.
 */
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, UUID> {
}
