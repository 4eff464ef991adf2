package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.DocumentRecord;
import com.hrflow.onboarding.model.DocumentStatus;

import java.time.Instant;
import java.util.UUID;

public record DocumentResponse(
        UUID           id,
        UUID           stepId,
        String         documentName,
        String         documentType,
        String         fileType,
        long           fileSizeBytes,
        DocumentStatus status,
        Instant        createdAt,
        Instant        signedAt
) {
    public static DocumentResponse from(DocumentRecord d) {
        return new DocumentResponse(
                d.getId(),
                d.getStepId(),
                d.getDocumentName(),
                d.getDocumentType(),
                d.getFileType(),
                d.getFileSizeBytes(),
                d.getStatus(),
                d.getCreatedAt(),
                d.getSignedAt()
        );
    }
}
