package com.hrflow.onboarding.api.dto;

import java.util.UUID;

/**
 * Request body for POST /workflows/{id}/documents.
 * Only metadata is kept; the file itself lives in document storage.
 */
public record RecordDocumentRequest(
        UUID   stepId,
        String documentName,
        String documentType,
        String fileType,
        long   fileSizeBytes
) {}
