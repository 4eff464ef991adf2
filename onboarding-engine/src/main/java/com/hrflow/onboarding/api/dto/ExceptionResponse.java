package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.ExceptionRecord;
import com.hrflow.onboarding.model.ExceptionType;
import com.hrflow.onboarding.model.ResolutionStatus;
import com.hrflow.onboarding.model.Severity;

import java.time.Instant;
import java.util.UUID;

public record ExceptionResponse(
        UUID             id,
        UUID             workflowId,
        UUID             stepId,
        ExceptionType    exceptionType,
        String           title,
        String           description,
        Severity         severity,
        ResolutionStatus resolutionStatus,
        Instant          createdAt,
        Instant          resolvedAt,
        String           resolvedBy,
        String           resolutionNote
) {
    public static ExceptionResponse from(ExceptionRecord e) {
        return new ExceptionResponse(
                e.getId(),
                e.getWorkflow().getId(),
                e.getStepId(),
                e.getExceptionType(),
                e.getTitle(),
                e.getDescription(),
                e.getSeverity(),
                e.getResolutionStatus(),
                e.getCreatedAt(),
                e.getResolvedAt(),
                e.getResolvedBy(),
                e.getResolutionNote()
        );
    }
}
