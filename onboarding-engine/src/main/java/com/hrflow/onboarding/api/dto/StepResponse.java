package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.model.StepStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record StepResponse(
        UUID         id,
        int          stepOrder,
        Stage        stage,
        String       name,
        String       description,
        String       integrationType,
        StepStatus   status,
        Instant      dueDate,
        Instant      startedAt,
        Instant      completedAt,
        String       completedBy,
        String       skipReason,
        String       statusCause,
        List<String> prerequisites
) {
    public static StepResponse from(StepRecord s) {
        return new StepResponse(
                s.getId(),
                s.getStepOrder(),
                s.getStage(),
                s.getName(),
                s.getDescription(),
                s.getIntegrationType(),
                s.getStatus(),
                s.getDueDate(),
                s.getStartedAt(),
                s.getCompletedAt(),
                s.getCompletedBy(),
                s.getSkipReason(),
                s.getStatusCause(),
                List.copyOf(s.getPrerequisites())
        );
    }
}
