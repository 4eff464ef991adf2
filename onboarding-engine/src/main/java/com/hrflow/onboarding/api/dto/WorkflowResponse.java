package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.WorkflowInstance;
import com.hrflow.onboarding.model.WorkflowStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Summary of a workflow, returned by POST /workflows, GET /workflows and the
 * cancel command. progressPercentage is the value cached at the last command.
 */
public record WorkflowResponse(
        UUID           id,
        UUID           employeeId,
        String         templateId,
        WorkflowStatus status,
        Stage          currentStage,
        int            progressPercentage,
        int            expectedDays,
        Instant        startedAt,
        Instant        completedAt,
        Instant        updatedAt
) {
    public static WorkflowResponse from(WorkflowInstance w) {
        return new WorkflowResponse(
                w.getId(),
                w.getEmployeeId(),
                w.getTemplateId(),
                w.getStatus(),
                w.getCurrentStage(),
                w.getProgressPercentage(),
                w.getExpectedDays(),
                w.getStartedAt(),
                w.getCompletedAt(),
                w.getUpdatedAt()
        );
    }
}
