package com.hrflow.onboarding.engine;

import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.WorkflowStatus;

import java.util.List;
import java.util.UUID;

/**
 * Workflow-level metrics derived from the current steps and exceptions.
 * Built fresh on every read, never stored.
 *
 * @param overdueStepIds steps past their due date that are neither completed
 *                       nor skipped. Display only: overdue is not a status.
 */
public record ProgressSnapshot(
        UUID           workflowId,
        WorkflowStatus status,
        Stage          currentStage,
        int            totalSteps,
        int            completedSteps,
        int            skippedSteps,
        int            inProgressSteps,
        int            pendingSteps,
        int            blockedSteps,
        int            failedSteps,
        int            progressPercentage,
        long           daysElapsed,
        int            expectedDays,
        boolean        onTrack,
        int            openExceptions,
        List<UUID>     overdueStepIds
) {}
