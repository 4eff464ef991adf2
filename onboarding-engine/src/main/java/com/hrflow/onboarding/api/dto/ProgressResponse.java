package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.engine.ProgressSnapshot;
import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.WorkflowStatus;

import java.util.List;
import java.util.UUID;

/** Response body for GET /workflows/{id}/progress. */
public record ProgressResponse(
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
) {
    public static ProgressResponse from(ProgressSnapshot p) {
        return new ProgressResponse(
                p.workflowId(),
                p.status(),
                p.currentStage(),
                p.totalSteps(),
                p.completedSteps(),
                p.skippedSteps(),
                p.inProgressSteps(),
                p.pendingSteps(),
                p.blockedSteps(),
                p.failedSteps(),
                p.progressPercentage(),
                p.daysElapsed(),
                p.expectedDays(),
                p.onTrack(),
                p.openExceptions(),
                p.overdueStepIds()
        );
    }
}
