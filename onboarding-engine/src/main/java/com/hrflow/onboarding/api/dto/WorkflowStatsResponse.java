package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.service.WorkflowStats;

public record WorkflowStatsResponse(
        int  templateCount,
        long activeWorkflows,
        int  completedThisMonth,
        long averageCompletionDays
) {
    public static WorkflowStatsResponse from(WorkflowStats s) {
        return new WorkflowStatsResponse(
                s.templateCount(),
                s.activeWorkflows(),
                s.completedThisMonth(),
                s.averageCompletionDays()
        );
    }
}
