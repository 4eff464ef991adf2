package com.hrflow.onboarding.service;

/**
 * Dashboard counters across all workflows.
 *
 * @param averageCompletionDays whole days from start to completion, averaged
 *                              over the workflows completed this month; 0 when none
 */
public record WorkflowStats(
        int  templateCount,
        long activeWorkflows,
        int  completedThisMonth,
        long averageCompletionDays
) {}
