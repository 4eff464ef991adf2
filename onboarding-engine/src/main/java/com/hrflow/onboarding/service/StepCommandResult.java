package com.hrflow.onboarding.service;

import com.hrflow.onboarding.engine.ProgressSnapshot;
import com.hrflow.onboarding.model.StepRecord;

/**
 * Result of start / complete / skip / block / fail / requeue: the step as it
 * now stands plus the workflow's refreshed progress.
 */
public record StepCommandResult(
        StepRecord       step,
        CommandOutcome   outcome,
        ProgressSnapshot progress
) {
    public boolean applied() {
        return outcome == CommandOutcome.APPLIED;
    }
}
