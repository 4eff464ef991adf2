package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.service.CommandOutcome;
import com.hrflow.onboarding.service.StepCommandResult;

/**
 * Response body for every step command. outcome is "already-applied" when
 * the command was a retry and nothing changed.
 */
public record StepCommandResponse(
        CommandOutcome   outcome,
        StepResponse     step,
        ProgressResponse progress
) {
    public static StepCommandResponse from(StepCommandResult r) {
        return new StepCommandResponse(
                r.outcome(),
                StepResponse.from(r.step()),
                ProgressResponse.from(r.progress())
        );
    }
}
