package com.hrflow.onboarding.engine;

import java.util.UUID;

public class DuplicateWorkflowException extends OnboardingException {
    public DuplicateWorkflowException(UUID employeeId) {
        super(ErrorCode.DUPLICATE_WORKFLOW, "Employee already has an active onboarding workflow: " + employeeId);
    }
}
